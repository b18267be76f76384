package at.sv.sihoa.inventory;

import java.util.function.Function;

public interface InventoryStore {

    /**
     * Runs the given work as one serializable unit of work. Changes are committed once after the work completed, or
     * rolled back if it throws.
     */
    <T> T inTransaction(Function<DeviceInventory, T> work);
}
