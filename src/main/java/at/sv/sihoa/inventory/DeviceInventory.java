package at.sv.sihoa.inventory;

import java.util.List;
import java.util.Optional;

/**
 * Access to the device inventory within a single unit of work.
 *
 * @see InventoryStore#inTransaction(java.util.function.Function)
 */
public interface DeviceInventory {

    Optional<DeviceRecord> get(String ieeeAddress);

    /**
     * Inserts the record and sets its creation timestamp.
     */
    void insert(DeviceRecord device);

    void update(DeviceRecord device);

    /**
     * @return all records that are not retired
     */
    List<DeviceRecord> findActive();

    List<DeviceRecord> findAll();
}
