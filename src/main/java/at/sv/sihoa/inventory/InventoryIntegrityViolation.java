package at.sv.sihoa.inventory;

/**
 * A write violated a constraint of the inventory, e.g. a duplicate friendly name or an out of range network address.
 */
public final class InventoryIntegrityViolation extends RuntimeException {
    public InventoryIntegrityViolation(String message, Throwable cause) {
        super(message, cause);
    }
}
