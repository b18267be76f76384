package at.sv.sihoa.inventory;

public final class InventoryStoreFailure extends RuntimeException {
    public InventoryStoreFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
