package at.sv.sihoa.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Aligns the persisted inventory with a freshly published device list: devices in the list are created or updated
 * and marked active, active devices missing from the list are retired. All changes are committed together.
 * <p>
 * Constraint violations of the store are not handled here. They abort the whole reconciliation.
 */
@Slf4j
public final class InventoryReconciler {

    private final InventoryStore store;
    private final Supplier<Instant> currentTime;

    public InventoryReconciler(InventoryStore store, Supplier<Instant> currentTime) {
        this.store = store;
        this.currentTime = currentTime;
    }

    public ReconcileResult reconcile(List<JsonNode> snapshot) {
        return store.inTransaction(inventory -> {
            Set<String> activeAddresses = new HashSet<>();
            int upserted = 0;
            for (JsonNode entry : snapshot) {
                DeviceDescriptor descriptor = DeviceDescriptor.from(entry).orElse(null);
                if (descriptor == null) {
                    log.debug("Skipping device entry without IEEE address or friendly name: {}", entry);
                    continue;
                }
                upsert(inventory, descriptor);
                activeAddresses.add(descriptor.getIeeeAddress());
                upserted++;
            }
            int retired = retireMissing(inventory, activeAddresses);
            log.info("Reconciled inventory: {} upserted, {} retired", upserted, retired);
            return new ReconcileResult(upserted, retired);
        });
    }

    private void upsert(DeviceInventory inventory, DeviceDescriptor descriptor) {
        DeviceRecord existing = inventory.get(descriptor.getIeeeAddress()).orElse(null);
        DeviceRecord device = existing != null ? existing : new DeviceRecord();
        device.setIeeeAddress(descriptor.getIeeeAddress());
        device.setFriendlyName(descriptor.getFriendlyName());
        descriptor.parseNetworkAddress().ifPresent(device::setNetworkAddress);
        if (descriptor.getDeviceType() != null) {
            device.setDeviceType(descriptor.getDeviceType());
        }
        if (descriptor.getModel() != null) {
            device.setModel(descriptor.getModel());
        }
        if (descriptor.getManufacturer() != null) {
            device.setManufacturer(descriptor.getManufacturer());
        }
        if (descriptor.getFirmwareVersion() != null) {
            device.setFirmwareVersion(descriptor.getFirmwareVersion());
        }
        BuildDateParser.parse(descriptor.getBuildDate()).ifPresent(device::setFirmwareBuildDate);
        device.setRetiredAt(null);
        if (existing == null) {
            inventory.insert(device);
            log.debug("Created {} ({})", device.getFriendlyName(), device.getIeeeAddress());
        } else {
            inventory.update(device);
            log.debug("Updated {} ({})", device.getFriendlyName(), device.getIeeeAddress());
        }
    }

    private int retireMissing(DeviceInventory inventory, Set<String> activeAddresses) {
        int retired = 0;
        for (DeviceRecord device : inventory.findActive()) {
            if (!activeAddresses.contains(device.getIeeeAddress())) {
                device.setRetiredAt(currentTime.get());
                inventory.update(device);
                log.info("Retired {} ({})", device.getFriendlyName(), device.getIeeeAddress());
                retired++;
            }
        }
        return retired;
    }
}
