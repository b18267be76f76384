package at.sv.sihoa.inventory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted inventory entry of a Zigbee device. Records are never deleted, only retired.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public final class DeviceRecord {
    /**
     * Primary key: the permanent 64-bit IEEE address, e.g. {@code 0x00124b0012345678}.
     */
    String ieeeAddress;
    String friendlyName;
    /**
     * The 16-bit network (short) address, may change after a rejoin.
     */
    Integer networkAddress;
    LocalDate firmwareBuildDate;
    String firmwareVersion;
    String deviceType;
    String model;
    String manufacturer;
    /**
     * Assigned by the store on insert.
     */
    Instant createdAt;
    /**
     * {@code null} while the device is active.
     */
    Instant retiredAt;

    public boolean isRetired() {
        return retiredAt != null;
    }
}
