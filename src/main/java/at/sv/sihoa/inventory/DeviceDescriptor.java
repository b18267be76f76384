package at.sv.sihoa.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * One entry of the device list published by the bridge. Each attribute may be given under one of several keys,
 * the first non-empty one wins.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DeviceDescriptor {

    static final List<String> IEEE_ADDRESS_KEYS = List.of("ieee_address", "ieeeAddress", "ieee");
    static final List<String> FRIENDLY_NAME_KEYS = List.of("friendly_name", "friendlyName", "name");
    static final List<String> NETWORK_ADDRESS_KEYS = List.of("network_address", "networkAddress");
    static final List<String> DEVICE_TYPE_KEYS = List.of("type", "device_type");
    static final List<String> MODEL_KEYS = List.of("model", "zigbee_model", "model_id");
    static final List<String> MANUFACTURER_KEYS = List.of("manufacturer", "zigbee_manufacturer");
    static final List<String> FIRMWARE_VERSION_KEYS = List.of("software_version", "firmware_version");
    static final List<String> BUILD_DATE_KEYS = List.of("software_build_id", "firmware_build_date", "date_code");

    private final String ieeeAddress;
    private final String friendlyName;
    private final String networkAddress;
    private final String deviceType;
    private final String model;
    private final String manufacturer;
    private final String firmwareVersion;
    private final String buildDate;

    /**
     * @return the descriptor, or empty if the entry is not an object or lacks the IEEE address or friendly name
     */
    public static Optional<DeviceDescriptor> from(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        String ieeeAddress = firstNonEmpty(entry, IEEE_ADDRESS_KEYS);
        String friendlyName = firstNonEmpty(entry, FRIENDLY_NAME_KEYS);
        if (ieeeAddress == null || friendlyName == null) {
            return Optional.empty();
        }
        return Optional.of(new DeviceDescriptor(ieeeAddress, friendlyName,
                firstNonEmpty(entry, NETWORK_ADDRESS_KEYS),
                firstNonEmpty(entry, DEVICE_TYPE_KEYS),
                firstNonEmpty(entry, MODEL_KEYS),
                firstNonEmpty(entry, MANUFACTURER_KEYS),
                firstNonEmpty(entry, FIRMWARE_VERSION_KEYS),
                firstNonEmpty(entry, BUILD_DATE_KEYS)));
    }

    /**
     * @return the network address, or empty if none was given or it is not a number
     */
    public Optional<Integer> parseNetworkAddress() {
        if (networkAddress == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(networkAddress.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String firstNonEmpty(JsonNode entry, List<String> keys) {
        for (String key : keys) {
            JsonNode value = entry.get(key);
            if (value == null || value.isNull() || value.isContainerNode()) {
                continue;
            }
            String text = value.asText();
            if (!text.isBlank()) {
                return text;
            }
        }
        return null;
    }
}
