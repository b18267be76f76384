package at.sv.sihoa.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceDescriptorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void from_zigbee2mqttEntry_readsAllAttributes() throws Exception {
        DeviceDescriptor descriptor = DeviceDescriptor.from(json("""
                {
                  "ieee_address": "0x00124b0012345678",
                  "friendly_name": "Kitchen",
                  "network_address": 4711,
                  "type": "Router",
                  "model_id": "TRADFRI bulb E27",
                  "manufacturer": "IKEA of Sweden",
                  "software_build_id": "2.3.086",
                  "date_code": "20210315"
                }
                """)).orElseThrow();

        assertThat(descriptor.getIeeeAddress()).isEqualTo("0x00124b0012345678");
        assertThat(descriptor.getFriendlyName()).isEqualTo("Kitchen");
        assertThat(descriptor.parseNetworkAddress()).contains(4711);
        assertThat(descriptor.getDeviceType()).isEqualTo("Router");
        assertThat(descriptor.getModel()).isEqualTo("TRADFRI bulb E27");
        assertThat(descriptor.getManufacturer()).isEqualTo("IKEA of Sweden");
        assertThat(descriptor.getFirmwareVersion()).isNull();
        assertThat(descriptor.getBuildDate()).isEqualTo("2.3.086");
    }

    @Test
    void from_alternativeKeys_areUsed() throws Exception {
        DeviceDescriptor descriptor = DeviceDescriptor.from(json("""
                {"ieeeAddress": "0x01", "friendlyName": "Plug", "networkAddress": "12",
                 "device_type": "EndDevice", "zigbee_model": "SP 120", "zigbee_manufacturer": "innr",
                 "firmware_version": "1.0", "firmware_build_date": "2020-01-02"}
                """)).orElseThrow();

        assertThat(descriptor.getIeeeAddress()).isEqualTo("0x01");
        assertThat(descriptor.getFriendlyName()).isEqualTo("Plug");
        assertThat(descriptor.parseNetworkAddress()).contains(12);
        assertThat(descriptor.getDeviceType()).isEqualTo("EndDevice");
        assertThat(descriptor.getModel()).isEqualTo("SP 120");
        assertThat(descriptor.getManufacturer()).isEqualTo("innr");
        assertThat(descriptor.getFirmwareVersion()).isEqualTo("1.0");
        assertThat(descriptor.getBuildDate()).isEqualTo("2020-01-02");
    }

    @Test
    void from_emptyPrimaryKey_fallsBackToNextAlias() throws Exception {
        DeviceDescriptor descriptor = DeviceDescriptor.from(json("""
                {"ieee_address": "", "ieee": "0x02", "friendly_name": "  ", "name": "Desk"}
                """)).orElseThrow();

        assertThat(descriptor.getIeeeAddress()).isEqualTo("0x02");
        assertThat(descriptor.getFriendlyName()).isEqualTo("Desk");
    }

    @Test
    void from_missingIeeeAddressOrName_isEmpty() throws Exception {
        assertThat(DeviceDescriptor.from(json("{\"friendly_name\": \"Desk\"}"))).isEmpty();
        assertThat(DeviceDescriptor.from(json("{\"ieee_address\": \"0x03\"}"))).isEmpty();
        assertThat(DeviceDescriptor.from(json("{\"ieee_address\": null, \"friendly_name\": \"Desk\"}"))).isEmpty();
    }

    @Test
    void from_notAnObject_isEmpty() throws Exception {
        assertThat(DeviceDescriptor.from(json("\"Coordinator\""))).isEmpty();
        assertThat(DeviceDescriptor.from(json("[]"))).isEmpty();
        assertThat(DeviceDescriptor.from(null)).isEmpty();
    }

    @Test
    void parseNetworkAddress_zero_isKept() throws Exception {
        DeviceDescriptor descriptor = DeviceDescriptor.from(json("""
                {"ieee_address": "0x00", "friendly_name": "Coordinator", "network_address": 0}
                """)).orElseThrow();

        assertThat(descriptor.parseNetworkAddress()).contains(0);
    }

    @Test
    void parseNetworkAddress_notNumeric_isEmpty() throws Exception {
        DeviceDescriptor descriptor = DeviceDescriptor.from(json("""
                {"ieee_address": "0x04", "friendly_name": "Lamp", "network_address": "n/a"}
                """)).orElseThrow();

        assertThat(descriptor.parseNetworkAddress()).isEmpty();
    }
}
