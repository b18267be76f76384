package at.sv.sihoa.device;

/**
 * The stable identity of a physical device.
 *
 * @param ieeeAddress  the permanent hardware address
 * @param friendlyName the unique name, also used as the topic namespace of the device
 */
public record Device(String ieeeAddress, String friendlyName) {
}
