package at.sv.sihoa.device;

public enum Availability {
    UNKNOWN,
    ONLINE,
    OFFLINE
}
