package at.sv.sihoa.device;

public enum PowerState {
    ON,
    OFF,
    /**
     * No report confirmed the state yet.
     */
    UNCONFIRMED
}
