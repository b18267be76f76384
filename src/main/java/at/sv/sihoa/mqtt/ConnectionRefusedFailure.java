package at.sv.sihoa.mqtt;

import lombok.Getter;

public final class ConnectionRefusedFailure extends RuntimeException {

    @Getter
    private final int reasonCode;

    public ConnectionRefusedFailure(int reasonCode) {
        super("Connection to broker failed with code: " + reasonCode);
        this.reasonCode = reasonCode;
    }
}
