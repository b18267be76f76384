package at.sv.sihoa.mqtt;

public final class DuplicateRegistrationException extends RuntimeException {
    public DuplicateRegistrationException(String topic) {
        super("Topic '" + topic + "' is already registered");
    }
}
