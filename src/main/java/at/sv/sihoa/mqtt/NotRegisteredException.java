package at.sv.sihoa.mqtt;

public final class NotRegisteredException extends RuntimeException {
    public NotRegisteredException(String topic) {
        super("Topic '" + topic + "' is not registered");
    }
}
