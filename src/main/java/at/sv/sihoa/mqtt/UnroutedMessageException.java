package at.sv.sihoa.mqtt;

/**
 * A message arrived for a topic without a registered handler. This means the subscriptions on the broker and the
 * registry are out of sync, which is treated as fatal.
 */
public final class UnroutedMessageException extends RuntimeException {
    public UnroutedMessageException(String topic) {
        super("Received message on '" + topic + "' but no handler is registered");
    }
}
