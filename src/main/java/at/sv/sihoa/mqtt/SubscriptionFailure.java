package at.sv.sihoa.mqtt;

import lombok.Getter;

/**
 * Signals that the broker did not accept a subscribe or unsubscribe request. The registry does not retry these.
 */
@Getter
public final class SubscriptionFailure extends RuntimeException {

    private final String topic;
    private final int resultCode;

    public SubscriptionFailure(String action, String topic, int resultCode) {
        super(action + " of '" + topic + "' failed with result code " + resultCode);
        this.topic = topic;
        this.resultCode = resultCode;
    }
}
