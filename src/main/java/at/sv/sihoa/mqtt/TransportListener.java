package at.sv.sihoa.mqtt;

/**
 * Callbacks of an {@link MqttTransport}. Invoked on the transport's own network thread.
 */
public interface TransportListener {

    /**
     * @param reasonCode 0 if the (re-)connect succeeded, the broker or client reason code otherwise
     */
    void onConnect(int reasonCode);

    void onMessage(String topic, byte[] payload);

    void onConnectionLost(Throwable cause);
}
