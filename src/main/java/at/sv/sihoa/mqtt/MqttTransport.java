package at.sv.sihoa.mqtt;

/**
 * Minimal publish/subscribe client. Delivery is at most or at least once, without ordering across topics, and
 * messages may be delivered again after a reconnect.
 */
public interface MqttTransport {

    void setListener(TransportListener listener);

    /**
     * Starts connecting in the background. The outcome is reported via {@link TransportListener#onConnect(int)}.
     */
    void connect();

    boolean isConnected();

    /**
     * @return 0 on success, a non-zero result code otherwise
     */
    int subscribe(String topic);

    /**
     * @return 0 on success, a non-zero result code otherwise
     */
    int unsubscribe(String topic);

    /**
     * Fire and forget. Failures are logged by the implementation and never thrown.
     */
    void publish(String topic, byte[] payload);

    void disconnect();
}
