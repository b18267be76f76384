package at.sv.sihoa.mqtt;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

/**
 * {@link MqttTransport} backed by the Eclipse Paho v3 async client. Reconnects automatically after a connection loss.
 * <p>
 * Paho completes tokens on its callback thread, so waiting for a token from within a callback would block forever.
 * Subscriptions requested from a callback (i.e. the re-subscriptions after a reconnect) are therefore only issued,
 * and their outcome is logged asynchronously.
 */
@Slf4j
public final class PahoMqttTransport implements MqttTransport, MqttCallbackExtended {

    private static final int QOS = 0;
    private static final int SUBSCRIPTION_REJECTED = 128;
    private static final int CLIENT_FAILURE = -1;
    private static final int KEEP_ALIVE_SECONDS = 60;
    private static final ThreadLocal<Boolean> IN_CALLBACK = ThreadLocal.withInitial(() -> false);

    private final BrokerSettings settings;
    private final long completionTimeoutMs;
    private volatile MqttAsyncClient client;
    private volatile TransportListener listener;

    public PahoMqttTransport(BrokerSettings settings, long completionTimeoutMs) {
        this.settings = settings;
        this.completionTimeoutMs = completionTimeoutMs;
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        options.setMqttVersion(MqttConnectOptions.MQTT_VERSION_3_1_1);
        if (settings.hasCredentials()) {
            options.setUserName(settings.username());
            options.setPassword(settings.password().toCharArray());
        }
        try {
            client = new MqttAsyncClient(settings.serverUri(), settings.clientId(), new MemoryPersistence());
            client.setCallback(this);
            log.info("Connecting to broker {} as {}", settings.serverUri(), settings.clientId());
            client.connect(options, null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken token) {
                    log.debug("Connect request to {} completed", settings.serverUri());
                }

                @Override
                public void onFailure(IMqttToken token, Throwable exception) {
                    log.error("Connect to {} failed: {}", settings.serverUri(), exception.getLocalizedMessage());
                    notifyConnect(reasonCodeOf(exception));
                }
            });
        } catch (MqttException e) {
            throw new BrokerConnectionFailure("Failed to connect to " + settings.serverUri(), e);
        }
    }

    @Override
    public boolean isConnected() {
        MqttAsyncClient c = client;
        return c != null && c.isConnected();
    }

    @Override
    public int subscribe(String topic) {
        MqttAsyncClient c = client;
        if (c == null) {
            return MqttException.REASON_CODE_CLIENT_NOT_CONNECTED;
        }
        try {
            if (IN_CALLBACK.get()) {
                c.subscribe(topic, QOS, null, loggingListener("Re-subscription", topic));
                return 0;
            }
            IMqttToken token = c.subscribe(topic, QOS);
            token.waitForCompletion(completionTimeoutMs);
            int[] grantedQos = token.getGrantedQos();
            if (grantedQos != null && grantedQos.length > 0 && grantedQos[0] == SUBSCRIPTION_REJECTED) {
                return SUBSCRIPTION_REJECTED;
            }
            return 0;
        } catch (MqttException e) {
            log.debug("Subscription to {} failed: {}", topic, e.getMessage());
            return nonZero(e.getReasonCode());
        }
    }

    @Override
    public int unsubscribe(String topic) {
        MqttAsyncClient c = client;
        if (c == null) {
            return MqttException.REASON_CODE_CLIENT_NOT_CONNECTED;
        }
        try {
            if (IN_CALLBACK.get()) {
                c.unsubscribe(topic, null, loggingListener("Unsubscription", topic));
                return 0;
            }
            c.unsubscribe(topic).waitForCompletion(completionTimeoutMs);
            return 0;
        } catch (MqttException e) {
            log.debug("Unsubscription from {} failed: {}", topic, e.getMessage());
            return nonZero(e.getReasonCode());
        }
    }

    @Override
    public void publish(String topic, byte[] payload) {
        MqttAsyncClient c = client;
        if (c == null) {
            log.warn("Publish to {} dropped: not connected", topic);
            return;
        }
        try {
            c.publish(topic, payload, QOS, false);
        } catch (MqttException e) {
            log.warn("Publish to {} failed: {}", topic, e.getMessage());
        }
    }

    @Override
    public void disconnect() {
        MqttAsyncClient c = client;
        if (c == null) {
            return;
        }
        try {
            if (c.isConnected()) {
                c.disconnect().waitForCompletion(completionTimeoutMs);
            }
            c.close();
        } catch (MqttException e) {
            log.warn("Error during disconnect: {}", e.getMessage());
        } finally {
            client = null;
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        log.info("{} to {}", reconnect ? "Reconnected" : "Connected", serverURI);
        notifyConnect(0);
    }

    @Override
    public void connectionLost(Throwable cause) {
        TransportListener l = listener;
        if (l != null) {
            l.onConnectionLost(cause);
        }
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        TransportListener l = listener;
        if (l == null) {
            log.warn("Message on {} arrived before a listener was set", topic);
            return;
        }
        IN_CALLBACK.set(true);
        try {
            l.onMessage(topic, message.getPayload());
        } finally {
            IN_CALLBACK.set(false);
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
    }

    private void notifyConnect(int reasonCode) {
        TransportListener l = listener;
        if (l == null) {
            return;
        }
        IN_CALLBACK.set(true);
        try {
            l.onConnect(reasonCode);
        } catch (RuntimeException e) {
            // the listener keeps the failure and raises it again on the application thread
            log.error("Connect handling failed: {}", e.getLocalizedMessage());
        } finally {
            IN_CALLBACK.set(false);
        }
    }

    private static IMqttActionListener loggingListener(String action, String topic) {
        return new IMqttActionListener() {
            @Override
            public void onSuccess(IMqttToken token) {
                log.debug("{} of {} completed", action, topic);
            }

            @Override
            public void onFailure(IMqttToken token, Throwable exception) {
                log.warn("{} of {} failed: {}", action, topic, exception.getLocalizedMessage());
            }
        };
    }

    private static int reasonCodeOf(Throwable exception) {
        if (exception instanceof MqttException mqttException) {
            return nonZero(mqttException.getReasonCode());
        }
        return CLIENT_FAILURE;
    }

    private static int nonZero(int reasonCode) {
        return reasonCode == 0 ? CLIENT_FAILURE : reasonCode;
    }
}
