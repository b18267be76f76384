package at.sv.sihoa.inventory;

import at.sv.sihoa.mqtt.ConnectionRefusedFailure;
import at.sv.sihoa.mqtt.MqttTransport;
import at.sv.sihoa.mqtt.TransportListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the device list the bridge publishes as retained message on {@code <base_topic>/bridge/devices}.
 */
@Slf4j
public final class BridgeDevicesReader {

    private static final long POLL_INTERVAL_MS = 50;

    private final MqttTransport transport;
    private final Ticker ticker;
    private final ObjectMapper objectMapper;

    public BridgeDevicesReader(MqttTransport transport, Ticker ticker) {
        this.transport = transport;
        this.ticker = ticker;
        objectMapper = new ObjectMapper();
    }

    /**
     * Connects, subscribes to the given topic and waits until the device list arrived.
     *
     * @return the device descriptors, or an empty list if nothing arrived within the timeout
     * @throws ConnectionRefusedFailure if the broker refused the connection
     */
    public List<JsonNode> read(String topic, Duration timeout) throws InterruptedException {
        AtomicReference<List<JsonNode>> devices = new AtomicReference<>();
        AtomicReference<ConnectionRefusedFailure> refused = new AtomicReference<>();
        transport.setListener(new TransportListener() {
            @Override
            public void onConnect(int reasonCode) {
                if (reasonCode != 0) {
                    log.error("Connection failed with code: {}", reasonCode);
                    refused.compareAndSet(null, new ConnectionRefusedFailure(reasonCode));
                    return;
                }
                int result = transport.subscribe(topic);
                if (result != 0) {
                    log.error("Subscription to {} failed with result code {}", topic, result);
                }
            }

            @Override
            public void onMessage(String messageTopic, byte[] payload) {
                if (topic.equals(messageTopic)) {
                    parse(payload).ifPresent(devices::set);
                }
            }

            @Override
            public void onConnectionLost(Throwable cause) {
                log.warn("Connection lost while waiting for device list: {}",
                        cause == null ? "<no cause>" : cause.getLocalizedMessage());
            }
        });
        transport.connect();
        try {
            long deadline = ticker.read() + timeout.toNanos();
            while (devices.get() == null && refused.get() == null && ticker.read() < deadline) {
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } finally {
            transport.disconnect();
        }
        List<JsonNode> result = devices.get();
        if (result == null && refused.get() != null) {
            throw refused.get();
        }
        if (result == null) {
            log.warn("No device list received on {} within {} ms", topic, timeout.toMillis());
            return List.of();
        }
        log.info("Received {} device descriptors from {}", result.size(), topic);
        return result;
    }

    private Optional<List<JsonNode>> parse(byte[] payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (!root.isArray()) {
                log.warn("Ignoring device list that is not a JSON array");
                return Optional.empty();
            }
            List<JsonNode> entries = new ArrayList<>();
            root.forEach(entries::add);
            return Optional.of(entries);
        } catch (IOException e) {
            log.warn("Ignoring malformed device list: {}", e.getLocalizedMessage());
            return Optional.empty();
        }
    }
}
