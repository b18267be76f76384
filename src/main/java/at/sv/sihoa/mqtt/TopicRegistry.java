package at.sv.sihoa.mqtt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes messages between the transport and the per-device handlers.
 * <p>
 * Inbound messages are decoded on the transport thread and put onto the inbound queue. The application loop drains
 * that queue and runs the handlers, so handler code never blocks the transport's network thread. Commands are put
 * onto the outbound queue by the actuators and published when the loop drains it.
 * <p>
 * Fatal conditions raised on the transport thread are remembered and thrown again on the next drain, so that they
 * also terminate the application loop.
 */
@Slf4j
public final class TopicRegistry implements TransportListener {

    private final MqttTransport transport;
    private final MessageQueue inboundQueue;
    private final MessageQueue outboundQueue;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, TopicHandler> handlers;
    private final AtomicReference<RuntimeException> callbackFailure;

    public TopicRegistry(MqttTransport transport, MessageQueue inboundQueue, MessageQueue outboundQueue) {
        this.transport = transport;
        this.inboundQueue = inboundQueue;
        this.outboundQueue = outboundQueue;
        objectMapper = new ObjectMapper();
        handlers = new ConcurrentHashMap<>();
        callbackFailure = new AtomicReference<>();
    }

    public void register(String topic, TopicHandler handler) {
        // bound before subscribing, retained messages may arrive before subscribe returns
        if (handlers.putIfAbsent(topic, handler) != null) {
            throw new DuplicateRegistrationException(topic);
        }
        int result = transport.subscribe(topic);
        if (result != 0) {
            handlers.remove(topic, handler);
            throw new SubscriptionFailure("Subscription", topic, result);
        }
        log.info("Subscribed to {} successfully", topic);
    }

    public TopicHandler unregister(String topic) {
        if (!handlers.containsKey(topic)) {
            throw new NotRegisteredException(topic);
        }
        int result = transport.unsubscribe(topic);
        if (result != 0) {
            throw new SubscriptionFailure("Unsubscription", topic, result);
        }
        log.info("Unsubscribed from {} successfully", topic);
        return handlers.remove(topic);
    }

    public boolean isRegistered(String topic) {
        return handlers.containsKey(topic);
    }

    public Set<String> getRegisteredTopics() {
        return Set.copyOf(handlers.keySet());
    }

    public void processInbound(String topic, JsonNode payload) {
        TopicHandler handler = handlers.get(topic);
        if (handler == null) {
            throw new UnroutedMessageException(topic);
        }
        handler.handle(payload);
    }

    public void processOutbound(String topic, JsonNode payload) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            log.error("Could not encode payload for {}: {}", topic, e.getLocalizedMessage());
            return;
        }
        log.info("Message to {} with payload {} sent", topic, payload);
        transport.publish(topic, bytes);
    }

    /**
     * Processes all queued inbound messages, waiting at most {@code pollTimeout} for each next message.
     *
     * @return the number of processed messages
     */
    public int drainInbound(Duration pollTimeout) throws InterruptedException {
        rethrowCallbackFailure();
        int processed = 0;
        Message message;
        while ((message = inboundQueue.poll(pollTimeout)) != null) {
            processInbound(message.topic(), message.payload());
            processed++;
        }
        return processed;
    }

    /**
     * Publishes all queued outbound messages, waiting at most {@code pollTimeout} for each next message.
     *
     * @return the number of published messages
     */
    public int drainOutbound(Duration pollTimeout) throws InterruptedException {
        rethrowCallbackFailure();
        int processed = 0;
        Message message;
        while ((message = outboundQueue.poll(pollTimeout)) != null) {
            processOutbound(message.topic(), message.payload());
            processed++;
        }
        return processed;
    }

    /**
     * Throws the first fatal exception raised on the transport thread, if any.
     */
    public void rethrowCallbackFailure() {
        RuntimeException failure = callbackFailure.get();
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void onConnect(int reasonCode) {
        if (reasonCode != 0) {
            log.error("Connection failed with code: {}", reasonCode);
            throw recordFailure(new ConnectionRefusedFailure(reasonCode));
        }
        log.info("Connected successfully");
        // broker side subscriptions do not necessarily survive a reconnect
        handlers.keySet().forEach(topic -> {
            int result = transport.subscribe(topic);
            if (result != 0) {
                log.warn("Re-subscription to {} failed with result code {}", topic, result);
            }
        });
    }

    @Override
    public void onMessage(String topic, byte[] payload) {
        if (!handlers.containsKey(topic)) {
            log.error("Message from {} received but not registered", topic);
            throw recordFailure(new UnroutedMessageException(topic));
        }
        log.debug("Message from {} received with {} bytes", topic, payload.length);
        inboundQueue.put(topic, decode(topic, payload));
    }

    @Override
    public void onConnectionLost(Throwable cause) {
        log.warn("Connection to broker lost: {}", cause == null ? "<no cause>" : cause.getLocalizedMessage());
    }

    private JsonNode decode(String topic, byte[] payload) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(ByteBuffer.wrap(payload))
                                         .toString();
        } catch (CharacterCodingException e) {
            log.warn("Ignoring payload on {}: not valid UTF-8", topic);
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Payload on {} is not JSON, passing it on as plain text", topic);
            return TextNode.valueOf(text.trim());
        }
    }

    private RuntimeException recordFailure(RuntimeException failure) {
        callbackFailure.compareAndSet(null, failure);
        return failure;
    }
}
