package at.sv.sihoa.mqtt;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One-directional, thread-safe queue between the transport thread and the application loop. Producers may be any
 * thread, the application loop is the only consumer.
 */
public final class MessageQueue {

    private final BlockingQueue<Message> queue;

    public MessageQueue() {
        queue = new LinkedBlockingQueue<>();
    }

    public void put(String topic, JsonNode payload) {
        queue.add(new Message(topic, payload));
    }

    /**
     * @return the next message or {@code null} if none arrived within the given timeout
     */
    public Message poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int drainTo(List<Message> target) {
        return queue.drainTo(target);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
