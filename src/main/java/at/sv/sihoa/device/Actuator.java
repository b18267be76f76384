package at.sv.sihoa.device;

import at.sv.sihoa.mqtt.MessageQueue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * In-memory model of a switchable device.
 * <p>
 * Requesting a state queues a {@code set} command followed by a {@code get} read-back and marks a command as pending.
 * Until a report of the device confirms the command, further requests are ignored. This keeps the application loop
 * from flooding the device while it re-asserts the same desired state every tick.
 * <p>
 * Not thread-safe: all methods must be called from the application loop.
 */
@Slf4j
public final class Actuator {

    @Getter
    private final Device device;
    @Getter
    private final DeviceTopics topics;
    @Getter
    private final ActuatorVariant variant;
    private final MessageQueue outboundQueue;
    private final Ticker ticker;
    private final long pendingCommandTimeoutNanos;

    @Getter
    private Availability availability = Availability.UNKNOWN;
    private Boolean on;
    @Getter
    private boolean pendingCommand;
    private long pendingSince;

    /**
     * @param pendingCommandTimeout the time after which an unconfirmed command no longer blocks new requests, or
     *                              {@link Duration#ZERO} to wait for a confirmation indefinitely
     */
    public Actuator(Device device, DeviceTopics topics, ActuatorVariant variant, MessageQueue outboundQueue,
                    Ticker ticker, Duration pendingCommandTimeout) {
        this.device = device;
        this.topics = topics;
        this.variant = variant;
        this.outboundQueue = outboundQueue;
        this.ticker = ticker;
        this.pendingCommandTimeoutNanos = pendingCommandTimeout.toNanos();
    }

    public static Actuator create(ActuatorType type, Device device, String baseTopic, MessageQueue outboundQueue) {
        return new Actuator(device, DeviceTopics.of(baseTopic, device.friendlyName()), type.createVariant(),
                outboundQueue, Ticker.systemTicker(), Duration.ZERO);
    }

    public String getFriendlyName() {
        return device.friendlyName();
    }

    public boolean isOnline() {
        return availability == Availability.ONLINE;
    }

    /**
     * @return the last confirmed on state, {@code null} if not yet confirmed
     */
    public Boolean getOn() {
        return on;
    }

    public PowerState getPowerState() {
        if (on == null) {
            return PowerState.UNCONFIRMED;
        }
        return on ? PowerState.ON : PowerState.OFF;
    }

    public void onAvailability(JsonNode payload) {
        String state = null;
        if (payload.isObject()) {
            state = ReportFields.readText(payload, "state");
        } else if (payload.isTextual()) {
            state = payload.asText(); // legacy availability payload
        }
        if (state == null) {
            log.debug("Ignoring availability message without state for {}", getFriendlyName());
            return;
        }
        switch (state.trim().toLowerCase(Locale.ROOT)) {
            case "online" -> {
                availability = Availability.ONLINE;
                log.info("{} is online", getFriendlyName());
                requestRead(variant.getOnlineReadKeys());
            }
            case "offline" -> {
                availability = Availability.OFFLINE;
                log.info("{} is offline", getFriendlyName());
            }
            default -> log.debug("Ignoring unknown availability '{}' for {}", state, getFriendlyName());
        }
    }

    public void onReport(JsonNode report) {
        if (!report.isObject()) {
            log.debug("Ignoring malformed report for {}", getFriendlyName());
            return;
        }
        pendingCommand = false;
        String state = ReportFields.readText(report, "state");
        if (state != null) {
            on = "ON".equals(state);
        }
        variant.onReport(report);
    }

    public CommandResult requestOn() {
        return requestState(true);
    }

    public CommandResult requestOff() {
        return requestState(false);
    }

    /**
     * Same as {@link #requestState(boolean)}.
     */
    public CommandResult setOn(boolean value) {
        return requestState(value);
    }

    /**
     * The inverse of {@link #setOn(boolean)}: {@code setOff(true)} turns the device off.
     */
    public CommandResult setOff(boolean value) {
        return requestState(!value);
    }

    /**
     * Queues a command for the given state, unless a previous command is still waiting for its confirmation.
     * Idempotent: requesting the current state again only re-confirms it via read-back.
     */
    public CommandResult requestState(boolean desiredOn) {
        if (pendingCommand) {
            if (!isPendingCommandExpired()) {
                return CommandResult.SKIPPED_PENDING;
            }
            log.warn("Command for {} was not confirmed within {} ms. Sending again.", getFriendlyName(),
                    Duration.ofNanos(pendingCommandTimeoutNanos).toMillis());
        }
        ObjectNode command = JsonNodeFactory.instance.objectNode();
        command.put("state", desiredOn ? "ON" : "OFF");
        variant.decorateCommand(command);
        outboundQueue.put(topics.set(), command);
        requestRead(List.of("state"));
        pendingCommand = true;
        pendingSince = ticker.read();
        log.debug("Requested {} for {}", desiredOn ? "ON" : "OFF", getFriendlyName());
        return CommandResult.ISSUED;
    }

    private boolean isPendingCommandExpired() {
        return pendingCommandTimeoutNanos > 0 && ticker.read() - pendingSince >= pendingCommandTimeoutNanos;
    }

    private void requestRead(List<String> keys) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        keys.forEach(key -> request.put(key, ""));
        outboundQueue.put(topics.get(), request);
    }

    @Override
    public String toString() {
        return "Actuator{" +
               "name=" + getFriendlyName() +
               ", type=" + variant.getType() +
               ", availability=" + availability +
               ", power=" + getPowerState() +
               ", pending=" + pendingCommand +
               '}';
    }
}
