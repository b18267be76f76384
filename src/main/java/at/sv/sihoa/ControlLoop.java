package at.sv.sihoa;

import at.sv.sihoa.device.Actuator;
import at.sv.sihoa.mqtt.TopicRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * The single application thread: publishes queued commands, dispatches received messages and evaluates the
 * schedules. All actuator state is only touched from here.
 */
@Slf4j
public final class ControlLoop implements Runnable {

    private final TopicRegistry registry;
    private final List<ScheduledGroup> groups;
    private final Supplier<ZonedDateTime> currentTime;
    private final Duration pollTimeout;
    private final Duration period;

    public ControlLoop(TopicRegistry registry, List<ScheduledGroup> groups, Supplier<ZonedDateTime> currentTime,
                       Duration pollTimeout, Duration period) {
        this.registry = registry;
        this.groups = groups;
        this.currentTime = currentTime;
        this.pollTimeout = pollTimeout;
        this.period = period;
    }

    /**
     * Binds the availability and state topic of every actuator to its handlers.
     */
    public void registerTopics() {
        for (ScheduledGroup group : groups) {
            for (Actuator actuator : group.getActuators()) {
                registry.register(actuator.getTopics().availability(), payload -> {
                    MDC.put("context", "availability " + actuator.getFriendlyName());
                    actuator.onAvailability(payload);
                });
                registry.register(actuator.getTopics().state(), payload -> {
                    MDC.put("context", "on-report " + actuator.getFriendlyName());
                    actuator.onReport(payload);
                });
            }
        }
    }

    public void tick() throws InterruptedException {
        registry.drainOutbound(pollTimeout);
        registry.drainInbound(pollTimeout);
        MDC.put("context", "loop");
        ZonedDateTime now = currentTime.get();
        for (ScheduledGroup group : groups) {
            group.evaluate(now);
        }
    }

    /**
     * Runs until the thread is interrupted. Dispatcher failures end the loop.
     */
    @Override
    public void run() {
        MDC.put("context", "loop");
        log.info("Control loop started for {} group(s)", groups.size());
        try {
            while (!Thread.currentThread().isInterrupted()) {
                tick();
                Thread.sleep(period.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("Control loop stopped");
            MDC.remove("context");
        }
    }
}
