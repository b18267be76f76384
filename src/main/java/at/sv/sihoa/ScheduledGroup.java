package at.sv.sihoa;

import at.sv.sihoa.device.Actuator;
import at.sv.sihoa.device.CommandResult;
import at.sv.sihoa.schedule.ActuatorSchedule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Actuators sharing one schedule.
 */
@Slf4j
public final class ScheduledGroup {

    @Getter
    private final ActuatorSchedule schedule;
    @Getter
    private final List<Actuator> actuators;

    public ScheduledGroup(ActuatorSchedule schedule, List<Actuator> actuators) {
        this.schedule = schedule;
        this.actuators = List.copyOf(actuators);
    }

    /**
     * Requests the desired state from every online actuator whose confirmed state differs from it.
     *
     * @return the number of issued commands
     */
    public int evaluate(ZonedDateTime now) {
        boolean desiredOn = schedule.shouldBeOn(now);
        int issued = 0;
        for (Actuator actuator : actuators) {
            if (!actuator.isOnline() || Boolean.valueOf(desiredOn).equals(actuator.getOn())) {
                continue;
            }
            if (actuator.requestState(desiredOn) == CommandResult.ISSUED) {
                log.info("Turning {} {} ({})", actuator.getFriendlyName(), desiredOn ? "on" : "off", schedule);
                issued++;
            }
        }
        return issued;
    }

    @Override
    public String toString() {
        return schedule + " " + actuators.stream().map(Actuator::getFriendlyName).toList();
    }
}
