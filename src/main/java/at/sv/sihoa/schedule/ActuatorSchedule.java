package at.sv.sihoa.schedule;

import java.time.ZonedDateTime;

/**
 * Decides whether the actuators of a group should be on at a given time.
 */
public interface ActuatorSchedule {

    boolean shouldBeOn(ZonedDateTime now);
}
