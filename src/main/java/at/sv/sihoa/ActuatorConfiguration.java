package at.sv.sihoa;

import at.sv.sihoa.device.Actuator;

import java.util.List;

/**
 * The actuators of a configuration file, grouped by their schedule.
 */
public record ActuatorConfiguration(List<Actuator> actuators, List<ScheduledGroup> groups) {
}
