package at.sv.sihoa;

import at.sv.sihoa.device.Actuator;
import at.sv.sihoa.device.ActuatorType;
import at.sv.sihoa.device.Device;
import at.sv.sihoa.device.DeviceTopics;
import at.sv.sihoa.mqtt.MessageQueue;
import at.sv.sihoa.schedule.ActuatorSchedule;
import at.sv.sihoa.schedule.SunsetToSunriseSchedule;
import at.sv.sihoa.schedule.SunsetToTimeSchedule;
import at.sv.sihoa.time.SunTimesProvider;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses the actuator configuration. Each line describes one actuator:
 * <pre>
 * friendly_name  ieee_address  light|plug  sunset-sunrise|sunset-HH:mm
 * </pre>
 * Parts are separated by tabs or at least two spaces, so friendly names may contain single spaces.
 */
public final class ActuatorConfigurationParser {

    private static final String SUNSET_PREFIX = "sunset-";
    private static final String SUNRISE = "sunrise";

    private final SunTimesProvider sunTimesProvider;
    private final ZoneId zone;
    private final String baseTopic;
    private final MessageQueue outboundQueue;
    private final Ticker ticker;
    private final Duration pendingCommandTimeout;

    public ActuatorConfigurationParser(SunTimesProvider sunTimesProvider, ZoneId zone, String baseTopic,
                                       MessageQueue outboundQueue, Ticker ticker, Duration pendingCommandTimeout) {
        this.sunTimesProvider = sunTimesProvider;
        this.zone = zone;
        this.baseTopic = baseTopic;
        this.outboundQueue = outboundQueue;
        this.ticker = ticker;
        this.pendingCommandTimeout = pendingCommandTimeout;
    }

    public ActuatorConfiguration parse(List<String> lines) {
        List<Actuator> actuators = new ArrayList<>();
        Map<String, List<Actuator>> actuatorsBySchedule = new LinkedHashMap<>();
        Map<String, ActuatorSchedule> schedules = new LinkedHashMap<>();
        Set<String> names = new HashSet<>();
        for (String line : lines) {
            if (line.isBlank() || line.trim().startsWith("#")) {
                continue;
            }
            String[] parts = line.trim().split("\\t+|\\s{2,}");
            if (parts.length != 4) {
                throw new InvalidConfigurationLine("Invalid configuration line '" + line + "': expected friendly name," +
                                                   " IEEE address, type and schedule. Make sure to use either tabs or" +
                                                   " at least two spaces to separate the different parts.");
            }
            String name = parts[0];
            if (!names.add(name)) {
                throw new InvalidConfigurationLine("Invalid configuration line '" + line + "': '" + name +
                                                   "' is already configured.");
            }
            String scheduleKey = parts[3].toLowerCase(Locale.ROOT);
            ActuatorSchedule schedule = schedules.get(scheduleKey);
            if (schedule == null) {
                schedule = parseSchedule(line, scheduleKey);
                schedules.put(scheduleKey, schedule);
            }
            Actuator actuator = createActuator(line, name, parts[1], parts[2]);
            actuators.add(actuator);
            actuatorsBySchedule.computeIfAbsent(scheduleKey, key -> new ArrayList<>()).add(actuator);
        }
        List<ScheduledGroup> groups = new ArrayList<>();
        actuatorsBySchedule.forEach((key, members) -> groups.add(new ScheduledGroup(schedules.get(key), members)));
        return new ActuatorConfiguration(List.copyOf(actuators), List.copyOf(groups));
    }

    private Actuator createActuator(String line, String name, String ieeeAddress, String type) {
        ActuatorType actuatorType;
        try {
            actuatorType = ActuatorType.parse(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationLine("Invalid configuration line '" + line + "': " + e.getMessage(), e);
        }
        Device device = new Device(ieeeAddress, name);
        return new Actuator(device, DeviceTopics.of(baseTopic, name), actuatorType.createVariant(), outboundQueue,
                ticker, pendingCommandTimeout);
    }

    private ActuatorSchedule parseSchedule(String line, String value) {
        if (!value.startsWith(SUNSET_PREFIX)) {
            throw invalidSchedule(line, value, null);
        }
        String end = value.substring(SUNSET_PREFIX.length());
        if (end.equals(SUNRISE)) {
            return new SunsetToSunriseSchedule(sunTimesProvider);
        }
        try {
            return new SunsetToTimeSchedule(sunTimesProvider, LocalTime.parse(end), zone);
        } catch (DateTimeParseException e) {
            throw invalidSchedule(line, value, e);
        }
    }

    private static InvalidConfigurationLine invalidSchedule(String line, String value, Throwable cause) {
        return new InvalidConfigurationLine("Invalid configuration line '" + line + "': unknown schedule '" + value +
                                            "'. Supported: sunset-sunrise, sunset-HH:mm", cause);
    }
}
