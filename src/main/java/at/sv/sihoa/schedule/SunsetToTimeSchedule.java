package at.sv.sihoa.schedule;

import at.sv.sihoa.time.SunTimesProvider;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * On from sunset until a fixed local off-time, which may be before or after midnight.
 */
public final class SunsetToTimeSchedule implements ActuatorSchedule {

    private final SunTimesProvider sunTimesProvider;
    private final LocalTime offTime;
    private final ZoneId zone;

    public SunsetToTimeSchedule(SunTimesProvider sunTimesProvider, LocalTime offTime, ZoneId zone) {
        this.sunTimesProvider = sunTimesProvider;
        this.offTime = offTime;
        this.zone = zone;
    }

    @Override
    public boolean shouldBeOn(ZonedDateTime now) {
        ZonedDateTime localNow = now.withZoneSameInstant(zone);
        ZonedDateTime sunset = sunTimesProvider.getSunset(localNow);
        ZonedDateTime todaysOffTime = localNow.with(offTime);
        if (todaysOffTime.isAfter(sunset)) {
            // off-time before midnight, e.g. 23:00
            return !localNow.isBefore(sunset) && localNow.isBefore(todaysOffTime);
        }
        // off-time after midnight, e.g. 04:00
        return !localNow.isBefore(sunset) || localNow.isBefore(todaysOffTime);
    }

    @Override
    public String toString() {
        return "sunset-" + offTime;
    }
}
