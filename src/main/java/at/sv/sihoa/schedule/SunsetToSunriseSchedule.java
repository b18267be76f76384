package at.sv.sihoa.schedule;

import at.sv.sihoa.time.SunTimesProvider;

import java.time.ZonedDateTime;

/**
 * On during the night, i.e. from today's sunset until (before) today's sunrise.
 */
public final class SunsetToSunriseSchedule implements ActuatorSchedule {

    private final SunTimesProvider sunTimesProvider;

    public SunsetToSunriseSchedule(SunTimesProvider sunTimesProvider) {
        this.sunTimesProvider = sunTimesProvider;
    }

    @Override
    public boolean shouldBeOn(ZonedDateTime now) {
        ZonedDateTime sunrise = sunTimesProvider.getSunrise(now);
        ZonedDateTime sunset = sunTimesProvider.getSunset(now);
        return !now.isBefore(sunset) || now.isBefore(sunrise);
    }

    @Override
    public String toString() {
        return "sunset-sunrise";
    }
}
