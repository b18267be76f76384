package at.sv.sihoa.time;

import java.time.ZonedDateTime;

public interface SunTimesProvider {

    /**
     * @return the sunrise on the date of the given date-time, in its zone
     */
    ZonedDateTime getSunrise(ZonedDateTime dateTime);

    /**
     * @return the sunset on the date of the given date-time, in its zone
     */
    ZonedDateTime getSunset(ZonedDateTime dateTime);

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }
}
