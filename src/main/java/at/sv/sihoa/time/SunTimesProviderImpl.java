package at.sv.sihoa.time;

import org.shredzone.commons.suncalc.SunTimes;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final double lat;
    private final double lng;
    private final double elevation;

    private final Map<String, SunTimes> cache;

    public SunTimesProviderImpl(double lat, double lng, double elevation) {
        this.lat = lat;
        this.lng = lng;
        this.elevation = elevation;
        cache = new ConcurrentHashMap<>();
    }

    @Override
    public ZonedDateTime getSunrise(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime).getRise();
    }

    @Override
    public ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime).getSet();
    }

    private SunTimes sunTimesFor(ZonedDateTime dateTime) {
        // one entry per day and zone, the loop asks for the same day several times per second
        String key = dateTime.toLocalDate() + "-" + dateTime.getZone();
        return cache.computeIfAbsent(key, k -> SunTimes.compute()
                                                       .at(lat, lng)
                                                       .elevation(elevation)
                                                       .on(dateTime.with(LocalTime.MIDNIGHT))
                                                       .twilight(SunTimes.Twilight.VISUAL)
                                                       .execute());
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return "sunrise: " + TIME_FORMATTER.format(getSunrise(dateTime)) +
               "\nsunset: " + TIME_FORMATTER.format(getSunset(dateTime));
    }
}
