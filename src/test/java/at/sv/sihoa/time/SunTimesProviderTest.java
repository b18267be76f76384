package at.sv.sihoa.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

class SunTimesProviderTest {

    private ZonedDateTime dateTime;
    private SunTimesProviderImpl provider;

    private void assertTimeAround(ZonedDateTime time, int hour, int minute) {
        LocalTime expected = LocalTime.of(hour, minute);
        assertThat("Time differs", time.toLocalTime(),
                allOf(greaterThanOrEqualTo(expected.minusMinutes(2)), lessThanOrEqualTo(expected.plusMinutes(2))));
    }

    @BeforeEach
    void setUp() {
        ZoneId zone = ZoneId.of("Europe/Vienna");
        dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, zone);
        provider = new SunTimesProviderImpl(48.20, 16.39, 165);
    }

    @Test
    void returnsCorrectTimes_dependingOnDate() {
        assertTimeAround(provider.getSunrise(dateTime), 7, 42);
        assertTimeAround(provider.getSunset(dateTime), 16, 14);
        dateTime = dateTime.plusDays(30);
        assertTimeAround(provider.getSunrise(dateTime), 7, 21);
        assertTimeAround(provider.getSunset(dateTime), 16, 55);
    }

    @Test
    void returnsSameTime_doesNotDependOnTimeOfDay() {
        ZonedDateTime sunset = provider.getSunset(dateTime);

        assertThat(provider.getSunset(dateTime.withHour(16).withMinute(14).withSecond(30)), is(sunset));
        assertThat(provider.getSunset(dateTime.withHour(23)), is(sunset));
    }

    @Test
    void returnsTimesOnSameDate() {
        ZonedDateTime summer = dateTime.withMonth(7).withHour(12);

        assertThat(provider.getSunrise(summer).toLocalDate(), is(summer.toLocalDate()));
        assertThat(provider.getSunset(summer).toLocalDate(), is(summer.toLocalDate()));
    }

    @Test
    void toDebugString_containsSunriseAndSunset() {
        assertThat(provider.toDebugString(dateTime), allOf(containsString("sunrise: 07:4"), containsString("sunset: 16:1")));
    }
}
