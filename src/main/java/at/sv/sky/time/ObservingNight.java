package at.sv.sky.time;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * A local-time interval used for nightly scans.
 *
 * @param start inclusive
 * @param end   the end of the night, see the individual factories for whether it is sampled
 */
public record ObservingNight(ZonedDateTime start, ZonedDateTime end) {

    public static final LocalTime EVENING = LocalTime.of(18, 0);
    public static final LocalTime SCAN_END = LocalTime.of(6, 0);
    public static final LocalTime CHART_END = LocalTime.of(8, 0);

    /**
     * The interval scanned for visibility windows: from 18:00 today (or from {@code now} when it is already
     * later) until 06:00 on the following day.
     */
    public static ObservingNight visibilityScan(ZonedDateTime now) {
        ZonedDateTime evening = now.with(EVENING);
        ZonedDateTime start = now.isBefore(evening) ? evening : now;
        ZonedDateTime end = evening.plusDays(1).with(SCAN_END);
        return new ObservingNight(start, end);
    }

    /**
     * The fixed 18:00 to 08:00 span on now's date used for altitude charts.
     */
    public static ObservingNight chart(ZonedDateTime now) {
        ZonedDateTime start = now.with(EVENING);
        return new ObservingNight(start, start.plusDays(1).with(CHART_END));
    }

    /**
     * From sunset until the next sunrise, or null if the sun does not set or rise at this location.
     */
    public static ObservingNight sunsetToSunrise(ZonedDateTime now, SunTimesProvider sunTimesProvider) {
        ZonedDateTime sunset = sunTimesProvider.getSunset(now);
        ZonedDateTime sunrise = sunTimesProvider.getNextSunrise(now);
        if (sunset == null || sunrise == null || !sunrise.isAfter(sunset)) {
            return null;
        }
        return new ObservingNight(sunset, sunrise);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean contains(ZonedDateTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }
}
