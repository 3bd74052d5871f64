package at.sv.sky.time;

import java.time.ZonedDateTime;

/**
 * Sun event times for the evening of the given date and the following morning.
 */
public interface SunTimesProvider {

    ZonedDateTime getSunset(ZonedDateTime dateTime);

    /**
     * @return the sunrise on the morning after the given date
     */
    ZonedDateTime getNextSunrise(ZonedDateTime dateTime);

    ZonedDateTime getAstronomicalDusk(ZonedDateTime dateTime);

    /**
     * @return the astronomical dawn on the morning after the given date
     */
    ZonedDateTime getAstronomicalDawn(ZonedDateTime dateTime);

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }

    void clearCache();
}
