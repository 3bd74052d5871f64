package at.sv.sky.time;

import org.shredzone.commons.suncalc.SunTimes;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

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
    public ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime, SunTimes.Twilight.VISUAL).getSet();
    }

    @Override
    public ZonedDateTime getNextSunrise(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime.plusDays(1), SunTimes.Twilight.VISUAL).getRise();
    }

    @Override
    public ZonedDateTime getAstronomicalDusk(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime, SunTimes.Twilight.ASTRONOMICAL).getSet();
    }

    @Override
    public ZonedDateTime getAstronomicalDawn(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime.plusDays(1), SunTimes.Twilight.ASTRONOMICAL).getRise();
    }

    private SunTimes sunTimesFor(ZonedDateTime dateTime, SunTimes.Twilight twilight) {
        String key = generateKey(dateTime, twilight);
        return cache.computeIfAbsent(key, k -> getProviderFor(dateTime).twilight(twilight).execute());
    }

    private SunTimes.Parameters getProviderFor(ZonedDateTime dateTime) {
        return SunTimes.compute().at(lat, lng).elevation(elevation).on(dateTime.with(LocalTime.MIDNIGHT))
                       .oneDay();
    }

    private String generateKey(ZonedDateTime dateTime, SunTimes.Twilight twilight) {
        return dateTime.toLocalDate().toString() + "-" + twilight.toString();
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return "sunset: " + format(getSunset(dateTime)) +
               "\nastronomical_dusk: " + format(getAstronomicalDusk(dateTime)) +
               "\nastronomical_dawn: " + format(getAstronomicalDawn(dateTime)) +
               "\nsunrise: " + format(getNextSunrise(dateTime));
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    private String format(ZonedDateTime time) {
        return time == null ? "N/A" : TIME_FORMATTER.format(time);
    }
}
