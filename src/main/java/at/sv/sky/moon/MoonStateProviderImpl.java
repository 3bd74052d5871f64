package at.sv.sky.moon;

import at.sv.sky.coords.AltAz;
import at.sv.sky.coords.CoordinateTransform;
import org.shredzone.commons.suncalc.MoonIllumination;
import org.shredzone.commons.suncalc.MoonTimes;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Illumination and rise/set come from commons-suncalc, the position from {@link MoonEphemeris}
 * run through the same transform as every catalog target.
 */
public final class MoonStateProviderImpl implements MoonStateProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private final double lat;
    private final double lng;
    private final double elevation;

    public MoonStateProviderImpl(double lat, double lng, double elevation) {
        this.lat = lat;
        this.lng = lng;
        this.elevation = elevation;
    }

    @Override
    public MoonState getMoonState(ZonedDateTime dateTime) {
        MoonIllumination illumination = MoonIllumination.compute().on(dateTime).execute();
        MoonTimes times = MoonTimes.compute()
                                   .on(dateTime)
                                   .at(lat, lng)
                                   .elevation(elevation)
                                   .oneDay()
                                   .execute();
        return MoonState.builder()
                        .illumination(illumination.getFraction())
                        .phase(toPhaseFraction(illumination.getPhase()))
                        .position(position(dateTime))
                        .rise(times.getRise())
                        .set(times.getSet())
                        .alwaysUp(times.isAlwaysUp())
                        .alwaysDown(times.isAlwaysDown())
                        .build();
    }

    private AltAz position(ZonedDateTime dateTime) {
        double[] equatorial = MoonEphemeris.equatorial(dateTime.toInstant());
        return CoordinateTransform.altAz(equatorial[0], equatorial[1], lat, lng, dateTime);
    }

    /**
     * Maps the suncalc phase angle (-180° new, -90° first quarter, 0° full, 90° last quarter) to [0, 1).
     */
    static double toPhaseFraction(double phaseDegrees) {
        double fraction = ((phaseDegrees + 180.0) / 360.0) % 1.0;
        if (fraction < 0) {
            fraction += 1.0;
        }
        return fraction;
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        MoonState state = getMoonState(dateTime);
        return "moon: " + state.getPhaseName() +
               String.format(Locale.ROOT, " (%.0f%% illuminated, age %.1f days)",
                       state.getIlluminationPercent(), state.getAge()) +
               "\nmoon position: " + state.getPosition() +
               "\nmoonrise: " + format(state.getRise()) +
               "\nmoonset: " + format(state.getSet());
    }

    private String format(ZonedDateTime time) {
        return time == null ? "N/A" : TIME_FORMATTER.format(time);
    }
}
