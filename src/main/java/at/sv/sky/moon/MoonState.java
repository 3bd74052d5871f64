package at.sv.sky.moon;

import at.sv.sky.coords.AltAz;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;

/**
 * Moon conditions for one instant and observer. Recomputed on every call, never persisted.
 */
@Data
@AllArgsConstructor
@Builder
public final class MoonState {

    public static final double SYNODIC_MONTH_DAYS = 29.53;

    /**
     * Illuminated fraction of the disk [0, 1].
     */
    private final double illumination;
    /**
     * [0, 1): 0 new moon, 0.25 first quarter, 0.5 full moon, 0.75 last quarter.
     */
    private final double phase;
    private final AltAz position;
    /**
     * Next moonrise within 24 hours, or null.
     */
    private final ZonedDateTime rise;
    /**
     * Next moonset within 24 hours, or null.
     */
    private final ZonedDateTime set;
    private final boolean alwaysUp;
    private final boolean alwaysDown;

    public MoonPhaseName getPhaseName() {
        return MoonPhaseName.of(phase);
    }

    public boolean isWaxing() {
        return phase <= 0.5;
    }

    public double getIlluminationPercent() {
        return illumination * 100.0;
    }

    public double getAge() {
        return phase * SYNODIC_MONTH_DAYS;
    }

    public LightPollutionLevel getLightPollution() {
        return LightPollutionLevel.of(getIlluminationPercent());
    }

    public double getAltitude() {
        return position.altitude();
    }

    public double getAzimuth() {
        return position.azimuth();
    }

    public boolean isUp() {
        return position.altitude() > 0;
    }

    /**
     * @return angular distance in degrees between the Moon and the given position
     */
    public double separationTo(AltAz target) {
        return position.separationTo(target);
    }
}
