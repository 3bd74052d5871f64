package at.sv.sky.visibility;

import at.sv.sky.coords.AltAz;
import at.sv.sky.coords.CoordinateTransform;
import at.sv.sky.horizon.HorizonProfile;
import at.sv.sky.time.ObservingNight;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Nightly rise, peak and set search against the effective minimum altitude
 * {@code max(minAltitude, horizon(azimuth))}, with the azimuth recomputed at every step.
 */
public final class VisibilityWindowSearch {

    public static final Duration SCAN_STEP = Duration.ofMinutes(10);
    public static final Duration PEAK_SCAN_STEP = Duration.ofMinutes(15);
    public static final int PEAK_SCAN_STEPS = 48;

    private VisibilityWindowSearch() {
    }

    public static VisibilityWindow visibilityWindow(double raHours, double decDeg, double lat, double lon,
                                                    double minAltitude, HorizonProfile horizon, ZonedDateTime now) {
        return search(raHours, decDeg, lat, lon, minAltitude, horizon, ObservingNight.visibilityScan(now), SCAN_STEP);
    }

    /**
     * Samples {@code [night.start, night.end]} every {@code step}.
     */
    public static VisibilityWindow search(double raHours, double decDeg, double lat, double lon, double minAltitude,
                                          HorizonProfile horizon, ObservingNight night, Duration step) {
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Scan step must be positive: " + step);
        }
        ZonedDateTime start = null;
        ZonedDateTime end = null;
        ZonedDateTime optimalTime = null;
        double maxAltitude = VisibilityWindow.NO_PEAK;
        boolean wasVisible = false;
        int visibleSteps = 0;

        for (ZonedDateTime time = night.start(); !time.isAfter(night.end()); time = time.plus(step)) {
            AltAz position = CoordinateTransform.altAz(raHours, decDeg, lat, lon, time);
            double effectiveMinimum = HorizonProfile.effectiveMinimumAltitude(minAltitude, horizon, position.azimuth());
            boolean visible = position.altitude() >= effectiveMinimum;

            if (visible) {
                visibleSteps++;
                if (start == null) {
                    start = time;
                }
                if (position.altitude() > maxAltitude) {
                    maxAltitude = position.altitude();
                    optimalTime = time;
                }
            } else if (wasVisible && end == null) {
                end = time;
            }
            wasVisible = visible;
        }
        if (wasVisible && end == null) {
            end = night.end();
        }
        if (start == null) {
            return VisibilityWindow.empty(night);
        }
        double visibleHours = visibleSteps * step.toMinutes() / 60.0;
        return new VisibilityWindow(start, end, visibleHours, optimalTime, maxAltitude, night);
    }

    /**
     * Unobstructed peak over twelve hours from {@code start}, sampled every 15 minutes.
     */
    public static MaxAltitude findMaxAltitude(double raHours, double decDeg, double lat, double lon,
                                              ZonedDateTime start) {
        double maxAltitude = -90.0;
        ZonedDateTime maxTime = start;
        for (int i = 0; i < PEAK_SCAN_STEPS; i++) {
            ZonedDateTime time = start.plus(PEAK_SCAN_STEP.multipliedBy(i));
            double altitude = CoordinateTransform.altAz(raHours, decDeg, lat, lon, time).altitude();
            if (altitude > maxAltitude) {
                maxAltitude = altitude;
                maxTime = time;
            }
        }
        return new MaxAltitude(maxAltitude, maxTime);
    }
}
