package at.sv.sky.visibility;

import at.sv.sky.coords.AltAz;
import at.sv.sky.coords.CoordinateTransform;
import at.sv.sky.horizon.HorizonProfile;
import at.sv.sky.time.ObservingNight;
import at.sv.sky.time.SunTimesProvider;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoublePredicate;

/**
 * Evenly spaced altitude/azimuth samples for charting. Holds no state; recomputing is cheap.
 */
public final class AltitudeSampler {

    public static final Duration CHART_STEP = Duration.ofMinutes(15);
    /**
     * Display threshold for the chart, independent of the recommender's minimum altitude.
     */
    public static final double CHART_IDEAL_ALTITUDE = 30.0;
    public static final double SUN_NIGHT_IDEAL_ALTITUDE = 20.0;
    static final DoublePredicate CHART_IDEAL = altitude -> altitude >= CHART_IDEAL_ALTITUDE;
    /**
     * Strictly above the threshold, unlike the chart.
     */
    static final DoublePredicate SUN_NIGHT_IDEAL = altitude -> altitude > SUN_NIGHT_IDEAL_ALTITUDE;
    private static final long MIN_SUN_NIGHT_STEP_MINUTES = 10;
    private static final long SUN_NIGHT_TARGET_SAMPLES = 60;

    private AltitudeSampler() {
    }

    /**
     * 18:00 to 08:00 every 15 minutes, both ends included (57 samples). Negative altitudes are clamped to 0.
     */
    public static AltitudeSeries sampleNight(double raHours, double decDeg, double lat, double lon,
                                             HorizonProfile horizon, ZonedDateTime now) {
        return sample(raHours, decDeg, lat, lon, horizon, ObservingNight.chart(now), CHART_STEP,
                CHART_IDEAL, true);
    }

    /**
     * Sunset to next sunrise with at least 10 minutes between samples and roughly 60 samples in total.
     *
     * @return an empty series if the sun does not set or rise on that date
     */
    public static AltitudeSeries sampleSunsetToSunrise(double raHours, double decDeg, double lat, double lon,
                                                       HorizonProfile horizon, ZonedDateTime now,
                                                       SunTimesProvider sunTimesProvider) {
        ObservingNight night = ObservingNight.sunsetToSunrise(now, sunTimesProvider);
        if (night == null) {
            return new AltitudeSeries(List.of(), List.of());
        }
        long totalMinutes = night.length().toMinutes();
        Duration step = Duration.ofMinutes(Math.max(MIN_SUN_NIGHT_STEP_MINUTES, totalMinutes / SUN_NIGHT_TARGET_SAMPLES));
        return sample(raHours, decDeg, lat, lon, horizon, night, step, SUN_NIGHT_IDEAL, false);
    }

    /**
     * Samples {@code [night.start, night.end]} every {@code step}.
     */
    public static AltitudeSeries sample(double raHours, double decDeg, double lat, double lon, HorizonProfile horizon,
                                        ObservingNight night, Duration step, DoublePredicate ideal,
                                        boolean clampNegative) {
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Sample step must be positive: " + step);
        }
        List<AltitudePoint> points = new ArrayList<>();
        List<HorizonSample> horizonSamples = new ArrayList<>();
        for (ZonedDateTime time = night.start(); !time.isAfter(night.end()); time = time.plus(step)) {
            AltAz position = CoordinateTransform.altAz(raHours, decDeg, lat, lon, time);
            double altitude = clampNegative ? Math.max(0.0, position.altitude()) : position.altitude();
            points.add(new AltitudePoint(time, altitude, position.azimuth(), ideal.test(position.altitude())));
            horizonSamples.add(new HorizonSample(time, HorizonProfile.horizonAltitude(horizon, position.azimuth())));
        }
        return new AltitudeSeries(points, horizonSamples);
    }
}
