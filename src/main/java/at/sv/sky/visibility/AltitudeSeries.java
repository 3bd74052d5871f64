package at.sv.sky.visibility;

import java.util.List;

/**
 * Altitude samples over a night with the horizon floor at each sample's azimuth.
 * Both lists have the same length and matching times.
 */
public record AltitudeSeries(List<AltitudePoint> points, List<HorizonSample> horizon) {

    public AltitudeSeries {
        if (points.size() != horizon.size()) {
            throw new IllegalArgumentException("Series length mismatch: " + points.size() + " != " + horizon.size());
        }
        points = List.copyOf(points);
        horizon = List.copyOf(horizon);
    }

    public int size() {
        return points.size();
    }

    /**
     * @return the first sample with the highest altitude, or null for an empty series
     */
    public AltitudePoint maxAltitudePoint() {
        AltitudePoint max = null;
        for (AltitudePoint point : points) {
            if (max == null || point.altitude() > max.altitude()) {
                max = point;
            }
        }
        return max;
    }

    /**
     * First and last sample at or above {@code max(threshold, horizon)}.
     */
    public TimeRange idealTimeRange(double threshold) {
        AltitudePoint first = null;
        AltitudePoint last = null;
        for (int i = 0; i < points.size(); i++) {
            AltitudePoint point = points.get(i);
            if (point.altitude() >= effectiveThreshold(threshold, i)) {
                if (first == null) {
                    first = point;
                }
                last = point;
            }
        }
        return first == null ? TimeRange.NONE : new TimeRange(first.time(), last.time());
    }

    /**
     * The sample with the largest clearance above {@code max(threshold, horizon)}, even if that clearance is
     * negative, or null for an empty series.
     */
    public AltitudePoint bestObservationPoint(double threshold) {
        AltitudePoint best = null;
        double bestClearance = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < points.size(); i++) {
            double clearance = points.get(i).altitude() - effectiveThreshold(threshold, i);
            if (clearance > bestClearance) {
                bestClearance = clearance;
                best = points.get(i);
            }
        }
        return best;
    }

    private double effectiveThreshold(double threshold, int index) {
        return Math.max(threshold, horizon.get(index).altitude());
    }
}
