package at.sv.sky.visibility;

import at.sv.sky.time.ObservingNight;

import java.time.ZonedDateTime;

/**
 * When a target is above its effective minimum altitude during one night.
 *
 * @param start        first visible sample, null if never visible
 * @param end          first sample that is no longer visible after having been visible, or the scan end
 *                     if still visible then; null if never visible
 * @param visibleHours number of visible samples times the step length
 * @param optimalTime  time of the highest visible sample, null if never visible
 * @param maxAltitude  altitude at {@code optimalTime}, {@link #NO_PEAK} if never visible
 * @param night        the scanned interval
 */
public record VisibilityWindow(ZonedDateTime start, ZonedDateTime end, double visibleHours,
                               ZonedDateTime optimalTime, double maxAltitude, ObservingNight night) {

    public static final double NO_PEAK = -90.0;
    /**
     * Below this, a target is not considered observable tonight.
     */
    public static final double MIN_VISIBLE_HOURS = 0.5;

    public static VisibilityWindow empty(ObservingNight night) {
        return new VisibilityWindow(null, null, 0.0, null, NO_PEAK, night);
    }

    public boolean isEmpty() {
        return start == null;
    }

    public boolean isVisibleTonight() {
        return visibleHours >= MIN_VISIBLE_HOURS;
    }

    /**
     * @return true if the target was already visible when the scan started
     */
    public boolean isOpenAtStart() {
        return start != null && start.isEqual(night.start());
    }

    /**
     * @return true if the target was still visible when the scan ended
     */
    public boolean isOpenAtEnd() {
        return end != null && end.isEqual(night.end());
    }
}
