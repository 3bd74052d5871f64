package at.sv.sky.visibility;

import java.time.ZonedDateTime;

public record TimeRange(ZonedDateTime start, ZonedDateTime end) {

    public static final TimeRange NONE = new TimeRange(null, null);

    public boolean isEmpty() {
        return start == null;
    }
}
