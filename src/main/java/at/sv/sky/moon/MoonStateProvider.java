package at.sv.sky.moon;

import java.time.ZonedDateTime;

public interface MoonStateProvider {

    MoonState getMoonState(ZonedDateTime dateTime);

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }
}
