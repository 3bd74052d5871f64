package at.sv.sky.visibility;

import java.time.ZonedDateTime;

public record AltitudePoint(ZonedDateTime time, double altitude, double azimuth, boolean ideal) {
}
