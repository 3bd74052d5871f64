package at.sv.sky.visibility;

import java.time.ZonedDateTime;

public record MaxAltitude(double altitude, ZonedDateTime time) {
}
