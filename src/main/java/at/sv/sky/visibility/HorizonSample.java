package at.sv.sky.visibility;

import java.time.ZonedDateTime;

/**
 * Horizon floor at the azimuth of the matching {@link AltitudePoint}.
 */
public record HorizonSample(ZonedDateTime time, double altitude) {
}
