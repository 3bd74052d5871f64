package at.sv.sky.horizon;

/**
 * One obstruction sample: the lowest observable altitude at the given azimuth.
 */
public record HorizonPoint(double azimuth, double altitude) {
}
