package at.sv.sky.coords;

public enum CompassDirection {
    N, NNE, NE, ENE, E, ESE, SE, SSE, S, SSW, SW, WSW, W, WNW, NW, NNW;

    private static final CompassDirection[] POINTS = values();

    public static CompassDirection of(double azimuth) {
        double normalized = CoordinateTransform.normalize(azimuth, 360.0);
        int index = (int) Math.round(normalized / 22.5) % POINTS.length;
        return POINTS[index];
    }
}
