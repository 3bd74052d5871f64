package at.sv.sky.moon;

public enum LightPollutionLevel {
    MINIMAL,
    MODERATE,
    SEVERE;

    /**
     * @param illuminationPercent [0, 100]
     */
    public static LightPollutionLevel of(double illuminationPercent) {
        if (illuminationPercent < 25) return MINIMAL;
        if (illuminationPercent < 75) return MODERATE;
        return SEVERE;
    }
}
