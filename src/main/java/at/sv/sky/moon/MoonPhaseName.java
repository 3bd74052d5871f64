package at.sv.sky.moon;

/**
 * Display names for the phase value [0, 1) where 0 is new moon and 0.5 is full moon.
 * The band limits are fixed; existing displays depend on them.
 */
public enum MoonPhaseName {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private final String displayName;

    MoonPhaseName(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static MoonPhaseName of(double phase) {
        if (phase < 0.03) return NEW_MOON;
        if (phase < 0.22) return WAXING_CRESCENT;
        if (phase < 0.28) return FIRST_QUARTER;
        if (phase < 0.47) return WAXING_GIBBOUS;
        if (phase < 0.53) return FULL_MOON;
        if (phase < 0.72) return WANING_GIBBOUS;
        if (phase < 0.78) return LAST_QUARTER;
        if (phase < 0.97) return WANING_CRESCENT;
        return NEW_MOON;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
