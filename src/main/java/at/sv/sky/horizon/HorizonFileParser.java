package at.sv.sky.horizon;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the plain-text horizon format: one {@code azimuth altitude} pair per line, separated by whitespace.
 * Blank lines and lines starting with {@code #} are ignored, as are lines without two numeric values.
 */
@Slf4j
public final class HorizonFileParser {

    private HorizonFileParser() {
    }

    public static HorizonProfile parse(String text) {
        return parse(null, text);
    }

    public static HorizonProfile parse(String name, String text) {
        if (text == null || text.isBlank()) {
            return new HorizonProfile(name, List.of());
        }
        List<HorizonPoint> points = new ArrayList<>();
        for (String line : text.strip().split("\\R")) {
            HorizonPoint point = parseLine(line);
            if (point != null) {
                points.add(point);
            }
        }
        return new HorizonProfile(name, points);
    }

    static HorizonPoint parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return null;
        }
        String[] parts = trimmed.split("\\s+");
        if (parts.length < 2) {
            log.debug("Skipping horizon line '{}': expected 'azimuth altitude'", trimmed);
            return null;
        }
        try {
            double azimuth = Double.parseDouble(parts[0]);
            double altitude = Double.parseDouble(parts[1]);
            if (!Double.isFinite(azimuth) || !Double.isFinite(altitude)) {
                log.debug("Skipping horizon line '{}': non-finite value", trimmed);
                return null;
            }
            return new HorizonPoint(HorizonProfile.normalizeAzimuth(azimuth), altitude);
        } catch (NumberFormatException e) {
            log.debug("Skipping horizon line '{}': {}", trimmed, e.getMessage());
            return null;
        }
    }
}
