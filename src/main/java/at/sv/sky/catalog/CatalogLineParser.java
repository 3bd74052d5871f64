package at.sv.sky.catalog;

import at.sv.sky.coords.SexagesimalParser;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Parses one catalog line. Columns are separated by tabs or at least two spaces:
 * <pre>
 * id  name  type  ra  dec  [magnitude]  [size]  [constellation]  [common name]  [distance]
 * </pre>
 * RA is given in decimal hours or as {@code 05h 35m 17.3s}, Dec in decimal degrees or as {@code -05° 23' 28"}.
 * Size is in arc minutes, distance in light years. A single {@code -} marks an empty optional column. Malformed lines yield null.
 */
@Slf4j
public final class CatalogLineParser {

    private static final Pattern SEPARATOR = Pattern.compile("\\t+|\\s{2,}");
    private static final String EMPTY = "-";

    private CatalogLineParser() {
    }

    public static boolean isSkippable(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    public static CatalogTarget parse(String line) {
        if (line == null || isSkippable(line)) {
            return null;
        }
        String[] parts = SEPARATOR.split(line.trim());
        if (parts.length < 5) {
            log.warn("Skipping catalog line '{}': at least id, name, type, ra and dec have to be set", line.trim());
            return null;
        }
        Double ra = parseRightAscension(parts[3].trim());
        Double dec = parseDeclination(parts[4].trim());
        if (ra == null || dec == null) {
            log.warn("Skipping catalog line '{}': invalid coordinates ra='{}' dec='{}'", line.trim(), parts[3], parts[4]);
            return null;
        }
        try {
            return CatalogTarget.builder()
                                .id(parts[0].trim())
                                .name(parts[1].trim())
                                .type(parts[2].trim())
                                .ra(ra)
                                .dec(dec)
                                .magnitude(optionalDouble(parts, 5))
                                .size(optionalDouble(parts, 6))
                                .constellation(optionalString(parts, 7))
                                .commonName(optionalString(parts, 8))
                                .distance(optionalDouble(parts, 9))
                                .build();
        } catch (NumberFormatException e) {
            log.warn("Skipping catalog line '{}': {}", line.trim(), e.getMessage());
            return null;
        }
    }

    static Double parseRightAscension(String value) {
        Double decimal = tryParseDouble(value);
        double ra = decimal != null ? decimal : orNaN(SexagesimalParser.parseRightAscension(value));
        if (Double.isNaN(ra) || ra < 0 || ra >= 24) {
            return null;
        }
        return ra;
    }

    static Double parseDeclination(String value) {
        Double decimal = tryParseDouble(value);
        double dec = decimal != null ? decimal : orNaN(SexagesimalParser.parseDeclination(value));
        if (Double.isNaN(dec) || dec < -90 || dec > 90) {
            return null;
        }
        return dec;
    }

    private static Double optionalDouble(String[] parts, int index) {
        String value = optionalString(parts, index);
        return value == null ? null : Double.valueOf(value);
    }

    private static String optionalString(String[] parts, int index) {
        if (index >= parts.length) {
            return null;
        }
        String value = parts[index].trim();
        return value.isEmpty() || EMPTY.equals(value) ? null : value;
    }

    private static Double tryParseDouble(String value) {
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException ignore) {
            return null;
        }
    }

    private static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }
}
