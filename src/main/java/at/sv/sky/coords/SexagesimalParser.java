package at.sv.sky.coords;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses catalog style coordinates, e.g. {@code 05h 35m 17.3s} and {@code -05° 23' 28"}.
 * Unparseable input yields {@code null} so that a single bad record can simply be skipped.
 */
public final class SexagesimalParser {

    private static final Pattern RA_PATTERN = Pattern.compile("^(\\d+)h\\s*(\\d+)m\\s*([\\d.]+)s$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DEC_PATTERN = Pattern.compile("^([+-]?)(\\d+)°\\s*(\\d+)'\\s*([\\d.]+)(?:\"|'')$");

    private SexagesimalParser() {
    }

    /**
     * @return right ascension in hours, or null if the input does not match {@code HHh MMm SS.Ss}
     */
    public static Double parseRightAscension(String input) {
        if (input == null) {
            return null;
        }
        Matcher matcher = RA_PATTERN.matcher(input.trim());
        if (!matcher.matches()) {
            return null;
        }
        try {
            int hours = Integer.parseInt(matcher.group(1));
            int minutes = Integer.parseInt(matcher.group(2));
            double seconds = Double.parseDouble(matcher.group(3));
            if (hours >= 24 || minutes >= 60 || seconds >= 60) {
                return null;
            }
            return hours + minutes / 60.0 + seconds / 3600.0;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * @return declination in degrees, or null if the input does not match {@code ±DD° MM' SS.S"}
     */
    public static Double parseDeclination(String input) {
        if (input == null) {
            return null;
        }
        Matcher matcher = DEC_PATTERN.matcher(input.trim());
        if (!matcher.matches()) {
            return null;
        }
        try {
            int sign = "-".equals(matcher.group(1)) ? -1 : 1;
            int degrees = Integer.parseInt(matcher.group(2));
            int minutes = Integer.parseInt(matcher.group(3));
            double seconds = Double.parseDouble(matcher.group(4));
            double value = degrees + minutes / 60.0 + seconds / 3600.0;
            if (value > 90.0 || minutes >= 60 || seconds >= 60) {
                return null;
            }
            return sign * value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
