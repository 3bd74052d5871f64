package at.sv.sky;

import at.sv.sky.catalog.CatalogTarget;
import at.sv.sky.coords.CompassDirection;
import at.sv.sky.moon.MoonState;
import at.sv.sky.recommend.RecommendedTarget;
import at.sv.sky.visibility.AltitudePoint;
import at.sv.sky.visibility.AltitudeSeries;
import at.sv.sky.visibility.TimeRange;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a recommendation run either as a plain text table or as JSON.
 */
public final class RecommendationPrinter {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private final ObjectMapper mapper;

    public RecommendationPrinter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toText(String recommenderName, ZonedDateTime time, MoonState moon, List<RecommendedTarget> targets) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%s recommendations for %s (moon: %s, %.0f%%)%n",
                recommenderName, time.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), moon.getPhaseName(),
                moon.getIlluminationPercent()));
        if (targets.isEmpty()) {
            sb.append("No targets are visible right now.").append(System.lineSeparator());
            return sb.toString();
        }
        int rank = 1;
        for (RecommendedTarget target : targets) {
            sb.append(String.format(Locale.ROOT, "%2d. %-28s %-18s %-8s alt %3d° %-3s max %3d° @ %s  %4.1fh  score %3d%n",
                    rank++, target.getTarget().getDisplayName(), target.getType(), formatMagnitude(target.getMagnitude()),
                    target.getAltitude(), target.getDirection(), target.getMaxAltitude(),
                    formatTime(target.getMaxAltitudeTime()), target.getVisibilityHours(), target.getScore()));
            if (!target.getReasons().isEmpty()) {
                sb.append("    ").append(String.join(", ", target.getReasons())).append(System.lineSeparator());
            }
        }
        return sb.toString();
    }

    public String toJson(String recommenderId, ObserverLocation location, ZonedDateTime time, MoonState moon,
                         List<RecommendedTarget> targets) {
        Report report = new Report(recommenderId, location.getName(), location.getLatitude(), location.getLongitude(),
                formatIso(time), moon.getPhaseName().getDisplayName(), Math.round(moon.getIlluminationPercent()),
                targets.stream().map(RecommendationPrinter::toEntry).collect(Collectors.toList()));
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize recommendations", e);
        }
    }

    /**
     * One line per sample with a bar for the altitude, marking samples below the local horizon with {@code x}.
     */
    public String toChart(CatalogTarget target, AltitudeSeries series, double threshold) {
        StringBuilder sb = new StringBuilder();
        sb.append(target.getDisplayName()).append(System.lineSeparator());
        if (series.size() == 0) {
            sb.append("The sun does not set tonight.").append(System.lineSeparator());
            return sb.toString();
        }
        for (int i = 0; i < series.size(); i++) {
            AltitudePoint point = series.points().get(i);
            boolean obstructed = point.altitude() < series.horizon().get(i).altitude();
            int barLength = (int) Math.round(Math.max(0.0, point.altitude()) / 3.0);
            sb.append(String.format(Locale.ROOT, "%s %5.1f° %-3s %s%s%n", formatTime(point.time()), point.altitude(),
                    CompassDirection.of(point.azimuth()), (obstructed ? "x" : "#").repeat(barLength),
                    point.ideal() ? " *" : ""));
        }
        TimeRange ideal = series.idealTimeRange(threshold);
        AltitudePoint best = series.bestObservationPoint(threshold);
        AltitudePoint peak = series.maxAltitudePoint();
        sb.append(String.format(Locale.ROOT, "Peak: %.1f° at %s%n", peak.altitude(), formatTime(peak.time())));
        sb.append("Above ").append(String.format(Locale.ROOT, "%.0f°", threshold)).append(": ")
          .append(ideal.isEmpty() ? "never" : formatTime(ideal.start()) + " - " + formatTime(ideal.end()))
          .append(System.lineSeparator());
        sb.append("Best time: ").append(formatTime(best.time())).append(System.lineSeparator());
        return sb.toString();
    }

    private static Entry toEntry(RecommendedTarget target) {
        return new Entry(target.getId(), target.getName(), target.getTarget().getCommonName(), target.getType(),
                target.getMagnitude(), target.getTarget().getConstellation(), target.getTarget().getDistance(), target.getAltitude(),
                target.getAzimuth(), target.getDirection().name(), target.getMaxAltitude(),
                formatIso(target.getMaxAltitudeTime()), formatIso(target.getVisibilityStart()),
                formatIso(target.getVisibilityEnd()), target.getVisibilityHours(), target.getScore(),
                target.getReasons());
    }

    private static String formatMagnitude(Double magnitude) {
        return magnitude == null ? "mag ?" : String.format(Locale.ROOT, "mag %.1f", magnitude);
    }

    private static String formatTime(ZonedDateTime time) {
        return time == null ? "--:--" : TIME_FORMATTER.format(time);
    }

    private static String formatIso(ZonedDateTime time) {
        return time == null ? null : time.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public record Report(String recommender, String location, double latitude, double longitude, String time,
                  String moonPhase, long moonIllumination, List<Entry> targets) {
    }

    public record Entry(String id, String name, String commonName, String type, Double magnitude, String constellation,
                 Double distance, long altitude, long azimuth, String direction, long maxAltitude, String maxAltitudeTime,
                 String visibilityStart, String visibilityEnd, double visibilityHours, int score,
                 List<String> reasons) {
    }
}
