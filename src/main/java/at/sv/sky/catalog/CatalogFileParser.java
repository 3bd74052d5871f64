package at.sv.sky.catalog;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a whole catalog, omitting malformed lines so one bad record never aborts loading.
 */
@Slf4j
public final class CatalogFileParser {

    public static final String MESSIER_RESOURCE = "/catalog/messier.tsv";

    private CatalogFileParser() {
    }

    public static List<CatalogTarget> parse(String text) {
        List<CatalogTarget> targets = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return targets;
        }
        int skipped = 0;
        for (String line : text.split("\\R")) {
            if (CatalogLineParser.isSkippable(line)) {
                continue;
            }
            CatalogTarget target = CatalogLineParser.parse(line);
            if (target != null) {
                targets.add(target);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed catalog line(s)", skipped);
        }
        log.debug("Parsed {} catalog targets", targets.size());
        return targets;
    }

    public static List<CatalogTarget> parse(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog file '" + file.toAbsolutePath() + "'", e);
        }
    }

    public static List<CatalogTarget> loadResource(String resource) {
        InputStream stream = CatalogFileParser.class.getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalArgumentException("Catalog resource '" + resource + "' not found");
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            StringBuilder text = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                text.append(line).append('\n');
            }
            return parse(text.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog resource '" + resource + "'", e);
        }
    }

    public static List<CatalogTarget> loadMessier() {
        return loadResource(MESSIER_RESOURCE);
    }
}
