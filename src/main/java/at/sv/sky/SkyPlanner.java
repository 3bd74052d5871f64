package at.sv.sky;

import at.sv.sky.catalog.CatalogFileParser;
import at.sv.sky.catalog.CatalogTarget;
import at.sv.sky.horizon.HorizonFileParser;
import at.sv.sky.horizon.HorizonProfile;
import at.sv.sky.moon.MoonState;
import at.sv.sky.moon.MoonStateProvider;
import at.sv.sky.moon.MoonStateProviderImpl;
import at.sv.sky.recommend.RecommendationContext;
import at.sv.sky.recommend.RecommendedTarget;
import at.sv.sky.recommend.Recommender;
import at.sv.sky.recommend.RecommenderInfo;
import at.sv.sky.recommend.RecommenderOptions;
import at.sv.sky.recommend.RecommenderRegistry;
import at.sv.sky.recommend.VisibilityRecommender;
import at.sv.sky.time.SunTimesProvider;
import at.sv.sky.time.SunTimesProviderImpl;
import at.sv.sky.visibility.AltitudeSampler;
import at.sv.sky.visibility.AltitudeSeries;
import at.sv.sky.visibility.VisibilityWindowCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

@Command(name = "SkyPlanner", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class SkyPlanner implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SkyPlanner.class);
    private static final Duration VISIBILITY_CACHE_BUCKET = Duration.ofMinutes(30);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your observing site in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your observing site in degrees [-180..180], east positive.")
    double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your site, used for sun and moon rise/set times.")
    double elevation;
    @Option(names = "--location-name",
            defaultValue = "${env:LOCATION_NAME:-Observing site}",
            description = "A display name for your site. Default: ${DEFAULT-VALUE}")
    String locationName;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:ZONE}",
            description = "The IANA time zone of your site, e.g. America/Chicago. Default: system time zone.")
    String zone;
    @Option(names = "--horizon-file", paramLabel = "<file>",
            defaultValue = "${env:HORIZON_FILE}",
            description = "Optional local horizon file with 'azimuth altitude' pairs per line.")
    Path horizonFile;
    @Option(names = "--catalog-file", paramLabel = "<file>",
            defaultValue = "${env:CATALOG_FILE}",
            description = "Optional target catalog. Default: the bundled Messier catalog.")
    Path catalogFile;
    @Option(names = "--recommender",
            defaultValue = "${env:RECOMMENDER:-" + RecommenderRegistry.VISIBILITY + "}",
            description = "The recommender to use. Default: ${DEFAULT-VALUE}")
    String recommenderId;
    @Option(names = "--list-recommenders",
            description = "Print the available recommenders and exit.")
    boolean listRecommenders;
    @Option(names = "--min-altitude", paramLabel = "<degrees>",
            defaultValue = "${env:MIN_ALTITUDE:-20}",
            description = "The minimum altitude a target has to reach [0..90]. Default: ${DEFAULT-VALUE}")
    double minAltitude;
    @Option(names = "--max-targets",
            defaultValue = "${env:MAX_TARGETS:-20}",
            description = "The maximum number of recommended targets. Default: ${DEFAULT-VALUE}")
    int maxTargets;
    @Option(names = "--type", split = ",", paramLabel = "<type>",
            description = "Only recommend targets of the given type(s), e.g. 'Globular Cluster'. Repeatable.")
    List<String> types;
    @Option(names = "--min-magnitude", paramLabel = "<mag>",
            description = "Exclude targets fainter than this magnitude.")
    Double minMagnitude;
    @Option(names = "--max-magnitude", paramLabel = "<mag>",
            description = "Exclude targets brighter than this magnitude.")
    Double maxMagnitude;
    @Option(names = "--cloud-cover", paramLabel = "<percent>",
            defaultValue = "${env:CLOUD_COVER}",
            description = "Current cloud cover in percent [0..100], if known.")
    Double cloudCover;
    @Option(names = "--seeing", paramLabel = "<arcsec>",
            defaultValue = "${env:SEEING}",
            description = "Current seeing in arc seconds, if known.")
    Double seeing;
    @Option(names = "--chart", paramLabel = "<id>",
            description = "Print tonight's altitude chart for the catalog target with the given id instead of recommendations.")
    String chartTargetId;
    @Option(names = "--sun-night",
            description = "Chart from sunset to sunrise instead of 18:00 to 08:00. Related to '--chart'.")
    boolean chartSunNight;
    @Option(names = "--json",
            description = "Print the recommendations as JSON.")
    boolean json;
    @Option(names = "--watch",
            defaultValue = "${env:WATCH:-false}",
            description = "Keep running and recompute the recommendations periodically. Default: ${DEFAULT-VALUE}")
    boolean watch;
    @Option(names = "--refresh-interval", paramLabel = "<minutes>",
            defaultValue = "${env:REFRESH_INTERVAL:-5}",
            description = "The interval in minutes between recomputations in watch mode. Default: ${DEFAULT-VALUE}")
    int refreshIntervalInMinutes;

    private final Function<ZoneId, ZonedDateTime> currentTime;
    private final PrintStream out;
    private final Supplier<ScheduledExecutorService> schedulerFactory;
    private final RecommendationPrinter printer = new RecommendationPrinter();
    private RecommenderRegistry registry;
    private ObserverLocation location;
    private List<CatalogTarget> catalog;
    private MoonStateProvider moonStateProvider;
    private SunTimesProvider sunTimesProvider;
    private ZoneId zoneId;

    public SkyPlanner() {
        this(ZonedDateTime::now, System.out);
    }

    SkyPlanner(Function<ZoneId, ZonedDateTime> currentTime, PrintStream out) {
        this(currentTime, out, Executors::newSingleThreadScheduledExecutor);
    }

    SkyPlanner(Function<ZoneId, ZonedDateTime> currentTime, PrintStream out,
               Supplier<ScheduledExecutorService> schedulerFactory) {
        this.currentTime = currentTime;
        this.out = out;
        this.schedulerFactory = schedulerFactory;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SkyPlanner()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    /**
     * The main entry point for the command line. Loads the site and catalog, then prints one recommendation run
     * or schedules periodic runs in watch mode.
     */
    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        registry = createRegistry();
        if (listRecommenders) {
            printAvailableRecommenders();
            return;
        }
        assertRecommenderExists();
        location = createLocation();
        catalog = loadCatalog();
        moonStateProvider = new MoonStateProviderImpl(latitude, longitude, elevation);
        sunTimesProvider = new SunTimesProviderImpl(latitude, longitude, elevation);
        LOG.info("Loaded {} catalog targets for {}", catalog.size(), location.getName());
        MDC.remove("context");
        if (chartTargetId != null) {
            printChart();
        } else if (watch) {
            startWatching();
        } else {
            printRecommendations();
        }
    }

    private RecommenderRegistry createRegistry() {
        if (watch) {
            return RecommenderRegistry.withDefaults(new VisibilityRecommender(
                    new VisibilityWindowCache(Ticker.systemTicker(), VISIBILITY_CACHE_BUCKET)));
        }
        return RecommenderRegistry.withDefaults();
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertRecommenderOptions();
        assertSkyConditions();
        if (refreshIntervalInMinutes <= 0) {
            fail("--refresh-interval must be > 0");
        }
        zoneId = parseZone();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertRecommenderOptions() {
        if (minAltitude < 0 || minAltitude > 90) {
            fail("--min-altitude must be between 0 and 90 degrees");
        }
        if (maxTargets <= 0) {
            fail("--max-targets must be > 0");
        }
    }

    private void assertSkyConditions() {
        if (cloudCover != null && (cloudCover < 0 || cloudCover > 100)) {
            fail("--cloud-cover must be within [0,100]");
        }
        if (seeing != null && seeing <= 0) {
            fail("--seeing must be > 0");
        }
    }

    private ZoneId parseZone() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            fail("--zone '" + zone + "' is not a valid time zone");
            return null;
        }
    }

    private void assertRecommenderExists() {
        if (registry.find(recommenderId).isEmpty()) {
            fail("--recommender '" + recommenderId + "' is unknown. Available: " +
                 registry.available().stream().map(RecommenderInfo::id).toList());
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private ObserverLocation createLocation() {
        HorizonProfile horizon = horizonFile != null ? HorizonFileParser.parse(horizonFile.toString(), read(horizonFile))
                : null;
        return new ObserverLocation(locationName, latitude, longitude, elevation, horizon);
    }

    private List<CatalogTarget> loadCatalog() {
        if (catalogFile == null) {
            return CatalogFileParser.loadMessier();
        }
        return CatalogFileParser.parse(catalogFile);
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read '" + file.toAbsolutePath() + "'", e);
        }
    }

    private void printAvailableRecommenders() {
        registry.available().forEach(info -> out.println(info.id() + ": " + info.name() + " - " + info.description()));
    }

    private void startWatching() {
        ScheduledExecutorService executor = schedulerFactory.get();
        executor.scheduleAtFixedRate(this::printRecommendationsSafely, 0, refreshIntervalInMinutes, TimeUnit.MINUTES);
        executor.scheduleAtFixedRate(sunTimesProvider::clearCache, 1, 1, TimeUnit.DAYS);
        LOG.info("Refreshing recommendations every {} min", refreshIntervalInMinutes);
    }

    private void printRecommendationsSafely() {
        try {
            printRecommendations();
        } catch (Exception e) {
            LOG.error("Failed to compute recommendations: '{}'. Retry in {} min", e.getLocalizedMessage(),
                    refreshIntervalInMinutes, e);
        }
    }

    void printRecommendations() {
        ZonedDateTime now = currentTime.apply(zoneId);
        MDC.put("context", "info");
        LOG.info("Current sky:\n{}\n{}", sunTimesProvider.toDebugString(now), moonStateProvider.toDebugString(now));
        MDC.put("context", "recommend");
        try {
            MoonState moon = moonStateProvider.getMoonState(now);
            RecommendationContext context = RecommendationContext.of(location, now, moon, cloudCover, seeing);
            Recommender recommender = registry.get(recommenderId);
            List<RecommendedTarget> recommendations = recommender.recommend(catalog, context, createOptions());
            if (json) {
                out.println(printer.toJson(recommenderId, location, now, moon, recommendations));
            } else {
                out.print(printer.toText(recommender.name(), now, moon, recommendations));
            }
            out.flush();
        } finally {
            MDC.remove("context");
        }
    }

    void printChart() {
        CatalogTarget target = catalog.stream()
                                      .filter(t -> t.getId().equalsIgnoreCase(chartTargetId))
                                      .findFirst()
                                      .orElse(null);
        if (target == null) {
            fail("--chart target '" + chartTargetId + "' is not in the catalog");
            return;
        }
        ZonedDateTime now = currentTime.apply(zoneId);
        AltitudeSeries series;
        double threshold;
        if (chartSunNight) {
            series = AltitudeSampler.sampleSunsetToSunrise(target.getRa(), target.getDec(), latitude, longitude,
                    location.getHorizon(), now, sunTimesProvider);
            threshold = AltitudeSampler.SUN_NIGHT_IDEAL_ALTITUDE;
        } else {
            series = AltitudeSampler.sampleNight(target.getRa(), target.getDec(), latitude, longitude,
                    location.getHorizon(), now);
            threshold = AltitudeSampler.CHART_IDEAL_ALTITUDE;
        }
        out.print(printer.toChart(target, series, Math.max(threshold, minAltitude)));
        out.flush();
    }

    private RecommenderOptions createOptions() {
        return RecommenderOptions.builder()
                                 .minAltitude(minAltitude)
                                 .maxTargets(maxTargets)
                                 .typeFilter(types)
                                 .minMagnitude(minMagnitude)
                                 .maxMagnitude(maxMagnitude)
                                 .build();
    }
}
