package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.Ephemeris;
import io.github.jakubt4.skychart.ephemeris.EphemerisBody;
import io.github.jakubt4.skychart.ephemeris.EphemerisSource;
import io.github.jakubt4.skychart.scene.ConstellationStyle;
import io.github.jakubt4.skychart.scene.FeatureFailure;
import io.github.jakubt4.skychart.scene.HorizontalCoordinate;
import io.github.jakubt4.skychart.scene.Polyline;
import io.github.jakubt4.skychart.scene.Scene;
import io.github.jakubt4.skychart.scene.SceneConstellation;
import io.github.jakubt4.skychart.scene.ScenePath;
import io.github.jakubt4.skychart.theme.Theme;
import io.github.jakubt4.skychart.theme.ThemeKey;
import io.github.jakubt4.skychart.theme.ThemeResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Sky of one observer: owns the ephemeris, the precomputed solstice tracks, the
 * body markers and constellation figures, and assembles a {@link Scene} per frame.
 *
 * <p>Lifecycle is {@link State#UNINITIALIZED} → {@link State#LOADING} →
 * {@link State#READY}. {@link #load()} is idempotent and serialized by a lock, so
 * the ephemeris is acquired once even under concurrent callers; a failed load
 * returns to {@code UNINITIALIZED} and may be retried. Rendering before the sky is
 * ready fails with {@link SkyNotReadyException}.
 *
 * <p>The active theme is an immutable snapshot swapped by {@link #setTheme}. Each
 * render reads it once, so all elements of a frame share one theme, and a theme
 * switch never touches geometry.
 */
@Slf4j
public class Sky {

    public enum State { UNINITIALIZED, LOADING, READY }

    static final String WINTER_SOLSTICE = "winter-solstice";
    static final String SUMMER_SOLSTICE = "summer-solstice";
    static final String TODAY = "today";
    static final String HORIZON = "horizon";

    static final PathStyle SOLSTICE_WINTER_STYLE = new PathStyle(ThemeKey.SOLSTICE_WINTER, true, 1.0, 0.8);
    static final PathStyle SOLSTICE_SUMMER_STYLE = new PathStyle(ThemeKey.SOLSTICE_SUMMER, true, 1.0, 0.8);
    static final PathStyle TODAY_STYLE = new PathStyle(ThemeKey.SUN_TODAY, false, 1.0, 0.8);

    private static final Polyline HORIZON_LINE = horizonLine(200);
    private static final double HORIZON_LINE_WIDTH = 3.0;

    private final SkyOptions options;
    private final EphemerisSource ephemerisSource;
    private final ConstellationCatalog catalog;
    private final ThemeResolver themes;
    private final Clock clock;
    private final CoordinateEngine engine = new CoordinateEngine();
    private final PathSampler sampler = new PathSampler(engine);
    private final int solsticeYear;

    private final ReentrantLock loadLock = new ReentrantLock();
    private final AtomicReference<Theme> activeTheme;
    private volatile State state = State.UNINITIALIZED;
    private volatile LoadedSky loaded;

    private record LoadedSky(ObserverLocation observer,
                             BodyPath winterSolstice,
                             BodyPath summerSolstice,
                             List<SkyPoint> points,
                             List<Constellation> constellations) {
    }

    public Sky(final SkyOptions options, final EphemerisSource ephemerisSource,
               final ConstellationCatalog catalog, final ThemeResolver themes, final Clock clock) {
        this.options = options;
        this.ephemerisSource = ephemerisSource;
        this.catalog = catalog;
        this.themes = themes;
        this.clock = clock;
        this.solsticeYear = LocalDate.now(clock.withZone(options.zone())).getYear();
        this.activeTheme = new AtomicReference<>(themes.resolve(options.colorPreset()));
    }

    /**
     * Acquires the ephemeris and precomputes everything that does not change
     * between frames. A no-op once the sky is ready.
     */
    public void load() {
        if (state == State.READY) {
            return;
        }
        loadLock.lock();
        try {
            if (state == State.READY) {
                return;
            }
            state = State.LOADING;
            try {
                loaded = initialize(ephemerisSource.load());
                state = State.READY;
            } catch (final RuntimeException e) {
                state = State.UNINITIALIZED;
                log.error("Sky load failed: {}", e.getMessage());
                throw e;
            }
        } finally {
            loadLock.unlock();
        }
        log.info("Sky loaded — lat={}, lon={}, zone={}, points={}, constellations={}, solstice year={}",
                options.latitude(), options.longitude(), options.zone(),
                loaded.points().size(), loaded.constellations().size(), solsticeYear);
    }

    private LoadedSky initialize(final Ephemeris ephemeris) {
        final var observer = new ObserverLocation(options.latitude(), options.longitude(), options.zone(),
                ephemeris.observatory(options.latitude(), options.longitude()));

        final var winter = sampler.build(WINTER_SOLSTICE, EphemerisBody.SUN,
                LocalDate.of(solsticeYear, Month.DECEMBER, 21), observer, SOLSTICE_WINTER_STYLE);
        final var summer = sampler.build(SUMMER_SOLSTICE, EphemerisBody.SUN,
                LocalDate.of(solsticeYear, Month.JUNE, 21), observer, SOLSTICE_SUMMER_STYLE);

        final List<Constellation> constellations = options.showConstellations()
                ? catalog.build(options.constellationList())
                : List.of();

        return new LoadedSky(observer, winter, summer, buildPoints(), constellations);
    }

    private List<SkyPoint> buildPoints() {
        final var planetList = options.planetList();
        final var filtered = planetList != null && !planetList.isEmpty();
        if (filtered) {
            planetList.stream()
                    .filter(label -> SolarSystemObject.byLabel(label).isEmpty())
                    .forEach(label -> log.warn("Body [{}] in planet list is not supported, ignoring", label));
        }
        return Arrays.stream(SolarSystemObject.values())
                .filter(object -> !filtered || planetList.contains(object.label()))
                .map(object -> new SkyPoint(object.label(), object.body(), SolarSystemObject.markerSize(object.label())))
                .toList();
    }

    /**
     * Assembles the frame for {@code when}, a local date-time in the observer's zone.
     *
     * <p>The "today" Sun track follows the clock's current local day, not {@code when}.
     * A constellation that fails to project is logged, recorded in
     * {@link Scene#failures()} and left out; the rest of the frame is still built.
     *
     * @throws SkyNotReadyException  if {@link #load()} has not completed
     * @throws LocalizationException if {@code when} falls into a DST gap or fold
     */
    public Scene render(final LocalDateTime when) {
        final var sky = requireReady();
        final var theme = activeTheme.get();
        final var instant = CoordinateEngine.localize(when, options.zone());

        final var today = sampler.build(TODAY, EphemerisBody.SUN, LocalDate.now(clock.withZone(options.zone())),
                sky.observer(), TODAY_STYLE);
        final var paths = Stream.of(sky.winterSolstice(), sky.summerSolstice(), today)
                .map(path -> path.toScenePath(theme))
                .toList();

        final var points = sky.points().stream()
                .map(point -> point.project(engine, sky.observer(), instant, theme))
                .toList();

        final var style = constellationStyle(theme);
        final var figures = new ArrayList<SceneConstellation>();
        final var failures = new ArrayList<FeatureFailure>();
        for (final var constellation : sky.constellations()) {
            try {
                figures.add(constellation.project(engine, sky.observer(), instant, style));
            } catch (final RuntimeException e) {
                log.error("Error drawing constellation {}: {}", constellation.name(), e.getMessage(), e);
                failures.add(new FeatureFailure(constellation.name(), e.getMessage()));
            }
        }

        log.debug("Scene assembled for {} — theme={}, points={}, constellations={}, failures={}",
                when, theme.name(), points.size(), figures.size(), failures.size());

        final var horizon = new ScenePath(HORIZON, HORIZON_LINE, theme.color(ThemeKey.GRID_CIRCLE),
                false, HORIZON_LINE_WIDTH, 1.0);
        return new Scene(when, theme, options.layout(), horizon, paths, points, figures, failures);
    }

    /**
     * Renders the sky for the clock's current local time.
     */
    public Scene renderNow() {
        return render(now());
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(options.zone()));
    }

    /**
     * Switches the active theme; unknown names resolve through the theme fallback chain.
     *
     * @return the theme now active
     */
    public Theme setTheme(final String name) {
        final var theme = themes.resolve(name);
        final var previous = activeTheme.getAndSet(theme);
        log.info("Theme switched [{}] -> [{}] (requested [{}])", previous.name(), theme.name(), name);
        return theme;
    }

    public Theme activeTheme() {
        return activeTheme.get();
    }

    public ThemeResolver themes() {
        return themes;
    }

    public State state() {
        return state;
    }

    public int solsticeYear() {
        return solsticeYear;
    }

    public ObserverLocation observer() {
        return requireReady().observer();
    }

    public BodyPath winterSolstice() {
        return requireReady().winterSolstice();
    }

    public BodyPath summerSolstice() {
        return requireReady().summerSolstice();
    }

    public List<SkyPoint> points() {
        return requireReady().points();
    }

    public List<Constellation> constellations() {
        return requireReady().constellations();
    }

    private LoadedSky requireReady() {
        final var current = state;
        if (current != State.READY) {
            throw new SkyNotReadyException(current);
        }
        return loaded;
    }

    private static ConstellationStyle constellationStyle(final Theme theme) {
        return new ConstellationStyle(
                theme.color(ThemeKey.STAR_COLOR),
                theme.number(ThemeKey.STAR_SIZE),
                theme.number(ThemeKey.STAR_ALPHA),
                theme.color(ThemeKey.CONSTELLATION_COLOR),
                theme.number(ThemeKey.CONSTELLATION_LINEWIDTH),
                theme.number(ThemeKey.CONSTELLATION_ALPHA));
    }

    private static Polyline horizonLine(final int vertices) {
        return Polyline.linear(0.0, HorizontalCoordinate.HORIZON,
                CoordinateEngine.TWO_PI, HorizontalCoordinate.HORIZON, vertices);
    }
}
