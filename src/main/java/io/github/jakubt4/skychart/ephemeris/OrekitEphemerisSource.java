package io.github.jakubt4.skychart.ephemeris;

import lombok.extern.slf4j.Slf4j;
import org.orekit.bodies.CelestialBody;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.data.DataContext;
import org.orekit.data.DataProvider;
import org.orekit.data.DirectoryCrawler;
import org.orekit.data.LazyLoadedDataContext;
import org.orekit.data.ZipJarCrawler;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;

import java.io.File;
import java.util.Map;

/**
 * Acquires the Orekit data set (JPL DE ephemerides, Earth orientation parameters,
 * leap seconds) and assembles an {@link OrekitEphemeris} from it.
 *
 * <p>The data location is either {@code classpath:<resource>} pointing at a zip
 * archive, or a filesystem path to a directory or zip archive.
 */
@Slf4j
public class OrekitEphemerisSource implements EphemerisSource {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final String dataLocation;
    private final LazyLoadedDataContext context;

    // a provider outlives a failed load; retries reuse it
    private boolean registered;

    public OrekitEphemerisSource(final String dataLocation) {
        this(dataLocation, DataContext.getDefault());
    }

    OrekitEphemerisSource(final String dataLocation, final LazyLoadedDataContext context) {
        this.dataLocation = dataLocation;
        this.context = context;
    }

    /**
     * Registers the data set with the Orekit {@link DataContext} (once) and builds
     * the Earth model and body table.
     *
     * @throws IllegalStateException if the data set cannot be found
     */
    @Override
    public synchronized Ephemeris load() {
        if (!registered) {
            context.getDataProvidersManager().addProvider(resolveProvider());
            registered = true;
            log.info("Orekit data registered from {}", dataLocation);
        }

        final var bodyFactory = context.getCelestialBodies();
        final var utc = context.getTimeScales().getUTC();
        final var itrf = context.getFrames().getITRF(IERSConventions.IERS_2010, true);
        final var earth = new OneAxisEllipsoid(
                Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
                Constants.WGS84_EARTH_FLATTENING,
                itrf
        );

        final Map<String, CelestialBody> bodies = Map.of(
                "sun", bodyFactory.getSun(),
                "moon", bodyFactory.getMoon(),
                "mercury", bodyFactory.getMercury(),
                "venus", bodyFactory.getVenus(),
                "mars", bodyFactory.getMars(),
                "jupiter barycenter", bodyFactory.getJupiter(),
                "saturn barycenter", bodyFactory.getSaturn(),
                "uranus barycenter", bodyFactory.getUranus(),
                "neptune barycenter", bodyFactory.getNeptune()
        );
        log.info("Ephemeris ready — {} bodies, WGS84 ellipsoid, ITRF/IERS-2010", bodies.size());

        return new OrekitEphemeris(utc, earth, context.getFrames().getGCRF(), bodies);
    }

    DataProvider resolveProvider() {
        if (dataLocation.startsWith(CLASSPATH_PREFIX)) {
            final var resource = dataLocation.substring(CLASSPATH_PREFIX.length());
            final var url = OrekitEphemerisSource.class.getClassLoader().getResource(resource);
            if (url == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            return new ZipJarCrawler(url);
        }

        final var file = new File(dataLocation);
        if (file.isDirectory()) {
            return new DirectoryCrawler(file);
        }
        if (file.isFile()) {
            return new ZipJarCrawler(file);
        }
        throw new IllegalStateException("Orekit data not found at " + dataLocation);
    }
}
