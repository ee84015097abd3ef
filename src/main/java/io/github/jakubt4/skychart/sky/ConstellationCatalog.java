package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.FixedStar;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Constellation line figures read from a flat text file, one segment per line:
 *
 * <pre>
 *   &lt;name&gt; &lt;ra1&gt; &lt;dec1&gt; &lt;ra2&gt; &lt;dec2&gt;
 * </pre>
 *
 * <p>Right ascensions are given in degrees and stored in hours; declinations are
 * degrees. Blank lines and {@code #} comments are ignored. A line without exactly
 * five tokens is skipped silently, a line whose coordinates are not numbers is
 * skipped with a warning; neither aborts the load. Segments keep file order per name.
 */
@Slf4j
public final class ConstellationCatalog {

    public static final String DEFAULT_RESOURCE = "constellations_by_RA_Dec.dat";

    private static final int TOKENS_PER_LINE = 5;

    private final Map<String, List<ConstellationSegment>> segmentsByName;

    private ConstellationCatalog(final Map<String, List<ConstellationSegment>> segmentsByName) {
        this.segmentsByName = segmentsByName;
    }

    public static ConstellationCatalog parse(final Reader source) throws IOException {
        final var segments = new LinkedHashMap<String, List<ConstellationSegment>>();
        final var reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        String line;
        var lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            parseLine(line, lineNumber).ifPresent(entry ->
                    segments.computeIfAbsent(entry.getKey(), name -> new ArrayList<>()).add(entry.getValue()));
        }

        final var frozen = new LinkedHashMap<String, List<ConstellationSegment>>();
        segments.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
        return new ConstellationCatalog(Collections.unmodifiableMap(frozen));
    }

    /**
     * Reads a catalog bundled on the classpath.
     *
     * @throws IllegalStateException if the resource does not exist
     * @throws UncheckedIOException  if it cannot be read
     */
    public static ConstellationCatalog fromClasspath(final String resource) {
        final var stream = ConstellationCatalog.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalStateException(resource + " not found on classpath");
        }
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            final var catalog = parse(reader);
            log.info("Constellation catalog loaded from classpath:{} — {} constellations, {} segments",
                    resource, catalog.names().size(), catalog.segmentCount());
            return catalog;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read constellation catalog " + resource, e);
        }
    }

    static Optional<Map.Entry<String, ConstellationSegment>> parseLine(final String rawLine, final int lineNumber) {
        final var line = rawLine.strip();
        if (line.isEmpty() || line.startsWith("#")) {
            return Optional.empty();
        }

        final var tokens = line.split("\\s+");
        if (tokens.length != TOKENS_PER_LINE) {
            return Optional.empty();
        }

        try {
            final var start = FixedStar.ofDegrees(Double.parseDouble(tokens[1]), Double.parseDouble(tokens[2]));
            final var end = FixedStar.ofDegrees(Double.parseDouble(tokens[3]), Double.parseDouble(tokens[4]));
            return Optional.of(Map.entry(tokens[0], new ConstellationSegment(start, end)));
        } catch (final NumberFormatException e) {
            log.warn("Skipping constellation line {}: {} ({})", lineNumber, line, e.getMessage());
            return Optional.empty();
        }
    }

    public Set<String> names() {
        return segmentsByName.keySet();
    }

    public List<ConstellationSegment> segments(final String name) {
        return segmentsByName.getOrDefault(name, List.of());
    }

    public int segmentCount() {
        return segmentsByName.values().stream().mapToInt(List::size).sum();
    }

    /**
     * One {@link Constellation} per catalog name, in catalog order.
     *
     * @param whitelist names to keep, {@code null} for all
     */
    public List<Constellation> build(final Collection<String> whitelist) {
        final var result = new ArrayList<Constellation>();
        segmentsByName.forEach((name, segments) -> {
            if (whitelist == null || whitelist.contains(name)) {
                result.add(new Constellation(name, segments));
            }
        });
        if (whitelist != null) {
            whitelist.stream()
                    .filter(name -> !segmentsByName.containsKey(name))
                    .forEach(name -> log.warn("Constellation [{}] is not in the catalog, ignoring", name));
        }
        return result;
    }
}
