package io.segmentlite.segment;

import io.segmentlite.segment.catalog.FieldCatalogLoader;
import io.segmentlite.segment.compiler.CombinatorMode;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.preview.PreviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine settings.
 *
 * Read from {@code segment-engine.properties} on the classpath; a system property with
 * the same key overrides the file.
 * <ul>
 *   <li>{@code segment.dialect}: {@code duckdb} or {@code sqlite}</li>
 *   <li>{@code segment.jdbc.url}: database holding the event tables</li>
 *   <li>{@code segment.catalog.resource}: field catalog JSON on the classpath</li>
 *   <li>{@code segment.preview.sample-size}: rows fetched by a preview</li>
 *   <li>{@code segment.compiler.combinator-mode}: {@code uniform} or {@code pairwise}</li>
 *   <li>{@code segment.validation.placeholder-name}: name a saved segment may not keep</li>
 * </ul>
 */
public record SegmentEngineConfig(
        String dialect,
        String jdbcUrl,
        String catalogResource,
        int previewSampleSize,
        CombinatorMode combinatorMode,
        String placeholderName) {

    private static final Logger logger = LoggerFactory.getLogger(SegmentEngineConfig.class);

    public static final String DEFAULT_RESOURCE = "segment-engine.properties";

    public static final String DIALECT = "segment.dialect";
    public static final String JDBC_URL = "segment.jdbc.url";
    public static final String CATALOG_RESOURCE = "segment.catalog.resource";
    public static final String PREVIEW_SAMPLE_SIZE = "segment.preview.sample-size";
    public static final String COMBINATOR_MODE = "segment.compiler.combinator-mode";
    public static final String PLACEHOLDER_NAME = "segment.validation.placeholder-name";

    public SegmentEngineConfig {
        Objects.requireNonNull(dialect, "Dialect cannot be null");
        Objects.requireNonNull(jdbcUrl, "JDBC URL cannot be null");
        Objects.requireNonNull(catalogResource, "Catalog resource cannot be null");
        Objects.requireNonNull(combinatorMode, "Combinator mode cannot be null");
        Objects.requireNonNull(placeholderName, "Placeholder name cannot be null");
        if (previewSampleSize <= 0) {
            throw new SegmentEngineConfigException("Preview sample size must be positive: " + previewSampleSize);
        }
    }

    /**
     * In-memory DuckDB with the bundled field catalog.
     */
    public static SegmentEngineConfig defaults() {
        return new SegmentEngineConfig("duckdb", "jdbc:duckdb:", FieldCatalogLoader.DEFAULT_RESOURCE,
                PreviewService.DEFAULT_SAMPLE_SIZE, CombinatorMode.UNIFORM, SegmentDefinition.DEFAULT_NAME);
    }

    public static SegmentEngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a properties resource, falling back to the defaults for missing keys or a
     * missing resource.
     */
    public static SegmentEngineConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = SegmentEngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No {} on the classpath, using defaults", resource);
            } else {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
                logger.info("Loaded engine configuration from {}", resource);
            }
        } catch (IOException e) {
            throw new SegmentEngineConfigException("Failed to read " + resource, e);
        }
        return fromProperties(properties, System.getProperties());
    }

    /**
     * @param file      Settings from the configuration file
     * @param overrides Settings that win over the file, typically the system properties
     */
    public static SegmentEngineConfig fromProperties(Properties file, Properties overrides) {
        SegmentEngineConfig defaults = defaults();
        return new SegmentEngineConfig(
                value(file, overrides, DIALECT, defaults.dialect()).toLowerCase(Locale.ROOT),
                value(file, overrides, JDBC_URL, defaults.jdbcUrl()),
                value(file, overrides, CATALOG_RESOURCE, defaults.catalogResource()),
                parseSampleSize(value(file, overrides, PREVIEW_SAMPLE_SIZE,
                        String.valueOf(defaults.previewSampleSize()))),
                parseCombinatorMode(value(file, overrides, COMBINATOR_MODE, defaults.combinatorMode().name())),
                value(file, overrides, PLACEHOLDER_NAME, defaults.placeholderName()));
    }

    private static String value(Properties file, Properties overrides, String key, String defaultValue) {
        String override = overrides.getProperty(key);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        String configured = file.getProperty(key);
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        return defaultValue;
    }

    private static int parseSampleSize(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new SegmentEngineConfigException("'" + PREVIEW_SAMPLE_SIZE + "' must be an integer, got " + text, e);
        }
    }

    private static CombinatorMode parseCombinatorMode(String text) {
        try {
            return CombinatorMode.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SegmentEngineConfigException("'" + COMBINATOR_MODE + "' must be uniform or pairwise, got " + text, e);
        }
    }
}
