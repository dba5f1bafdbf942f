package io.segmentlite.segment;

import io.segmentlite.engine.execution.ConnectionResolver;
import io.segmentlite.engine.execution.JdbcQueryExecutor;
import io.segmentlite.engine.execution.QueryExecutor;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.transpiler.SQLDialect;
import io.segmentlite.engine.transpiler.SQLDialects;
import io.segmentlite.engine.transpiler.SQLGenerator;
import io.segmentlite.segment.analysis.SegmentAnalyzer;
import io.segmentlite.segment.analysis.SegmentComplexity;
import io.segmentlite.segment.analysis.SegmentStructure;
import io.segmentlite.segment.catalog.FieldCatalog;
import io.segmentlite.segment.catalog.FieldCatalogLoader;
import io.segmentlite.segment.compiler.CompiledSegment;
import io.segmentlite.segment.compiler.CompilerOptions;
import io.segmentlite.segment.compiler.SegmentCompiler;
import io.segmentlite.segment.library.InMemorySegmentRepository;
import io.segmentlite.segment.library.SegmentLibrary;
import io.segmentlite.segment.library.SegmentRepository;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.preview.PreviewService;
import io.segmentlite.segment.preview.PreviewSession;
import io.segmentlite.segment.preview.SegmentPreview;
import io.segmentlite.segment.stats.FieldProfiler;
import io.segmentlite.segment.stats.SegmentStatistics;
import io.segmentlite.segment.stats.StatisticsEngine;
import io.segmentlite.segment.validation.SegmentValidator;
import io.segmentlite.segment.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Entry point wiring the segment components for one event database.
 *
 * <pre>
 * try (SegmentEngine engine = SegmentEngine.open(SegmentEngineConfig.load())) {
 *     CompiledSegment compiled = engine.compile(definition);
 *     SegmentStatistics stats = engine.statistics(definition);
 * }
 * </pre>
 */
public final class SegmentEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SegmentEngine.class);

    private final SegmentEngineConfig config;
    private final FieldCatalog catalog;
    private final SegmentCompiler compiler;
    private final SegmentValidator validator;
    private final StatisticsEngine statisticsEngine;
    private final FieldProfiler profiler;
    private final PreviewService previewService;
    private final SegmentAnalyzer analyzer = new SegmentAnalyzer();
    private final SegmentLibrary library;
    private final ConnectionResolver ownedConnections;
    private final Clock clock;

    /**
     * Wires the engine over an executor the caller owns.
     */
    public SegmentEngine(SegmentEngineConfig config, EventSchema schema, QueryExecutor executor,
            SegmentRepository repository, Clock clock) {
        this(config, schema, executor, repository, clock, null);
    }

    public SegmentEngine(SegmentEngineConfig config, QueryExecutor executor) {
        this(config, EventSchema.standard(), executor, new InMemorySegmentRepository(), Clock.systemUTC(), null);
    }

    private SegmentEngine(SegmentEngineConfig config, EventSchema schema, QueryExecutor executor,
            SegmentRepository repository, Clock clock, ConnectionResolver ownedConnections) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(schema, "Schema cannot be null");
        Objects.requireNonNull(executor, "Executor cannot be null");

        SQLDialect dialect;
        try {
            dialect = SQLDialects.forName(config.dialect());
        } catch (IllegalArgumentException e) {
            throw new SegmentEngineConfigException(e.getMessage(), e);
        }
        SQLGenerator generator = new SQLGenerator(dialect);

        this.catalog = new FieldCatalogLoader(schema).loadResource(config.catalogResource());
        this.compiler = new SegmentCompiler(catalog, schema, generator,
                CompilerOptions.defaults().withCombinatorMode(config.combinatorMode()));
        this.validator = new SegmentValidator(catalog, config.placeholderName());
        this.statisticsEngine = new StatisticsEngine(compiler, executor, schema);
        this.profiler = new FieldProfiler(catalog, schema, generator, executor);
        this.previewService = new PreviewService(compiler, executor, statisticsEngine, config.previewSampleSize());
        this.library = new SegmentLibrary(repository, validator, clock);
        this.ownedConnections = ownedConnections;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        logger.info("Segment engine ready: dialect={}, fields={}, combinator mode={}",
                dialect.name(), catalog.size(), config.combinatorMode());
    }

    /**
     * Opens the configured database and wires the engine over it. Closing the engine
     * closes the connection.
     */
    public static SegmentEngine open(SegmentEngineConfig config) throws SQLException {
        ConnectionResolver resolver = new ConnectionResolver();
        QueryExecutor executor = new JdbcQueryExecutor(resolver.resolve(config.jdbcUrl()));
        return new SegmentEngine(config, EventSchema.standard(), executor, new InMemorySegmentRepository(),
                Clock.systemUTC(), resolver);
    }

    public SegmentEngineConfig config() {
        return config;
    }

    public FieldCatalog catalog() {
        return catalog;
    }

    public SegmentCompiler compiler() {
        return compiler;
    }

    public CompiledSegment compile(SegmentDefinition definition) {
        return compiler.compile(definition);
    }

    public String toSql(SegmentDefinition definition) {
        return compiler.toSql(definition);
    }

    public ValidationResult validate(SegmentDefinition definition) {
        return validator.validate(definition);
    }

    public SegmentStatistics statistics(SegmentDefinition definition) {
        return statisticsEngine.statistics(definition);
    }

    public StatisticsEngine statisticsEngine() {
        return statisticsEngine;
    }

    public SegmentPreview preview(SegmentDefinition definition) {
        return previewService.preview(definition);
    }

    public PreviewSession openPreviewSession(ExecutorService executor, Consumer<SegmentPreview> listener) {
        return new PreviewSession(previewService, executor, listener);
    }

    public SegmentStructure structure(SegmentDefinition definition) {
        return analyzer.structure(definition);
    }

    public SegmentComplexity complexity(SegmentDefinition definition) {
        return analyzer.complexity(definition);
    }

    public String explain(SegmentDefinition definition) {
        return analyzer.explain(definition);
    }

    public String document(SegmentDefinition definition) {
        return analyzer.document(definition, compiler.toSql(definition), clock.instant());
    }

    public FieldProfiler profiler() {
        return profiler;
    }

    public SegmentLibrary library() {
        return library;
    }

    @Override
    public void close() {
        if (ownedConnections != null) {
            ownedConnections.clearCache();
        }
    }
}
