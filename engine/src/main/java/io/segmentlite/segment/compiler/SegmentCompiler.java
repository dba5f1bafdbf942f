package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.ColumnReference;
import io.segmentlite.engine.plan.ComparisonExpression;
import io.segmentlite.engine.plan.Expression;
import io.segmentlite.engine.plan.FilterNode;
import io.segmentlite.engine.plan.LogicalExpression;
import io.segmentlite.engine.plan.ProjectNode;
import io.segmentlite.engine.plan.Projection;
import io.segmentlite.engine.plan.RelationNode;
import io.segmentlite.engine.plan.SortNode;
import io.segmentlite.engine.store.Column;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.EventTable;
import io.segmentlite.engine.transpiler.SQLGenerator;
import io.segmentlite.engine.transpiler.SqlQuery;
import io.segmentlite.segment.catalog.FieldCatalog;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.SegmentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a whole segment definition into one SELECT over the event table.
 *
 * <pre>
 * SELECT "h"."hit_id" AS "hit_id", ...
 * FROM "hits" AS "h"
 *   [LEFT OUTER JOIN "sessions" AS "s" ON "h"."session_id" = "s"."session_id"]
 *   [LEFT OUTER JOIN "users" AS "u" ON "h"."user_id" = "u"."user_id"]
 * WHERE &lt;root containers joined by the segment combinator&gt;
 * ORDER BY "h"."timestamp" DESC
 * </pre>
 *
 * Rollups are joined only when a hit-level predicate at the root references them.
 * When no container contributes a predicate the WHERE clause is {@code 1 = 0}.
 * Compilation is deterministic: the same definition and catalog give the same SQL
 * and parameters.
 */
public final class SegmentCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SegmentCompiler.class);

    private static final String TIMESTAMP_COLUMN = "timestamp";

    private final EventSchema schema;
    private final ContainerCompiler containerCompiler;
    private final SQLGenerator generator;

    public SegmentCompiler(FieldCatalog catalog, EventSchema schema, SQLGenerator generator, CompilerOptions options) {
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.generator = Objects.requireNonNull(generator, "Generator cannot be null");
        this.containerCompiler = new ContainerCompiler(new ConditionCompiler(catalog, schema), schema, options);
    }

    public SegmentCompiler(FieldCatalog catalog, EventSchema schema, SQLGenerator generator) {
        this(catalog, schema, generator, CompilerOptions.defaults());
    }

    public SQLGenerator generator() {
        return generator;
    }

    /**
     * Compiles the definition to parameterised SQL.
     */
    public CompiledSegment compile(SegmentDefinition definition) {
        RootPredicate root = rootPredicate(definition);
        RelationNode plan = plan(root, true);
        SqlQuery query = generator.generate(plan);
        logger.debug("Compiled segment '{}': {}", definition.name(), query);
        return new CompiledSegment(plan, query, root.matchesNothing());
    }

    /**
     * SQL for display, with every value inlined as a quoted literal.
     */
    public String toSql(SegmentDefinition definition) {
        return generator.generateInlined(plan(definition, true));
    }

    /**
     * The segment's SELECT plan.
     *
     * @param ordered false to leave out the ORDER BY, for callers that wrap the plan
     *                as a derived table
     */
    public RelationNode plan(SegmentDefinition definition, boolean ordered) {
        return plan(rootPredicate(definition), ordered);
    }

    private RelationNode plan(RootPredicate root, boolean ordered) {
        TableAliases aliases = TableAliases.root();
        String hitsAlias = aliases.alias(EventTable.HITS);

        RelationNode from = EventJoins.from(schema, aliases, root.requiredTables());
        FilterNode filter = new FilterNode(from, root.expression());

        List<Projection> projections = new ArrayList<>();
        for (Column column : schema.hits().columns()) {
            projections.add(Projection.column(hitsAlias, column.name()));
        }
        RelationNode project = new ProjectNode(filter, projections);

        if (!ordered) {
            return project;
        }
        return SortNode.of(project, SortNode.SortColumn.desc(ColumnReference.of(hitsAlias, TIMESTAMP_COLUMN)));
    }

    private RootPredicate rootPredicate(SegmentDefinition definition) {
        Objects.requireNonNull(definition, "Segment definition cannot be null");
        TableAliases aliases = TableAliases.root();

        List<Expression> predicates = new ArrayList<>();
        Set<EventTable> tables = EnumSet.noneOf(EventTable.class);
        for (Container container : definition.containers()) {
            containerCompiler.compile(container, aliases).ifPresent(compiled -> {
                predicates.add(compiled.expression());
                tables.addAll(compiled.requiredTables());
            });
        }

        if (predicates.isEmpty()) {
            return new RootPredicate(ComparisonExpression.alwaysFalse(), Set.of(), true);
        }
        Expression combined = LogicalExpression.combine(
                ContainerCompiler.logicalOperator(definition.effectiveCombinator()), predicates);
        return new RootPredicate(combined, tables, false);
    }

    private record RootPredicate(Expression expression, Set<EventTable> requiredTables, boolean matchesNothing) {
    }
}
