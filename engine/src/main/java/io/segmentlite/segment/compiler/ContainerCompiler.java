package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.ColumnReference;
import io.segmentlite.engine.plan.Expression;
import io.segmentlite.engine.plan.FilterNode;
import io.segmentlite.engine.plan.InSubqueryExpression;
import io.segmentlite.engine.plan.LogicalExpression;
import io.segmentlite.engine.plan.LogicalExpression.LogicalOperator;
import io.segmentlite.engine.plan.ProjectNode;
import io.segmentlite.engine.plan.Projection;
import io.segmentlite.engine.plan.RelationNode;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.EventTable;
import io.segmentlite.segment.model.Combinator;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.Sign;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a container to a scoped, signed predicate, recursing into its children.
 *
 * <ul>
 *   <li>hit: the combined predicate applies to the enclosing row directly, and the tables
 *       it references are reported so the enclosing query can join them</li>
 *   <li>visit: {@code <outer>.session_id IN (SELECT <inner>.session_id FROM hits ... WHERE <combined>)}</li>
 *   <li>visitor: the same, keyed on user_id</li>
 * </ul>
 *
 * Visit and visitor containers test set membership of the session or user, not a
 * correlated per-hit match. Nested visit or visitor children are their own membership
 * tests, so their conditions may be met by other hits of the session or user. The
 * subquery uses the next level of aliases and joins the rollups it needs itself.
 *
 * An exclude container compiles to the negation of its include form.
 */
public final class ContainerCompiler {

    private final ConditionCompiler conditionCompiler;
    private final EventSchema schema;
    private final CompilerOptions options;

    public ContainerCompiler(ConditionCompiler conditionCompiler, EventSchema schema, CompilerOptions options) {
        this.conditionCompiler = Objects.requireNonNull(conditionCompiler, "Condition compiler cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    /**
     * @param container The container to compile
     * @param aliases   Aliases of the enclosing query level
     * @return The predicate and the tables the enclosing level must join, or empty if
     *         nothing in the container compiled
     */
    public Optional<CompiledPredicate> compile(Container container, TableAliases aliases) {
        Scope scope = container.effectiveScope();
        TableAliases inner = scope == Scope.HIT ? aliases : aliases.nested();
        String key = keyColumn(scope);

        Set<EventTable> tables = EnumSet.noneOf(EventTable.class);
        List<Expression> conditionPredicates = new ArrayList<>();
        List<Combinator> conditionCombinators = new ArrayList<>();
        for (Condition condition : container.conditions()) {
            conditionCompiler.compile(condition, inner).ifPresent(compiled -> {
                conditionPredicates.add(compiled.predicate());
                conditionCombinators.add(condition.effectiveCombinator());
                tables.add(compiled.table());
            });
        }
        List<Expression> childPredicates = new ArrayList<>();
        for (Container child : container.children()) {
            compile(child, inner).ifPresent(compiled -> {
                childPredicates.add(compiled.expression());
                tables.addAll(compiled.requiredTables());
            });
        }

        if (conditionPredicates.isEmpty() && childPredicates.isEmpty()) {
            return Optional.empty();
        }

        Expression combined = combine(container.effectiveCombinator(),
                conditionPredicates, conditionCombinators, childPredicates);
        Expression scoped = combined;
        Set<EventTable> required = tables;
        if (key != null) {
            scoped = InSubqueryExpression.of(
                    ColumnReference.of(aliases.alias(EventTable.HITS), key),
                    keySubquery(inner, tables, combined, key));
            required = Set.of();
        }

        Expression signed = container.effectiveSign() == Sign.EXCLUDE ? LogicalExpression.not(scoped) : scoped;
        return Optional.of(new CompiledPredicate(signed, required));
    }

    /**
     * @return the key a visit or visitor container tests membership on, null for hit
     */
    private static String keyColumn(Scope scope) {
        return switch (scope) {
            case HIT -> null;
            case VISIT -> EventTable.SESSIONS.keyColumn();
            case VISITOR -> EventTable.USERS.keyColumn();
        };
    }

    private Expression combine(Combinator containerCombinator, List<Expression> conditionPredicates,
            List<Combinator> conditionCombinators, List<Expression> childPredicates) {
        List<Expression> operands = new ArrayList<>();
        if (options.combinatorMode() == CombinatorMode.PAIRWISE) {
            if (!conditionPredicates.isEmpty()) {
                operands.add(foldPairwise(conditionPredicates, conditionCombinators));
            }
        } else {
            operands.addAll(conditionPredicates);
        }
        operands.addAll(childPredicates);
        return LogicalExpression.combine(logicalOperator(containerCombinator), operands);
    }

    /**
     * Left fold where each predicate is joined to everything before it by its own
     * combinator. The first combinator is never used.
     */
    private static Expression foldPairwise(List<Expression> predicates, List<Combinator> combinators) {
        Expression folded = predicates.get(0);
        for (int i = 1; i < predicates.size(); i++) {
            LogicalOperator operator = logicalOperator(combinators.get(i));
            if (folded instanceof LogicalExpression logical && logical.operator() == operator) {
                List<Expression> operands = new ArrayList<>(logical.operands());
                operands.add(predicates.get(i));
                folded = new LogicalExpression(operator, operands);
            } else {
                folded = new LogicalExpression(operator, List.of(folded, predicates.get(i)));
            }
        }
        return folded;
    }

    static LogicalOperator logicalOperator(Combinator combinator) {
        return combinator.isDisjunctive() ? LogicalOperator.OR : LogicalOperator.AND;
    }

    /**
     * {@code SELECT <inner hits>.<key> FROM hits [joins] WHERE <predicate>}
     */
    private RelationNode keySubquery(TableAliases inner, Set<EventTable> tables, Expression predicate, String key) {
        RelationNode from = EventJoins.from(schema, inner, tables);
        return ProjectNode.of(new FilterNode(from, predicate),
                Projection.column(inner.alias(EventTable.HITS), key));
    }
}
