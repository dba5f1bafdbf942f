package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.BetweenExpression;
import io.segmentlite.engine.plan.CastExpression;
import io.segmentlite.engine.plan.ColumnReference;
import io.segmentlite.engine.plan.ComparisonExpression;
import io.segmentlite.engine.plan.ComparisonExpression.ComparisonOperator;
import io.segmentlite.engine.plan.Expression;
import io.segmentlite.engine.plan.LikeExpression;
import io.segmentlite.engine.plan.Literal;
import io.segmentlite.engine.plan.LogicalExpression;
import io.segmentlite.engine.plan.Parameter;
import io.segmentlite.engine.plan.SqlFunctionCall;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.Table;
import io.segmentlite.segment.catalog.FieldCatalog;
import io.segmentlite.segment.catalog.FieldDefinition;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lowers one condition to a predicate over its field's column.
 *
 * Incomplete conditions, unknown fields and conditions without an operator compile
 * to nothing. Values are always bound as parameters.
 *
 * Whether a comparison is numeric follows the catalog type of the column, never the
 * type declared on the condition: a number is bound only against a numeric column
 * and only when the value parses. Everything else compares as text, with numeric
 * columns cast to their text form.
 *
 * Equality and pattern matching ignore case by applying {@code LOWER} to both the
 * column and the bound value, so both sides fold the same way. SQLite's {@code LOWER}
 * folds ASCII letters only, so on SQLite non-ASCII letters still match case-sensitively.
 */
public final class ConditionCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ConditionCompiler.class);

    private final FieldCatalog catalog;
    private final EventSchema schema;

    public ConditionCompiler(FieldCatalog catalog, EventSchema schema) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
    }

    public FieldCatalog catalog() {
        return catalog;
    }

    /**
     * @param condition The condition to compile
     * @param aliases   Aliases of the query level the predicate is evaluated at
     * @return The predicate and owning table, or empty if the condition contributes nothing
     * @throws SegmentCompileException if the catalog binds the field to a column the schema lacks
     */
    public Optional<CompiledCondition> compile(Condition condition, TableAliases aliases) {
        if (!condition.isComplete() || condition.operator() == null) {
            return Optional.empty();
        }
        Optional<FieldDefinition> resolved = catalog.resolve(condition.field());
        if (resolved.isEmpty()) {
            logger.debug("Dropping condition on unknown field '{}'", condition.field());
            return Optional.empty();
        }
        FieldDefinition field = resolved.get();

        Table table = schema.table(field.owningTable());
        if (table.findColumn(field.column()).isEmpty()) {
            throw new SegmentCompileException("Field '" + field.field() + "' is bound to column '"
                    + field.column() + "', which table " + table.name() + " does not have");
        }

        ColumnReference column = ColumnReference.of(aliases.alias(field.owningTable()), field.column());
        Expression predicate = predicate(condition, column, field.isNumeric());
        return Optional.of(new CompiledCondition(predicate, field.owningTable()));
    }

    private Expression predicate(Condition condition, ColumnReference column, boolean numericColumn) {
        Operator operator = condition.operator();
        String value = condition.value();

        return switch (operator) {
            case EXISTS -> exists(column, numericColumn);
            case NOT_EXISTS -> LogicalExpression.not(exists(column, numericColumn));
            case EQUALS, NOT_EQUALS -> {
                ComparisonOperator op = operator == Operator.EQUALS
                        ? ComparisonOperator.EQUALS
                        : ComparisonOperator.NOT_EQUALS;
                OptionalDouble number = numericColumn ? parseNumber(value) : OptionalDouble.empty();
                if (number.isPresent()) {
                    yield ComparisonExpression.of(column, op, Parameter.of(number.getAsDouble()));
                }
                yield ComparisonExpression.of(folded(column, numericColumn), op, foldedValue(value));
            }
            case CONTAINS -> like(column, numericColumn, LikeExpression.containsPattern(value));
            case NOT_CONTAINS ->
                    LogicalExpression.not(like(column, numericColumn, LikeExpression.containsPattern(value)));
            case STARTS_WITH -> like(column, numericColumn, LikeExpression.prefixPattern(value));
            case ENDS_WITH -> like(column, numericColumn, LikeExpression.suffixPattern(value));
            case GREATER_THAN -> magnitude(column, numericColumn, ComparisonOperator.GREATER_THAN, value);
            case LESS_THAN -> magnitude(column, numericColumn, ComparisonOperator.LESS_THAN, value);
            case GREATER_OR_EQUAL ->
                    magnitude(column, numericColumn, ComparisonOperator.GREATER_THAN_OR_EQUALS, value);
            case LESS_OR_EQUAL -> magnitude(column, numericColumn, ComparisonOperator.LESS_THAN_OR_EQUALS, value);
            case BETWEEN -> between(condition, column, numericColumn);
        };
    }

    /**
     * Not null, and for text columns not empty either.
     */
    private static Expression exists(ColumnReference column, boolean numericColumn) {
        if (numericColumn) {
            return ComparisonExpression.isNotNull(column);
        }
        return LogicalExpression.and(
                ComparisonExpression.isNotNull(column),
                ComparisonExpression.notEquals(column, Literal.string("")));
    }

    private static Expression like(ColumnReference column, boolean numericColumn, String pattern) {
        return LikeExpression.of(folded(column, numericColumn), foldedValue(pattern));
    }

    private static Expression magnitude(ColumnReference column, boolean numericColumn, ComparisonOperator op,
            String value) {
        OptionalDouble number = numericColumn ? parseNumber(value) : OptionalDouble.empty();
        if (number.isPresent()) {
            return ComparisonExpression.of(column, op, Parameter.of(number.getAsDouble()));
        }
        return ComparisonExpression.of(text(column, numericColumn), op, Parameter.of(value));
    }

    /**
     * BETWEEN with both bounds; with a single bound it degrades to equality.
     */
    private static Expression between(Condition condition, ColumnReference column, boolean numericColumn) {
        Optional<Condition.Range> range = condition.range();
        if (range.isEmpty()) {
            OptionalDouble number = numericColumn ? parseNumber(condition.value()) : OptionalDouble.empty();
            if (number.isPresent()) {
                return ComparisonExpression.equals(column, Parameter.of(number.getAsDouble()));
            }
            return ComparisonExpression.equals(folded(column, numericColumn), foldedValue(condition.value()));
        }
        OptionalDouble lower = parseNumber(range.get().lower());
        OptionalDouble upper = parseNumber(range.get().upper());
        if (numericColumn && lower.isPresent() && upper.isPresent()) {
            return new BetweenExpression(column,
                    Parameter.of(lower.getAsDouble()), Parameter.of(upper.getAsDouble()));
        }
        return new BetweenExpression(text(column, numericColumn),
                Parameter.of(range.get().lower()), Parameter.of(range.get().upper()));
    }

    private static Expression text(ColumnReference column, boolean numericColumn) {
        return numericColumn ? CastExpression.toText(column) : column;
    }

    private static Expression folded(ColumnReference column, boolean numericColumn) {
        return SqlFunctionCall.lower(text(column, numericColumn));
    }

    private static Expression foldedValue(String value) {
        return SqlFunctionCall.lower(Parameter.of(value));
    }

    static OptionalDouble parseNumber(String value) {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(parsed);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
