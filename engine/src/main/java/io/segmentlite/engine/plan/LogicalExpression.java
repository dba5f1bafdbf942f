package io.segmentlite.engine.plan;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AND/OR over two or more predicates, or NOT over exactly one.
 *
 * Container combinators and exclude signs compile to this node.
 */
public record LogicalExpression(LogicalOperator operator, List<Expression> operands) implements Expression {

    public enum LogicalOperator {
        AND,
        OR,
        NOT
    }

    public LogicalExpression {
        Objects.requireNonNull(operator, "Logical operator cannot be null");
        operands = List.copyOf(Objects.requireNonNull(operands, "Logical operands cannot be null"));
        boolean arityOk = operator == LogicalOperator.NOT ? operands.size() == 1 : operands.size() >= 2;
        if (!arityOk) {
            throw new IllegalArgumentException(operator + " cannot take " + operands.size() + " operand(s)");
        }
    }

    public static LogicalExpression and(Expression... predicates) {
        return new LogicalExpression(LogicalOperator.AND, List.of(predicates));
    }

    public static LogicalExpression or(Expression... predicates) {
        return new LogicalExpression(LogicalOperator.OR, List.of(predicates));
    }

    public static LogicalExpression not(Expression predicate) {
        return new LogicalExpression(LogicalOperator.NOT, List.of(predicate));
    }

    /**
     * Folds predicates under AND or OR; a lone predicate comes back as is.
     */
    public static Expression combine(LogicalOperator operator, List<Expression> predicates) {
        if (operator == LogicalOperator.NOT || predicates.isEmpty()) {
            throw new IllegalArgumentException("Cannot fold " + predicates.size() + " predicate(s) with " + operator);
        }
        return predicates.size() == 1 ? predicates.get(0) : new LogicalExpression(operator, predicates);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public String toString() {
        if (operator == LogicalOperator.NOT) {
            return "NOT " + operands.get(0);
        }
        return operands.stream().map(String::valueOf).collect(Collectors.joining(" " + operator + " ", "(", ")"));
    }
}
