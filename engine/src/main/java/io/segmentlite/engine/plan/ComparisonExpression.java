package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * A binary comparison such as {@code LOWER(h.device_type) = ?}, or a null test,
 * which has no right-hand side.
 */
public record ComparisonExpression(Expression left, ComparisonOperator operator, Expression right)
        implements Expression {

    public enum ComparisonOperator {
        EQUALS("="),
        NOT_EQUALS("<>"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">="),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String toSql() {
            return symbol;
        }

        /** Null tests take only the left operand. */
        public boolean isUnary() {
            return symbol.startsWith("IS ");
        }
    }

    public ComparisonExpression {
        Objects.requireNonNull(left, "Compared expression cannot be null");
        Objects.requireNonNull(operator, "Comparison operator cannot be null");
        if (operator.isUnary() != (right == null)) {
            throw new IllegalArgumentException(operator.isUnary()
                    ? operator + " takes no right operand"
                    : operator + " needs a right operand");
        }
    }

    public static ComparisonExpression of(Expression left, ComparisonOperator operator, Expression right) {
        return new ComparisonExpression(left, operator, right);
    }

    public static ComparisonExpression equals(Expression left, Expression right) {
        return of(left, ComparisonOperator.EQUALS, right);
    }

    public static ComparisonExpression notEquals(Expression left, Expression right) {
        return of(left, ComparisonOperator.NOT_EQUALS, right);
    }

    public static ComparisonExpression isNull(Expression operand) {
        return of(operand, ComparisonOperator.IS_NULL, null);
    }

    public static ComparisonExpression isNotNull(Expression operand) {
        return of(operand, ComparisonOperator.IS_NOT_NULL, null);
    }

    /** {@code 1 = 0}, the filter of a segment with nothing in it. */
    public static ComparisonExpression alwaysFalse() {
        return equals(Literal.integer(1), Literal.integer(0));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return operator.isUnary()
                ? left + " " + operator.toSql()
                : left + " " + operator.toSql() + " " + right;
    }
}
