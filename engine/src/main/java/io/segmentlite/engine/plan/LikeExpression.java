package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Represents {@code operand LIKE pattern ESCAPE '\'}.
 *
 * The pattern is usually a {@link Parameter} whose value was built with
 * {@link #containsPattern}, {@link #prefixPattern} or {@link #suffixPattern},
 * which escape the wildcard characters of the user's text.
 *
 * @param operand The value being matched
 * @param pattern The LIKE pattern
 */
public record LikeExpression(
        Expression operand,
        Expression pattern
) implements Expression {

    public static final char ESCAPE_CHAR = '\\';

    public LikeExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(pattern, "Pattern cannot be null");
    }

    public static LikeExpression of(Expression operand, Expression pattern) {
        return new LikeExpression(operand, pattern);
    }

    public static String containsPattern(String text) {
        return "%" + escape(text) + "%";
    }

    public static String prefixPattern(String text) {
        return escape(text) + "%";
    }

    public static String suffixPattern(String text) {
        return "%" + escape(text);
    }

    /**
     * Escapes {@code %}, {@code _} and the escape character itself.
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 4);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '%' || c == '_' || c == ESCAPE_CHAR) {
                sb.append(ESCAPE_CHAR);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLike(this);
    }

    @Override
    public String toString() {
        return operand + " LIKE " + pattern;
    }
}
