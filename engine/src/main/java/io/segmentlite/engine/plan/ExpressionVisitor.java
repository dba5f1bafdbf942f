package io.segmentlite.engine.plan;

/**
 * Double dispatch over expression kinds. {@link io.segmentlite.engine.transpiler.SQLGenerator}
 * is the main implementation.
 */
public interface ExpressionVisitor<T> {

    // Operands

    T visitColumnReference(ColumnReference columnRef);

    T visitLiteral(Literal literal);

    T visitParameter(Parameter parameter);

    T visitFunctionCall(SqlFunctionCall functionCall);

    T visitCast(CastExpression cast);

    T visitAggregate(AggregateExpression aggregate);

    // Predicates

    T visitComparison(ComparisonExpression comparison);

    T visitLogical(LogicalExpression logical);

    T visitLike(LikeExpression like);

    T visitBetween(BetweenExpression between);

    /** {@code operand IN (SELECT key ...)}, the per-session and per-user membership test. */
    T visitInSubquery(InSubqueryExpression in);
}
