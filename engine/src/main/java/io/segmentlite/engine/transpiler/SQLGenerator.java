package io.segmentlite.engine.transpiler;

import io.segmentlite.engine.plan.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Transpiles a RelationNode tree into SQL.
 *
 * A chain of Limit, Sort, Project/GroupBy and Filter nodes over a table, a join chain
 * or a derived table collapses into a single SELECT statement. Any other arrangement is
 * wrapped as a derived table.
 *
 * {@link Parameter}s are rendered as {@code ?} markers and collected in the order the
 * markers appear in the text, so every clause is rendered in textual order.
 * {@link #generateInlined} renders them as quoted literals instead, for display only.
 */
public final class SQLGenerator {

    private final SQLDialect dialect;

    public SQLGenerator(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Generates parameterised SQL from a relation node tree.
     *
     * @param node The root node of the logical plan
     * @return The SQL text and its bound values
     */
    public SqlQuery generate(RelationNode node) {
        Renderer renderer = new Renderer(false);
        String sql = node.accept(renderer);
        return new SqlQuery(sql, renderer.parameters);
    }

    /**
     * Generates SQL with every parameter inlined as a dialect literal.
     * The result is meant to be read, not executed.
     */
    public String generateInlined(RelationNode node) {
        return node.accept(new Renderer(true));
    }

    /**
     * Generates parameterised SQL from an expression.
     */
    public SqlQuery generateExpression(Expression expression) {
        Renderer renderer = new Renderer(false);
        String sql = expression.accept(renderer);
        return new SqlQuery(sql, renderer.parameters);
    }

    /**
     * One rendering pass. Holds the parameters collected so far.
     */
    private final class Renderer implements RelationNodeVisitor<String>, ExpressionVisitor<String> {

        private final boolean inline;
        private final List<Object> parameters = new ArrayList<>();

        private Renderer(boolean inline) {
            this.inline = inline;
        }

        // ==================== RelationNode Visitors ====================

        @Override
        public String visit(TableNode table) {
            return select(table);
        }

        @Override
        public String visit(JoinNode join) {
            return select(join);
        }

        @Override
        public String visit(SubqueryNode subquery) {
            return select(subquery);
        }

        @Override
        public String visit(FilterNode filter) {
            return select(filter);
        }

        @Override
        public String visit(ProjectNode project) {
            return select(project);
        }

        @Override
        public String visit(GroupByNode groupBy) {
            return select(groupBy);
        }

        @Override
        public String visit(SortNode sort) {
            return select(sort);
        }

        @Override
        public String visit(LimitNode limit) {
            return select(limit);
        }

        /**
         * Collapses the node chain into one SELECT statement.
         */
        private String select(RelationNode root) {
            RelationNode node = root;

            LimitNode limit = null;
            if (node instanceof LimitNode l) {
                limit = l;
                node = l.source();
            }
            SortNode sort = null;
            if (node instanceof SortNode s) {
                sort = s;
                node = s.source();
            }
            ProjectNode project = null;
            GroupByNode groupBy = null;
            if (node instanceof ProjectNode p) {
                project = p;
                node = p.source();
            } else if (node instanceof GroupByNode g) {
                groupBy = g;
                node = g.source();
            }
            List<Expression> filters = new ArrayList<>();
            while (node instanceof FilterNode f) {
                // Inner filters apply first
                filters.add(0, f.condition());
                node = f.source();
            }

            var sb = new StringBuilder();

            sb.append("SELECT ");
            if (project != null) {
                sb.append(formatProjections(project.projections()));
            } else if (groupBy != null) {
                sb.append(formatProjections(groupBy.projections()));
            } else {
                sb.append("*");
            }

            sb.append(" FROM ").append(formatFrom(node));
            if (!filters.isEmpty()) {
                sb.append(" WHERE ");
                sb.append(LogicalExpression.combine(LogicalExpression.LogicalOperator.AND, filters).accept(this));
            }

            if (groupBy != null && !groupBy.groupingKeys().isEmpty()) {
                sb.append(" GROUP BY ");
                sb.append(groupBy.groupingKeys().stream()
                        .map(e -> e.accept(this))
                        .collect(Collectors.joining(", ")));
            }

            if (sort != null) {
                sb.append(" ORDER BY ");
                sb.append(sort.columns().stream()
                        .map(col -> col.expression().accept(this) + " " + col.direction().name())
                        .collect(Collectors.joining(", ")));
            }

            if (limit != null) {
                sb.append(" LIMIT ").append(limit.limit());
            }

            return sb.toString();
        }

        private String formatFrom(RelationNode node) {
            if (node instanceof TableNode table) {
                return formatTable(table);
            }
            if (node instanceof JoinNode join) {
                return formatFrom(join.left())
                        + " LEFT OUTER JOIN "
                        + formatTable(join.right())
                        + " ON " + join.condition().accept(this);
            }
            if (node instanceof SubqueryNode subquery) {
                return "(" + subquery.source().accept(this) + ") AS " + dialect.quoteIdentifier(subquery.alias());
            }
            // Filter over a limit and similar: derived table
            return "(" + node.accept(this) + ") AS " + dialect.quoteIdentifier("subq");
        }

        private String formatTable(TableNode table) {
            return dialect.quoteIdentifier(table.table().name())
                    + " AS " + dialect.quoteIdentifier(table.alias());
        }

        private String formatProjections(List<Projection> projections) {
            return projections.stream()
                    .map(this::formatProjection)
                    .collect(Collectors.joining(", "));
        }

        private String formatProjection(Projection projection) {
            String expr = projection.expression().accept(this);
            return expr + " AS " + dialect.quoteIdentifier(projection.alias());
        }

        // ==================== Expression Visitors ====================

        @Override
        public String visitColumnReference(ColumnReference columnRef) {
            if (columnRef.tableAlias().isEmpty()) {
                return dialect.quoteIdentifier(columnRef.columnName());
            }
            return dialect.quoteIdentifier(columnRef.tableAlias())
                    + "." + dialect.quoteIdentifier(columnRef.columnName());
        }

        @Override
        public String visitLiteral(Literal literal) {
            return switch (literal.literalType()) {
                case STRING -> dialect.quoteStringLiteral((String) literal.value());
                case INTEGER, DOUBLE -> String.valueOf(literal.value());
                case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
                case NULL -> dialect.formatNull();
            };
        }

        @Override
        public String visitParameter(Parameter parameter) {
            if (inline) {
                if (parameter.value() instanceof String text) {
                    return dialect.quoteStringLiteral(text);
                }
                return String.valueOf(parameter.value());
            }
            parameters.add(parameter.value());
            return "?";
        }

        @Override
        public String visitComparison(ComparisonExpression comparison) {
            String rendered = comparison.left().accept(this) + " " + comparison.operator().toSql();
            return comparison.operator().isUnary() ? rendered : rendered + " " + comparison.right().accept(this);
        }

        @Override
        public String visitLogical(LogicalExpression logical) {
            if (logical.operator() == LogicalExpression.LogicalOperator.NOT) {
                return "NOT (" + logical.operands().get(0).accept(this) + ")";
            }
            String glue = " " + logical.operator().name() + " ";
            return logical.operands().stream()
                    .map(operand -> operand.accept(this))
                    .collect(Collectors.joining(glue, "(", ")"));
        }

        @Override
        public String visitLike(LikeExpression like) {
            String operand = like.operand().accept(this);
            String pattern = like.pattern().accept(this);
            return operand + " LIKE " + pattern
                    + " ESCAPE " + dialect.quoteStringLiteral(String.valueOf(LikeExpression.ESCAPE_CHAR));
        }

        @Override
        public String visitBetween(BetweenExpression between) {
            return between.operand().accept(this) + " BETWEEN " + between.lower().accept(this)
                    + " AND " + between.upper().accept(this);
        }

        @Override
        public String visitInSubquery(InSubqueryExpression in) {
            return in.operand().accept(this) + " IN (" + in.subquery().accept(this) + ")";
        }

        @Override
        public String visitFunctionCall(SqlFunctionCall functionCall) {
            return functionCall.functionName() + "(" + functionCall.argument().accept(this) + ")";
        }

        @Override
        public String visitCast(CastExpression cast) {
            return "CAST(" + cast.expression().accept(this)
                    + " AS " + dialect.castTypeName(cast.targetType()) + ")";
        }

        @Override
        public String visitAggregate(AggregateExpression aggregate) {
            String funcName = aggregate.function().sql();
            return switch (aggregate.function()) {
                case COUNT_ALL -> funcName + "(*)";
                case COUNT_DISTINCT -> funcName + "(DISTINCT " + aggregate.argument().accept(this) + ")";
                default -> funcName + "(" + aggregate.argument().accept(this) + ")";
            };
        }
    }
}
