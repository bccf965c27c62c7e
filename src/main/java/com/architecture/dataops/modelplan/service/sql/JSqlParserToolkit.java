package com.architecture.dataops.modelplan.service.sql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SelectVisitorAdapter;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * SQL toolkit backed by JSqlParser.
 * <p>
 * Two statements are cosmetically equal when their deparsed forms match: the parser drops
 * comments and whitespace and prints keywords in one case. Column extraction collects every
 * {@link Column} reference in the query, lower-cased and unqualified.
 */
@Slf4j
public class JSqlParserToolkit implements SqlToolkit {

    @Override
    public CosmeticCheck classifyChange(String oldSql, String newSql) {
        if (oldSql == null || newSql == null) {
            return CosmeticCheck.UNPARSEABLE;
        }
        if (oldSql.equals(newSql)) {
            return CosmeticCheck.IDENTICAL;
        }
        try {
            String before = parse(oldSql).toString();
            String after = parse(newSql).toString();
            return before.equals(after) ? CosmeticCheck.COSMETIC_ONLY : CosmeticCheck.SEMANTIC;
        } catch (JSQLParserException e) {
            log.warn("Could not parse SQL for cosmetic check: {}", rootMessage(e));
            return CosmeticCheck.UNPARSEABLE;
        }
    }

    @Override
    public ColumnExtraction extractColumns(String sql) {
        if (sql == null || sql.isBlank()) {
            return ColumnExtraction.failed("empty SQL");
        }
        Statement statement;
        try {
            statement = parse(sql);
        } catch (JSQLParserException e) {
            return ColumnExtraction.failed(rootMessage(e));
        }
        if (!(statement instanceof Select select)) {
            return ColumnExtraction.failed("not a query: " + statement.getClass().getSimpleName());
        }

        ColumnCollector collector = new ColumnCollector();
        collector.walk(select);
        return ColumnExtraction.of(collector.columns);
    }

    private static Statement parse(String sql) throws JSQLParserException {
        String trimmed = sql.strip();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return CCJSqlParserUtil.parse(trimmed);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null ? root.getClass().getSimpleName() : message.lines().findFirst().orElse(message);
    }

    static String unquote(String identifier) {
        if (identifier.length() >= 2) {
            char first = identifier.charAt(0);
            char last = identifier.charAt(identifier.length() - 1);
            if ((first == '`' && last == '`') || (first == '"' && last == '"') || (first == '[' && last == ']')) {
                return identifier.substring(1, identifier.length() - 1);
            }
        }
        return identifier;
    }

    // ========================= Traversal =========================

    /**
     * Walks select bodies itself and hands expressions to a JSqlParser expression visitor.
     * Subqueries inside expressions come back through the select visitor.
     */
    private static final class ColumnCollector {

        private final Set<String> columns = new TreeSet<>();
        private final ExpressionVisitorAdapter expressions;

        ColumnCollector() {
            expressions = new ExpressionVisitorAdapter() {
                @Override
                public void visit(Column column) {
                    columns.add(unquote(column.getColumnName()).toLowerCase(Locale.ROOT));
                }
            };
            expressions.setSelectVisitor(new SelectVisitorAdapter() {
                @Override
                public void visit(PlainSelect plainSelect) {
                    walk(plainSelect);
                }

                @Override
                public void visit(SetOperationList setOperationList) {
                    walk(setOperationList);
                }

                @Override
                public void visit(ParenthesedSelect parenthesedSelect) {
                    walk(parenthesedSelect);
                }
            });
        }

        void walk(Select select) {
            if (select == null) {
                return;
            }
            if (select.getWithItemsList() != null) {
                for (WithItem withItem : select.getWithItemsList()) {
                    walk(withItem.getSelect());
                }
            }
            if (select instanceof PlainSelect plainSelect) {
                walkPlainSelect(plainSelect);
            } else if (select instanceof SetOperationList setOperationList) {
                setOperationList.getSelects().forEach(this::walk);
            } else if (select instanceof ParenthesedSelect parenthesedSelect) {
                walk(parenthesedSelect.getSelect());
            }
        }

        private void walkPlainSelect(PlainSelect plainSelect) {
            if (plainSelect.getSelectItems() != null) {
                for (SelectItem<?> item : plainSelect.getSelectItems()) {
                    accept(item.getExpression());
                }
            }
            walkFromItem(plainSelect.getFromItem());
            if (plainSelect.getJoins() != null) {
                for (Join join : plainSelect.getJoins()) {
                    walkFromItem(join.getRightItem());
                    if (join.getOnExpressions() != null) {
                        join.getOnExpressions().forEach(this::accept);
                    }
                    if (join.getUsingColumns() != null) {
                        join.getUsingColumns().forEach(this::accept);
                    }
                }
            }
            accept(plainSelect.getWhere());
            GroupByElement groupBy = plainSelect.getGroupBy();
            if (groupBy != null) {
                accept(groupBy.getGroupByExpressionList());
            }
            accept(plainSelect.getHaving());
            if (plainSelect.getOrderByElements() != null) {
                for (OrderByElement orderBy : plainSelect.getOrderByElements()) {
                    accept(orderBy.getExpression());
                }
            }
        }

        // Tables contribute no columns; derived tables do.
        private void walkFromItem(FromItem fromItem) {
            if (fromItem instanceof Select subquery) {
                walk(subquery);
            }
        }

        private void accept(Expression expression) {
            if (expression != null) {
                expression.accept(expressions);
            }
        }
    }
}
