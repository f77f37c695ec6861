package com.strata.query.rewrite;

import com.strata.domain.DateRange;
import com.strata.domain.TableConfig;
import com.strata.query.AttributeResolver;
import com.strata.query.InvalidQueryException;
import com.strata.query.QueryParseException;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Rewrites user supplied SQL so that it can only read data belonging to one
 * project within one time window.
 *
 * Every SELECT reading directly from a resource table gets its table name
 * replaced by the physical table, unknown identifiers mapped to attribute
 * lookups, {@code $time_interval('...')} expanded to a bucketing expression,
 * counts and sums scaled by the sample factor on sampled tables, and a
 * table-qualified project and time predicate ANDed onto its WHERE clause.
 * Resource tables may not be joined, and select aliases may not take the name
 * of the project column. Applying the rewrite to its own output adds no
 * further scoping predicates.
 */
@Component
public class SqlRewriter {
    private static final Logger log = LoggerFactory.getLogger(SqlRewriter.class);

    public static final String TIME_INTERVAL = "$time_interval";
    static final String TIME_INTERVAL_PLACEHOLDER = "strata_time_interval";

    private static final Pattern SETTINGS_CLAUSE = Pattern.compile("(?i)\\bSETTINGS\\s+[A-Za-z_][\\w.]*\\s*=");
    private static final Pattern TIME_INTERVAL_TOKEN = Pattern.compile(Pattern.quote(TIME_INTERVAL) + "\\b");
    private static final Set<String> RESERVED_COLUMNS = Set.of(
        "Timestamp", "UUID", "_sample_factor", TableConfig.PROJECT_ID, TableConfig.LEGACY_PROJECT_ID);
    private static final Set<String> LITERAL_NAMES = Set.of("TRUE", "FALSE", "NULL", "*");

    /**
     * Rewrites {@code sql} against {@code config} for exactly one project.
     *
     * @throws InvalidQueryException when the statement is rejected
     * @throws QueryParseException   when the statement cannot be parsed
     */
    public String rewrite(String sql, TableConfig config, List<Integer> projectIds, DateRange dateRange) {
        if (SqlText.containsOutsideQuotes(sql, SETTINGS_CLAUSE)) {
            throw new InvalidQueryException("SQL statement cannot include a settings clause.");
        }
        Statement statement = parseSingle(sql);
        if (!(statement instanceof Select)) {
            return sql;
        }

        Rewrite rewrite = new Rewrite(config, projectIds, dateRange);
        for (PlainSelect select : plainSelects((Select) statement)) {
            rewrite.apply(select);
        }
        String result = statement.toString().replace(TIME_INTERVAL_PLACEHOLDER, TIME_INTERVAL);
        log.debug("Rewrote SQL for {} (attributes {}): {}", config.getResource(), rewrite.attributeFields, result);
        return result;
    }

    /**
     * Resource tables referenced by {@code sql}, in order of first appearance
     * for SELECT statements.
     */
    public List<String> resourceTables(String sql) {
        Statement statement = parseSingle(sql);
        Set<String> found = new LinkedHashSet<>();
        if (statement instanceof Select) {
            for (PlainSelect select : plainSelects((Select) statement)) {
                for (FromItem item : fromItems(select)) {
                    collectTables(item, found);
                }
            }
        } else {
            Set<String> names;
            try {
                names = new TablesNamesFinder<Void>().getTables(statement);
            } catch (UnsupportedOperationException e) {
                throw new InvalidQueryException("Unsupported SQL statement: " + e.getMessage());
            }
            for (String name : names) {
                addResource(name, found);
            }
        }
        return new ArrayList<>(found);
    }

    private static void collectTables(FromItem item, Set<String> found) {
        if (item instanceof Table) {
            addResource(((Table) item).getName(), found);
        } else if (item instanceof ParenthesedFromItem) {
            ParenthesedFromItem parenthesed = (ParenthesedFromItem) item;
            collectTables(parenthesed.getFromItem(), found);
            if (parenthesed.getJoins() != null) {
                for (Join join : parenthesed.getJoins()) {
                    collectTables(join.getRightItem(), found);
                }
            }
        }
    }

    private static void addResource(String name, Set<String> found) {
        String table = unquote(name);
        if (ResourceTables.isResource(table)) {
            found.add(table);
        }
    }

    private static Statement parseSingle(String sql) {
        String prepared = SqlText.replaceOutsideQuotes(sql, TIME_INTERVAL_TOKEN, TIME_INTERVAL_PLACEHOLDER);
        Statements statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(prepared);
        } catch (JSQLParserException e) {
            throw new QueryParseException("Failed to parse SQL: " + rootMessage(e), sql, e);
        }
        if (statements.size() != 1) {
            throw new InvalidQueryException(String.format("Expected 1 SQL statement, found %d", statements.size()));
        }
        return statements.get(0);
    }

    /**
     * All plain selects of {@code select}, innermost first.
     */
    static List<PlainSelect> plainSelects(Select select) {
        List<PlainSelect> out = new ArrayList<>();
        collect(select, out);
        return out;
    }

    @SuppressWarnings("rawtypes")
    private static void collect(Select select, List<PlainSelect> out) {
        if (select == null) {
            return;
        }
        if (select.getWithItemsList() != null) {
            for (Object item : select.getWithItemsList()) {
                Object body = ((WithItem) item).getSelect();
                if (body instanceof Select) {
                    collect((Select) body, out);
                }
            }
        }
        if (select instanceof PlainSelect) {
            PlainSelect plain = (PlainSelect) select;
            for (FromItem item : fromItems(plain)) {
                collectFrom(item, out);
            }
            for (Expression expression : expressions(plain)) {
                walk(expression, column -> { }, function -> { }, nested -> collect(nested, out));
            }
            out.add(plain);
        } else if (select instanceof SetOperationList) {
            for (Select branch : ((SetOperationList) select).getSelects()) {
                collect(branch, out);
            }
        } else if (select instanceof ParenthesedSelect) {
            collect(((ParenthesedSelect) select).getSelect(), out);
        }
    }

    private static void collectFrom(FromItem item, List<PlainSelect> out) {
        if (item instanceof Select) {
            collect((Select) item, out);
        } else if (item instanceof ParenthesedFromItem) {
            ParenthesedFromItem parenthesed = (ParenthesedFromItem) item;
            collectFrom(parenthesed.getFromItem(), out);
            if (parenthesed.getJoins() != null) {
                for (Join join : parenthesed.getJoins()) {
                    collectFrom(join.getRightItem(), out);
                }
            }
        }
    }

    private static List<FromItem> fromItems(PlainSelect select) {
        List<FromItem> items = new ArrayList<>();
        if (select.getFromItem() != null) {
            items.add(select.getFromItem());
        }
        if (select.getJoins() != null) {
            for (Join join : select.getJoins()) {
                items.add(join.getRightItem());
            }
        }
        return items;
    }

    /**
     * Expressions owned by {@code select} itself: select list, join conditions,
     * WHERE, GROUP BY, HAVING and ORDER BY.
     */
    private static List<Expression> expressions(PlainSelect select) {
        List<Expression> expressions = new ArrayList<>();
        for (SelectItem<?> item : select.getSelectItems()) {
            expressions.add(item.getExpression());
        }
        if (select.getJoins() != null) {
            for (Join join : select.getJoins()) {
                Collection<Expression> on = join.getOnExpressions();
                if (on != null) {
                    expressions.addAll(on);
                }
            }
        }
        if (select.getWhere() != null) {
            expressions.add(select.getWhere());
        }
        if (select.getGroupBy() != null && select.getGroupBy().getGroupByExpressionList() != null) {
            expressions.add(select.getGroupBy().getGroupByExpressionList());
        }
        if (select.getHaving() != null) {
            expressions.add(select.getHaving());
        }
        if (select.getOrderByElements() != null) {
            for (OrderByElement element : select.getOrderByElements()) {
                expressions.add(element.getExpression());
            }
        }
        return expressions;
    }

    private static void walk(Expression expression, Consumer<Column> columns, Consumer<Function> functions,
                             Consumer<Select> subSelects) {
        if (expression == null) {
            return;
        }
        expression.accept(new ExpressionVisitorAdapter<Void>() {
            @Override
            public <S> Void visit(Column column, S context) {
                columns.accept(column);
                return null;
            }

            @Override
            public <S> Void visit(Function function, S context) {
                functions.accept(function);
                return super.visit(function, context);
            }

            @Override
            public <S> Void visit(ParenthesedSelect select, S context) {
                subSelects.accept(select);
                return null;
            }

            @Override
            public <S> Void visit(Select select, S context) {
                subSelects.accept(select);
                return null;
            }
        });
    }

    static String unquote(String name) {
        if (name != null && name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);
            if ((first == '"' || first == '`') && first == last) {
                return name.substring(1, name.length() - 1);
            }
        }
        return name;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    /**
     * State of one rewrite pass. Nodes are tracked by identity so that no node
     * is rewritten twice.
     */
    private static final class Rewrite {
        private final TableConfig config;
        private final List<Integer> projectIds;
        private final DateRange dateRange;
        private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<String> attributeFields = new LinkedHashSet<>();

        Rewrite(TableConfig config, List<Integer> projectIds, DateRange dateRange) {
            this.config = config;
            this.projectIds = projectIds;
            this.dateRange = dateRange;
        }

        void apply(PlainSelect select) {
            if (!visited.add(select)) {
                return;
            }
            Table table = resourceTable(select);
            if (table == null) {
                return;
            }

            Set<String> aliases = new LinkedHashSet<>();
            for (SelectItem<?> item : select.getSelectItems()) {
                if (item.getAlias() != null) {
                    aliases.add(unquote(item.getAlias().getName()));
                }
            }
            checkNoShadowing(aliases);

            Set<String> fields = new LinkedHashSet<>();
            List<Expression> expressions = expressions(select);
            for (Expression expression : expressions) {
                walk(expression, column -> replaceColumn(column, aliases, fields), function -> { }, nested -> { });
            }
            for (Expression expression : expressions) {
                walk(expression, column -> { }, this::replaceFunction, nested -> { });
            }
            attributeFields.addAll(fields);

            table.setName(config.getTableName());
            table.setSchemaName(null);
            visited.add(table);

            scope(select, qualifier(table), aliases);
            if (config.hasAttributesTable() && !fields.isEmpty()) {
                joinAttributes(select, fields);
            }
        }

        /**
         * The resource table read directly by {@code select}, or null when it
         * reads from something else.
         */
        private Table resourceTable(PlainSelect select) {
            FromItem from = select.getFromItem();
            if (from == null) {
                return null;
            }
            if (select.getJoins() != null && !select.getJoins().isEmpty()) {
                for (FromItem item : fromItems(select)) {
                    checkNotJoined(item);
                }
                return null;
            }
            if (from instanceof Table) {
                Table table = (Table) from;
                if (visited.contains(table) || !ResourceTables.isResource(unquote(table.getName()))) {
                    return null;
                }
                return table;
            }
            if (from instanceof Select || from instanceof TableFunction) {
                return null;
            }
            if (from instanceof ParenthesedFromItem) {
                checkNotJoined(from);
                return null;
            }
            throw new InvalidQueryException("Unsupported FROM expression: " + from.getClass().getSimpleName());
        }

        private void checkNotJoined(FromItem item) {
            if (item instanceof Table) {
                if (!visited.contains(item) && ResourceTables.isResource(unquote(((Table) item).getName()))) {
                    throw new InvalidQueryException("Resource tables cannot be used in JOIN expression");
                }
            } else if (item instanceof ParenthesedFromItem) {
                ParenthesedFromItem parenthesed = (ParenthesedFromItem) item;
                checkNotJoined(parenthesed.getFromItem());
                if (parenthesed.getJoins() != null) {
                    for (Join join : parenthesed.getJoins()) {
                        checkNotJoined(join.getRightItem());
                    }
                }
            }
        }

        private void replaceColumn(Column column, Set<String> aliases, Set<String> fields) {
            if (!visited.add(column)) {
                return;
            }
            if (column.getTable() != null && column.getTable().getName() != null) {
                return;
            }
            String name = unquote(column.getColumnName());
            if (LITERAL_NAMES.contains(name.toUpperCase(Locale.ROOT)) || aliases.contains(name)) {
                return;
            }
            String mapped = AttributeResolver.column(config, name);
            if (mapped != null) {
                column.setColumnName(mapped);
                return;
            }
            if (RESERVED_COLUMNS.contains(name)
                || AttributeResolver.isKnownColumn(config, name)
                || config.isAttributesColumn(name)) {
                return;
            }
            column.setColumnName(AttributeResolver.attributeLiteral(config, name, ""));
            fields.add(name);
        }

        private void replaceFunction(Function function) {
            if (!visited.add(function)) {
                return;
            }
            String name = function.getName();
            if (TIME_INTERVAL_PLACEHOLDER.equalsIgnoreCase(name)) {
                ExpressionList<?> parameters = function.getParameters();
                int count = parameters == null ? 0 : parameters.size();
                if (count != 1) {
                    throw new InvalidQueryException(
                        String.format("Expecting 1 argument for %s, found %d", TIME_INTERVAL, count));
                }
                if (!(parameters.get(0) instanceof StringValue)) {
                    throw new InvalidQueryException("Expecting $time_interval argument to be a string literal.");
                }
                String interval = ((StringValue) parameters.get(0)).getValue();
                Function bucket = (Function) parse("toStartOfInterval(Timestamp, INTERVAL '" + interval + "')");
                function.setName(bucket.getName());
                function.setParameters(bucket.getParameters());
                return;
            }
            if (config.isSampled() && name != null) {
                String lower = name.toLowerCase(Locale.ROOT);
                if (lower.contains("sum") || lower.contains("count")) {
                    function.setName("any(_sample_factor) * " + name);
                }
            }
        }

        /**
         * Aliases named after the project column would shadow it in WHERE.
         */
        private void checkNoShadowing(Set<String> aliases) {
            String projectColumn = config.getProjectIdColumn();
            for (String alias : aliases) {
                if (alias.equalsIgnoreCase(projectColumn) || alias.endsWith("." + projectColumn)) {
                    throw new InvalidQueryException("Column alias cannot be named " + projectColumn);
                }
            }
        }

        /**
         * Name used to qualify scoping columns: the table alias when present,
         * otherwise the physical table name without any SAMPLE clause.
         */
        private static String qualifier(Table table) {
            if (table.getAlias() != null && table.getAlias().getName() != null) {
                return table.getAlias().getName();
            }
            String name = table.getName().trim();
            int space = name.indexOf(' ');
            return space < 0 ? name : name.substring(0, space);
        }

        private void scope(PlainSelect select, String qualifier, Set<String> aliases) {
            if (projectIds == null || projectIds.size() != 1) {
                throw new InvalidQueryException(String.format("SQL queries must use 1 project id, %d found",
                    projectIds == null ? 0 : projectIds.size()));
            }
            int projectId = projectIds.get(0);
            Expression where = select.getWhere();

            List<String> predicates = new ArrayList<>();
            if (!hasProjectPredicate(where, qualifier, projectId)) {
                predicates.add(qualifier + "." + config.getProjectIdColumn() + " = " + projectId);
            }
            if (!referencesTimestamp(where, qualifier, aliases.contains("Timestamp"))) {
                predicates.add(String.format("%s.Timestamp >= toDateTime(%d)",
                    qualifier, dateRange.getStartDate().getEpochSecond()));
                predicates.add(String.format("%s.Timestamp <= toDateTime(%d)",
                    qualifier, dateRange.getEndDate().getEpochSecond()));
            }
            String defaultFilter = config.getDefaultFilter();
            if (defaultFilter != null && !defaultFilter.isEmpty()) {
                String normalized = parse(defaultFilter).toString();
                if (where == null || !where.toString().contains(normalized)) {
                    predicates.add("(" + defaultFilter + ")");
                }
            }
            if (predicates.isEmpty()) {
                return;
            }

            Expression scope = parse(String.join(" AND ", predicates));
            markVisited(scope);
            if (where == null) {
                select.setWhere(scope);
            } else {
                select.setWhere(new AndExpression(new ParenthesedExpressionList<>(where), scope));
            }
        }

        /**
         * Whether the top level AND chain of {@code where} already holds the
         * qualified project predicate. Unqualified references may resolve to
         * an alias and do not count.
         */
        private boolean hasProjectPredicate(Expression where, String qualifier, int projectId) {
            if (where instanceof AndExpression) {
                AndExpression and = (AndExpression) where;
                return hasProjectPredicate(and.getLeftExpression(), qualifier, projectId)
                    || hasProjectPredicate(and.getRightExpression(), qualifier, projectId);
            }
            if (where instanceof EqualsTo) {
                EqualsTo equals = (EqualsTo) where;
                return isQualified(equals.getLeftExpression(), qualifier, config.getProjectIdColumn())
                    && equals.getRightExpression() instanceof LongValue
                    && ((LongValue) equals.getRightExpression()).getValue() == projectId;
            }
            return false;
        }

        private static boolean isQualified(Expression expression, String qualifier, String columnName) {
            if (!(expression instanceof Column)) {
                return false;
            }
            Column column = (Column) expression;
            return column.getTable() != null
                && unquote(qualifier).equals(unquote(column.getTable().getName()))
                && columnName.equals(unquote(column.getColumnName()));
        }

        private boolean referencesTimestamp(Expression where, String qualifier, boolean shadowed) {
            boolean[] found = {false};
            walk(where, column -> {
                boolean unqualified = column.getTable() == null || column.getTable().getName() == null;
                if (isQualified(column, qualifier, "Timestamp")
                    || (!shadowed && unqualified && "Timestamp".equals(unquote(column.getColumnName())))) {
                    found[0] = true;
                }
            }, function -> { }, nested -> { });
            return found[0];
        }

        private void joinAttributes(PlainSelect select, Set<String> fields) {
            if (select.getJoins() != null) {
                for (Join join : select.getJoins()) {
                    if (join.getRightItem().getAlias() != null
                        && "attributes".equals(join.getRightItem().getAlias().getName())) {
                        return;
                    }
                }
            }
            List<String> keys = new ArrayList<>();
            for (String field : fields) {
                keys.add(AttributeResolver.quote(field));
            }
            String template = String.format(
                "SELECT 1 FROM t LEFT JOIN (SELECT UUID, groupArray((`Key`, `Value`)) AS %s FROM %s"
                    + " WHERE %s = %d AND Timestamp >= toDateTime(%d) AND Timestamp <= toDateTime(%d)"
                    + " AND `Key` IN (%s) GROUP BY UUID) AS attributes USING (UUID)",
                config.getAttributesColumn(""), config.getAttributesTable(), config.getProjectIdColumn(),
                projectIds.get(0), dateRange.getStartDate().getEpochSecond(),
                dateRange.getEndDate().getEpochSecond(), String.join(", ", keys));
            PlainSelect parsed;
            try {
                parsed = (PlainSelect) CCJSqlParserUtil.parse(template);
            } catch (JSQLParserException e) {
                throw new QueryParseException("Failed to build attributes join", template, e);
            }
            List<Join> joins = select.getJoins() == null ? new ArrayList<>() : new ArrayList<>(select.getJoins());
            joins.addAll(parsed.getJoins());
            select.setJoins(joins);
        }

        private void markVisited(Expression expression) {
            walk(expression, visited::add, visited::add, nested -> { });
        }

        private static Expression parse(String expression) {
            try {
                return CCJSqlParserUtil.parseCondExpression(expression);
            } catch (JSQLParserException e) {
                throw new QueryParseException("Failed to parse expression", expression, e);
            }
        }
    }
}
