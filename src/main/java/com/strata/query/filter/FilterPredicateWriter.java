package com.strata.query.filter;

import com.strata.domain.TableConfig;
import com.strata.query.AttributeResolver;
import com.strata.query.SelectBuilder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a filter tree as WHERE predicates on a {@link SelectBuilder}
 */
@Component
public class FilterPredicateWriter {

    private static final Pattern KEY_WRAPPER = Pattern.compile("toString\\((\\w+)\\)");

    /**
     * Adds one WHERE predicate per top level filter.
     *
     * @return the attribute keys the predicates read, in first-use order
     */
    public List<String> write(SelectBuilder sb, TableConfig config, List<FilterOperation> filters) {
        List<String> attributeFields = new ArrayList<>();
        for (FilterOperation filter : filters) {
            sb.where(predicate(sb, config, filter, attributeFields));
        }
        return attributeFields;
    }

    private String predicate(SelectBuilder sb, TableConfig config, FilterOperation filter, List<String> fields) {
        switch (filter.getOperator()) {
            case AND:
            case OR: {
                List<String> children = new ArrayList<>();
                for (FilterOperation child : filter.getFilters()) {
                    children.add(predicate(sb, config, child, fields));
                }
                String joiner = filter.getOperator() == FilterOperator.AND ? " AND " : " OR ";
                return "(" + String.join(joiner, children) + ")";
            }
            case NOT:
                return "NOT (" + predicate(sb, config, filter.getFilters().get(0), fields) + ")";
            default:
                return comparison(sb, config, filter, fields);
        }
    }

    private String comparison(SelectBuilder sb, TableConfig config, FilterOperation filter, List<String> fields) {
        String key = filter.getKey();
        Matcher wrapped = KEY_WRAPPER.matcher(key);
        if (wrapped.matches()) {
            key = wrapped.group(1);
        }

        String bodyColumn = config.getBodyColumn();
        boolean bodyFilter = bodyColumn != null && filter.getColumn() == null && key.equals(bodyColumn);

        String column;
        if (filter.getColumn() != null) {
            column = filter.getColumn();
        } else if (bodyFilter) {
            column = bodyColumn;
        } else if (AttributeResolver.column(config, key) != null) {
            column = "toString(" + AttributeResolver.column(config, key) + ")";
        } else {
            column = AttributeResolver.attribute(sb, config, key, "");
            if (!fields.contains(key)) {
                fields.add(key);
            }
        }

        List<String> parts = new ArrayList<>();
        for (String value : filter.getValues()) {
            parts.add(valuePredicate(sb, column, filter.getOperator(), value, bodyFilter));
        }
        return parts.size() == 1 ? parts.get(0) : "(" + String.join(" AND ", parts) + ")";
    }

    private String valuePredicate(SelectBuilder sb, String column, FilterOperator operator, String value,
                                  boolean bodyFilter) {
        switch (operator) {
            case REGEXP:
                return "match(" + column + ", " + sb.var(value) + ")";
            case NOT_REGEXP:
                return "NOT match(" + column + ", " + sb.var(value) + ")";
            case NOT_EQUAL: {
                String unnegated = value.startsWith("-") ? value.substring(1) : value;
                if (unnegated.contains("%")) {
                    return column + " NOT ILIKE " + sb.var(unnegated);
                }
                return sb.notEqual(column, unnegated);
            }
            default:
                if (value.contains("%")) {
                    return column + " ILIKE " + sb.var(value);
                }
                if (bodyFilter) {
                    return "hasTokenCaseInsensitive(" + column + ", " + sb.var(value) + ")";
                }
                return sb.equal(column, value);
        }
    }
}
