package com.strata.query;

import com.strata.domain.TableConfig;

/**
 * Maps logical field names to physical columns or attribute lookups.
 *
 * Known fields resolve to their column. Anything else is read from the
 * attribute column chosen by key prefix: {@code Attrs[key]} for inline maps,
 * or, when the configuration keeps attributes in a separate table joined in as
 * an array of {@code (key, value)} tuples, the first value whose key matches.
 * An optional transform function name wraps the looked up value.
 */
public final class AttributeResolver {

    private AttributeResolver() {
    }

    /**
     * @return the physical column, or null when {@code field} is not a known field
     */
    public static String column(TableConfig config, String field) {
        return config.getKeysToColumns().get(field);
    }

    public static boolean isKnownColumn(TableConfig config, String name) {
        return config.getKeysToColumns().containsValue(name);
    }

    /**
     * Attribute lookup with the key bound as a query argument.
     */
    public static String attribute(SelectBuilder sb, TableConfig config, String key, String transform) {
        return attributeExpression(config, key, sb.var(key), transform);
    }

    /**
     * Attribute lookup with the key inlined as a string literal, for rewritten
     * SQL that carries no bound arguments.
     */
    public static String attributeLiteral(TableConfig config, String key, String transform) {
        return attributeExpression(config, key, quote(key), transform);
    }

    /**
     * Known column (wrapped in {@code transform} when given) or attribute lookup.
     */
    public static String resolve(SelectBuilder sb, TableConfig config, String field, String transform) {
        String col = column(config, field);
        if (col != null) {
            return wrap(transform, col);
        }
        return attribute(sb, config, field, transform);
    }

    public static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String attributeExpression(TableConfig config, String key, String keyExpr, String transform) {
        String attributesColumn = config.getAttributesColumn(key);
        if (config.hasAttributesTable()) {
            return String.format("(arrayMap((k, v) -> %s, arrayFilter((k, v) -> k = %s, %s)))[1]",
                wrap(transform, "v"), keyExpr, attributesColumn);
        }
        return wrap(transform, attributesColumn + "[" + keyExpr + "]");
    }

    private static String wrap(String transform, String expr) {
        if (transform == null || transform.isEmpty()) {
            return expr;
        }
        return transform + "(" + expr + ")";
    }
}
