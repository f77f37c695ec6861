package com.strata.query.filter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Explicit per-row-type field accessors used for in-memory filter evaluation.
 *
 * @param <T> decoded row type
 */
public class FieldRegistry<T> {
    private final Map<String, Function<T, ?>> fields = new LinkedHashMap<>();
    private Function<T, Map<String, String>> attributeMap;
    private Function<T, List<TypedAttribute>> attributeList;

    public FieldRegistry<T> field(String name, Function<T, ?> getter) {
        fields.put(name, getter);
        return this;
    }

    public FieldRegistry<T> attributeMap(Function<T, Map<String, String>> getter) {
        this.attributeMap = getter;
        return this;
    }

    public FieldRegistry<T> attributeList(Function<T, List<TypedAttribute>> getter) {
        this.attributeList = getter;
        return this;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * Resolves a field by exact name, without dotted traversal, rendered with
     * {@link #repr(Object)}.
     */
    public Optional<String> direct(T row, String name) {
        Function<T, ?> getter = fields.get(name);
        if (getter == null) {
            return Optional.empty();
        }
        return Optional.of(repr(getter.apply(row)));
    }

    /**
     * Resolves a dotted path: the first segment names a registered field, the
     * rest walk {@link NestedFields} or map values, unwrapping optionals.
     */
    public Optional<String> child(T row, String path) {
        String[] parts = path.split("\\.");
        Function<T, ?> getter = fields.get(parts[0]);
        if (getter == null) {
            return Optional.empty();
        }
        Object value = unwrap(getter.apply(row));
        for (int i = 1; i < parts.length; i++) {
            if (value instanceof NestedFields) {
                Optional<Object> next = ((NestedFields) value).field(parts[i]);
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                value = unwrap(next.get());
            } else if (value instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) value;
                if (!map.containsKey(parts[i])) {
                    return Optional.empty();
                }
                value = unwrap(map.get(parts[i]));
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(repr(value));
    }

    public boolean hasAttributes() {
        return attributeMap != null || attributeList != null;
    }

    /**
     * Looks {@code key} up in the attribute map, or in the attribute list by
     * splitting it into {@code type_name}. Missing keys read as empty.
     */
    public String attribute(T row, String key) {
        if (attributeMap != null) {
            Map<String, String> attributes = attributeMap.apply(row);
            String value = attributes == null ? null : attributes.get(key);
            return value == null ? "" : value;
        }
        if (attributeList != null) {
            String[] parts = key.split("_", 2);
            List<TypedAttribute> attributes = attributeList.apply(row);
            if (parts.length == 2 && attributes != null) {
                for (TypedAttribute attribute : attributes) {
                    if (parts[0].equals(attribute.getType()) && parts[1].equals(attribute.getName())) {
                        return attribute.getValue() == null ? "" : attribute.getValue();
                    }
                }
            }
        }
        return "";
    }

    private static Object unwrap(Object value) {
        Object current = value;
        while (current instanceof Optional) {
            current = ((Optional<?>) current).orElse(null);
        }
        return current;
    }

    /**
     * String form used for comparisons: empty for null, plain decimal for
     * numbers without trailing zeros.
     */
    public static String repr(Object value) {
        Object unwrapped = unwrap(value);
        if (unwrapped == null) {
            return "";
        }
        if (unwrapped instanceof Double || unwrapped instanceof Float) {
            double d = ((Number) unwrapped).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return new BigDecimal(String.valueOf(d)).stripTrailingZeros().toPlainString();
        }
        if (unwrapped instanceof BigDecimal) {
            return ((BigDecimal) unwrapped).stripTrailingZeros().toPlainString();
        }
        if (unwrapped instanceof Enum) {
            return ((Enum<?>) unwrapped).name();
        }
        return unwrapped.toString();
    }
}
