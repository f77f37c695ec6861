package com.strata.query.filter;

/**
 * Entry of an attribute list, addressed in filters as {@code type_name}
 */
public class TypedAttribute {
    private final String type;
    private final String name;
    private final String value;

    public TypedAttribute(String type, String name, String value) {
        this.type = type;
        this.name = name;
        this.value = value;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }
}
