package com.strata.domain;

public enum KeyType {
    STRING("String"),
    NUMERIC("Numeric"),
    BOOLEAN("Boolean");

    private final String value;

    KeyType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static KeyType fromValue(String value) {
        for (KeyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return STRING;
    }
}
