package com.strata.storage;

/**
 * Name and declared type of one result column
 */
public class ResultColumn {
    private final String name;
    private final String typeName;

    public ResultColumn(String name, String typeName) {
        this.name = name;
        this.typeName = typeName;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return name + " " + typeName;
    }
}
