package com.strata.domain;

public class ValueSuggestion {
    private final String value;
    private final long count;
    private final long rank;

    public ValueSuggestion(String value, long count, long rank) {
        this.value = value;
        this.count = count;
        this.rank = rank;
    }

    public String getValue() {
        return value;
    }

    public long getCount() {
        return count;
    }

    public long getRank() {
        return rank;
    }
}
