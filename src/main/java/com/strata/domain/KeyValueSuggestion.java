package com.strata.domain;

import java.util.List;

/**
 * Most frequent values for one key
 */
public class KeyValueSuggestion {
    private final String key;
    private final List<ValueSuggestion> values;

    public KeyValueSuggestion(String key, List<ValueSuggestion> values) {
        this.key = key;
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    public String getKey() {
        return key;
    }

    public List<ValueSuggestion> getValues() {
        return values;
    }
}
