package com.strata.query.keys;

import com.strata.domain.KeyType;
import com.strata.domain.QueryKey;
import com.strata.domain.TableConfig;
import com.strata.storage.TableConfigRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reserved keys of every resource table. They are always offered as
 * suggestions even when the key tables hold no usage for them.
 */
@Component
public class DefaultKeys {

    private final List<QueryKey> keys;

    public DefaultKeys(TableConfigRegistry registry) {
        Set<String> names = new LinkedHashSet<>();
        for (TableConfig config : registry.all()) {
            names.addAll(config.getKeysToColumns().keySet());
        }
        List<QueryKey> reserved = new ArrayList<>();
        for (String name : names) {
            reserved.add(new QueryKey(name, KeyType.STRING));
        }
        this.keys = List.copyOf(reserved);
    }

    public List<QueryKey> all() {
        return keys;
    }

    /**
     * Reserved keys whose name contains {@code query}, ignoring case. A null
     * query matches every key.
     */
    public List<QueryKey> matching(String query) {
        if (query == null) {
            return keys;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<QueryKey> matches = new ArrayList<>();
        for (QueryKey key : keys) {
            if (key.getName().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(key);
            }
        }
        return matches;
    }
}
