package com.strata.query.filter;

import com.strata.domain.TableConfig;
import com.strata.query.InvalidFilterException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Re-evaluates a filter tree against an already decoded row.
 *
 * Used to check optimistically fetched rows, so it errs toward matching: an
 * uncompilable regex imposes no constraint, and a filter on a field the row
 * cannot resolve counts as a match unless it sits directly under an OR.
 *
 * @param <T> decoded row type
 */
public class FilterMatcher<T> {

    // Store token boundaries: anything but word characters, ':' and '*'
    private static final Pattern NON_TOKEN_CHARS = Pattern.compile("[^\\w:*]");

    // Filter keys may arrive wrapped as toString(Column)
    private static final Pattern KEY_WRAPPER = Pattern.compile("toString\\((\\w+)\\)");

    private final FieldRegistry<T> fields;

    public FilterMatcher(FieldRegistry<T> fields) {
        this.fields = fields;
    }

    /**
     * Top level filters are implicitly ANDed.
     */
    public boolean matches(T row, TableConfig config, List<FilterOperation> filters) {
        return matchesQuery(row, config, filters, FilterOperator.AND);
    }

    public boolean matches(T row, TableConfig config, FilterOperation filter) {
        return matchesQuery(row, config, List.of(filter), FilterOperator.AND);
    }

    private boolean matchesQuery(T row, TableConfig config, List<FilterOperation> filters, FilterOperator parent) {
        for (FilterOperation filter : filters) {
            switch (filter.getOperator()) {
                case AND:
                    for (FilterOperation child : filter.getFilters()) {
                        if (!matchesQuery(row, config, List.of(child), FilterOperator.AND)) {
                            return false;
                        }
                    }
                    break;
                case OR:
                    boolean anyMatch = false;
                    for (FilterOperation child : filter.getFilters()) {
                        if (matchesQuery(row, config, List.of(child), FilterOperator.OR)) {
                            anyMatch = true;
                            break;
                        }
                    }
                    if (!anyMatch) {
                        return false;
                    }
                    break;
                case NOT:
                    if (matchesQuery(row, config, List.of(filter.getFilters().get(0)), FilterOperator.NOT)) {
                        return false;
                    }
                    break;
                default:
                    boolean matches;
                    try {
                        matches = matchFilter(row, config, filter);
                    } catch (InvalidFilterException e) {
                        matches = parent != FilterOperator.OR;
                    }
                    if (!matches) {
                        return false;
                    }
            }
        }
        return true;
    }

    /**
     * Evaluates one comparison leaf.
     *
     * @throws InvalidFilterException if the key resolves to nothing on the row
     */
    boolean matchFilter(T row, TableConfig config, FilterOperation filter) {
        String key = filter.getKey();
        Matcher wrapped = KEY_WRAPPER.matcher(key);
        if (wrapped.find()) {
            key = wrapped.group(1);
        }

        String bodyColumn = config.getBodyColumn();
        boolean bodyFilter = bodyColumn != null && !bodyColumn.isEmpty()
            && filter.getColumn() == null && key.equals(bodyColumn);
        if (bodyFilter) {
            return matchBody(fields.direct(row, bodyColumn).orElse(""), filter);
        }

        String rowValue = resolve(row, config, key);
        for (String value : filter.getValues()) {
            if (filter.getOperator() == FilterOperator.REGEXP || filter.getOperator() == FilterOperator.NOT_REGEXP) {
                Pattern pattern = compileOrNull(value);
                if (pattern != null) {
                    boolean found = pattern.matcher(rowValue).find();
                    boolean shouldMatch = filter.getOperator() == FilterOperator.REGEXP;
                    if (shouldMatch != found) {
                        return false;
                    }
                }
            } else if (filter.getOperator() == FilterOperator.NOT_EQUAL) {
                String unnegated = value.startsWith("-") ? value.substring(1) : value;
                boolean equal = unnegated.contains("%")
                    ? wildcard(unnegated).matcher(rowValue).find()
                    : rowValue.equals(unnegated);
                if (equal) {
                    return false;
                }
            } else if (value.contains("%")) {
                if (!wildcard(value).matcher(rowValue).find()) {
                    return false;
                }
            } else if (!value.equals(rowValue)) {
                return false;
            }
        }
        return true;
    }

    private boolean matchBody(String body, FilterOperation filter) {
        Set<String> terms = new HashSet<>();
        for (String term : NON_TOKEN_CHARS.split(body)) {
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        for (String value : filter.getValues()) {
            if (filter.getOperator() == FilterOperator.REGEXP || filter.getOperator() == FilterOperator.NOT_REGEXP) {
                Pattern pattern = compileOrNull(value);
                if (pattern != null) {
                    boolean found = pattern.matcher(body).find();
                    boolean shouldMatch = filter.getOperator() == FilterOperator.REGEXP;
                    if (shouldMatch != found) {
                        return false;
                    }
                }
            } else if (value.contains("%")) {
                if (!wildcard(value).matcher(body).find()) {
                    return false;
                }
            } else if (!terms.contains(value)) {
                return false;
            }
        }
        return true;
    }

    private String resolve(T row, TableConfig config, String key) {
        String column = config.getKeysToColumns().get(key);
        if (column != null) {
            Optional<String> nested = fields.child(row, column);
            if (nested.isPresent()) {
                return nested.get();
            }
            return fields.direct(row, column).orElse("");
        }
        Optional<String> direct = fields.direct(row, key);
        if (direct.isPresent()) {
            return direct.get();
        }
        Optional<String> child = fields.child(row, key);
        if (child.isPresent()) {
            return child.get();
        }
        if (!config.getAttributesColumns().isEmpty() && fields.hasAttributes()) {
            return fields.attribute(row, key);
        }
        throw new InvalidFilterException("invalid filter " + key);
    }

    /**
     * {@code %} stands for one or more characters; everything else is literal.
     */
    static Pattern wildcard(String value) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int idx;
        while ((idx = value.indexOf('%', start)) >= 0) {
            if (idx > start) {
                regex.append(Pattern.quote(value.substring(start, idx)));
            }
            regex.append(".+");
            start = idx + 1;
        }
        if (start < value.length()) {
            regex.append(Pattern.quote(value.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }

    private static Pattern compileOrNull(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            return null;
        }
    }
}
