package com.strata.query.filter;

import com.strata.domain.TableConfig;
import com.strata.query.InvalidQueryException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitespace separated search terms:
 * <ul>
 *   <li>{@code key=value}, {@code key:value} and {@code key!=value}</li>
 *   <li>{@code key=/regex/} and {@code key!=/regex/}</li>
 *   <li>a leading {@code -} negates a term</li>
 *   <li>{@code OR} between two terms joins them, binding tighter than the implicit AND</li>
 *   <li>bare words search the body column</li>
 * </ul>
 * Values may be double quoted and may contain {@code %} wildcards.
 */
@Component
public class SimpleSearchQueryParser implements SearchQueryParser {

    private static final Pattern TERM = Pattern.compile("^([A-Za-z_@][\\w.@\\-]*?)(!=|=|:)(.+)$");

    @Override
    public List<FilterOperation> parse(String query, TableConfig config) {
        List<FilterOperation> terms = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return terms;
        }

        boolean pendingOr = false;
        for (String token : tokenize(query)) {
            if (token.equals("OR")) {
                pendingOr = !terms.isEmpty();
                continue;
            }
            if (token.equals("AND")) {
                continue;
            }

            FilterOperation term = parseTerm(token, config);
            if (pendingOr) {
                FilterOperation previous = terms.remove(terms.size() - 1);
                List<FilterOperation> children = new ArrayList<>();
                if (previous.getOperator() == FilterOperator.OR) {
                    children.addAll(previous.getFilters());
                } else {
                    children.add(previous);
                }
                children.add(term);
                term = FilterOperation.or(children);
                pendingOr = false;
            }
            terms.add(term);
        }
        return terms;
    }

    private FilterOperation parseTerm(String token, TableConfig config) {
        boolean negated = token.length() > 1 && token.startsWith("-");
        String text = negated ? token.substring(1) : token;

        FilterOperation term;
        Matcher matcher = TERM.matcher(text);
        if (matcher.matches()) {
            String key = matcher.group(1);
            boolean notEqual = matcher.group(2).equals("!=");
            String value = unquote(matcher.group(3));
            FilterOperator operator;
            if (value.length() > 2 && value.startsWith("/") && value.endsWith("/")) {
                value = value.substring(1, value.length() - 1);
                operator = notEqual ? FilterOperator.NOT_REGEXP : FilterOperator.REGEXP;
            } else {
                operator = notEqual ? FilterOperator.NOT_EQUAL : FilterOperator.EQUAL;
            }
            term = FilterOperation.compare(key, operator, value);
        } else {
            String bodyColumn = config.getBodyColumn();
            if (bodyColumn == null || bodyColumn.isEmpty()) {
                throw new InvalidQueryException("Free text search is not supported for " + config.getResource());
            }
            term = FilterOperation.compare(bodyColumn, FilterOperator.EQUAL, unquote(text));
        }
        return negated ? FilterOperation.not(term) : term;
    }

    private static List<String> tokenize(String query) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : query.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (Character.isWhitespace(c) && !quoted) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new InvalidQueryException("Unterminated quote in search query: " + query);
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
