package com.strata.query.rewrite;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers over raw SQL text that ignore string literals, quoted
 * identifiers and comments
 */
final class SqlText {

    private SqlText() {
    }

    /**
     * Returns {@code sql} with the contents of literals, quoted identifiers and
     * comments replaced by spaces. Offsets are preserved.
     */
    static String mask(String sql) {
        char[] out = sql.toCharArray();
        int i = 0;
        while (i < out.length) {
            char c = out[i];
            if (c == '\'' || c == '"' || c == '`') {
                int end = closingQuote(sql, i, c);
                blank(out, i + 1, end);
                i = end + 1;
            } else if (c == '-' && i + 1 < out.length && out[i + 1] == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? out.length : end;
                blank(out, i, end);
                i = end;
            } else if (c == '/' && i + 1 < out.length && out[i + 1] == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? out.length : end + 2;
                blank(out, i, end);
                i = end;
            } else {
                i++;
            }
        }
        return new String(out);
    }

    static boolean containsOutsideQuotes(String sql, Pattern pattern) {
        return pattern.matcher(mask(sql)).find();
    }

    /**
     * Replaces matches of {@code pattern} that lie outside literals and comments.
     */
    static String replaceOutsideQuotes(String sql, Pattern pattern, String replacement) {
        Matcher matcher = pattern.matcher(mask(sql));
        StringBuilder result = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            result.append(sql, last, matcher.start()).append(replacement);
            last = matcher.end();
        }
        return result.append(sql.substring(last)).toString();
    }

    // Index of the closing quote, honouring backslash escapes and doubled quotes
    private static int closingQuote(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return sql.length() - 1;
    }

    private static void blank(char[] chars, int from, int to) {
        for (int i = Math.max(from, 0); i < Math.min(to, chars.length); i++) {
            if (chars[i] != '\n') {
                chars[i] = ' ';
            }
        }
    }
}
