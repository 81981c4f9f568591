package com.yuzhi.sqlguard.common.sql;

import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers for SQL identifiers: canonical form for cache keys and catalog lookups,
 * and quoting for identifiers that end up in generated SQL text.
 */
public final class SqlIdentifiers {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$#]*");

    private SqlIdentifiers() {}

    /**
     * Canonical form of an identifier: surrounding quotes ({@code "x"}, {@code `x`}, {@code [x]}) removed,
     * then upper-cased. Returns {@code null} for blank input.
     */
    public static String normalize(String identifier) {
        String unquoted = unquote(identifier);
        if (unquoted == null) {
            return null;
        }
        return unquoted.toUpperCase(Locale.ROOT);
    }

    public static String unquote(String identifier) {
        if (StringUtils.isBlank(identifier)) {
            return null;
        }
        String trimmed = identifier.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if (first == '"' && last == '"') {
                return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
            }
            if (first == '`' && last == '`') {
                return trimmed.substring(1, trimmed.length() - 1).replace("``", "`");
            }
            if (first == '[' && last == ']') {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    public static boolean isSimple(String identifier) {
        return identifier != null && SIMPLE_IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Renders an identifier for generated SQL: simple names stay bare, anything else is double-quoted.
     */
    public static String render(String identifier) {
        if (isSimple(identifier)) {
            return identifier;
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Guards identifiers that must be spliced into metadata SQL (table and column names from configuration).
     *
     * @throws IllegalArgumentException when the value is not a simple identifier
     */
    public static String requireSimple(String identifier, String what) {
        if (!isSimple(identifier)) {
            throw new IllegalArgumentException("Invalid " + what + " identifier: " + identifier);
        }
        return identifier;
    }
}
