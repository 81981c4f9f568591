package com.yuzhi.sqlguard.platform.service.sql;

import java.util.Locale;
import java.util.Set;

/**
 * One lexical token. {@code start}/{@code end} are character offsets into the source text;
 * {@code depth} is the number of enclosing parentheses (a paren token carries the depth outside it).
 */
public record SqlToken(SqlTokenType type, String text, int start, int end, int depth) {

    public boolean is(SqlTokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == SqlTokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    /** @param keywords upper-case keywords */
    public boolean isAnyKeyword(Set<String> keywords) {
        return type == SqlTokenType.WORD && keywords.contains(upperText());
    }

    public boolean isIdentifier() {
        return type == SqlTokenType.WORD || type == SqlTokenType.QUOTED_IDENTIFIER;
    }

    public String upperText() {
        return text.toUpperCase(Locale.ROOT);
    }
}
