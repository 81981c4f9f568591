package com.yuzhi.sqlguard.platform.service.sql;

import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException.Reason;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into tokens while honouring string literals, quoted identifiers and comments, so that
 * keywords hidden inside {@code 'FROM x'} or {@code "WHERE"} are never mistaken for clause boundaries.
 * Comments and whitespace are dropped.
 */
public final class SqlTokenizer {

    public List<SqlToken> tokenize(String sql) {
        List<SqlToken> tokens = new ArrayList<>();
        if (sql == null) {
            return tokens;
        }
        int n = sql.length();
        int depth = 0;
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && next == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol + 1;
            } else if (c == '/' && next == '*') {
                int close = sql.indexOf("*/", i + 2);
                if (close < 0) {
                    throw malformed("unterminated block comment", i);
                }
                i = close + 2;
            } else if (c == '\'') {
                int end = scanQuoted(sql, i, '\'');
                tokens.add(new SqlToken(SqlTokenType.STRING, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (isAlternativeQuoteStart(sql, i)) {
                int end = scanAlternativeQuote(sql, i);
                tokens.add(new SqlToken(SqlTokenType.STRING, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (isPrefixedStringStart(c, next)) {
                int end = scanQuoted(sql, i + 1, '\'');
                tokens.add(new SqlToken(SqlTokenType.STRING, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (c == '"' || c == '`') {
                int end = scanQuoted(sql, i, c);
                tokens.add(new SqlToken(SqlTokenType.QUOTED_IDENTIFIER, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (c == '[') {
                int close = sql.indexOf(']', i + 1);
                if (close < 0) {
                    throw malformed("unterminated bracket identifier", i);
                }
                tokens.add(new SqlToken(SqlTokenType.QUOTED_IDENTIFIER, sql.substring(i, close + 1), i, close + 1, depth));
                i = close + 1;
            } else if (c == '(') {
                tokens.add(new SqlToken(SqlTokenType.LEFT_PAREN, "(", i, i + 1, depth));
                depth++;
                i++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw malformed("unbalanced closing parenthesis", i);
                }
                tokens.add(new SqlToken(SqlTokenType.RIGHT_PAREN, ")", i, i + 1, depth));
                i++;
            } else if (c == ',') {
                tokens.add(new SqlToken(SqlTokenType.COMMA, ",", i, i + 1, depth));
                i++;
            } else if (c == ';') {
                tokens.add(new SqlToken(SqlTokenType.SEMICOLON, ";", i, i + 1, depth));
                i++;
            } else if (c == '.' && Character.isDigit(next) && !followsOperand(tokens)) {
                int end = scanNumber(sql, i);
                tokens.add(new SqlToken(SqlTokenType.NUMBER, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (c == '.') {
                tokens.add(new SqlToken(SqlTokenType.DOT, ".", i, i + 1, depth));
                i++;
            } else if (c == ':' && next == ':') {
                tokens.add(new SqlToken(SqlTokenType.OPERATOR, "::", i, i + 2, depth));
                i += 2;
            } else if (c == ':' && (isWordStart(next) || Character.isDigit(next))) {
                int end = scanWord(sql, i + 1);
                tokens.add(new SqlToken(SqlTokenType.PARAMETER, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (c == '?') {
                tokens.add(new SqlToken(SqlTokenType.PARAMETER, "?", i, i + 1, depth));
                i++;
            } else if (Character.isDigit(c)) {
                int end = scanNumber(sql, i);
                tokens.add(new SqlToken(SqlTokenType.NUMBER, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (c == '$' && Character.isDigit(next)) {
                int end = scanNumber(sql, i + 1);
                tokens.add(new SqlToken(SqlTokenType.PARAMETER, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (c == '$' && dollarTagEnd(sql, i) > 0) {
                int end = scanDollarQuote(sql, i);
                tokens.add(new SqlToken(SqlTokenType.STRING, sql.substring(i, end), i, end, depth));
                i = end;
            } else if (isWordStart(c)) {
                int end = scanWord(sql, i);
                tokens.add(new SqlToken(SqlTokenType.WORD, sql.substring(i, end), i, end, depth));
                i = end;
            } else {
                tokens.add(new SqlToken(SqlTokenType.OPERATOR, String.valueOf(c), i, i + 1, depth));
                i++;
            }
        }
        if (depth != 0) {
            throw malformed("unbalanced parentheses", n);
        }
        return tokens;
    }

    private static int scanQuoted(String sql, int start, char quote) {
        int n = sql.length();
        int i = start + 1;
        while (i < n) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw malformed("unterminated quoted text", start);
    }

    // Oracle alternative quoting: q'[...]', nq'{...}' and friends
    private static boolean isAlternativeQuoteStart(String sql, int i) {
        int q = i;
        char c = sql.charAt(i);
        if ((c == 'n' || c == 'N') && i + 1 < sql.length()) {
            q = i + 1;
        }
        char qc = sql.charAt(q);
        if (qc != 'q' && qc != 'Q') {
            return false;
        }
        if (i > 0 && isWordPart(sql.charAt(i - 1))) {
            return false;
        }
        return q + 2 < sql.length() && sql.charAt(q + 1) == '\'';
    }

    private static int scanAlternativeQuote(String sql, int i) {
        int quote = sql.indexOf('\'', i);
        char open = sql.charAt(quote + 1);
        char close = switch (open) {
            case '[' -> ']';
            case '{' -> '}';
            case '(' -> ')';
            case '<' -> '>';
            default -> open;
        };
        int end = sql.indexOf(String.valueOf(close) + '\'', quote + 2);
        if (end < 0) {
            throw malformed("unterminated alternative quote", i);
        }
        return end + 2;
    }

    // PostgreSQL dollar quoting: $$...$$ and $tag$...$tag$
    private static int dollarTagEnd(String sql, int start) {
        int i = start + 1;
        if (i < sql.length() && isWordStart(sql.charAt(i))) {
            while (i < sql.length() && sql.charAt(i) != '$' && isWordPart(sql.charAt(i))) {
                i++;
            }
        }
        return i < sql.length() && sql.charAt(i) == '$' ? i + 1 : -1;
    }

    private static int scanDollarQuote(String sql, int start) {
        int bodyStart = dollarTagEnd(sql, start);
        String tag = sql.substring(start, bodyStart);
        int close = sql.indexOf(tag, bodyStart);
        if (close < 0) {
            throw malformed("unterminated dollar-quoted text", start);
        }
        return close + tag.length();
    }

    private static boolean isPrefixedStringStart(char c, char next) {
        if (next != '\'') {
            return false;
        }
        return switch (c) {
            case 'n', 'N', 'e', 'E', 'b', 'B', 'x', 'X' -> true;
            default -> false;
        };
    }

    private static int scanNumber(String sql, int start) {
        int n = sql.length();
        int i = start;
        while (i < n && (Character.isDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
            i++;
        }
        if (i < n && (sql.charAt(i) == 'e' || sql.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (sql.charAt(j) == '+' || sql.charAt(j) == '-')) {
                j++;
            }
            if (j < n && Character.isDigit(sql.charAt(j))) {
                i = j;
                while (i < n && Character.isDigit(sql.charAt(i))) {
                    i++;
                }
            }
        }
        return i;
    }

    private static int scanWord(String sql, int start) {
        int i = start;
        while (i < sql.length() && isWordPart(sql.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean followsOperand(List<SqlToken> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        SqlToken last = tokens.get(tokens.size() - 1);
        return last.isIdentifier() || last.is(SqlTokenType.RIGHT_PAREN);
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    private static UnparsableStatementException malformed(String what, int offset) {
        return new UnparsableStatementException(Reason.MALFORMED, "Malformed SQL: " + what + " at offset " + offset);
    }
}
