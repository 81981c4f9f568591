package com.yuzhi.sqlguard.platform.service.sql;

import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Statement-level helpers shared by the gate and the query service.
 */
public final class SqlStatements {

    private static final SqlTokenizer TOKENIZER = new SqlTokenizer();

    private static final Set<String> WRITE_KEYWORDS = Set.of("INSERT", "UPDATE", "DELETE", "MERGE");

    private SqlStatements() {}

    /**
     * Removes trailing semicolons and whitespace. Leading text is never touched so character offsets computed
     * on the result are valid offsets into the original statement.
     */
    public static String stripTrailingSemicolons(String sql) {
        if (sql == null) {
            return null;
        }
        String s = sql.stripTrailing();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).stripTrailing();
        }
        return s;
    }

    /**
     * True when a semicolon separates two statements. Trailing semicolons should be stripped first; a semicolon
     * inside a literal or comment does not count. Text that cannot be tokenized yields {@code false}, the parser
     * refuses it later.
     */
    public static boolean hasMultipleStatements(String sql) {
        if (StringUtils.isBlank(sql)) {
            return false;
        }
        try {
            return TOKENIZER.tokenize(sql).stream().anyMatch(token -> token.is(SqlTokenType.SEMICOLON));
        } catch (UnparsableStatementException ex) {
            return false;
        }
    }

    /**
     * True for read-only queries: a leading {@code SELECT}, a parenthesized query, or a {@code WITH} prefix whose
     * CTE bodies and main statement are queries. Text that cannot be tokenized counts as a query, so the parser
     * refuses it later.
     */
    public static boolean isSelect(String sql) {
        if (StringUtils.isBlank(sql)) {
            return false;
        }
        List<SqlToken> tokens;
        try {
            tokens = TOKENIZER.tokenize(sql);
        } catch (UnparsableStatementException ex) {
            return true;
        }
        if (tokens.isEmpty()) {
            return false;
        }
        SqlToken first = tokens.get(0);
        if (first.is(SqlTokenType.LEFT_PAREN) || first.isKeyword("SELECT")) {
            return true;
        }
        if (!first.isKeyword("WITH")) {
            return false;
        }
        for (int i = 1; i < tokens.size(); i++) {
            // data-modifying CTE body: WITH d AS (DELETE ... RETURNING *) SELECT ...
            SqlToken token = tokens.get(i);
            if (token.depth() == 1 && tokens.get(i - 1).is(SqlTokenType.LEFT_PAREN) && token.isAnyKeyword(WRITE_KEYWORDS)) {
                return false;
            }
        }
        // main statement follows the last CTE body: first keyword at depth 0 after a closing paren
        for (int i = 1; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.depth() != 0 || !tokens.get(i - 1).is(SqlTokenType.RIGHT_PAREN)) {
                continue;
            }
            if (token.is(SqlTokenType.COMMA) || token.isKeyword("AS")) {
                continue;
            }
            if (token.is(SqlTokenType.LEFT_PAREN)) {
                return true;
            }
            if (token.is(SqlTokenType.WORD)) {
                return token.isKeyword("SELECT");
            }
        }
        return false;
    }
}
