package com.yuzhi.sqlguard.platform.service.sql;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException.Reason;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Locates the query blocks of a statement and, inside each, the FROM and WHERE keywords and the first trailing
 * clause ({@code GROUP BY}, {@code HAVING}, {@code ORDER BY}, {@code LIMIT}, {@code FETCH}, ...).
 * <p>
 * Blocks are the top-level SELECTs (one per set-operation branch), the bodies of a leading {@code WITH} clause and
 * every parenthesized subquery that is not a derived table in a FROM clause, e.g. scalar subqueries in the select
 * list or {@code IN (SELECT ...)} conditions. Derived tables stay opaque and only show up through
 * {@link ScannedStatement#containsNestedSelect()}.
 */
public class QueryBlockScanner {

    private static final Set<String> SET_OPERATORS = Set.of("UNION", "INTERSECT", "EXCEPT", "MINUS");

    private static final Set<String> TRAILING_CLAUSES = Set.of(
        "GROUP",
        "HAVING",
        "ORDER",
        "LIMIT",
        "OFFSET",
        "FETCH",
        "FOR",
        "WINDOW",
        "QUALIFY",
        "CONNECT",
        "START"
    );

    private static final Set<String> DERIVED_TABLE_LEADS = Set.of("FROM", "JOIN", "LATERAL", "APPLY");

    private final SqlTokenizer tokenizer;

    public QueryBlockScanner(SqlTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * @throws UnparsableStatementException with {@link Reason#MALFORMED} when the text cannot be tokenized or holds
     *     more than one statement
     */
    public ScannedStatement scan(String sql) {
        List<SqlToken> tokens = tokenizer.tokenize(sql);
        int lo = 0;
        int hi = tokens.size();
        while (hi > lo && tokens.get(hi - 1).is(SqlTokenType.SEMICOLON)) {
            hi--;
        }
        for (int i = lo; i < hi; i++) {
            if (tokens.get(i).is(SqlTokenType.SEMICOLON)) {
                throw new UnparsableStatementException(Reason.MALFORMED, "Malformed SQL: more than one statement");
            }
        }
        int baseDepth = 0;
        // (SELECT ...) wrapped as a whole: descend into it
        while (hi - lo >= 2 && tokens.get(lo).is(SqlTokenType.LEFT_PAREN) && closing(tokens, lo) == hi - 1) {
            lo++;
            hi--;
            baseDepth++;
        }

        Scan scan = new Scan(tokens);
        int mainStart = lo;
        if (lo < hi && tokens.get(lo).isKeyword("WITH")) {
            mainStart = scanCtes(scan, lo + 1, hi, baseDepth);
        }
        if (mainStart < hi) {
            collectBlocks(scan, mainStart, hi, baseDepth);
        }
        return new ScannedStatement(sql, tokens, baseDepth, scan.blocks, scan.cteNames, scan.opaque);
    }

    /**
     * Walks {@code name [(columns)] AS [NOT] [MATERIALIZED] (body)} entries and scans each body.
     *
     * @return index of the first token of the main query
     */
    private int scanCtes(Scan scan, int lo, int hi, int depth) {
        List<SqlToken> tokens = scan.tokens;
        int i = lo;
        if (i < hi && tokens.get(i).isKeyword("RECURSIVE")) {
            i++;
        }
        while (true) {
            if (i >= hi || !tokens.get(i).isIdentifier()) {
                scan.opaque = true;
                return hi;
            }
            String name = SqlIdentifiers.normalize(tokens.get(i).text());
            i++;
            if (i < hi && tokens.get(i).is(SqlTokenType.LEFT_PAREN)) {
                i = closing(tokens, i) + 1;
            }
            if (i >= hi || !tokens.get(i).isKeyword("AS")) {
                scan.opaque = true;
                return hi;
            }
            i++;
            if (i < hi && tokens.get(i).isKeyword("NOT")) {
                i++;
            }
            if (i < hi && tokens.get(i).isKeyword("MATERIALIZED")) {
                i++;
            }
            if (i >= hi || !tokens.get(i).is(SqlTokenType.LEFT_PAREN)) {
                scan.opaque = true;
                return hi;
            }
            int close = closing(tokens, i);
            if (close < 0 || close >= hi) {
                scan.opaque = true;
                return hi;
            }
            scan.cteNames.add(name);
            scanQuery(scan, i + 1, close, depth + 1);
            i = close + 1;
            if (i < hi && tokens.get(i).is(SqlTokenType.COMMA)) {
                i++;
                continue;
            }
            return i;
        }
    }

    /** Scans a parenthesized query body; anything that does not start with a plain SELECT is opaque. */
    private void scanQuery(Scan scan, int lo, int hi, int depth) {
        if (lo >= hi) {
            scan.opaque = true;
            return;
        }
        SqlToken first = scan.tokens.get(lo);
        if (!first.isKeyword("SELECT") && !first.is(SqlTokenType.LEFT_PAREN)) {
            scan.opaque = true;
            return;
        }
        collectBlocks(scan, lo, hi, depth);
    }

    private void collectBlocks(Scan scan, int lo, int hi, int depth) {
        List<SqlToken> tokens = scan.tokens;
        boolean afterSetOperator = false;
        int blockStart = -1;
        for (int i = lo; i < hi; i++) {
            SqlToken token = tokens.get(i);
            if (token.depth() != depth) {
                continue;
            }
            if (blockStart < 0 && token.is(SqlTokenType.LEFT_PAREN) && (i == lo || afterSetOperator)) {
                scan.opaque = true;
            }
            if (token.isKeyword("SELECT") && blockStart < 0 && !afterDot(tokens, i)) {
                blockStart = i;
                afterSetOperator = false;
            } else if (token.isAnyKeyword(SET_OPERATORS)) {
                if (blockStart >= 0) {
                    addBlock(scan, buildBlock(tokens, blockStart, i, depth));
                    blockStart = -1;
                }
                afterSetOperator = true;
            } else if (afterSetOperator && !token.isKeyword("ALL") && !token.isKeyword("DISTINCT")) {
                afterSetOperator = false;
            }
        }
        if (blockStart >= 0) {
            addBlock(scan, buildBlock(tokens, blockStart, hi, depth));
        }
    }

    private void addBlock(Scan scan, QueryBlock block) {
        scan.blocks.add(block);
        List<SqlToken> tokens = scan.tokens;
        int i = block.selectIndex() + 1;
        while (i < block.endIndex()) {
            SqlToken token = tokens.get(i);
            if (!token.is(SqlTokenType.LEFT_PAREN) || i + 1 >= block.endIndex()) {
                i++;
                continue;
            }
            SqlToken next = tokens.get(i + 1);
            if (!next.isKeyword("SELECT") && !next.isKeyword("WITH")) {
                i++;
                continue;
            }
            int close = closing(tokens, i);
            if (close < 0) {
                throw new UnparsableStatementException(Reason.MALFORMED, "Malformed SQL: unbalanced parentheses");
            }
            if (!isDerivedTable(tokens, block, i)) {
                scanQuery(scan, i + 1, close, token.depth() + 1);
            }
            i = close + 1;
        }
    }

    /** A subquery in table position of the block's FROM clause, possibly wrapped in extra parentheses. */
    private boolean isDerivedTable(List<SqlToken> tokens, QueryBlock block, int openIndex) {
        if (!block.hasFrom() || openIndex < block.fromIndex() || openIndex >= block.regionEnd()) {
            return false;
        }
        if (block.hasWhere() && openIndex > block.whereIndex()) {
            return false;
        }
        int i = openIndex - 1;
        while (i > block.fromIndex() && tokens.get(i).is(SqlTokenType.LEFT_PAREN)) {
            i--;
        }
        SqlToken previous = tokens.get(i);
        return previous.isAnyKeyword(DERIVED_TABLE_LEADS) || previous.is(SqlTokenType.COMMA);
    }

    private QueryBlock buildBlock(List<SqlToken> tokens, int start, int end, int depth) {
        int from = -1;
        int where = -1;
        int regionEnd = end;
        for (int i = start + 1; i < end; i++) {
            SqlToken token = tokens.get(i);
            if (token.depth() != depth || afterDot(tokens, i)) {
                continue;
            }
            if (from < 0) {
                if (token.isKeyword("FROM")) {
                    from = i;
                }
                continue;
            }
            if (where < 0 && token.isKeyword("WHERE")) {
                where = i;
            } else if (isTrailingClause(tokens, i, end)) {
                regionEnd = i;
                break;
            }
        }
        return new QueryBlock(start, from, where, regionEnd, end, depth);
    }

    private boolean isTrailingClause(List<SqlToken> tokens, int i, int end) {
        SqlToken token = tokens.get(i);
        if (!token.isAnyKeyword(TRAILING_CLAUSES)) {
            return false;
        }
        SqlToken next = i + 1 < end ? tokens.get(i + 1) : null;
        return switch (token.upperText()) {
            case "GROUP", "ORDER", "CONNECT" -> next != null && next.isKeyword("BY");
            case "START" -> next != null && next.isKeyword("WITH");
            default -> true;
        };
    }

    private static boolean afterDot(List<SqlToken> tokens, int i) {
        return i > 0 && tokens.get(i - 1).is(SqlTokenType.DOT);
    }

    private static int closing(List<SqlToken> tokens, int openIndex) {
        int depth = tokens.get(openIndex).depth();
        for (int i = openIndex + 1; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.is(SqlTokenType.RIGHT_PAREN) && token.depth() == depth) {
                return i;
            }
        }
        return -1;
    }

    private static final class Scan {

        private final List<SqlToken> tokens;
        private final List<QueryBlock> blocks = new ArrayList<>();
        private final Set<String> cteNames = new LinkedHashSet<>();
        private boolean opaque;

        Scan(List<SqlToken> tokens) {
            this.tokens = tokens;
        }
    }
}
