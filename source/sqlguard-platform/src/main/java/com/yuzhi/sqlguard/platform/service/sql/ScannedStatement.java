package com.yuzhi.sqlguard.platform.service.sql;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Result of a clause-boundary scan: the token stream plus the query blocks found in it.
 */
public final class ScannedStatement {

    private final String sql;
    private final List<SqlToken> tokens;
    private final int baseDepth;
    private final List<QueryBlock> blocks;
    private final Set<String> cteNames;
    private final boolean opaqueBranch;

    ScannedStatement(
        String sql,
        List<SqlToken> tokens,
        int baseDepth,
        List<QueryBlock> blocks,
        Set<String> cteNames,
        boolean opaqueBranch
    ) {
        this.sql = sql;
        this.tokens = List.copyOf(tokens);
        this.baseDepth = baseDepth;
        this.blocks = List.copyOf(blocks);
        this.cteNames = Set.copyOf(cteNames);
        this.opaqueBranch = opaqueBranch;
    }

    public String sql() {
        return sql;
    }

    public List<SqlToken> tokens() {
        return tokens;
    }

    public SqlToken token(int index) {
        return tokens.get(index);
    }

    /** Parenthesis depth of the outermost query; greater than zero when the whole statement is wrapped in parentheses. */
    public int baseDepth() {
        return baseDepth;
    }

    public List<QueryBlock> blocks() {
        return blocks;
    }

    /** Normalized names declared in a leading {@code WITH} clause. */
    public Set<String> cteNames() {
        return cteNames;
    }

    /**
     * True when part of the statement could not be scanned: a parenthesized set-operation branch, a {@code WITH}
     * inside a subquery, or a CTE body that is not a SELECT.
     */
    public boolean hasOpaqueBranch() {
        return opaqueBranch;
    }

    /** True when a SELECT below the outermost query starts no scanned block, i.e. sits inside a derived table. */
    public boolean containsNestedSelect() {
        Set<Integer> blockStarts = new HashSet<>();
        for (QueryBlock block : blocks) {
            blockStarts.add(block.selectIndex());
        }
        for (int i = 0; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.depth() > baseDepth && token.isKeyword("SELECT") && !blockStarts.contains(i)) {
                return true;
            }
        }
        return false;
    }

    /** Lower-cased names of the named bind parameters already present, without the leading colon. */
    public Set<String> parameterNames() {
        Set<String> names = new LinkedHashSet<>();
        for (SqlToken token : tokens) {
            if (token.is(SqlTokenType.PARAMETER) && token.text().startsWith(":")) {
                names.add(token.text().substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    /** Innermost block whose text covers {@code offset}. */
    public Optional<QueryBlock> blockAt(int offset) {
        QueryBlock found = null;
        for (QueryBlock block : blocks) {
            int start = tokens.get(block.selectIndex()).start();
            int end = tokens.get(block.endIndex() - 1).end();
            if (offset >= start && offset < end && (found == null || block.selectIndex() > found.selectIndex())) {
                found = block;
            }
        }
        return Optional.ofNullable(found);
    }

    /** Index of the matching closing parenthesis for the opening parenthesis at {@code openIndex}. */
    public int closingParen(int openIndex) {
        int depth = tokens.get(openIndex).depth();
        for (int i = openIndex + 1; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.is(SqlTokenType.RIGHT_PAREN) && token.depth() == depth) {
                return i;
            }
        }
        throw new UnparsableStatementException(UnparsableStatementException.Reason.MALFORMED, "Malformed SQL: unbalanced parentheses");
    }
}
