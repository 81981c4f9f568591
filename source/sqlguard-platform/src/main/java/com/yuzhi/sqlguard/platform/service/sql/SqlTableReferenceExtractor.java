package com.yuzhi.sqlguard.platform.service.sql;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException.Reason;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lists the tables a statement reads through the FROM/JOIN clauses of its query blocks, in block order.
 * <p>
 * Tables inside CTE bodies and inside subqueries outside a FROM clause are reported with the block they belong to.
 * Derived tables ({@code FROM (SELECT ...) x}) and table functions are opaque: their alias is consumed but
 * nothing inside them is reported. Parenthesized join trees are walked. CTE names and {@code DUAL} are not tables.
 */
public class SqlTableReferenceExtractor {

    private static final Set<String> PSEUDO_TABLES = Set.of("DUAL");

    private static final Set<String> SUBQUERY_STARTS = Set.of("SELECT", "WITH", "VALUES");

    private static final Set<String> TABLE_PREFIXES = Set.of("LATERAL", "ONLY");

    private static final Set<String> NOT_AN_ALIAS = Set.of(
        "AND",
        "APPLY",
        "AS",
        "CONNECT",
        "CROSS",
        "EXCEPT",
        "FETCH",
        "FOR",
        "FROM",
        "FULL",
        "GROUP",
        "HAVING",
        "INNER",
        "INTERSECT",
        "JOIN",
        "LATERAL",
        "LEFT",
        "LIMIT",
        "MINUS",
        "MODEL",
        "NATURAL",
        "NOT",
        "OFFSET",
        "ON",
        "OR",
        "ORDER",
        "OUTER",
        "PARTITION",
        "PIVOT",
        "QUALIFY",
        "RIGHT",
        "SAMPLE",
        "SELECT",
        "START",
        "STRAIGHT_JOIN",
        "TABLESAMPLE",
        "UNION",
        "UNPIVOT",
        "USING",
        "WHERE",
        "WINDOW",
        "WITH"
    );

    private final QueryBlockScanner scanner;

    public SqlTableReferenceExtractor(QueryBlockScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * @throws UnparsableStatementException with {@link Reason#NO_FROM_CLAUSE} when no query block reads a table,
     *     or {@link Reason#MALFORMED} when the text cannot be tokenized
     * @throws InjectionPointNotFoundException when tables are read from places no filter could reach
     */
    public List<TableReference> extractTables(String sql) {
        return extractTables(scanner.scan(sql));
    }

    public List<TableReference> extractTables(ScannedStatement statement) {
        if (statement.hasOpaqueBranch()) {
            throw new InjectionPointNotFoundException("part of the statement cannot be scanned");
        }
        List<TableReference> refs = new ArrayList<>();
        boolean anyFrom = false;
        for (QueryBlock block : statement.blocks()) {
            if (!block.hasFrom()) {
                continue;
            }
            anyFrom = true;
            int end = block.hasWhere() ? block.whereIndex() : block.regionEnd();
            parseFromItems(statement, block.fromIndex() + 1, end, block.depth(), refs);
        }
        if (!anyFrom) {
            if (statement.containsNestedSelect()) {
                throw new InjectionPointNotFoundException("derived table without an outer FROM clause");
            }
            throw new UnparsableStatementException(Reason.NO_FROM_CLAUSE, "Statement has no FROM clause");
        }
        return refs;
    }

    private void parseFromItems(ScannedStatement statement, int start, int end, int depth, List<TableReference> refs) {
        boolean expectTable = true;
        int i = start;
        while (i < end) {
            SqlToken token = statement.token(i);
            if (token.depth() != depth) {
                i++;
                continue;
            }
            if (!expectTable) {
                if (token.is(SqlTokenType.COMMA) || token.isKeyword("JOIN") || token.isKeyword("APPLY")) {
                    expectTable = true;
                }
                // everything else (join modifiers, ON/USING conditions, hints) is skipped
                i++;
                continue;
            }
            if (token.isAnyKeyword(TABLE_PREFIXES)) {
                i++;
                continue;
            }
            if (token.is(SqlTokenType.LEFT_PAREN)) {
                int close = statement.closingParen(i);
                if (close == i + 1) {
                    throw new InjectionPointNotFoundException("empty parentheses in FROM clause");
                }
                if (!startsSubquery(statement, i + 1)) {
                    parseFromItems(statement, i + 1, close, depth + 1, refs);
                }
                i = skipAlias(statement, close + 1, end);
                expectTable = false;
                continue;
            }
            if (!token.isIdentifier()) {
                throw new InjectionPointNotFoundException("unexpected '" + token.text() + "' in FROM clause");
            }
            List<String> parts = new ArrayList<>();
            parts.add(token.text());
            int j = i + 1;
            while (
                j + 1 < end &&
                statement.token(j).is(SqlTokenType.DOT) &&
                statement.token(j + 1).isIdentifier()
            ) {
                parts.add(statement.token(j + 1).text());
                j += 2;
            }
            if (j < end && statement.token(j).is(SqlTokenType.LEFT_PAREN)) {
                // table function: TABLE(...), UNNEST(...), generate_series(...)
                i = skipAlias(statement, statement.closingParen(j) + 1, end);
                expectTable = false;
                continue;
            }
            String name = parts.get(parts.size() - 1);
            String schema = parts.size() > 1 ? parts.get(parts.size() - 2) : null;
            String alias = null;
            if (j < end && statement.token(j).isKeyword("AS") && j + 1 < end && statement.token(j + 1).isIdentifier()) {
                alias = statement.token(j + 1).text();
                j += 2;
            } else if (j < end && isAlias(statement.token(j))) {
                alias = statement.token(j).text();
                j++;
            }
            if (!isVirtual(statement, schema, name)) {
                refs.add(new TableReference(schema, name, alias, token.start()));
            }
            i = j;
            expectTable = false;
        }
        if (expectTable && i > start) {
            throw new InjectionPointNotFoundException("dangling join or comma in FROM clause");
        }
    }

    private boolean startsSubquery(ScannedStatement statement, int index) {
        int i = index;
        while (statement.token(i).is(SqlTokenType.LEFT_PAREN)) {
            i++;
        }
        return statement.token(i).isAnyKeyword(SUBQUERY_STARTS);
    }

    private int skipAlias(ScannedStatement statement, int index, int end) {
        int i = index;
        if (i < end && statement.token(i).isKeyword("AS")) {
            i++;
        }
        if (i < end && isAlias(statement.token(i))) {
            i++;
            if (i < end && statement.token(i).is(SqlTokenType.LEFT_PAREN)) {
                i = statement.closingParen(i) + 1;
            }
        }
        return i;
    }

    private boolean isAlias(SqlToken token) {
        if (token.is(SqlTokenType.QUOTED_IDENTIFIER)) {
            return true;
        }
        return token.is(SqlTokenType.WORD) && !token.isAnyKeyword(NOT_AN_ALIAS);
    }

    private boolean isVirtual(ScannedStatement statement, String schema, String name) {
        if (schema != null) {
            return false;
        }
        String normalized = SqlIdentifiers.normalize(name);
        return PSEUDO_TABLES.contains(normalized) || statement.cteNames().contains(normalized);
    }
}
