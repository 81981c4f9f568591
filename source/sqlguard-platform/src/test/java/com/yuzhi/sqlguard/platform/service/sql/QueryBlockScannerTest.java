package com.yuzhi.sqlguard.platform.service.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QueryBlockScannerTest {

    private final QueryBlockScanner scanner = new QueryBlockScanner(new SqlTokenizer());

    @Test
    void clauseBoundariesIgnoreSubqueries() {
        ScannedStatement statement = scanner.scan(
            "SELECT a FROM t WHERE a IN (SELECT b FROM u WHERE c = 1 GROUP BY b) GROUP BY a ORDER BY a"
        );

        assertThat(statement.blocks()).hasSize(2);
        QueryBlock block = statement.blocks().get(0);
        assertThat(statement.token(block.fromIndex()).text()).isEqualTo("FROM");
        assertThat(statement.token(block.whereIndex()).depth()).isZero();
        assertThat(statement.token(block.regionEnd()).text()).isEqualTo("GROUP");
        assertThat(statement.token(block.regionEnd() - 1).text()).isEqualTo(")");
        assertThat(statement.containsNestedSelect()).isFalse();
    }

    @Test
    void subqueriesOutsideFromAreBlocksOfTheirOwn() {
        ScannedStatement statement = scanner.scan(
            "SELECT a FROM t WHERE a IN (SELECT b FROM u WHERE c = 1 GROUP BY b) GROUP BY a ORDER BY a"
        );

        QueryBlock inner = statement.blocks().get(1);
        assertThat(inner.depth()).isEqualTo(1);
        assertThat(statement.token(inner.whereIndex()).text()).isEqualTo("WHERE");
        assertThat(statement.token(inner.regionEnd()).text()).isEqualTo("GROUP");
        assertThat(statement.token(inner.endIndex()).text()).isEqualTo(")");
    }

    @Test
    void scalarSubqueryInsideFunctionCallIsScanned() {
        ScannedStatement statement = scanner.scan("SELECT COALESCE((SELECT MAX(s) FROM emp), 0) FROM dept");

        assertThat(statement.blocks()).hasSize(2);
        assertThat(statement.blocks().get(1).depth()).isEqualTo(2);
        assertThat(statement.containsNestedSelect()).isFalse();
    }

    @Test
    void derivedTablesStayOpaque() {
        ScannedStatement statement = scanner.scan("SELECT * FROM emp e JOIN (SELECT id FROM dept) d ON d.id = e.d, (SELECT 1 FROM x) y");

        assertThat(statement.blocks()).hasSize(1);
        assertThat(statement.containsNestedSelect()).isTrue();
    }

    @Test
    void semicolonBetweenStatementsIsMalformed() {
        assertThatThrownBy(() -> scanner.scan("SELECT id FROM emp; SELECT id FROM emp"))
            .isInstanceOfSatisfying(UnparsableStatementException.class, ex ->
                assertThat(ex.getReason()).isEqualTo(UnparsableStatementException.Reason.MALFORMED)
            );
        assertThat(scanner.scan("SELECT ';' FROM emp;;").blocks()).hasSize(1);
    }

    @Test
    void setOperationsProduceOneBlockPerBranch() {
        ScannedStatement statement = scanner.scan("SELECT a FROM t UNION ALL SELECT a FROM u WHERE x = 1 ORDER BY 1");

        assertThat(statement.blocks()).hasSize(2);
        assertThat(statement.blocks().get(0).hasWhere()).isFalse();
        assertThat(statement.blocks().get(1).hasWhere()).isTrue();
        assertThat(statement.token(statement.blocks().get(1).regionEnd()).text()).isEqualTo("ORDER");
        assertThat(statement.hasOpaqueBranch()).isFalse();
    }

    @Test
    void parenthesizedBranchIsOpaque() {
        assertThat(scanner.scan("(SELECT a FROM t) UNION SELECT a FROM u").hasOpaqueBranch()).isTrue();
        assertThat(scanner.scan("SELECT a FROM t UNION ALL (SELECT a FROM u)").hasOpaqueBranch()).isTrue();
    }

    @Test
    void wrappedStatementIsUnwrapped() {
        ScannedStatement statement = scanner.scan("((SELECT a FROM t WHERE b = 1));");

        assertThat(statement.baseDepth()).isEqualTo(2);
        assertThat(statement.blocks()).hasSize(1);
        assertThat(statement.blocks().get(0).hasWhere()).isTrue();
        assertThat(statement.hasOpaqueBranch()).isFalse();
    }

    @Test
    void cteNamesAreCollected() {
        ScannedStatement statement = scanner.scan(
            "WITH mine (id) AS (SELECT id FROM emp), \"Other\" AS (SELECT 1 FROM dual) SELECT * FROM mine JOIN \"Other\" ON 1 = 1"
        );

        assertThat(statement.cteNames()).containsExactlyInAnyOrder("MINE", "OTHER");
        assertThat(statement.blocks()).hasSize(3);
        assertThat(statement.blocks()).extracting(QueryBlock::depth).containsExactly(1, 1, 0);
        assertThat(statement.hasOpaqueBranch()).isFalse();
    }

    @Test
    void unscannableCteBodiesAreOpaque() {
        assertThat(scanner.scan("WITH d AS (DELETE FROM emp RETURNING id) SELECT * FROM d").hasOpaqueBranch()).isTrue();
        assertThat(scanner.scan("WITH d AS MATERIALIZED (SELECT id FROM emp) SELECT * FROM d").hasOpaqueBranch()).isFalse();
        assertThat(scanner.scan("SELECT * FROM t WHERE a IN (WITH x AS (SELECT 1 FROM u) SELECT * FROM x)").hasOpaqueBranch())
            .isTrue();
    }

    @Test
    void oracleHierarchicalClausesEndTheFilterRegion() {
        ScannedStatement statement = scanner.scan("SELECT id FROM emp START WITH mgr IS NULL CONNECT BY PRIOR id = mgr");

        QueryBlock block = statement.blocks().get(0);
        assertThat(statement.token(block.regionEnd()).text()).isEqualTo("START");
    }

    @Test
    void existingParameterNamesAreReported() {
        ScannedStatement statement = scanner.scan("SELECT * FROM t WHERE a = :RLS_PARAM_0 AND b = :other AND c = ?");

        assertThat(statement.parameterNames()).containsExactly("rls_param_0", "other");
    }

    @Test
    void blockAtMapsOffsetsToBranches() {
        String sql = "SELECT a FROM t UNION SELECT a FROM u";
        ScannedStatement statement = scanner.scan(sql);

        assertThat(statement.blockAt(sql.indexOf("t "))).contains(statement.blocks().get(0));
        assertThat(statement.blockAt(sql.lastIndexOf('u'))).contains(statement.blocks().get(1));
    }

    @Test
    void blockAtPrefersTheInnermostBlock() {
        String sql = "SELECT a, (SELECT MAX(b) FROM u) FROM t";
        ScannedStatement statement = scanner.scan(sql);

        assertThat(statement.blockAt(sql.indexOf("u)"))).contains(statement.blocks().get(1));
        assertThat(statement.blockAt(sql.lastIndexOf('t'))).contains(statement.blocks().get(0));
    }
}
