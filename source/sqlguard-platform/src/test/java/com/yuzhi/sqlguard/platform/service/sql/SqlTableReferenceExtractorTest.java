package com.yuzhi.sqlguard.platform.service.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class SqlTableReferenceExtractorTest {

    private final SqlTableReferenceExtractor extractor = new SqlTableReferenceExtractor(new QueryBlockScanner(new SqlTokenizer()));

    @Test
    void extractsAliasesAcrossJoins() {
        List<TableReference> refs = extractor.extractTables(
            "SELECT * FROM employees e JOIN departments AS d ON e.dept_id = d.id LEFT OUTER JOIN hr.locations l USING (location_id)"
        );

        assertThat(refs)
            .extracting(TableReference::schema, TableReference::name, TableReference::alias)
            .containsExactly(tuple(null, "employees", "e"), tuple(null, "departments", "d"), tuple("hr", "locations", "l"));
    }

    @Test
    void unaliasedTableUsesItsNameAsQualifier() {
        List<TableReference> refs = extractor.extractTables("SELECT * FROM EMPLOYEES WHERE SALARY > 100");

        assertThat(refs).hasSize(1);
        assertThat(refs.get(0).alias()).isNull();
        assertThat(refs.get(0).qualifier()).isEqualTo("EMPLOYEES");
    }

    @Test
    void commaJoinsAndSelfJoinsKeepEveryOccurrence() {
        List<TableReference> refs = extractor.extractTables("SELECT * FROM emp e1 JOIN emp e2 ON e1.mgr_id = e2.id, dept");

        assertThat(refs).extracting(TableReference::qualifier).containsExactly("e1", "e2", "dept");
        assertThat(refs).extracting(TableReference::normalizedName).containsExactly("EMP", "EMP", "DEPT");
    }

    @Test
    void keywordsInLiteralsDoNotCreateTables() {
        List<TableReference> refs = extractor.extractTables("SELECT 'FROM secrets' AS label FROM t WHERE note = 'JOIN other'");

        assertThat(refs).extracting(TableReference::name).containsExactly("t");
    }

    @Test
    void derivedTablesAreOpaque() {
        List<TableReference> refs = extractor.extractTables(
            "SELECT x.id FROM (SELECT id FROM salaries) x JOIN emp ON emp.id = x.id"
        );

        assertThat(refs).extracting(TableReference::name).containsExactly("emp");
    }

    @Test
    void parenthesizedJoinsAreWalked() {
        List<TableReference> refs = extractor.extractTables("SELECT * FROM (emp e JOIN dept d ON e.d = d.id) LEFT JOIN loc ON loc.id = d.loc");

        assertThat(refs).extracting(TableReference::qualifier).containsExactly("e", "d", "loc");
    }

    @Test
    void quotedIdentifiersAreKeptAsWritten() {
        List<TableReference> refs = extractor.extractTables("SELECT * FROM \"HR\".\"Employee Data\" \"ed\"");

        TableReference ref = refs.get(0);
        assertThat(ref.name()).isEqualTo("\"Employee Data\"");
        assertThat(ref.alias()).isEqualTo("\"ed\"");
        assertThat(ref.normalizedName()).isEqualTo("EMPLOYEE DATA");
        assertThat(ref.normalizedSchema()).isEqualTo("HR");
    }

    @Test
    void cteNamesAndDualAreNotTablesButCteBodiesAreRead() {
        List<TableReference> refs = extractor.extractTables(
            "WITH mine AS (SELECT * FROM emp) SELECT * FROM mine m JOIN dept d ON m.d = d.id CROSS JOIN dual"
        );

        assertThat(refs).extracting(TableReference::name).containsExactly("emp", "dept");
    }

    @Test
    void subqueriesInSelectListAndWhereAreRead() {
        List<TableReference> refs = extractor.extractTables(
            "SELECT d.name, (SELECT MAX(salary) FROM emp e WHERE e.d = d.id) FROM dept d WHERE d.loc IN (SELECT id FROM loc)"
        );

        assertThat(refs).extracting(TableReference::qualifier).containsExactly("d", "e", "loc");
    }

    @Test
    void dollarQuotedTextHidesKeywords() {
        List<TableReference> refs = extractor.extractTables("SELECT $$ FROM secrets WHERE $$ AS s FROM t");

        assertThat(refs).extracting(TableReference::name).containsExactly("t");
    }

    @Test
    void setOperationBranchesAreAllExtracted() {
        List<TableReference> refs = extractor.extractTables("SELECT id FROM emp UNION SELECT id FROM contractors c");

        assertThat(refs).extracting(TableReference::name).containsExactly("emp", "contractors");
    }

    @Test
    void tableFunctionsAreOpaque() {
        List<TableReference> refs = extractor.extractTables("SELECT * FROM TABLE(get_rows(1)) r, emp");

        assertThat(refs).extracting(TableReference::name).containsExactly("emp");
    }

    @Test
    void statementWithoutFromReportsNoFromClause() {
        assertThatThrownBy(() -> extractor.extractTables("SELECT 1"))
            .isInstanceOfSatisfying(UnparsableStatementException.class, ex ->
                assertThat(ex.getReason()).isEqualTo(UnparsableStatementException.Reason.NO_FROM_CLAUSE)
            );
    }

    @Test
    void scalarSubqueryWithoutOuterFromIsRead() {
        List<TableReference> refs = extractor.extractTables("SELECT (SELECT MAX(salary) FROM emp)");

        assertThat(refs).extracting(TableReference::name).containsExactly("emp");
    }

    @Test
    void withInsideSubqueryCannotBeFiltered() {
        assertThatThrownBy(() -> extractor.extractTables("SELECT * FROM t WHERE a IN (WITH x AS (SELECT id FROM emp) SELECT id FROM x)"))
            .isInstanceOf(InjectionPointNotFoundException.class);
    }

    @Test
    void parenthesizedSetBranchCannotBeFiltered() {
        assertThatThrownBy(() -> extractor.extractTables("(SELECT id FROM emp) UNION SELECT id FROM dept"))
            .isInstanceOf(InjectionPointNotFoundException.class);
    }

    @Test
    void positionsPointAtTheTableName() {
        String sql = "SELECT * FROM a JOIN b ON a.x = b.x";
        List<TableReference> refs = extractor.extractTables(sql);

        assertThat(refs.get(1).position()).isEqualTo(sql.indexOf("b ON"));
    }
}
