package com.yuzhi.sqlguard.platform.service.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yuzhi.sqlguard.common.security.AuthenticatedUser;
import com.yuzhi.sqlguard.platform.config.QueryExecutionProperties;
import com.yuzhi.sqlguard.platform.config.RowLevelSecurityProperties;
import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;
import com.yuzhi.sqlguard.platform.service.catalog.CatalogDialect;
import com.yuzhi.sqlguard.platform.service.catalog.JdbcSchemaCatalogAccessor;
import com.yuzhi.sqlguard.platform.service.security.AccessPolicyGate;
import com.yuzhi.sqlguard.platform.service.security.ControlTableRoleResolver;
import com.yuzhi.sqlguard.platform.service.security.FilterColumnRegistry;
import com.yuzhi.sqlguard.platform.service.security.GuardPolicy;
import com.yuzhi.sqlguard.platform.service.security.RlsPredicateInjector;
import com.yuzhi.sqlguard.platform.service.security.RowLevelSecurityService;
import com.yuzhi.sqlguard.platform.service.security.SecurityGuardException;
import com.yuzhi.sqlguard.platform.service.security.TableColumnRegistry;
import com.yuzhi.sqlguard.platform.service.security.UserFilterValueResolver;
import com.yuzhi.sqlguard.platform.service.security.UserNotFoundException;
import com.yuzhi.sqlguard.platform.service.sql.QueryBlockScanner;
import com.yuzhi.sqlguard.platform.service.sql.SqlTableReferenceExtractor;
import com.yuzhi.sqlguard.platform.service.sql.SqlTokenizer;
import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

/**
 * Rewrites and executes against an in-memory database seeded with the control table and a small HR schema.
 */
class SecureQueryServiceTest {

    private EmbeddedDatabase database;
    private ControlTableRoleResolver roles;
    private SecureQueryService service;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("db/rls-schema.sql")
            .addScript("db/rls-data.sql")
            .build();
        RowLevelSecurityProperties rls = new RowLevelSecurityProperties();
        Clock clock = Clock.systemUTC();
        Duration ttl = Duration.ofMinutes(5);

        JdbcSchemaCatalogAccessor catalog = new JdbcSchemaCatalogAccessor(
            new JdbcTemplate(database),
            CatalogDialect.INFORMATION_SCHEMA,
            "PUBLIC",
            rls.getControlTable(),
            rls.getUsernameColumn(),
            List.of()
        );
        QueryBlockScanner scanner = new QueryBlockScanner(new SqlTokenizer());
        FilterColumnRegistry filterColumns = new FilterColumnRegistry(catalog, rls.getRoleColumns(), ttl, clock);
        TableColumnRegistry tableColumns = new TableColumnRegistry(catalog, ttl, clock);
        RowLevelSecurityService rowLevelSecurity = new RowLevelSecurityService(
            new AccessPolicyGate(true, rls.getPrivilegedRoles(), List.of(), new SqlTableReferenceExtractor(scanner)),
            filterColumns,
            new UserFilterValueResolver(catalog, filterColumns, rls.getUsernameColumn(), ttl, clock),
            tableColumns,
            new RlsPredicateInjector(tableColumns, scanner, GuardPolicy.ALLOW, GuardPolicy.ALLOW),
            catalog
        );
        roles = new ControlTableRoleResolver(catalog, rls.getRoleFlags(), rls.getDefaultRole());

        QueryExecutionProperties execution = new QueryExecutionProperties();
        execution.setMaxRows(3);
        service = new SecureQueryService(rowLevelSecurity, new JdbcQueryGateway(database, execution));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void normalUserOnlySeesOwnEmployeeRow() {
        Map<String, Object> result = service.execute(user("sarah"), "SELECT EMPLOYEE_ID, NAME FROM EMPLOYEES;");

        assertThat(rows(result)).extracting(r -> r.get("EMPLOYEE_ID")).containsExactly(189);
        assertThat(result.get("rlsApplied")).isEqualTo(true);
        assertThat(result.get("bypassReason")).isNull();
        assertThat((String) result.get("effectiveSql")).contains(":rls_param_0");
    }

    @Test
    void everyMatchingFilterColumnNarrowsTheResult() {
        Map<String, Object> result = service.execute(user("sarah"), "SELECT CONTACT_ID FROM CUSTOMER_CONTACTS");

        // contact 3 shares the email but belongs to another employee
        assertThat(rows(result)).extracting(r -> r.get("CONTACT_ID")).containsExactly(1);
    }

    @Test
    void orInExistingConditionCannotWidenTheResult() {
        Map<String, Object> result = service.execute(
            user("sarah"),
            "SELECT EMPLOYEE_ID FROM EMPLOYEES WHERE SALARY > 4000 OR DEPARTMENT_ID = 20 ORDER BY EMPLOYEE_ID"
        );

        assertThat(rows(result)).extracting(r -> r.get("EMPLOYEE_ID")).containsExactly(189);
    }

    @Test
    void joinedTablesWithoutFilterColumnsAreReadThroughTheFilteredSide() {
        Map<String, Object> result = service.execute(
            user("sarah"),
            "SELECT e.NAME, d.DEPARTMENT_NAME FROM EMPLOYEES e JOIN DEPARTMENTS d ON e.DEPARTMENT_ID = d.DEPARTMENT_ID"
        );

        assertThat(rows(result)).containsExactly(Map.of("NAME", "Sarah", "DEPARTMENT_NAME", "Engineering"));
    }

    @Test
    void cteBodyIsFiltered() {
        Map<String, Object> result = service.execute(
            user("sarah"),
            "WITH x AS (SELECT EMPLOYEE_ID FROM EMPLOYEES) SELECT EMPLOYEE_ID FROM x ORDER BY EMPLOYEE_ID"
        );

        assertThat(rows(result)).extracting(r -> r.get("EMPLOYEE_ID")).containsExactly(189);
    }

    @Test
    void scalarSubqueryInSelectListIsFiltered() {
        Map<String, Object> result = service.execute(
            user("sarah"),
            "SELECT (SELECT MAX(SALARY) FROM EMPLOYEES) AS TOP_SALARY FROM DEPARTMENTS"
        );

        assertThat(rows(result))
            .hasSize(2)
            .extracting(r -> ((Number) r.get("TOP_SALARY")).intValue())
            .containsOnly(4200);
    }

    @Test
    void inSubqueryIsFiltered() {
        Map<String, Object> result = service.execute(
            user("sarah"),
            "SELECT DEPARTMENT_NAME FROM DEPARTMENTS WHERE DEPARTMENT_ID IN (SELECT DEPARTMENT_ID FROM EMPLOYEES WHERE SALARY < 3000)"
        );

        assertThat(rows(result)).isEmpty();
    }

    @Test
    void secondStatementIsRefusedForNormalUsers() {
        assertThatThrownBy(() ->
            service.execute(user("sarah"), "SELECT EMPLOYEE_ID FROM EMPLOYEES; SELECT EMPLOYEE_ID FROM EMPLOYEES")
        )
            .isInstanceOfSatisfying(UnparsableStatementException.class, ex ->
                assertThat(ex.getReason()).isEqualTo(UnparsableStatementException.Reason.MALFORMED)
            );
    }

    @Test
    void writeAfterSemicolonIsRefusedForAdministrators() {
        assertThatThrownBy(() -> service.execute(user("admin"), "SELECT 1 FROM DUAL; DELETE FROM EMPLOYEES"))
            .isInstanceOf(UnparsableStatementException.class);

        assertThat(new JdbcTemplate(database).queryForObject("SELECT COUNT(*) FROM EMPLOYEES", Integer.class)).isEqualTo(4);
    }

    @Test
    void privilegedUserSeesEverythingUpToTheRowLimit() {
        Map<String, Object> result = service.execute(user("admin"), "SELECT EMPLOYEE_ID FROM EMPLOYEES ORDER BY EMPLOYEE_ID");

        assertThat(rows(result)).extracting(r -> r.get("EMPLOYEE_ID")).containsExactly(100, 189, 190);
        assertThat(result.get("truncated")).isEqualTo(true);
        assertThat(result.get("rlsApplied")).isEqualTo(false);
        assertThat(result.get("bypassReason")).isEqualTo("PRIVILEGED");
    }

    @Test
    void userWithoutFilterValuesIsNotNarrowed() {
        Map<String, Object> result = service.execute(user("guest"), "SELECT EMPLOYEE_ID FROM EMPLOYEES");

        assertThat(result.get("rlsApplied")).isEqualTo(false);
        assertThat(result.get("bypassReason")).isNull();
    }

    @Test
    void writesAreBlockedEvenForAdministrators() {
        assertThatThrownBy(() -> service.execute(user("admin"), "DELETE FROM EMPLOYEES"))
            .isInstanceOf(SecurityGuardException.class)
            .extracting(ex -> ((SecurityGuardException) ex).getCode())
            .isEqualTo(PolicyErrorCodes.WRITE_BLOCKED);

        assertThat(new JdbcTemplate(database).queryForObject("SELECT COUNT(*) FROM EMPLOYEES", Integer.class)).isEqualTo(4);
    }

    @Test
    void unknownUserIsRejectedBeforeExecution() {
        AuthenticatedUser mallory = AuthenticatedUser.of("mallory", List.of("user"));

        assertThatThrownBy(() -> service.execute(mallory, "SELECT * FROM EMPLOYEES")).isInstanceOf(UserNotFoundException.class);
    }

    private AuthenticatedUser user(String username) {
        return roles.resolveUser(username);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rows(Map<String, Object> result) {
        return (List<Map<String, Object>>) result.get("rows");
    }
}
