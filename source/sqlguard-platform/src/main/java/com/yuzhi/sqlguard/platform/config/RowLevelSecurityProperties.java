package com.yuzhi.sqlguard.platform.config;

import com.yuzhi.sqlguard.common.security.AuthoritiesConstants;
import com.yuzhi.sqlguard.platform.service.catalog.CatalogDialect;
import com.yuzhi.sqlguard.platform.service.security.GuardPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sqlguard.rls")
public class RowLevelSecurityProperties {

    /**
     * Global switch. When false every statement passes through untouched.
     */
    private boolean enabled = true;

    /**
     * TTL shared by the filter-column, user-value and table-column caches. Zero disables caching.
     */
    private Duration cacheTtl = Duration.ofSeconds(300);

    /**
     * Tables never filtered, optionally schema-qualified.
     */
    private List<String> excludedTables = new ArrayList<>();

    /**
     * Table mapping usernames to role flags and identity values.
     */
    private String controlTable = "AI_USERS";

    private String usernameColumn = "USERNAME";

    /**
     * Control-table columns that are not identity attributes.
     */
    private List<String> roleColumns = new ArrayList<>(List.of("USERNAME", "IS_ADMIN", "IS_SUPERUSER", "IS_NORMALUSER"));

    /**
     * Flag column to role name. A flag equal to 1 grants the role.
     */
    private Map<String, String> roleFlags = defaultRoleFlags();

    private String defaultRole = AuthoritiesConstants.USER;

    private List<String> privilegedRoles = new ArrayList<>(List.of(AuthoritiesConstants.ADMIN, AuthoritiesConstants.SUPERUSER));

    private CatalogDialect catalogDialect = CatalogDialect.ORACLE;

    /**
     * Default schema for INFORMATION_SCHEMA lookups and unqualified tables.
     */
    private String catalogSchema = "PUBLIC";

    /**
     * System tables hidden from table listings.
     */
    private List<String> catalogExcludedTables = new ArrayList<>(
        List.of("AI_USERS", "CHAINED_ROWS", "PLAN_TABLE", "MVIEW$_ADV_WORKLOAD", "MVIEW$_ADV_LOG")
    );

    /**
     * ALLOW reads tables without a matching filter column unfiltered (logged); DENY refuses the statement.
     */
    private GuardPolicy unmappedTablePolicy = GuardPolicy.ALLOW;

    /**
     * ALLOW treats nested SELECTs as opaque (logged); DENY refuses statements containing them for filtered users.
     */
    private GuardPolicy nestedQueryPolicy = GuardPolicy.ALLOW;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public List<String> getExcludedTables() {
        return excludedTables;
    }

    public void setExcludedTables(List<String> excludedTables) {
        this.excludedTables = excludedTables;
    }

    public String getControlTable() {
        return controlTable;
    }

    public void setControlTable(String controlTable) {
        this.controlTable = controlTable;
    }

    public String getUsernameColumn() {
        return usernameColumn;
    }

    public void setUsernameColumn(String usernameColumn) {
        this.usernameColumn = usernameColumn;
    }

    public List<String> getRoleColumns() {
        return roleColumns;
    }

    public void setRoleColumns(List<String> roleColumns) {
        this.roleColumns = roleColumns;
    }

    public Map<String, String> getRoleFlags() {
        return roleFlags;
    }

    public void setRoleFlags(Map<String, String> roleFlags) {
        this.roleFlags = roleFlags;
    }

    public String getDefaultRole() {
        return defaultRole;
    }

    public void setDefaultRole(String defaultRole) {
        this.defaultRole = defaultRole;
    }

    public List<String> getPrivilegedRoles() {
        return privilegedRoles;
    }

    public void setPrivilegedRoles(List<String> privilegedRoles) {
        this.privilegedRoles = privilegedRoles;
    }

    public CatalogDialect getCatalogDialect() {
        return catalogDialect;
    }

    public void setCatalogDialect(CatalogDialect catalogDialect) {
        this.catalogDialect = catalogDialect;
    }

    public String getCatalogSchema() {
        return catalogSchema;
    }

    public void setCatalogSchema(String catalogSchema) {
        this.catalogSchema = catalogSchema;
    }

    public List<String> getCatalogExcludedTables() {
        return catalogExcludedTables;
    }

    public void setCatalogExcludedTables(List<String> catalogExcludedTables) {
        this.catalogExcludedTables = catalogExcludedTables;
    }

    public GuardPolicy getUnmappedTablePolicy() {
        return unmappedTablePolicy;
    }

    public void setUnmappedTablePolicy(GuardPolicy unmappedTablePolicy) {
        this.unmappedTablePolicy = unmappedTablePolicy;
    }

    public GuardPolicy getNestedQueryPolicy() {
        return nestedQueryPolicy;
    }

    public void setNestedQueryPolicy(GuardPolicy nestedQueryPolicy) {
        this.nestedQueryPolicy = nestedQueryPolicy;
    }

    private static Map<String, String> defaultRoleFlags() {
        Map<String, String> flags = new LinkedHashMap<>();
        flags.put("IS_ADMIN", AuthoritiesConstants.ADMIN);
        flags.put("IS_SUPERUSER", AuthoritiesConstants.SUPERUSER);
        flags.put("IS_NORMALUSER", AuthoritiesConstants.USER);
        return flags;
    }
}
