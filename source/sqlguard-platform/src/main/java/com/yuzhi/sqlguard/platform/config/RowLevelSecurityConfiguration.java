package com.yuzhi.sqlguard.platform.config;

import com.yuzhi.sqlguard.platform.service.catalog.JdbcSchemaCatalogAccessor;
import com.yuzhi.sqlguard.platform.service.catalog.SchemaCatalogAccessor;
import com.yuzhi.sqlguard.platform.service.security.AccessPolicyGate;
import com.yuzhi.sqlguard.platform.service.security.ControlTableRoleResolver;
import com.yuzhi.sqlguard.platform.service.security.FilterColumnRegistry;
import com.yuzhi.sqlguard.platform.service.security.RlsPredicateInjector;
import com.yuzhi.sqlguard.platform.service.security.RowLevelSecurityService;
import com.yuzhi.sqlguard.platform.service.security.TableColumnRegistry;
import com.yuzhi.sqlguard.platform.service.security.UserFilterValueResolver;
import com.yuzhi.sqlguard.platform.service.sql.QueryBlockScanner;
import com.yuzhi.sqlguard.platform.service.sql.SqlTableReferenceExtractor;
import com.yuzhi.sqlguard.platform.service.sql.SqlTokenizer;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the row-level security engine. The engine classes take plain values, so all property lookups happen here.
 */
@Configuration
@EnableConfigurationProperties({ RowLevelSecurityProperties.class, QueryExecutionProperties.class })
public class RowLevelSecurityConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RowLevelSecurityConfiguration.class);

    private final RowLevelSecurityProperties properties;

    public RowLevelSecurityConfiguration(RowLevelSecurityProperties properties) {
        this.properties = properties;
    }

    @Bean
    Clock rlsClock() {
        return Clock.systemUTC();
    }

    @Bean
    SchemaCatalogAccessor schemaCatalogAccessor(JdbcTemplate jdbcTemplate) {
        return new JdbcSchemaCatalogAccessor(
            jdbcTemplate,
            properties.getCatalogDialect(),
            properties.getCatalogSchema(),
            properties.getControlTable(),
            properties.getUsernameColumn(),
            properties.getCatalogExcludedTables()
        );
    }

    @Bean
    QueryBlockScanner queryBlockScanner() {
        return new QueryBlockScanner(new SqlTokenizer());
    }

    @Bean
    SqlTableReferenceExtractor sqlTableReferenceExtractor(QueryBlockScanner scanner) {
        return new SqlTableReferenceExtractor(scanner);
    }

    @Bean
    FilterColumnRegistry filterColumnRegistry(SchemaCatalogAccessor catalog, Clock rlsClock) {
        return new FilterColumnRegistry(catalog, properties.getRoleColumns(), properties.getCacheTtl(), rlsClock);
    }

    @Bean
    UserFilterValueResolver userFilterValueResolver(SchemaCatalogAccessor catalog, FilterColumnRegistry filterColumns, Clock rlsClock) {
        return new UserFilterValueResolver(catalog, filterColumns, properties.getUsernameColumn(), properties.getCacheTtl(), rlsClock);
    }

    @Bean
    TableColumnRegistry tableColumnRegistry(SchemaCatalogAccessor catalog, Clock rlsClock) {
        return new TableColumnRegistry(catalog, properties.getCacheTtl(), rlsClock);
    }

    @Bean
    RlsPredicateInjector rlsPredicateInjector(TableColumnRegistry tableColumns, QueryBlockScanner scanner) {
        return new RlsPredicateInjector(
            tableColumns,
            scanner,
            properties.getUnmappedTablePolicy(),
            properties.getNestedQueryPolicy()
        );
    }

    @Bean
    AccessPolicyGate accessPolicyGate(SqlTableReferenceExtractor extractor) {
        return new AccessPolicyGate(
            properties.isEnabled(),
            properties.getPrivilegedRoles(),
            properties.getExcludedTables(),
            extractor
        );
    }

    @Bean
    ControlTableRoleResolver controlTableRoleResolver(SchemaCatalogAccessor catalog) {
        return new ControlTableRoleResolver(catalog, properties.getRoleFlags(), properties.getDefaultRole());
    }

    @Bean
    RowLevelSecurityService rowLevelSecurityService(
        AccessPolicyGate gate,
        FilterColumnRegistry filterColumns,
        UserFilterValueResolver userValues,
        TableColumnRegistry tableColumns,
        RlsPredicateInjector injector,
        SchemaCatalogAccessor catalog
    ) {
        log.info(
            "Row-level security {} (control table {}, cache TTL {}, unmapped tables {}, nested queries {})",
            properties.isEnabled() ? "enabled" : "DISABLED",
            properties.getControlTable(),
            properties.getCacheTtl(),
            properties.getUnmappedTablePolicy(),
            properties.getNestedQueryPolicy()
        );
        return new RowLevelSecurityService(gate, filterColumns, userValues, tableColumns, injector, catalog);
    }
}
