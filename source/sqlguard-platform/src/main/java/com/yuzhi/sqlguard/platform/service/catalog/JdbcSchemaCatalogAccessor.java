package com.yuzhi.sqlguard.platform.service.catalog;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link SchemaCatalogAccessor} over a {@link JdbcTemplate}. Control-table and key-column names come from
 * configuration and are spliced into SQL, so they are validated as plain identifiers up front.
 */
public class JdbcSchemaCatalogAccessor implements SchemaCatalogAccessor {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaCatalogAccessor.class);

    private final JdbcTemplate jdbcTemplate;
    private final CatalogDialect dialect;
    private final String defaultSchema;
    private final String controlTable;
    private final String usernameColumn;
    private final Set<String> excludedTables;

    public JdbcSchemaCatalogAccessor(
        JdbcTemplate jdbcTemplate,
        CatalogDialect dialect,
        String defaultSchema,
        String controlTable,
        String usernameColumn,
        Collection<String> excludedTables
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.dialect = dialect;
        this.defaultSchema = SqlIdentifiers.normalize(defaultSchema);
        this.controlTable = SqlIdentifiers.requireSimple(controlTable, "control table");
        this.usernameColumn = SqlIdentifiers.requireSimple(usernameColumn, "username column");
        Set<String> excluded = new LinkedHashSet<>();
        if (excludedTables != null) {
            for (String table : excludedTables) {
                String normalized = SqlIdentifiers.normalize(table);
                if (normalized != null) {
                    excluded.add(normalized);
                }
            }
        }
        excluded.add(controlTable.toUpperCase(Locale.ROOT));
        this.excludedTables = Set.copyOf(excluded);
        if (dialect == CatalogDialect.INFORMATION_SCHEMA && this.defaultSchema == null) {
            throw new IllegalArgumentException("A default schema is required for the INFORMATION_SCHEMA catalog");
        }
    }

    @Override
    public List<String> listColumns(String tableName) {
        return listColumns(null, tableName);
    }

    @Override
    public List<String> listColumns(String schema, String tableName) {
        String table = SqlIdentifiers.normalize(tableName);
        if (table == null) {
            return List.of();
        }
        String owner = SqlIdentifiers.normalize(schema);
        try {
            List<String> columns;
            if (owner == null && dialect.columnsSql() != null) {
                columns = jdbcTemplate.queryForList(dialect.columnsSql(), String.class, table);
            } else {
                columns = jdbcTemplate.queryForList(
                    dialect.schemaColumnsSql(),
                    String.class,
                    owner != null ? owner : defaultSchema,
                    table
                );
            }
            List<String> upper = new ArrayList<>(columns.size());
            for (String column : columns) {
                upper.add(column.toUpperCase(Locale.ROOT));
            }
            return upper;
        } catch (DataAccessException ex) {
            log.error("Column lookup for {} failed: {}", owner == null ? table : owner + "." + table, ex.getMessage());
            throw new CatalogUnavailableException("Schema lookup failed for table " + table, ex);
        }
    }

    @Override
    public List<String> listTables() {
        try {
            List<String> tables = dialect.tablesNeedSchema()
                ? jdbcTemplate.queryForList(dialect.tablesSql(), String.class, defaultSchema)
                : jdbcTemplate.queryForList(dialect.tablesSql(), String.class);
            Set<String> visible = new LinkedHashSet<>();
            for (String table : tables) {
                String normalized = table.toUpperCase(Locale.ROOT);
                if (!excludedTables.contains(normalized)) {
                    visible.add(normalized);
                }
            }
            return List.copyOf(visible);
        } catch (DataAccessException ex) {
            log.error("Table listing failed: {}", ex.getMessage());
            throw new CatalogUnavailableException("Schema lookup failed while listing tables", ex);
        }
    }

    @Override
    public String controlTable() {
        return controlTable;
    }

    @Override
    public List<Map<String, Object>> readControlTable() {
        String sql = "SELECT * FROM " + controlTable + " ORDER BY " + usernameColumn;
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql);
            List<Map<String, Object>> result = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                result.add(upperKeys(row));
            }
            return result;
        } catch (DataAccessException ex) {
            log.error("Reading control table {} failed: {}", controlTable, ex.getMessage());
            throw new CatalogUnavailableException("Control table " + controlTable + " is unavailable", ex);
        }
    }

    @Override
    public Optional<Map<String, Object>> findControlRow(String username) {
        String sql = "SELECT * FROM " + controlTable + " WHERE UPPER(" + usernameColumn + ") = UPPER(?)";
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, username);
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            if (rows.size() > 1) {
                log.warn("Control table {} has {} rows for user {}; using the first", controlTable, rows.size(), username);
            }
            return Optional.of(upperKeys(rows.get(0)));
        } catch (DataAccessException ex) {
            log.error("Control-table lookup for {} failed: {}", username, ex.getMessage());
            throw new CatalogUnavailableException("Control table " + controlTable + " is unavailable", ex);
        }
    }

    private static Map<String, Object> upperKeys(Map<String, Object> row) {
        Map<String, Object> copy = new LinkedHashMap<>();
        row.forEach((key, value) -> copy.put(key.toUpperCase(Locale.ROOT), value));
        return copy;
    }
}
