package com.yuzhi.sqlguard.platform.service.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over database metadata and the identity control table. Implementations carry no policy:
 * they only fetch, and report connectivity problems as {@link CatalogUnavailableException}.
 */
public interface SchemaCatalogAccessor {
    /**
     * Columns of a table in declaration order, upper-cased. Empty when the table does not exist.
     */
    List<String> listColumns(String tableName);

    /**
     * As {@link #listColumns(String)}, for a table in an explicit schema; a {@code null} schema means the default one.
     */
    List<String> listColumns(String schema, String tableName);

    /** Tables and views of the default schema, minus the system and control tables. */
    List<String> listTables();

    /** Name of the identity control table. */
    String controlTable();

    default List<String> listControlColumns() {
        return listColumns(controlTable());
    }

    /** Every control-table row, keys upper-cased. */
    List<Map<String, Object>> readControlTable();

    /** The control-table row for a username, compared case-insensitively. */
    Optional<Map<String, Object>> findControlRow(String username);
}
