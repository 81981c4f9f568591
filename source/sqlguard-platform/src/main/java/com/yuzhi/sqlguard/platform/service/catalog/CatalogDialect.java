package com.yuzhi.sqlguard.platform.service.catalog;

/**
 * Metadata queries per database family. All lookups compare upper-cased names so quoted and unquoted
 * spellings resolve alike.
 */
public enum CatalogDialect {
    ORACLE(
        "SELECT COLUMN_NAME FROM USER_TAB_COLUMNS WHERE UPPER(TABLE_NAME) = ? ORDER BY COLUMN_ID",
        "SELECT COLUMN_NAME FROM ALL_TAB_COLUMNS WHERE UPPER(OWNER) = ? AND UPPER(TABLE_NAME) = ? ORDER BY COLUMN_ID",
        "SELECT TABLE_NAME FROM USER_TABLES UNION SELECT VIEW_NAME FROM USER_VIEWS UNION SELECT MVIEW_NAME FROM USER_MVIEWS ORDER BY 1"
    ),
    INFORMATION_SCHEMA(
        null,
        "SELECT COLUMN_NAME FROM INFORMATION_SCHEMA.COLUMNS WHERE UPPER(TABLE_SCHEMA) = ? AND UPPER(TABLE_NAME) = ? ORDER BY ORDINAL_POSITION",
        "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE UPPER(TABLE_SCHEMA) = ? ORDER BY TABLE_NAME"
    );

    private final String columnsSql;
    private final String schemaColumnsSql;
    private final String tablesSql;

    CatalogDialect(String columnsSql, String schemaColumnsSql, String tablesSql) {
        this.columnsSql = columnsSql;
        this.schemaColumnsSql = schemaColumnsSql;
        this.tablesSql = tablesSql;
    }

    /** Column lookup for the connected user's own schema; {@code null} when the dialect always needs a schema. */
    String columnsSql() {
        return columnsSql;
    }

    String schemaColumnsSql() {
        return schemaColumnsSql;
    }

    /** Table listing; binds the schema when {@link #tablesNeedSchema()}. */
    String tablesSql() {
        return tablesSql;
    }

    boolean tablesNeedSchema() {
        return this == INFORMATION_SCHEMA;
    }
}
