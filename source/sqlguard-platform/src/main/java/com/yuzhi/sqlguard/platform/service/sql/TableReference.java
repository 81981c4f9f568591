package com.yuzhi.sqlguard.platform.service.sql;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;

/**
 * One table occurrence in FROM/JOIN position. Names are kept as written (quotes included) so they can be reused
 * verbatim as predicate qualifiers.
 *
 * @param schema schema qualifier as written, or {@code null}
 * @param name table name as written
 * @param alias alias as written, or {@code null}
 * @param position character offset of the reference in the statement
 */
public record TableReference(String schema, String name, String alias, int position) {

    public static TableReference of(String name) {
        return new TableReference(null, name, null, 0);
    }

    /** Alias when present, otherwise the bare table name. */
    public String qualifier() {
        return alias != null ? alias : name;
    }

    public String normalizedName() {
        return SqlIdentifiers.normalize(name);
    }

    public String normalizedSchema() {
        return SqlIdentifiers.normalize(schema);
    }
}
