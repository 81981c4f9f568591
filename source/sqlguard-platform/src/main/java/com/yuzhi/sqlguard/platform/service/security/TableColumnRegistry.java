package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.platform.service.catalog.SchemaCatalogAccessor;
import com.yuzhi.sqlguard.platform.service.sql.TableReference;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Column names per table, upper-cased, cached by normalized (optionally schema-qualified) table name.
 */
public class TableColumnRegistry {

    private final SchemaCatalogAccessor catalog;
    private final ExpiringCache<String, Set<String>> cache;

    public TableColumnRegistry(SchemaCatalogAccessor catalog, Duration ttl, Clock clock) {
        this.catalog = catalog;
        this.cache = new ExpiringCache<>(ttl, clock);
    }

    public Set<String> getColumns(String tableName) {
        return getColumns(TableReference.of(tableName));
    }

    public Set<String> getColumns(TableReference table) {
        String schema = table.normalizedSchema();
        String name = table.normalizedName();
        String key = schema == null ? name : schema + "." + name;
        return cache.get(key, k -> {
            Set<String> columns = new LinkedHashSet<>();
            for (String column : catalog.listColumns(schema, name)) {
                columns.add(column.toUpperCase(Locale.ROOT));
            }
            return Collections.unmodifiableSet(columns);
        });
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
