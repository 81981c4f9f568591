package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.catalog.CatalogUnavailableException;
import com.yuzhi.sqlguard.platform.service.catalog.SchemaCatalogAccessor;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity columns of the control table: all of its columns minus the fixed role columns.
 */
public class FilterColumnRegistry {

    private static final Logger log = LoggerFactory.getLogger(FilterColumnRegistry.class);

    private static final String KEY = "filter-columns";

    private final SchemaCatalogAccessor catalog;
    private final Set<String> roleColumns;
    private final ExpiringCache<String, Set<String>> cache;

    public FilterColumnRegistry(SchemaCatalogAccessor catalog, Collection<String> roleColumns, Duration ttl, Clock clock) {
        this.catalog = catalog;
        Set<String> normalized = new LinkedHashSet<>();
        for (String column : roleColumns) {
            String name = SqlIdentifiers.normalize(column);
            if (name != null) {
                normalized.add(name);
            }
        }
        this.roleColumns = Collections.unmodifiableSet(normalized);
        this.cache = new ExpiringCache<>(ttl, clock);
    }

    /**
     * @throws CatalogUnavailableException when the control table cannot be read or does not exist
     */
    public Set<String> getFilterColumns() {
        return cache.get(KEY, key -> discover());
    }

    public Set<String> getRoleColumns() {
        return roleColumns;
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    private Set<String> discover() {
        List<String> columns = catalog.listControlColumns();
        if (columns.isEmpty()) {
            throw new CatalogUnavailableException("Control table " + catalog.controlTable() + " has no columns or does not exist");
        }
        Set<String> filterColumns = new LinkedHashSet<>(columns);
        filterColumns.removeAll(roleColumns);
        log.info("Discovered {} filter columns on {}: {}", filterColumns.size(), catalog.controlTable(), filterColumns);
        return Collections.unmodifiableSet(filterColumns);
    }
}
