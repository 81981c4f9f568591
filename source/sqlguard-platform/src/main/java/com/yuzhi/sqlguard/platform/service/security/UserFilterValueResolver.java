package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.catalog.SchemaCatalogAccessor;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user identity values from the control table, cached by canonical (trimmed, upper-cased) username.
 * The returned map has one entry per filter column; a {@code null} value means the user has no value for it.
 */
public class UserFilterValueResolver {

    private static final Logger log = LoggerFactory.getLogger(UserFilterValueResolver.class);

    private final SchemaCatalogAccessor catalog;
    private final FilterColumnRegistry filterColumns;
    private final String usernameColumn;
    private final ExpiringCache<String, Map<String, Object>> cache;

    public UserFilterValueResolver(
        SchemaCatalogAccessor catalog,
        FilterColumnRegistry filterColumns,
        String usernameColumn,
        Duration ttl,
        Clock clock
    ) {
        this.catalog = catalog;
        this.filterColumns = filterColumns;
        this.usernameColumn = SqlIdentifiers.normalize(usernameColumn);
        this.cache = new ExpiringCache<>(ttl, clock);
    }

    /**
     * @throws UserNotFoundException when no control-table row matches the username
     */
    public Map<String, Object> getUserFilterValues(String username) {
        String key = canonical(username);
        if (key == null) {
            throw new UserNotFoundException(String.valueOf(username));
        }
        return cache.get(key, this::load);
    }

    public void invalidateUser(String username) {
        String key = canonical(username);
        if (key != null) {
            cache.invalidate(key);
            log.info("Cleared RLS filter values for user {}", key);
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * Re-reads the whole control table and replaces the cached values of every user found in it.
     *
     * @return number of users loaded
     */
    public int reloadAll() {
        List<Map<String, Object>> rows = catalog.readControlTable();
        Set<String> columns = filterColumns.getFilterColumns();
        Map<String, Map<String, Object>> loaded = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object name = row.get(usernameColumn);
            String key = name == null ? null : canonical(name.toString());
            if (key == null) {
                log.warn("Skipping control-table row without {}", usernameColumn);
                continue;
            }
            loaded.put(key, project(row, columns));
        }
        cache.invalidateAll();
        loaded.forEach(cache::put);
        log.info("Reloaded RLS filter values for {} users", loaded.size());
        return loaded.size();
    }

    private Map<String, Object> load(String username) {
        Map<String, Object> row = catalog.findControlRow(username).orElseThrow(() -> new UserNotFoundException(username));
        Map<String, Object> values = project(row, filterColumns.getFilterColumns());
        if (log.isDebugEnabled()) {
            log.debug("Loaded filter values for {} on columns {}", username, values.keySet());
        }
        return values;
    }

    private static Map<String, Object> project(Map<String, Object> row, Set<String> columns) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, row.get(column));
        }
        return Collections.unmodifiableMap(values);
    }

    static String canonical(String username) {
        if (StringUtils.isBlank(username)) {
            return null;
        }
        return username.trim().toUpperCase(Locale.ROOT);
    }
}
