package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.sql.InjectionPointNotFoundException;
import com.yuzhi.sqlguard.platform.service.sql.QueryBlock;
import com.yuzhi.sqlguard.platform.service.sql.QueryBlockScanner;
import com.yuzhi.sqlguard.platform.service.sql.RewriteResult;
import com.yuzhi.sqlguard.platform.service.sql.ScannedStatement;
import com.yuzhi.sqlguard.platform.service.sql.SqlToken;
import com.yuzhi.sqlguard.platform.service.sql.TableReference;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splices bind-parameterized identity predicates into a SELECT.
 * <p>
 * Every referenced table that carries at least one of the user's non-null filter columns gets
 * {@code <alias-or-table>.<COLUMN> = :rls_param_N}. Predicates are grouped per query block (CTE bodies and
 * subqueries outside FROM are blocks of their own) and
 * attached to that block's WHERE clause: {@code WHERE (...)} is created right after the FROM clause when there
 * is none, otherwise {@code AND (...)} is appended to the existing condition, which is parenthesized first when
 * it contains a top-level {@code OR}. Values are only ever bound, never written into the SQL text.
 */
public class RlsPredicateInjector {

    private static final Logger log = LoggerFactory.getLogger(RlsPredicateInjector.class);

    static final String PARAM_PREFIX = "rls_param_";

    private final TableColumnRegistry tableColumns;
    private final QueryBlockScanner scanner;
    private final GuardPolicy unmappedTablePolicy;
    private final GuardPolicy nestedQueryPolicy;

    public RlsPredicateInjector(
        TableColumnRegistry tableColumns,
        QueryBlockScanner scanner,
        GuardPolicy unmappedTablePolicy,
        GuardPolicy nestedQueryPolicy
    ) {
        this.tableColumns = tableColumns;
        this.scanner = scanner;
        this.unmappedTablePolicy = unmappedTablePolicy;
        this.nestedQueryPolicy = nestedQueryPolicy;
    }

    /**
     * @param sql statement the references were extracted from (offsets must match)
     * @param tableRefs tables to filter, as produced by the extractor
     * @param filterValues user's filter values; {@code null} values are ignored
     * @throws InjectionPointNotFoundException when a predicate cannot be attached to its query block
     * @throws UnmappedTableDeniedException when a table has no usable filter column and unmapped tables are denied
     * @throws NestedQueryDeniedException when the statement reads a derived table and nested queries are denied
     */
    public RewriteResult injectFilters(String sql, List<TableReference> tableRefs, Map<String, Object> filterValues) {
        ScannedStatement statement = scanner.scan(sql);
        if (statement.containsNestedSelect()) {
            if (nestedQueryPolicy == GuardPolicy.DENY) {
                throw new NestedQueryDeniedException();
            }
            log.warn("Statement reads a derived table; tables inside it are not filtered");
        }

        Map<String, Object> usable = new LinkedHashMap<>();
        filterValues.forEach((column, value) -> {
            if (value != null) {
                usable.put(column.toUpperCase(Locale.ROOT), value);
            }
        });

        ParameterNames names = new ParameterNames(statement.parameterNames());
        Map<String, Object> binds = new LinkedHashMap<>();
        Map<QueryBlock, List<String>> predicatesByBlock = new LinkedHashMap<>();
        for (TableReference table : tableRefs) {
            Set<String> columns = tableColumns.getColumns(table);
            List<String> matching = new ArrayList<>();
            for (String column : usable.keySet()) {
                if (columns.contains(column)) {
                    matching.add(column);
                }
            }
            if (matching.isEmpty()) {
                if (unmappedTablePolicy == GuardPolicy.DENY) {
                    throw new UnmappedTableDeniedException(table.name());
                }
                log.warn("No filter column of the current user matches table {}; it is read unfiltered", table.name());
                continue;
            }
            QueryBlock block = statement
                .blockAt(table.position())
                .orElseThrow(() -> new InjectionPointNotFoundException("table " + table.name() + " is outside any query block"));
            List<String> predicates = predicatesByBlock.computeIfAbsent(block, b -> new ArrayList<>());
            for (String column : matching) {
                String param = names.next();
                predicates.add(table.qualifier() + "." + SqlIdentifiers.render(column) + " = :" + param);
                binds.put(param, usable.get(column));
            }
        }
        if (predicatesByBlock.isEmpty()) {
            return RewriteResult.unchanged(sql);
        }

        // blocks nest, so every insertion is applied on its own, last offset first
        List<Splice> splices = new ArrayList<>();
        predicatesByBlock.forEach((block, predicates) -> splice(statement, block, String.join(" AND ", predicates), splices));
        splices.sort(Comparator.comparingInt(Splice::offset).reversed());
        StringBuilder rewritten = new StringBuilder(sql);
        for (Splice splice : splices) {
            rewritten.insert(splice.offset(), splice.text());
        }
        if (log.isDebugEnabled()) {
            log.debug("RLS bind parameters: {}", binds);
        }
        return new RewriteResult(rewritten.toString(), binds);
    }

    private void splice(ScannedStatement statement, QueryBlock block, String conjunction, List<Splice> splices) {
        if (!block.hasFrom() || block.regionEnd() <= block.fromIndex() + 1) {
            throw new InjectionPointNotFoundException("query block without a usable FROM clause");
        }
        int lastIndex = block.regionEnd() - 1;
        int insertAt = statement.token(lastIndex).end();
        if (!block.hasWhere()) {
            splices.add(new Splice(insertAt, " WHERE (" + conjunction + ")"));
            return;
        }
        if (lastIndex == block.whereIndex()) {
            throw new InjectionPointNotFoundException("WHERE clause without a condition");
        }
        if (hasTopLevelOr(statement, block)) {
            splices.add(new Splice(statement.token(block.whereIndex() + 1).start(), "("));
            splices.add(new Splice(insertAt, ") AND (" + conjunction + ")"));
            return;
        }
        splices.add(new Splice(insertAt, " AND (" + conjunction + ")"));
    }

    private static boolean hasTopLevelOr(ScannedStatement statement, QueryBlock block) {
        for (int i = block.whereIndex() + 1; i < block.regionEnd(); i++) {
            SqlToken token = statement.token(i);
            if (token.depth() == block.depth() && token.isKeyword("OR")) {
                return true;
            }
        }
        return false;
    }

    private record Splice(int offset, String text) {}

    /** Hands out {@code rls_param_N} names that do not clash with parameters already in the statement. */
    private static final class ParameterNames {

        private final Set<String> taken;
        private int counter;

        ParameterNames(Set<String> taken) {
            this.taken = taken;
        }

        String next() {
            String name;
            do {
                name = PARAM_PREFIX + counter++;
            } while (taken.contains(name));
            return name;
        }
    }
}
