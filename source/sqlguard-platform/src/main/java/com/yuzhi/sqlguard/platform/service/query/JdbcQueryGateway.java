package com.yuzhi.sqlguard.platform.service.query;

import com.yuzhi.sqlguard.platform.config.QueryExecutionProperties;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

@Service
public class JdbcQueryGateway implements QueryGateway {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryGateway.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final int maxRows;

    public JdbcQueryGateway(DataSource dataSource, QueryExecutionProperties properties) {
        this.maxRows = Math.max(1, properties.getMaxRows());
        JdbcTemplate template = new JdbcTemplate(dataSource);
        // one extra row tells us the result was cut
        template.setMaxRows(maxRows + 1);
        template.setQueryTimeout(Math.max(1, properties.getQueryTimeoutSeconds()));
        this.jdbcTemplate = new NamedParameterJdbcTemplate(template);
    }

    @Override
    public Map<String, Object> execute(String effectiveSql, Map<String, Object> bindParams) {
        long started = System.currentTimeMillis();
        List<String> headers = new ArrayList<>();
        List<Map<String, Object>> rows = jdbcTemplate.query(
            effectiveSql,
            new MapSqlParameterSource(bindParams),
            (ResultSetExtractor<List<Map<String, Object>>>) rs -> {
                ResultSetMetaData meta = rs.getMetaData();
                int columnCount = meta.getColumnCount();
                for (int i = 1; i <= columnCount; i++) {
                    headers.add(meta.getColumnLabel(i));
                }
                List<Map<String, Object>> data = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(headers.get(i - 1), rs.getObject(i));
                    }
                    data.add(row);
                }
                return data;
            }
        );
        boolean truncated = rows != null && rows.size() > maxRows;
        List<Map<String, Object>> visible = rows == null ? List.of() : truncated ? rows.subList(0, maxRows) : rows;
        long duration = System.currentTimeMillis() - started;
        log.info("Executed query in {} ms ({} rows{})", duration, visible.size(), truncated ? ", truncated" : "");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("headers", headers);
        result.put("rows", new ArrayList<>(visible));
        result.put("rowCount", visible.size());
        result.put("truncated", truncated);
        result.put("durationMs", duration);
        result.put("effectiveSql", effectiveSql);
        return result;
    }
}
