package com.yuzhi.sqlguard.platform.service.query;

import java.util.Map;

public interface QueryGateway {
    /**
     * Execute a read-only query with named bind parameters and return a simple tabular payload
     * ({@code headers}, {@code rows}, {@code rowCount}, {@code truncated}, {@code durationMs}, {@code effectiveSql}).
     */
    Map<String, Object> execute(String effectiveSql, Map<String, Object> bindParams);
}
