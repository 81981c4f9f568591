package com.yuzhi.sqlguard.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sqlguard.query")
public class QueryExecutionProperties {

    /**
     * Upper bound on rows returned by one query; further rows are dropped and the result is flagged as truncated.
     */
    private int maxRows = 1000;

    private int queryTimeoutSeconds = 30;

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }
}
