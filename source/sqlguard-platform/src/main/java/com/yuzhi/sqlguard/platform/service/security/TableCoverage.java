package com.yuzhi.sqlguard.platform.service.security;

import java.util.List;

public record TableCoverage(String table, CoverageStatus status, List<String> filterColumns) {

    public TableCoverage {
        filterColumns = filterColumns == null ? List.of() : List.copyOf(filterColumns);
    }
}
