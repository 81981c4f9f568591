package com.yuzhi.sqlguard.platform.web.rest.dto;

import jakarta.validation.constraints.NotBlank;

public record SqlRequest(@NotBlank String sql) {}
