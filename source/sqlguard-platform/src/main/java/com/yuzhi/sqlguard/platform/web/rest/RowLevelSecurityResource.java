package com.yuzhi.sqlguard.platform.web.rest;

import com.yuzhi.sqlguard.common.security.AuthenticatedUser;
import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;
import com.yuzhi.sqlguard.platform.service.query.SecureQueryService;
import com.yuzhi.sqlguard.platform.service.security.ControlTableRoleResolver;
import com.yuzhi.sqlguard.platform.service.security.RowLevelSecurityService;
import com.yuzhi.sqlguard.platform.service.security.SecurityGuardException;
import com.yuzhi.sqlguard.platform.service.security.TableCoverage;
import com.yuzhi.sqlguard.platform.web.rest.dto.RewriteResponse;
import com.yuzhi.sqlguard.platform.web.rest.dto.SqlRequest;
import jakarta.validation.Valid;
import java.security.Principal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Row-level security endpoints. The caller's roles come from the control table, keyed by the authenticated
 * principal's name. Failures never fall back to unfiltered execution: they are returned as error envelopes.
 */
@RestController
@RequestMapping("/api/rls")
public class RowLevelSecurityResource {

    private static final Logger log = LoggerFactory.getLogger(RowLevelSecurityResource.class);

    private final RowLevelSecurityService rowLevelSecurity;
    private final SecureQueryService secureQueryService;
    private final ControlTableRoleResolver roleResolver;

    public RowLevelSecurityResource(
        RowLevelSecurityService rowLevelSecurity,
        SecureQueryService secureQueryService,
        ControlTableRoleResolver roleResolver
    ) {
        this.rowLevelSecurity = rowLevelSecurity;
        this.secureQueryService = secureQueryService;
        this.roleResolver = roleResolver;
    }

    @PostMapping("/rewrite")
    public ApiResponse<RewriteResponse> rewrite(@Valid @RequestBody SqlRequest request, Principal principal) {
        return guarded("rewrite", principal, user -> RewriteResponse.from(rowLevelSecurity.rewriteForUser(user, request.sql())));
    }

    @PostMapping("/query")
    public ApiResponse<Map<String, Object>> query(@Valid @RequestBody SqlRequest request, Principal principal) {
        return guarded("query", principal, user -> secureQueryService.execute(user, request.sql()));
    }

    @GetMapping("/coverage")
    public ApiResponse<List<TableCoverage>> coverage(Principal principal) {
        return privileged("coverage", principal, user -> rowLevelSecurity.describeCoverage());
    }

    @PostMapping("/cache/clear")
    public ApiResponse<Map<String, Object>> clearCache(Principal principal) {
        return privileged("cache.clear", principal, user -> {
            rowLevelSecurity.clearCache();
            return Map.of("cleared", true);
        });
    }

    @PostMapping("/cache/reload")
    public ApiResponse<Map<String, Object>> reloadCache(Principal principal) {
        return privileged("cache.reload", principal, user -> Map.of("users", rowLevelSecurity.reloadUserCache()));
    }

    @DeleteMapping("/cache/users/{username}")
    public ApiResponse<Map<String, Object>> clearUserCache(@PathVariable String username, Principal principal) {
        return privileged("cache.user", principal, user -> {
            rowLevelSecurity.clearUserCache(username);
            return Map.of("cleared", username);
        });
    }

    private <T> ApiResponse<T> privileged(String action, Principal principal, UserAction<T> body) {
        return guarded(action, principal, user -> {
            if (!rowLevelSecurity.isPrivileged(user)) {
                throw new SecurityGuardException(PolicyErrorCodes.RBAC_DENY, "Administrator role required");
            }
            return body.apply(user);
        });
    }

    private <T> ApiResponse<T> guarded(String action, Principal principal, UserAction<T> body) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return ApiResponses.denied(PolicyErrorCodes.NOT_AUTHENTICATED, "Authentication required");
        }
        try {
            AuthenticatedUser user = roleResolver.resolveUser(principal.getName());
            return ApiResponses.ok(body.apply(user));
        } catch (SecurityGuardException ex) {
            log.warn("RLS {} refused for {}: [{}] {}", action, principal.getName(), ex.getCode(), ex.getMessage());
            if (PolicyErrorCodes.RBAC_DENY.equals(ex.getCode()) || PolicyErrorCodes.USER_NOT_FOUND.equals(ex.getCode())) {
                return ApiResponses.denied(ex.getCode(), ex.getMessage());
            }
            return ApiResponses.error(ex.getCode(), ex.getMessage());
        } catch (IllegalArgumentException ex) {
            return ApiResponses.error(ex.getMessage());
        } catch (DataAccessException ex) {
            log.error("RLS {} failed for {}", action, principal.getName(), ex);
            return ApiResponses.error("Query failed: " + ex.getMostSpecificCause().getMessage());
        }
    }

    @FunctionalInterface
    private interface UserAction<T> {
        T apply(AuthenticatedUser user);
    }
}
