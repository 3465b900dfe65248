package com.tradefeed.orderservice.security;

import com.tradefeed.common.exception.AccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reads the tenant from the {@code tenant_id} claim and the role from
 * {@code resource_access.tradefeed-backend.roles}.
 */
@Component
@Slf4j
public class JwtTenantAccessResolver implements TenantAccessResolver {

    static final String TENANT_CLAIM = "tenant_id";
    static final String CLIENT_ID = "tradefeed-backend";
    static final String ROLE_OWNER = "OWNER";
    static final String ROLE_SELLER = "SELLER";

    @Override
    public TenantAccess resolve(Jwt jwt) {
        if (jwt == null) {
            throw new AccessDeniedException("Authentication required");
        }

        UUID tenantId = parseUuid(jwt.getClaimAsString(TENANT_CLAIM))
                .orElseThrow(() -> {
                    log.warn("Token without a valid tenant claim: subject={}", jwt.getSubject());
                    return new AccessDeniedException("No shop is linked to this account");
                });
        UUID callerId = parseUuid(jwt.getSubject())
                .orElseThrow(() -> new AccessDeniedException("Invalid token subject"));

        List<String> roles = getRoles(jwt);
        String role;
        if (roles.contains(ROLE_OWNER)) {
            role = ROLE_OWNER;
        } else if (roles.contains(ROLE_SELLER)) {
            role = ROLE_SELLER;
        } else {
            log.warn("Token without a seller role: subject={}, roles={}", jwt.getSubject(), roles);
            throw new AccessDeniedException("Only sellers can manage orders");
        }

        return new TenantAccess(tenantId, callerId, role);
    }

    private List<String> getRoles(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(CLIENT_ID))
                .filter(Map.class::isInstance)
                .map(backend -> (Map<?, ?>) backend)
                .map(backendMap -> backendMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    private static Optional<UUID> parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
