package com.tradefeed.orderservice.security;

import org.springframework.security.oauth2.jwt.Jwt;

public interface TenantAccessResolver {

    /**
     * @throws com.tradefeed.common.exception.AccessDeniedException if the token
     *         does not carry a tenant or a seller role
     */
    TenantAccess resolve(Jwt jwt);
}
