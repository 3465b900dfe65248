package com.tradefeed.orderservice.security;

import lombok.Value;

import java.util.UUID;

/**
 * An authenticated seller: the shop they act for and who they are.
 */
@Value
public class TenantAccess {
    UUID tenantId;
    UUID callerId;
    String role;
}
