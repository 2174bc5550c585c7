package com.example.oidclogin.domain.entity;

import java.time.Instant;

/**
 * Who the current login context belongs to, as read from its ID (or access) token.
 */
public record IdentitySummary(
    String username,
    String email,
    String name,
    String subject,
    String issuer,
    String realm,
    Instant expiresAt,
    boolean expired
) {}
