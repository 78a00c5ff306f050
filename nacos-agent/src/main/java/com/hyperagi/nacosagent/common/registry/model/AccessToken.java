package com.hyperagi.nacosagent.common.registry.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 登录换取的 accessToken
 */
public class AccessToken {
    private final String value;
    private final Instant issuedAt;
    private final Duration ttl;

    public AccessToken(String value, Instant issuedAt, Duration ttl) {
        this.value = value;
        this.issuedAt = issuedAt;
        this.ttl = ttl;
    }

    public String getValue() {
        return value;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * 提前 ttl/10 视为过期，留出刷新窗口
     */
    public boolean isExpired(Instant now) {
        Duration refreshWindow = ttl.dividedBy(10);
        return !now.isBefore(issuedAt.plus(ttl).minus(refreshWindow));
    }

    @Override
    public String toString() {
        return "AccessToken{issuedAt=" + issuedAt + ", ttl=" + ttl + '}';
    }
}
