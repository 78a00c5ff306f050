package com.hyperagi.nacosagent.registration;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 注册连接统计
 * <p>
 * 调度线程写入，HTTP 线程读取
 */
public class ConnectionStats {

    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successfulConnections = new AtomicLong();
    private final AtomicLong failedConnections = new AtomicLong();
    private final AtomicLong heartbeatSuccessCount = new AtomicLong();
    private final AtomicLong heartbeatFailCount = new AtomicLong();
    private final AtomicReference<Instant> lastSuccessTime = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public void recordAttempt() {
        totalAttempts.incrementAndGet();
    }

    public void recordConnectSuccess(Instant now) {
        successfulConnections.incrementAndGet();
        lastSuccessTime.set(now);
        lastError.set(null);
    }

    public void recordConnectFailure(String error) {
        failedConnections.incrementAndGet();
        lastError.set(error);
    }

    public void recordHeartbeatSuccess(Instant now) {
        heartbeatSuccessCount.incrementAndGet();
        lastSuccessTime.set(now);
    }

    public void recordHeartbeatFailure(String error) {
        heartbeatFailCount.incrementAndGet();
        lastError.set(error);
    }

    public long getTotalAttempts() {
        return totalAttempts.get();
    }

    public long getSuccessfulConnections() {
        return successfulConnections.get();
    }

    public long getFailedConnections() {
        return failedConnections.get();
    }

    public long getHeartbeatSuccessCount() {
        return heartbeatSuccessCount.get();
    }

    public long getHeartbeatFailCount() {
        return heartbeatFailCount.get();
    }

    public Instant getLastSuccessTime() {
        return lastSuccessTime.get();
    }

    public String getLastError() {
        return lastError.get();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalAttempts", getTotalAttempts());
        map.put("successfulConnections", getSuccessfulConnections());
        map.put("failedConnections", getFailedConnections());
        map.put("heartbeatSuccessCount", getHeartbeatSuccessCount());
        map.put("heartbeatFailCount", getHeartbeatFailCount());
        Instant last = getLastSuccessTime();
        map.put("lastSuccessTime", last != null ? last.toString() : null);
        map.put("lastError", getLastError());
        return map;
    }

    @Override
    public String toString() {
        return "ConnectionStats{" +
                "attempts=" + getTotalAttempts() +
                ", success=" + getSuccessfulConnections() +
                ", failed=" + getFailedConnections() +
                ", heartbeatOk=" + getHeartbeatSuccessCount() +
                ", heartbeatFail=" + getHeartbeatFailCount() +
                '}';
    }
}
