package com.hyperagi.nacosagent.common.registry.model;

/**
 * 心跳结果
 */
public class HeartbeatResult {
    private final boolean lightBeatEnabled;
    private final long clientBeatInterval;
    private final int serverCode;

    public HeartbeatResult(boolean lightBeatEnabled, long clientBeatInterval, int serverCode) {
        this.lightBeatEnabled = lightBeatEnabled;
        this.clientBeatInterval = clientBeatInterval;
        this.serverCode = serverCode;
    }

    /**
     * 心跳能走到这里就是成功的，失败一律以异常形式抛出
     */
    public boolean isSuccess() {
        return true;
    }

    /**
     * 服务端是否允许轻量心跳（false 表示下次需要携带完整 beat 信息）
     */
    public boolean isLightBeatEnabled() {
        return lightBeatEnabled;
    }

    /**
     * 服务端建议的心跳间隔（毫秒），未返回时为 -1
     */
    public long getClientBeatInterval() {
        return clientBeatInterval;
    }

    public int getServerCode() {
        return serverCode;
    }

    @Override
    public String toString() {
        return "HeartbeatResult{" +
                "lightBeatEnabled=" + lightBeatEnabled +
                ", clientBeatInterval=" + clientBeatInterval +
                ", serverCode=" + serverCode +
                '}';
    }
}
