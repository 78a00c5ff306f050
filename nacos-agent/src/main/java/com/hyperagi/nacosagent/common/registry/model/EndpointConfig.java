package com.hyperagi.nacosagent.common.registry.model;

import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import okhttp3.HttpUrl;

import java.time.Duration;

/**
 * 注册中心端点配置
 * <p>
 * 构造时完成校验和规范化，之后不可变：
 * <ul>
 *   <li>地址可以不带协议（host:port），默认补全为 http</li>
 *   <li>逗号分隔的多个地址只取第一个</li>
 *   <li>用户名和密码必须同时设置或同时为空</li>
 * </ul>
 */
public final class EndpointConfig {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(8);
    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofSeconds(18000);

    private final String baseUrl;
    private final String username;
    private final String password;
    private final Duration requestTimeout;
    private final Duration tokenTtl;

    public EndpointConfig(String serverAddress, String username, String password,
                          Duration requestTimeout, Duration tokenTtl) {
        this.baseUrl = normalizeBaseUrl(serverAddress);
        this.username = emptyToNull(username);
        this.password = emptyToNull(password);
        if ((this.username == null) != (this.password == null)) {
            throw new ConfigException("认证信息不完整：用户名和密码必须同时设置或同时为空");
        }
        this.requestTimeout = requirePositive(requestTimeout, DEFAULT_REQUEST_TIMEOUT, "请求超时");
        this.tokenTtl = requirePositive(tokenTtl, DEFAULT_TOKEN_TTL, "Token 有效期");
    }

    /**
     * 匿名访问、默认超时
     */
    public static EndpointConfig of(String serverAddress) {
        return new EndpointConfig(serverAddress, null, null, null, null);
    }

    /**
     * 规范化服务器地址，返回不带末尾斜杠的 scheme://host:port
     *
     * @throws ConfigException 地址为空或格式错误
     */
    public static String normalizeBaseUrl(String serverAddress) {
        if (serverAddress == null || serverAddress.isBlank()) {
            throw new ConfigException("Nacos 服务器地址未配置");
        }

        String first = serverAddress.split(",")[0].trim();
        if (first.isEmpty()) {
            throw new ConfigException("Nacos 服务器地址未配置");
        }
        if (!first.contains("://")) {
            first = "http://" + first;
        }

        HttpUrl url = HttpUrl.parse(first);
        if (url == null) {
            throw new ConfigException("无效的 Nacos 服务器地址: " + serverAddress);
        }

        // IPv6 字面量需要保留方括号
        String host = url.host().contains(":") ? "[" + url.host() + "]" : url.host();
        return url.scheme() + "://" + host + ":" + url.port();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public boolean hasCredentials() {
        return username != null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static Duration requirePositive(Duration value, Duration defaultValue, String name) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isZero() || value.isNegative()) {
            throw new ConfigException(name + "必须大于 0: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "EndpointConfig{" +
                "baseUrl='" + baseUrl + '\'' +
                ", username='" + (username == null ? "" : username) + '\'' +
                ", password=" + (password == null ? "<none>" : "***") +
                ", requestTimeout=" + requestTimeout +
                ", tokenTtl=" + tokenTtl +
                '}';
    }
}
