package com.hyperagi.nacosagent.common.registry.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperagi.nacosagent.common.registry.api.NamingClient;
import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import com.hyperagi.nacosagent.common.registry.exception.ErrorCode;
import com.hyperagi.nacosagent.common.registry.exception.ProtocolException;
import com.hyperagi.nacosagent.common.registry.exception.TransportException;
import com.hyperagi.nacosagent.common.registry.model.AccessToken;
import com.hyperagi.nacosagent.common.registry.model.EndpointConfig;
import com.hyperagi.nacosagent.common.registry.model.HeartbeatResult;
import com.hyperagi.nacosagent.common.registry.model.InstanceRequest;
import com.hyperagi.nacosagent.common.registry.model.RegistryResult;
import com.hyperagi.nacosagent.common.registry.model.ServiceDetail;
import com.hyperagi.nacosagent.common.registry.model.ServiceSnapshot;
import okhttp3.Call;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 基于 Nacos v1 Open API 的命名服务客户端
 * <p>
 * 功能：
 * 1. 固定的几个 HTTP 调用（实例列表、服务详情、注册、注销、心跳、登录）
 * 2. JSON 响应解析，失败按传输 / 协议 / 解析分类抛出
 * 3. 配置了用户名密码时自动登录，401/403 时刷新 token 并重试一次
 * <p>
 * 除鉴权重试外不做任何重试。
 */
public class NacosHttpNamingClient implements NamingClient {

    private static final Logger logger = LoggerFactory.getLogger(NacosHttpNamingClient.class);

    public static final String INSTANCE_LIST_PATH = "/nacos/v1/ns/instance/list";
    public static final String SERVICE_PATH = "/nacos/v1/ns/service";
    public static final String INSTANCE_PATH = "/nacos/v1/ns/instance";
    public static final String BEAT_PATH = "/nacos/v1/ns/instance/beat";
    public static final String LOGIN_PATH = "/nacos/v1/auth/login";

    /**
     * logback 中 %registryOp 读取的 MDC 键
     */
    public static final String MDC_OPERATION_KEY = "registryOp";

    private static final String USER_AGENT = "nacos-agent/1.0";
    private static final String DEFAULT_CLUSTER = "DEFAULT";
    private static final String DEFAULT_GROUP = "DEFAULT_GROUP";
    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;

    private final EndpointConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final NacosResponseDecoder decoder;
    private final Clock clock;
    private final AccessTokenManager tokenManager;

    public NacosHttpNamingClient(EndpointConfig config) {
        this(config, buildHttpClient(config), new ObjectMapper(), Clock.systemUTC());
    }

    public NacosHttpNamingClient(EndpointConfig config, OkHttpClient httpClient,
                                 ObjectMapper objectMapper, Clock clock) {
        if (config == null) {
            throw new ConfigException("注册中心端点配置为空");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.decoder = new NacosResponseDecoder(objectMapper);
        this.clock = clock;
        this.tokenManager = config.hasCredentials() ? new AccessTokenManager(this::login, clock) : null;

        logger.info("[client-init] Nacos 客户端初始化: {}", config);
    }

    /**
     * 按配置的请求超时构建 OkHttpClient，callTimeout 约束整个调用（含 DNS、连接、读写）
     */
    public static OkHttpClient buildHttpClient(EndpointConfig config) {
        long timeoutMs = config.getRequestTimeout().toMillis();
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    // ==================== 查询 ====================

    @Override
    public ServiceSnapshot listInstances(String serviceName, String groupName, String clusters, boolean healthyOnly) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("serviceName", requireServiceName(serviceName));
        putIfPresent(params, "groupName", groupName);
        putIfPresent(params, "clusters", clusters);
        if (healthyOnly) {
            params.put("healthyOnly", "true");
        }

        logger.info("🔍 获取服务实例列表: service={}, group={}, clusters={}, healthyOnly={}",
                serviceName, orDefault(groupName), clusters, healthyOnly);

        String body = execute("listInstances", Method.GET, INSTANCE_LIST_PATH, params);
        ServiceSnapshot snapshot = decoder.decodeSnapshot(body);

        logger.info("✅ 实例列表获取成功: service={}, 实例数={}, 健康数={}",
                serviceName, snapshot.size(), snapshot.healthyCount());
        return snapshot;
    }

    @Override
    public ServiceDetail getServiceDetail(String serviceName, String groupName) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("serviceName", requireServiceName(serviceName));
        putIfPresent(params, "groupName", groupName);

        logger.info("🔍 获取服务详情: service={}, group={}", serviceName, orDefault(groupName));

        String body = execute("getServiceDetail", Method.GET, SERVICE_PATH, params);
        ServiceDetail detail = decoder.decodeDetail(body);

        logger.info("✅ 服务详情获取成功: service={}, clusters={}, protectThreshold={}",
                detail.getName(), detail.getClusters(), detail.getProtectThreshold());
        return detail;
    }

    // ==================== 注册 / 注销 ====================

    @Override
    public RegistryResult registerInstance(InstanceRequest request) {
        Map<String, String> params = identityParams(request);
        params.put("weight", String.valueOf(request.getWeight() != null ? request.getWeight() : 1.0));
        params.put("healthy", "true");
        params.put("enabled", "true");
        if (request.getEphemeral() != null) {
            params.put("ephemeral", String.valueOf(request.getEphemeral()));
        }
        if (request.getMetadata() != null && !request.getMetadata().isEmpty()) {
            params.put("metadata", toJson(request.getMetadata()));
        }

        logger.info("📝 注册服务实例: {}", request.describe());

        String body = execute("registerInstance", Method.POST, INSTANCE_PATH, params);

        logger.info("✅ 实例注册成功: {}", request.describe());
        return RegistryResult.success(body == null || body.isBlank() ? "ok" : body.trim());
    }

    @Override
    public RegistryResult deregisterInstance(InstanceRequest request) {
        Map<String, String> params = identityParams(request);
        if (request.getEphemeral() != null) {
            params.put("ephemeral", String.valueOf(request.getEphemeral()));
        }

        logger.info("🗑️ 注销服务实例: {}", request.describe());

        try {
            String body = execute("deregisterInstance", Method.DELETE, INSTANCE_PATH, params);
            logger.info("✅ 实例注销成功: {}", request.describe());
            return RegistryResult.success(body == null || body.isBlank() ? "ok" : body.trim());
        } catch (ProtocolException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            logger.info("实例不存在，按注销成功处理: {}, server={}", request.describe(), e.getServerMessage());
            return RegistryResult.notFound(e.getMessage());
        }
    }

    // ==================== 心跳 ====================

    @Override
    public HeartbeatResult sendHeartbeat(InstanceRequest request) {
        Map<String, String> params = identityParams(request);
        params.put("beat", toJson(buildBeatInfo(request)));

        logger.debug("💓 发送心跳: {}", request.describe());

        String body = execute("sendHeartbeat", Method.PUT, BEAT_PATH, params);
        if (decoder.isHeartbeatNotFound(body)) {
            throw new ProtocolException(404, ErrorCode.NOT_FOUND,
                    "server code " + NacosResponseDecoder.RESOURCE_NOT_FOUND + ": instance not found, " + request.describe());
        }

        HeartbeatResult result = decoder.decodeHeartbeat(body);
        logger.debug("心跳成功: {}, {}", request.describe(), result);
        return result;
    }

    // ==================== 鉴权 ====================

    @Override
    public AccessToken login() {
        if (!config.hasCredentials()) {
            throw new ConfigException("未配置用户名密码，无法登录");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("username", config.getUsername());
        params.put("password", config.getPassword());

        logger.info("🔑 登录 Nacos: username={}", config.getUsername());

        RawResponse response = withOperation("login", () -> exchange(Method.POST, LOGIN_PATH, params, null));
        if (!response.isSuccessful()) {
            throw ProtocolException.fromResponse(response.status(), response.body());
        }

        NacosResponseDecoder.LoginResponse login = decoder.decodeLogin(response.body());
        Duration ttl = config.getTokenTtl();
        if (login.tokenTtlSeconds() > 0 && Duration.ofSeconds(login.tokenTtlSeconds()).compareTo(ttl) < 0) {
            ttl = Duration.ofSeconds(login.tokenTtlSeconds());
        }

        logger.info("✅ 登录成功，token 有效期 {} 秒", ttl.toSeconds());
        return new AccessToken(login.accessToken(), clock.instant(), ttl);
    }

    @Override
    public void close() {
        httpClient.dispatcher().cancelAll();
        httpClient.connectionPool().evictAll();
        logger.info("Nacos 客户端已关闭: {}", config.getBaseUrl());
    }

    public EndpointConfig getConfig() {
        return config;
    }

    // ==================== 私有辅助方法 ====================

    /**
     * 执行请求：附带 token，401/403 时刷新 token 重试一次，非 2xx 抛 ProtocolException
     */
    private String execute(String operation, Method method, String path, Map<String, String> params) {
        return withOperation(operation, () -> {
            String token = tokenManager != null ? tokenManager.getToken() : null;
            RawResponse response = exchange(method, path, params, token);

            if (response.isAuthFailure() && tokenManager != null) {
                logger.warn("鉴权失败 HTTP {}，刷新 accessToken 后重试一次: op={}", response.status(), operation);
                tokenManager.invalidate(token);
                response = exchange(method, path, params, tokenManager.getToken());
            }

            if (!response.isSuccessful()) {
                ProtocolException e = ProtocolException.fromResponse(response.status(), response.body());
                logger.warn("❌ 请求失败: op={}, status={}, code={}", operation, response.status(), e.getErrorCode());
                throw e;
            }
            return response.body();
        });
    }

    /**
     * 单次 HTTP 交换，Response 在所有出口（含异常、取消）上都会关闭
     */
    private RawResponse exchange(Method method, String path, Map<String, String> params, String token) {
        HttpUrl baseUrl = HttpUrl.get(config.getBaseUrl() + path);
        HttpUrl.Builder urlBuilder = baseUrl.newBuilder();
        Request.Builder requestBuilder = new Request.Builder().header("User-Agent", USER_AGENT);

        if (token != null) {
            urlBuilder.addQueryParameter("accessToken", token);
            requestBuilder.header("Authorization", "Bearer " + token);
        }

        if (method.hasBody) {
            FormBody.Builder form = new FormBody.Builder();
            params.forEach(form::add);
            requestBuilder.method(method.name(), form.build());
        } else {
            params.forEach(urlBuilder::addQueryParameter);
            requestBuilder.method(method.name(), null);
        }

        Request request = requestBuilder.url(urlBuilder.build()).build();
        String target = method.name() + " " + config.getBaseUrl() + path;
        Call call = httpClient.newCall(request);

        long startTime = System.currentTimeMillis();
        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            logger.debug("📡 {} -> HTTP {} ({} ms)", target, response.code(), System.currentTimeMillis() - startTime);
            return new RawResponse(response.code(), text);
        } catch (IOException e) {
            TransportException te = TransportException.from(e, call.isCanceled(), target);
            logger.warn("❌ 网络请求失败: {} [{}], 耗时 {} ms", target, te.getErrorCode(),
                    System.currentTimeMillis() - startTime);
            throw te;
        }
    }

    private <T> T withOperation(String operation, Supplier<T> action) {
        String previous = MDC.get(MDC_OPERATION_KEY);
        MDC.put(MDC_OPERATION_KEY, operation);
        try {
            return action.get();
        } finally {
            if (previous != null) {
                MDC.put(MDC_OPERATION_KEY, previous);
            } else {
                MDC.remove(MDC_OPERATION_KEY);
            }
        }
    }

    private Map<String, String> identityParams(InstanceRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("实例参数为空");
        }
        if (request.getPort() < MIN_PORT || request.getPort() > MAX_PORT) {
            throw new IllegalArgumentException("端口号超出范围: " + request.getPort() + " (应在1-65535之间)");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("serviceName", requireServiceName(request.getServiceName()));
        params.put("ip", requireIp(request.getIp()));
        params.put("port", String.valueOf(request.getPort()));
        putIfPresent(params, "clusterName", request.getClusterName());
        putIfPresent(params, "groupName", request.getGroupName());
        return params;
    }

    /**
     * 心跳 beat 参数，服务名按 Nacos 约定带分组前缀
     */
    private Map<String, Object> buildBeatInfo(InstanceRequest request) {
        Map<String, Object> beat = new LinkedHashMap<>();
        beat.put("serviceName", orDefault(request.getGroupName()) + NacosResponseDecoder.GROUP_SEPARATOR
                + request.getServiceName());
        beat.put("ip", request.getIp());
        beat.put("port", request.getPort());
        beat.put("cluster", isBlank(request.getClusterName()) ? DEFAULT_CLUSTER : request.getClusterName());
        beat.put("weight", request.getWeight() != null ? request.getWeight() : 1.0);
        beat.put("metadata", request.getMetadata() != null ? request.getMetadata() : Map.of());
        beat.put("scheduled", false);
        return beat;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("无法序列化为 JSON: " + value, e);
        }
    }

    private static String requireServiceName(String serviceName) {
        if (isBlank(serviceName)) {
            throw new IllegalArgumentException("服务名不能为空");
        }
        return serviceName;
    }

    private static String requireIp(String ip) {
        if (isBlank(ip)) {
            throw new IllegalArgumentException("实例 IP 不能为空");
        }
        return ip;
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (!isBlank(value)) {
            params.put(key, value);
        }
    }

    private static String orDefault(String groupName) {
        return isBlank(groupName) ? DEFAULT_GROUP : groupName;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private enum Method {
        GET(false),
        POST(true),
        PUT(true),
        DELETE(false);

        private final boolean hasBody;

        Method(boolean hasBody) {
            this.hasBody = hasBody;
        }
    }

    private record RawResponse(int status, String body) {

        boolean isSuccessful() {
            return status >= 200 && status < 300;
        }

        boolean isAuthFailure() {
            return status == 401 || status == 403;
        }
    }
}
