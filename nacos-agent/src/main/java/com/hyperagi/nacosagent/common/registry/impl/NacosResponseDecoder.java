package com.hyperagi.nacosagent.common.registry.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperagi.nacosagent.common.registry.exception.DecodeException;
import com.hyperagi.nacosagent.common.registry.exception.ErrorCode;
import com.hyperagi.nacosagent.common.registry.model.HeartbeatResult;
import com.hyperagi.nacosagent.common.registry.model.ServiceDetail;
import com.hyperagi.nacosagent.common.registry.model.ServiceInstance;
import com.hyperagi.nacosagent.common.registry.model.ServiceSnapshot;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nacos v1 响应解析
 * <p>
 * 只校验各操作真正依赖的字段，其余字段缺失时取默认值
 */
public class NacosResponseDecoder {

    /**
     * Nacos 分组与服务名的分隔符，例如 DEFAULT_GROUP@@test
     */
    static final String GROUP_SEPARATOR = "@@";

    /**
     * 心跳响应中表示实例不存在的业务码
     */
    static final int RESOURCE_NOT_FOUND = 20404;

    private final ObjectMapper objectMapper;

    public NacosResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析实例列表响应
     */
    public ServiceSnapshot decodeSnapshot(String body) {
        JsonNode root = readObject("listInstances", body);

        JsonNode hosts = root.get("hosts");
        if (hosts == null || !hosts.isArray()) {
            throw DecodeException.missingField("listInstances", "hosts");
        }

        List<ServiceInstance> instances = new ArrayList<>(hosts.size());
        for (JsonNode host : hosts) {
            instances.add(decodeInstance(host));
        }

        String rawName = root.path("name").asText(null);
        String groupName = root.path("groupName").asText(null);
        if (groupName == null && rawName != null && rawName.contains(GROUP_SEPARATOR)) {
            groupName = rawName.substring(0, rawName.indexOf(GROUP_SEPARATOR));
        }

        return new ServiceSnapshot(
                stripGroup(rawName),
                groupName,
                root.path("clusters").asText(""),
                root.path("cacheMillis").asLong(0),
                instances);
    }

    /**
     * 解析服务详情响应
     */
    public ServiceDetail decodeDetail(String body) {
        JsonNode root = readObject("getServiceDetail", body);

        String name = root.path("name").asText(null);
        if (name == null) {
            name = root.path("serviceName").asText(null);
        }
        if (name == null) {
            throw DecodeException.missingField("getServiceDetail", "name");
        }

        List<String> clusters = new ArrayList<>();
        JsonNode clusterNode = root.path("clusters");
        if (clusterNode.isArray()) {
            for (JsonNode cluster : clusterNode) {
                clusters.add(cluster.isTextual() ? cluster.asText() : cluster.path("name").asText());
            }
        } else if (root.path("clusterMap").isObject()) {
            root.path("clusterMap").fieldNames().forEachRemaining(clusters::add);
        }

        Integer instanceCount = null;
        if (root.hasNonNull("ipCount")) {
            instanceCount = root.get("ipCount").asInt();
        } else if (root.hasNonNull("instanceCount")) {
            instanceCount = root.get("instanceCount").asInt();
        }

        return new ServiceDetail(
                stripGroup(name),
                root.path("groupName").asText(null),
                clusters,
                root.path("protectThreshold").asDouble(0.0),
                instanceCount,
                decodeMetadata(root.path("metadata")));
    }

    /**
     * 解析心跳响应
     * <p>
     * 老版本服务端直接返回纯文本 ok，视为成功但不支持轻量心跳
     */
    public HeartbeatResult decodeHeartbeat(String body) {
        if (body != null && "ok".equalsIgnoreCase(body.trim())) {
            return new HeartbeatResult(false, -1, 0);
        }

        JsonNode root = readObject("sendHeartbeat", body);
        return new HeartbeatResult(
                root.path("lightBeatEnabled").asBoolean(false),
                root.path("clientBeatInterval").asLong(-1),
                root.path("code").asInt(0));
    }

    /**
     * 心跳响应体中的业务码是否表示实例不存在
     */
    public boolean isHeartbeatNotFound(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root != null && root.path("code").asInt(0) == RESOURCE_NOT_FOUND;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /**
     * 解析登录响应
     */
    public LoginResponse decodeLogin(String body) {
        JsonNode root = readObject("login", body);
        String token = root.path("accessToken").asText(null);
        if (token == null || token.isEmpty()) {
            throw DecodeException.missingField("login", "accessToken");
        }
        return new LoginResponse(token, root.path("tokenTtl").asLong(-1));
    }

    // ==================== 私有辅助方法 ====================

    private ServiceInstance decodeInstance(JsonNode host) {
        if (!host.hasNonNull("ip")) {
            throw DecodeException.missingField("listInstances", "hosts[].ip");
        }
        if (!host.hasNonNull("port")) {
            throw DecodeException.missingField("listInstances", "hosts[].port");
        }

        ServiceInstance instance = new ServiceInstance();
        instance.setInstanceId(host.path("instanceId").asText(null));
        instance.setIp(host.get("ip").asText());
        instance.setPort(host.get("port").asInt());
        instance.setWeight(host.path("weight").asDouble(1.0));
        instance.setHealthy(host.path("healthy").asBoolean(true));
        instance.setEnabled(host.path("enabled").asBoolean(true));
        instance.setEphemeral(host.path("ephemeral").asBoolean(true));
        instance.setClusterName(host.path("clusterName").asText(null));
        instance.setServiceName(stripGroup(host.path("serviceName").asText(null)));
        instance.setMetadata(decodeMetadata(host.path("metadata")));
        return instance;
    }

    private Map<String, String> decodeMetadata(JsonNode node) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return metadata;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            metadata.put(field.getKey(), field.getValue().asText());
        }
        return metadata;
    }

    private JsonNode readObject(String operation, String body) {
        if (body == null || body.isBlank()) {
            throw new DecodeException(ErrorCode.INVALID_JSON, operation + " 响应体为空");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new DecodeException(ErrorCode.INVALID_JSON, operation + " 响应不是 JSON 对象");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new DecodeException(ErrorCode.INVALID_JSON,
                    operation + " 响应不是合法 JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String stripGroup(String name) {
        if (name == null) {
            return null;
        }
        int index = name.indexOf(GROUP_SEPARATOR);
        return index >= 0 ? name.substring(index + GROUP_SEPARATOR.length()) : name;
    }

    /**
     * 登录响应
     */
    public record LoginResponse(String accessToken, long tokenTtlSeconds) {
    }
}
