package com.hyperagi.nacosagent.common.registry.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 有状态的 Nacos v1 命名服务模拟，只实现客户端用到的几个接口
 */
class FakeNacosRegistry extends Dispatcher {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Map<String, ObjectNode>> services = new ConcurrentHashMap<>();

    @Override
    public MockResponse dispatch(RecordedRequest request) {
        HttpUrl url = request.getRequestUrl();
        String path = url.encodedPath();
        String method = request.getMethod();

        if ("GET".equals(method) && NacosHttpNamingClient.INSTANCE_LIST_PATH.equals(path)) {
            return list(url);
        }
        if ("POST".equals(method) && NacosHttpNamingClient.INSTANCE_PATH.equals(path)) {
            return register(formParams(request));
        }
        if ("DELETE".equals(method) && NacosHttpNamingClient.INSTANCE_PATH.equals(path)) {
            return deregister(url);
        }
        if ("PUT".equals(method) && NacosHttpNamingClient.BEAT_PATH.equals(path)) {
            return beat(formParams(request));
        }
        return new MockResponse().setResponseCode(404).setBody("no handler for " + method + " " + path);
    }

    int instanceCount(String serviceName) {
        return services.getOrDefault(serviceName, Map.of()).size();
    }

    private MockResponse list(HttpUrl params) {
        String serviceName = params.queryParameter("serviceName");
        String group = groupOf(params.queryParameter("groupName"));

        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", group + "@@" + serviceName);
        root.put("groupName", group);
        root.put("clusters", "");
        root.put("cacheMillis", 3000);
        ArrayNode hosts = root.putArray("hosts");
        services.getOrDefault(serviceName, Map.of()).values().forEach(hosts::add);
        return json(root.toString());
    }

    private MockResponse register(HttpUrl params) {
        String serviceName = params.queryParameter("serviceName");
        String ip = params.queryParameter("ip");
        int port = Integer.parseInt(params.queryParameter("port"));

        ObjectNode host = objectMapper.createObjectNode();
        host.put("instanceId", ip + "#" + port + "#DEFAULT#" + groupOf(params.queryParameter("groupName")) + "@@" + serviceName);
        host.put("ip", ip);
        host.put("port", port);
        host.put("weight", Double.parseDouble(params.queryParameter("weight")));
        host.put("healthy", Boolean.parseBoolean(params.queryParameter("healthy")));
        host.put("enabled", Boolean.parseBoolean(params.queryParameter("enabled")));
        host.put("ephemeral", true);
        host.put("clusterName", "DEFAULT");
        host.put("serviceName", groupOf(params.queryParameter("groupName")) + "@@" + serviceName);
        host.putObject("metadata");

        services.computeIfAbsent(serviceName, k -> new ConcurrentHashMap<>()).put(key(ip, port), host);
        return new MockResponse().setBody("ok");
    }

    private MockResponse deregister(HttpUrl params) {
        String serviceName = params.queryParameter("serviceName");
        String key = key(params.queryParameter("ip"), Integer.parseInt(params.queryParameter("port")));
        Map<String, ObjectNode> instances = services.get(serviceName);
        if (instances == null || instances.remove(key) == null) {
            return new MockResponse().setResponseCode(400).setBody("caused: instance not found: " + key);
        }
        return new MockResponse().setBody("ok");
    }

    private MockResponse beat(HttpUrl params) {
        String serviceName = params.queryParameter("serviceName");
        String key = key(params.queryParameter("ip"), Integer.parseInt(params.queryParameter("port")));
        Map<String, ObjectNode> instances = services.get(serviceName);
        if (instances == null || !instances.containsKey(key)) {
            return json("{\"clientBeatInterval\":5000,\"code\":20404}");
        }
        return json("{\"clientBeatInterval\":5000,\"code\":10200,\"lightBeatEnabled\":true}");
    }

    /**
     * 表单体借用 HttpUrl 的查询串解析
     */
    private static HttpUrl formParams(RecordedRequest request) {
        return HttpUrl.get("http://localhost/?" + request.getBody().clone().readUtf8());
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private static String groupOf(String groupName) {
        return groupName == null || groupName.isEmpty() ? "DEFAULT_GROUP" : groupName;
    }

    private static String key(String ip, int port) {
        return ip + ":" + port;
    }
}
