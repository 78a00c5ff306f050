package com.hyperagi.nacosagent.common.registry.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperagi.nacosagent.common.registry.exception.DecodeException;
import com.hyperagi.nacosagent.common.registry.exception.ErrorCode;
import com.hyperagi.nacosagent.common.registry.model.HeartbeatResult;
import com.hyperagi.nacosagent.common.registry.model.ServiceDetail;
import com.hyperagi.nacosagent.common.registry.model.ServiceInstance;
import com.hyperagi.nacosagent.common.registry.model.ServiceSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NacosResponseDecoder 单元测试")
class NacosResponseDecoderTest {

    private final NacosResponseDecoder decoder = new NacosResponseDecoder(new ObjectMapper());

    @Test
    @DisplayName("缺省字段取默认值")
    void testSnapshotDefaults() {
        ServiceSnapshot snapshot = decoder.decodeSnapshot(
                "{\"name\":\"G1@@svc\",\"hosts\":[{\"ip\":\"10.0.0.1\",\"port\":80}]}");

        assertEquals("svc", snapshot.getServiceName());
        assertEquals("G1", snapshot.getGroupName());
        ServiceInstance instance = snapshot.getInstances().get(0);
        assertEquals(1.0, instance.getWeight());
        assertTrue(instance.isHealthy());
        assertTrue(instance.isEnabled());
        assertTrue(instance.getMetadata().isEmpty());
        assertEquals("10.0.0.1:80", instance.getAddress());
    }

    @Test
    @DisplayName("空实例列表")
    void testEmptyHosts() {
        ServiceSnapshot snapshot = decoder.decodeSnapshot("{\"name\":\"svc\",\"hosts\":[]}");

        assertEquals(0, snapshot.size());
        assertEquals(0, snapshot.healthyCount());
    }

    @Test
    @DisplayName("实例缺少 port 抛出 MISSING_FIELD")
    void testHostMissingPort() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> decoder.decodeSnapshot("{\"hosts\":[{\"ip\":\"10.0.0.1\"}]}"));

        assertEquals(ErrorCode.MISSING_FIELD, e.getErrorCode());
        assertTrue(e.getMessage().contains("port"));
    }

    @Test
    @DisplayName("响应不是对象抛出 INVALID_JSON")
    void testNotAnObject() {
        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decodeSnapshot("[1,2]"));
        assertEquals(ErrorCode.INVALID_JSON, e.getErrorCode());

        DecodeException empty = assertThrows(DecodeException.class, () -> decoder.decodeSnapshot(""));
        assertEquals(ErrorCode.INVALID_JSON, empty.getErrorCode());
    }

    @Test
    @DisplayName("服务详情：clusterMap 与 ipCount")
    void testDetailFromClusterMap() {
        ServiceDetail detail = decoder.decodeDetail(
                "{\"serviceName\":\"svc\",\"groupName\":\"G1\",\"ipCount\":3,"
                        + "\"clusterMap\":{\"A\":{},\"B\":{}},\"protectThreshold\":0.2}");

        assertEquals("svc", detail.getName());
        assertEquals("G1", detail.getGroupName());
        assertEquals(3, detail.getInstanceCount());
        assertEquals(2, detail.getClusters().size());
        assertTrue(detail.getClusters().contains("A"));
    }

    @Test
    @DisplayName("服务详情缺少名称抛出 MISSING_FIELD")
    void testDetailMissingName() {
        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decodeDetail("{\"groupName\":\"G1\"}"));
        assertEquals(ErrorCode.MISSING_FIELD, e.getErrorCode());
    }

    @Test
    @DisplayName("心跳响应：纯文本 ok 与 JSON")
    void testHeartbeat() {
        HeartbeatResult plain = decoder.decodeHeartbeat("ok");
        assertTrue(plain.isSuccess());
        assertFalse(plain.isLightBeatEnabled());

        HeartbeatResult json = decoder.decodeHeartbeat("{\"clientBeatInterval\":5000,\"code\":10200,\"lightBeatEnabled\":true}");
        assertEquals(5000, json.getClientBeatInterval());
        assertEquals(10200, json.getServerCode());
        assertTrue(json.isLightBeatEnabled());
    }

    @Test
    @DisplayName("心跳业务码 20404 识别为实例不存在")
    void testHeartbeatNotFound() {
        assertTrue(decoder.isHeartbeatNotFound("{\"clientBeatInterval\":5000,\"code\":20404}"));
        assertFalse(decoder.isHeartbeatNotFound("{\"code\":10200}"));
        assertFalse(decoder.isHeartbeatNotFound("ok"));
        assertFalse(decoder.isHeartbeatNotFound(null));
    }

    @Test
    @DisplayName("登录响应")
    void testLogin() {
        NacosResponseDecoder.LoginResponse login = decoder.decodeLogin("{\"accessToken\":\"abc\",\"tokenTtl\":600}");
        assertEquals("abc", login.accessToken());
        assertEquals(600, login.tokenTtlSeconds());

        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decodeLogin("{\"tokenTtl\":600}"));
        assertEquals(ErrorCode.MISSING_FIELD, e.getErrorCode());
    }
}
