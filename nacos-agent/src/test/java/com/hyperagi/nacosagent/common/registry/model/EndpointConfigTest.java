package com.hyperagi.nacosagent.common.registry.model;

import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EndpointConfig 单元测试")
class EndpointConfigTest {

    @Test
    @DisplayName("地址规范化：补全协议、只取第一个、去掉路径")
    void testNormalizeBaseUrl() {
        assertEquals("http://nacos.hyperagi.network:80", EndpointConfig.normalizeBaseUrl("http://nacos.hyperagi.network:80"));
        assertEquals("http://10.0.0.1:8848", EndpointConfig.normalizeBaseUrl("10.0.0.1:8848"));
        assertEquals("http://a:8848", EndpointConfig.normalizeBaseUrl(" a:8848 , b:8848"));
        assertEquals("https://nacos.example.com:443", EndpointConfig.normalizeBaseUrl("https://nacos.example.com/"));
        assertEquals("http://nacos:80", EndpointConfig.normalizeBaseUrl("nacos"));
    }

    @Test
    @DisplayName("IPv6 地址保留方括号，可直接拼接请求路径")
    void testNormalizeIpv6BaseUrl() {
        // Act
        String baseUrl = EndpointConfig.normalizeBaseUrl("http://[::1]:8848");

        // Assert
        assertEquals("http://[::1]:8848", baseUrl);
        HttpUrl url = HttpUrl.get(baseUrl + "/nacos/v1/ns/instance/list");
        assertEquals("::1", url.host());
        assertEquals(8848, url.port());
    }

    @Test
    @DisplayName("空地址或非法地址抛出 ConfigException")
    void testInvalidServer() {
        assertThrows(ConfigException.class, () -> EndpointConfig.of(null));
        assertThrows(ConfigException.class, () -> EndpointConfig.of("  "));
        assertThrows(ConfigException.class, () -> EndpointConfig.of(",b:8848"));
        assertThrows(ConfigException.class, () -> EndpointConfig.of("ftp://nacos:21"));
    }

    @Test
    @DisplayName("默认超时 8 秒、token 有效期 18000 秒")
    void testDefaults() {
        EndpointConfig config = EndpointConfig.of("nacos:8848");

        assertEquals(Duration.ofSeconds(8), config.getRequestTimeout());
        assertEquals(Duration.ofSeconds(18000), config.getTokenTtl());
        assertFalse(config.hasCredentials());
    }

    @Test
    @DisplayName("用户名密码必须成对出现")
    void testCredentialPair() {
        assertThrows(ConfigException.class,
                () -> new EndpointConfig("nacos:8848", "nacos", "", null, null));
        assertThrows(ConfigException.class,
                () -> new EndpointConfig("nacos:8848", null, "secret", null, null));

        EndpointConfig config = new EndpointConfig("nacos:8848", "nacos", "secret", null, null);
        assertTrue(config.hasCredentials());
    }

    @Test
    @DisplayName("非正超时抛出 ConfigException")
    void testNonPositiveTimeout() {
        assertThrows(ConfigException.class,
                () -> new EndpointConfig("nacos:8848", null, null, Duration.ZERO, null));
        assertThrows(ConfigException.class,
                () -> new EndpointConfig("nacos:8848", null, null, null, Duration.ofSeconds(-1)));
    }

    @Test
    @DisplayName("toString 不输出密码")
    void testToStringMasksPassword() {
        EndpointConfig config = new EndpointConfig("nacos:8848", "nacos", "topsecret", null, null);

        assertFalse(config.toString().contains("topsecret"));
        assertTrue(config.toString().contains("***"));
    }

    @Test
    @DisplayName("AccessToken 提前 ttl/10 过期")
    void testAccessTokenExpiry() {
        Instant issued = Instant.parse("2024-01-01T00:00:00Z");
        AccessToken token = new AccessToken("t", issued, Duration.ofSeconds(18000));

        assertFalse(token.isExpired(issued.plusSeconds(16199)));
        assertTrue(token.isExpired(issued.plusSeconds(16200)));
    }
}
