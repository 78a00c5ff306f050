package com.hyperagi.nacosagent.common.diagnostics.model;

import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ServerAddress 解析测试")
class ServerAddressTest {

    @Test
    @DisplayName("四种写法")
    void testParseForms() {
        assertEquals(new ServerAddress("http", "nacos.hyperagi.network", 80),
                ServerAddress.parse("http://nacos.hyperagi.network:80"));
        assertEquals(new ServerAddress("https", "nacos.example.com", 443),
                ServerAddress.parse("https://nacos.example.com"));
        assertEquals(new ServerAddress("http", "10.0.0.1", 8848), ServerAddress.parse("10.0.0.1:8848"));
        assertEquals(new ServerAddress("http", "nacos", 80), ServerAddress.parse("nacos"));
    }

    @Test
    @DisplayName("逗号分隔只取第一个")
    void testFirstOfList() {
        ServerAddress address = ServerAddress.parse("a.example.com:8848, b.example.com:8848");

        assertEquals("a.example.com", address.host());
        assertEquals("http://a.example.com:8848", address.baseUrl());
        assertEquals("a.example.com:8848", address.toString());
    }

    @Test
    @DisplayName("空地址抛出 ConfigException")
    void testBlank() {
        assertThrows(ConfigException.class, () -> ServerAddress.parse(""));
        assertThrows(ConfigException.class, () -> ServerAddress.parse(null));
    }
}
