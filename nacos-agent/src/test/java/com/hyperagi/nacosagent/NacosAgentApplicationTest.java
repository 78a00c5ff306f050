package com.hyperagi.nacosagent;

import com.hyperagi.nacosagent.bootstrap.AgentStartupRunner;
import com.hyperagi.nacosagent.common.registry.api.NamingClient;
import com.hyperagi.nacosagent.common.registry.impl.NacosHttpNamingClient;
import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 上下文加载测试：关闭启动注册，不访问真实注册中心
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "registry.registration.enabled=false",
                "registry.server=http://127.0.0.1:8848",
                "registry.http-timeout-seconds=3",
                "registry.heartbeat.interval=10s"
        })
@DisplayName("应用上下文加载测试")
class NacosAgentApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private NamingClient namingClient;

    @Autowired
    private RegistryProperties properties;

    @Test
    @DisplayName("配置绑定与客户端装配")
    void testContextLoads() {
        assertInstanceOf(NacosHttpNamingClient.class, namingClient);
        assertEquals("http://127.0.0.1:8848", ((NacosHttpNamingClient) namingClient).getConfig().getBaseUrl());
        assertEquals(Duration.ofSeconds(3), properties.getHttpTimeout());
        assertEquals(Duration.ofSeconds(10), properties.getHeartbeat().getInterval());
        assertEquals("DEFAULT_GROUP", properties.getInstance().getGroup());
        assertTrue(context.getBeansOfType(AgentStartupRunner.class).isEmpty(), "关闭注册时不装配启动流程");
    }
}
