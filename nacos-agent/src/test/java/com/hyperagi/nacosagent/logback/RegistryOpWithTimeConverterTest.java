package com.hyperagi.nacosagent.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import com.hyperagi.nacosagent.common.registry.impl.NacosHttpNamingClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@DisplayName("RegistryOpWithTimeConverter 单元测试")
class RegistryOpWithTimeConverterTest {

    private static final long EVENT_TIME = Instant.parse("2024-01-01T08:09:10Z").toEpochMilli();

    private ILoggingEvent event;

    @BeforeEach
    void setUp() {
        event = Mockito.mock(ILoggingEvent.class);
        when(event.getTimeStamp()).thenReturn(EVENT_TIME);
    }

    private RegistryOpWithTimeConverter startedConverter(String zone) {
        RegistryOpWithTimeConverter converter = new RegistryOpWithTimeConverter();
        if (zone != null) {
            converter.setOptionList(List.of(zone));
        }
        converter.start();
        return converter;
    }

    @Test
    @DisplayName("注册中心调用内输出 操作名_事件时间")
    void testWithOperation() {
        when(event.getMDCPropertyMap()).thenReturn(Map.of(NacosHttpNamingClient.MDC_OPERATION_KEY, "sendHeartbeat"));

        String result = startedConverter("UTC").convert(event);

        assertEquals("sendHeartbeat_080910", result);
    }

    @Test
    @DisplayName("调用之外只输出 _事件时间")
    void testWithoutOperation() {
        when(event.getMDCPropertyMap()).thenReturn(Map.of());

        String result = startedConverter("Asia/Shanghai").convert(event);

        assertEquals("_160910", result);
    }

    @Test
    @DisplayName("不指定时区时按系统时区输出六位时间")
    void testDefaultZone() {
        when(event.getMDCPropertyMap()).thenReturn(Map.of(NacosHttpNamingClient.MDC_OPERATION_KEY, "login"));

        String result = startedConverter(null).convert(event);

        assertTrue(result.matches("login_\\d{6}"), result);
    }
}
