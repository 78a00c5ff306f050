package com.hyperagi.nacosagent.config.properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconnectPolicy 指数退避测试")
class ReconnectPolicyTest {

    @Test
    @DisplayName("默认 5s 起步、翻倍、封顶 300s")
    void testDefaultBackoff() {
        ReconnectPolicy policy = new ReconnectPolicy();

        assertEquals(5_000, policy.calculateDelay(1));
        assertEquals(10_000, policy.calculateDelay(2));
        assertEquals(20_000, policy.calculateDelay(3));
        assertEquals(160_000, policy.calculateDelay(6));
        assertEquals(300_000, policy.calculateDelay(7));
        assertEquals(300_000, policy.calculateDelay(100));
    }

    @Test
    @DisplayName("attempt 小于 1 按首次处理")
    void testNonPositiveAttempt() {
        ReconnectPolicy policy = new ReconnectPolicy();

        assertEquals(5_000, policy.calculateDelay(0));
    }

    @Test
    @DisplayName("自定义延迟")
    void testCustomDelays() {
        ReconnectPolicy policy = new ReconnectPolicy();
        policy.setInitialDelay(Duration.ofMillis(100));
        policy.setMaxDelay(Duration.ofMillis(250));

        assertEquals(100, policy.calculateDelay(1));
        assertEquals(200, policy.calculateDelay(2));
        assertEquals(250, policy.calculateDelay(3));
    }
}
