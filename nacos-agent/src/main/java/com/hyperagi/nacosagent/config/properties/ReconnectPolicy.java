package com.hyperagi.nacosagent.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * 重连退避策略配置
 */
@Component
@ConfigurationProperties(prefix = "registry.reconnect")
public class ReconnectPolicy {

    /**
     * 首次重连延迟
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration initialDelay = Duration.ofSeconds(5);

    /**
     * 最大重连延迟
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maxDelay = Duration.ofSeconds(300);

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    /**
     * 计算指数退避延迟时间
     *
     * @param attempt 第几次失败（从 1 开始）
     * @return 延迟时间（毫秒）
     */
    public long calculateDelay(int attempt) {
        // 指数退避：5s, 10s, 20s ... 封顶 300s
        int exponent = Math.max(0, attempt - 1);
        long initialMs = initialDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        if (exponent >= 62 || initialMs > (maxMs >> Math.min(exponent, 62))) {
            return maxMs;
        }
        return Math.min(initialMs << exponent, maxMs);
    }
}
