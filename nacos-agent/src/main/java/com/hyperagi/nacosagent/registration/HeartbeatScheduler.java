package com.hyperagi.nacosagent.registration;

import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * 心跳 / 重连调度
 * <p>
 * 固定延迟执行 {@link InstanceRegistrationManager#tick()}
 */
@Component
public class HeartbeatScheduler {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final TaskScheduler taskScheduler;
    private final InstanceRegistrationManager registrationManager;
    private final RegistryProperties properties;

    private ScheduledFuture<?> future;

    public HeartbeatScheduler(@Qualifier("heartbeatTaskScheduler") TaskScheduler taskScheduler,
                              InstanceRegistrationManager registrationManager,
                              RegistryProperties properties) {
        this.taskScheduler = taskScheduler;
        this.registrationManager = registrationManager;
        this.properties = properties;
    }

    public synchronized void start() {
        if (future != null) {
            logger.debug("心跳调度已启动，跳过");
            return;
        }
        Duration interval = properties.getHeartbeat().getInterval();
        future = taskScheduler.scheduleWithFixedDelay(registrationManager::tick, Instant.now().plus(interval), interval);
        logger.info("心跳调度已启动: interval={}s", interval.toSeconds());
    }

    public synchronized void stop() {
        if (future == null) {
            return;
        }
        future.cancel(false);
        future = null;
        logger.info("心跳调度已停止");
    }

    public synchronized boolean isRunning() {
        return future != null;
    }
}
