package com.hyperagi.nacosagent.registration;

import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("HeartbeatScheduler 单元测试")
class HeartbeatSchedulerTest {

    private TaskScheduler mockTaskScheduler;
    private ScheduledFuture<?> mockFuture;
    private HeartbeatScheduler scheduler;

    @BeforeEach
    void setUp() {
        mockTaskScheduler = Mockito.mock(TaskScheduler.class);
        mockFuture = Mockito.mock(ScheduledFuture.class);
        doReturn(mockFuture).when(mockTaskScheduler)
                .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

        RegistryProperties properties = new RegistryProperties();
        properties.getHeartbeat().setInterval(Duration.ofSeconds(7));
        scheduler = new HeartbeatScheduler(mockTaskScheduler,
                Mockito.mock(InstanceRegistrationManager.class), properties);
    }

    @Test
    @DisplayName("按配置间隔固定延迟调度，重复 start 只调度一次")
    void testStartOnce() {
        scheduler.start();
        scheduler.start();

        verify(mockTaskScheduler, times(1))
                .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(7)));
        assertTrue(scheduler.isRunning());
    }

    @Test
    @DisplayName("stop 取消任务")
    void testStop() {
        scheduler.start();

        scheduler.stop();

        verify(mockFuture).cancel(false);
        assertFalse(scheduler.isRunning());
    }

    @Test
    @DisplayName("未启动时 stop 无副作用")
    void testStopWithoutStart() {
        scheduler.stop();

        verifyNoInteractions(mockTaskScheduler);
    }
}
