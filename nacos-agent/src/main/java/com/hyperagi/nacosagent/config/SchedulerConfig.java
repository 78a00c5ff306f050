package com.hyperagi.nacosagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 心跳调度线程配置
 * <p>
 * 单线程：心跳、重连互不并发，客户端调用保持串行
 */
@Configuration
public class SchedulerConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean(name = "heartbeatTaskScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler heartbeatTaskScheduler() {
        logger.info("初始化心跳调度线程池: poolSize=1");

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("registry-heartbeat-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
