package com.hyperagi.nacosagent.shutdown;

import com.hyperagi.nacosagent.registration.HeartbeatScheduler;
import com.hyperagi.nacosagent.registration.InstanceRegistrationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * 优雅停机管理器
 *
 * <p>实现 Spring SmartLifecycle 接口，停机时：
 * <ol>
 *   <li>停止心跳调度</li>
 *   <li>从注册中心注销本实例（不论当前是否连接，只执行一次）</li>
 * </ol>
 */
@Component
public class GracefulShutdownManager implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdownManager.class);

    private final HeartbeatScheduler heartbeatScheduler;
    private final InstanceRegistrationManager registrationManager;

    private volatile boolean running = true;
    private volatile boolean shuttingDown = false;

    public GracefulShutdownManager(HeartbeatScheduler heartbeatScheduler,
                                   InstanceRegistrationManager registrationManager) {
        this.heartbeatScheduler = heartbeatScheduler;
        this.registrationManager = registrationManager;
    }

    @Override
    public void start() {
        // 组件启动时默认就是运行状态
        logger.info("GracefulShutdownManager 已启动");
    }

    @Override
    public void stop() {
        if (!running) {
            logger.info("GracefulShutdownManager 已经停止，跳过");
            return;
        }

        logger.info("========================================");
        logger.info("🛑 开始优雅停机流程...");
        logger.info("========================================");

        long startTime = System.currentTimeMillis();
        shuttingDown = true;

        // 阶段 1: 停止心跳调度
        logger.info("【阶段 1/2】停止心跳调度");
        stopScheduler();

        // 阶段 2: 注销实例
        logger.info("【阶段 2/2】从注册中心注销实例");
        deregisterInstance();

        running = false;

        long duration = System.currentTimeMillis() - startTime;
        logger.info("========================================");
        logger.info("✅ 优雅停机完成，耗时: {} ms", duration);
        logger.info("========================================");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    @Override
    public int getPhase() {
        // 最先停止，注销时 HTTP 客户端仍可用
        return Integer.MAX_VALUE;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private void stopScheduler() {
        try {
            heartbeatScheduler.stop();
        } catch (RuntimeException e) {
            logger.error("停止心跳调度时发生错误", e);
        }
    }

    private void deregisterInstance() {
        try {
            registrationManager.deregister();
        } catch (RuntimeException e) {
            logger.error("注销实例时发生错误", e);
        }
    }
}
