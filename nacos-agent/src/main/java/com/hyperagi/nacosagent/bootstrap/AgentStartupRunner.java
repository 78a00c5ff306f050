package com.hyperagi.nacosagent.bootstrap;

import com.hyperagi.nacosagent.common.diagnostics.api.NetworkDiagnostics;
import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import com.hyperagi.nacosagent.registration.HeartbeatScheduler;
import com.hyperagi.nacosagent.registration.InstanceRegistrationManager;
import com.hyperagi.nacosagent.validation.EnvironmentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 启动流程：环境校验 → 网络预检 → 首次注册 → 启动心跳调度
 * <p>
 * 校验或预检失败时抛出 ConfigException 终止启动；首次注册失败不终止，由调度器继续重试
 */
@Component
@ConditionalOnProperty(prefix = "registry.registration", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentStartupRunner {

    private static final Logger logger = LoggerFactory.getLogger(AgentStartupRunner.class);

    private final RegistryProperties properties;
    private final EnvironmentValidator environmentValidator;
    private final NetworkDiagnostics networkDiagnostics;
    private final InstanceRegistrationManager registrationManager;
    private final HeartbeatScheduler heartbeatScheduler;
    private final Environment environment;

    public AgentStartupRunner(RegistryProperties properties,
                              EnvironmentValidator environmentValidator,
                              NetworkDiagnostics networkDiagnostics,
                              InstanceRegistrationManager registrationManager,
                              HeartbeatScheduler heartbeatScheduler,
                              Environment environment) {
        this.properties = properties;
        this.environmentValidator = environmentValidator;
        this.networkDiagnostics = networkDiagnostics;
        this.registrationManager = registrationManager;
        this.heartbeatScheduler = heartbeatScheduler;
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        logger.info("========================================");
        logger.info("🚀 Nacos Agent 启动注册流程");
        logger.info("========================================");

        RegistryProperties.Registration registration = properties.getRegistration();

        if (registration.isValidateOnStartup()) {
            environmentValidator.validateOrFail();
        }

        if (registration.isPreflightOnStartup()) {
            networkDiagnostics.preflightOrFail(properties.getServer(), resolvePreflightPort());
        }

        // 首次注册失败不退出，由调度器继续重试
        if (!registrationManager.register()) {
            logger.warn("首次注册失败，后台将继续重试");
        }

        heartbeatScheduler.start();
    }

    /**
     * 实例端口就是本 Web 服务端口时已经被自己占用，跳过端口检查
     */
    int resolvePreflightPort() {
        int port = properties.getInstance().getPort();
        Integer localServerPort = environment.getProperty("local.server.port", Integer.class);
        if (localServerPort != null && localServerPort == port) {
            logger.debug("实例端口 {} 由本服务监听，跳过端口占用检查", port);
            return -1;
        }
        return port;
    }
}
