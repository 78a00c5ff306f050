package com.hyperagi.nacosagent.bootstrap;

import com.hyperagi.nacosagent.common.diagnostics.api.NetworkDiagnostics;
import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import com.hyperagi.nacosagent.registration.HeartbeatScheduler;
import com.hyperagi.nacosagent.registration.InstanceRegistrationManager;
import com.hyperagi.nacosagent.validation.EnvironmentValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("AgentStartupRunner 单元测试")
class AgentStartupRunnerTest {

    private RegistryProperties properties;
    private EnvironmentValidator mockValidator;
    private NetworkDiagnostics mockDiagnostics;
    private InstanceRegistrationManager mockManager;
    private HeartbeatScheduler mockScheduler;
    private MockEnvironment environment;
    private AgentStartupRunner runner;

    @BeforeEach
    void setUp() {
        properties = new RegistryProperties();
        properties.setServer("http://nacos:8848");
        properties.getInstance().setPort(11434);

        mockValidator = Mockito.mock(EnvironmentValidator.class);
        mockDiagnostics = Mockito.mock(NetworkDiagnostics.class);
        mockManager = Mockito.mock(InstanceRegistrationManager.class);
        mockScheduler = Mockito.mock(HeartbeatScheduler.class);
        environment = new MockEnvironment();

        runner = new AgentStartupRunner(properties, mockValidator, mockDiagnostics,
                mockManager, mockScheduler, environment);
    }

    @Test
    @DisplayName("校验 → 预检 → 注册 → 启动调度")
    void testStartupSequence() {
        when(mockManager.register()).thenReturn(true);

        runner.onApplicationReady();

        InOrder inOrder = inOrder(mockValidator, mockDiagnostics, mockManager, mockScheduler);
        inOrder.verify(mockValidator).validateOrFail();
        inOrder.verify(mockDiagnostics).preflightOrFail("http://nacos:8848", 11434);
        inOrder.verify(mockManager).register();
        inOrder.verify(mockScheduler).start();
    }

    @Test
    @DisplayName("首次注册失败仍启动调度")
    void testInitialRegisterFailureNotFatal() {
        when(mockManager.register()).thenReturn(false);

        runner.onApplicationReady();

        verify(mockScheduler).start();
    }

    @Test
    @DisplayName("校验失败终止启动，不注册")
    void testValidationFailureAborts() {
        when(mockValidator.validateOrFail()).thenThrow(new ConfigException("环境变量校验失败"));

        assertThrows(ConfigException.class, () -> runner.onApplicationReady());

        verify(mockManager, never()).register();
        verify(mockScheduler, never()).start();
    }

    @Test
    @DisplayName("关闭校验和预检开关")
    void testChecksDisabled() {
        properties.getRegistration().setValidateOnStartup(false);
        properties.getRegistration().setPreflightOnStartup(false);

        runner.onApplicationReady();

        verifyNoInteractions(mockValidator, mockDiagnostics);
        verify(mockManager).register();
    }

    @Test
    @DisplayName("实例端口就是本服务端口时跳过端口占用检查")
    void testPreflightSkipsOwnPort() {
        environment.setProperty("local.server.port", "11434");

        runner.onApplicationReady();

        verify(mockDiagnostics).preflightOrFail(anyString(), eq(-1));
        verify(mockDiagnostics, never()).preflightOrFail(anyString(), eq(11434));
    }

    @Test
    @DisplayName("端口不同时检查实例端口")
    void testPreflightChecksOtherPort() {
        environment.setProperty("local.server.port", "8080");

        assertEquals(11434, runner.resolvePreflightPort());
        verify(mockDiagnostics, never()).preflightOrFail(anyString(), anyInt());
    }
}
