package com.hyperagi.nacosagent.registration;

import com.hyperagi.nacosagent.common.registry.api.NamingClient;
import com.hyperagi.nacosagent.common.registry.exception.ErrorCode;
import com.hyperagi.nacosagent.common.registry.exception.ProtocolException;
import com.hyperagi.nacosagent.common.registry.exception.RegistryException;
import com.hyperagi.nacosagent.common.registry.model.InstanceRequest;
import com.hyperagi.nacosagent.common.registry.model.RegistryResult;
import com.hyperagi.nacosagent.config.properties.ReconnectPolicy;
import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 本节点注册状态管理
 *
 * 核心功能：
 * 1. 注册实例（元数据 walletAddress、node）
 * 2. 已连接时发送心跳，连续失败达到阈值或实例不存在时判定断开
 * 3. 断开时按指数退避重新注册
 * 4. 停机时注销实例
 *
 * {@link #tick()} 由单线程调度器周期调用。注册、心跳、注销都在 lifecycleLock 内执行，
 * 注销会等待正在进行的注册完成，注销之后不再注册。
 */
@Component
public class InstanceRegistrationManager {

    private static final Logger logger = LoggerFactory.getLogger(InstanceRegistrationManager.class);

    public static final String METADATA_WALLET_ADDRESS = "walletAddress";
    public static final String METADATA_NODE = "node";

    private final NamingClient namingClient;
    private final RegistryProperties properties;
    private final ReconnectPolicy reconnectPolicy;
    private final Clock clock;
    private final ConnectionStats stats = new ConnectionStats();

    private volatile boolean connected = false;
    private final AtomicBoolean registrationAttempted = new AtomicBoolean(false);
    private final AtomicBoolean deregistered = new AtomicBoolean(false);
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private int consecutiveHeartbeatFailures = 0;
    private int reconnectAttempt = 1;
    private Instant nextReconnectAt = Instant.MIN;

    @Autowired
    public InstanceRegistrationManager(NamingClient namingClient, RegistryProperties properties,
                                       ReconnectPolicy reconnectPolicy) {
        this(namingClient, properties, reconnectPolicy, Clock.systemUTC());
    }

    public InstanceRegistrationManager(NamingClient namingClient, RegistryProperties properties,
                                       ReconnectPolicy reconnectPolicy, Clock clock) {
        this.namingClient = namingClient;
        this.properties = properties;
        this.reconnectPolicy = reconnectPolicy;
        this.clock = clock;
    }

    /**
     * 注册一次
     *
     * @return 是否成功；失败或已注销时返回 false
     */
    public boolean register() {
        lifecycleLock.lock();
        try {
            if (deregistered.get()) {
                logger.warn("实例已注销，不再注册");
                return false;
            }
            return doRegister();
        } finally {
            lifecycleLock.unlock();
        }
    }

    private boolean doRegister() {
        registrationAttempted.set(true);
        stats.recordAttempt();

        InstanceRequest request = buildRequest();
        logger.info("🔄 尝试注册服务 (第{}次): {}", stats.getTotalAttempts(), request.describe());

        try {
            RegistryResult result = namingClient.registerInstance(request);
            connected = true;
            consecutiveHeartbeatFailures = 0;
            stats.recordConnectSuccess(clock.instant());
            logger.info("✅ 注册成功: service={}, ip={}, port={}, group={}, cluster={}, meta={}, result={}",
                    request.getServiceName(), request.getIp(), request.getPort(),
                    request.getGroupName(), request.getClusterName() != null ? request.getClusterName() : "-",
                    request.getMetadata(), result.getMessage());
            return true;
        } catch (RegistryException e) {
            connected = false;
            stats.recordConnectFailure(describe(e));
            logger.error("❌ 注册失败: {}, 统计: {}", describe(e), stats);
            return false;
        }
    }

    /**
     * 调度入口：已连接发心跳，未连接按退避重连
     */
    public void tick() {
        if (deregistered.get()) {
            return;
        }
        lifecycleLock.lock();
        try {
            // 等锁期间可能已经注销
            if (deregistered.get()) {
                return;
            }
            if (connected) {
                heartbeat();
            } else {
                reconnectIfDue();
            }
        } catch (RuntimeException e) {
            // 调度任务抛出异常后不会再执行
            logger.error("注册维护任务异常", e);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * 注销实例，只执行一次
     * <p>
     * 先置注销标记阻止新的注册，再等待正在进行的注册或心跳结束后发送注销。
     * 从未尝试注册时跳过；失败只记录日志
     */
    public void deregister() {
        if (!deregistered.compareAndSet(false, true)) {
            return;
        }

        lifecycleLock.lock();
        try {
            if (!registrationAttempted.get()) {
                logger.info("未尝试过注册，跳过注销");
                return;
            }
            InstanceRequest request = buildRequest();
            try {
                RegistryResult result = namingClient.deregisterInstance(request);
                if (result.isNotFound()) {
                    logger.info("实例不存在，无需注销: {}", request.describe());
                } else {
                    logger.info("已从 Nacos 注销: {}", request.describe());
                }
            } catch (RegistryException e) {
                logger.error("注销失败: {}", describe(e));
            }
        } finally {
            connected = false;
            lifecycleLock.unlock();
        }
    }

    public boolean isConnected() {
        return connected;
    }

    public ConnectionStats getStats() {
        return stats;
    }

    public boolean isRegistrationAttempted() {
        return registrationAttempted.get();
    }

    /**
     * 本节点注册信息（用于健康检查）
     */
    public Map<String, Object> describeInstance() {
        RegistryProperties.Instance instance = properties.getInstance();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", instance.getServiceName());
        info.put("publicIp", instance.getIp());
        info.put("port", instance.getPort());
        info.put("node", instance.getEffectiveNode());
        info.put("nacosServer", properties.getServer());
        info.put("group", instance.getGroup());
        info.put("cluster", instance.getCluster() != null ? instance.getCluster() : "");
        return info;
    }

    // ==================== 心跳与重连 ====================

    private void heartbeat() {
        InstanceRequest request = buildRequest();
        try {
            namingClient.sendHeartbeat(request);
            consecutiveHeartbeatFailures = 0;
            stats.recordHeartbeatSuccess(clock.instant());
            logger.debug("💓 心跳成功");
        } catch (RegistryException e) {
            consecutiveHeartbeatFailures++;
            stats.recordHeartbeatFailure(describe(e));
            logger.error("💓 心跳失败 ({}): {}", consecutiveHeartbeatFailures, describe(e));

            if (e instanceof ProtocolException && e.getErrorCode() == ErrorCode.NOT_FOUND) {
                logger.warn("实例在注册中心不存在，标记为断开，等待重新注册");
                markDisconnected();
            } else if (consecutiveHeartbeatFailures >= properties.getHeartbeat().getMaxConsecutiveFailures()) {
                logger.warn("心跳连续失败 {} 次，标记为断开", consecutiveHeartbeatFailures);
                markDisconnected();
            }
        }
    }

    private void reconnectIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(nextReconnectAt)) {
            return;
        }

        if (doRegister()) {
            logger.info("连接已建立，恢复正常运行");
            reconnectAttempt = 1;
            nextReconnectAt = Instant.MIN;
            return;
        }

        long delayMs = reconnectPolicy.calculateDelay(reconnectAttempt);
        logger.warn("第 {} 次重连失败，{} ms 后重试", reconnectAttempt, delayMs);
        reconnectAttempt++;
        nextReconnectAt = now.plusMillis(delayMs);
    }

    private void markDisconnected() {
        connected = false;
        consecutiveHeartbeatFailures = 0;
        reconnectAttempt = 1;
        nextReconnectAt = Instant.MIN;
    }

    // ==================== 私有辅助方法 ====================

    InstanceRequest buildRequest() {
        RegistryProperties.Instance instance = properties.getInstance();

        InstanceRequest request = InstanceRequest.of(instance.getServiceName(), instance.getIp(), instance.getPort());
        request.setGroupName(instance.getGroup());
        request.setClusterName(isBlank(instance.getCluster()) ? null : instance.getCluster());
        request.setWeight(instance.getWeight());
        request.setEphemeral(instance.isEphemeral());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(METADATA_WALLET_ADDRESS, instance.getWalletAddress());
        metadata.put(METADATA_NODE, instance.getEffectiveNode());
        request.setMetadata(metadata);
        return request;
    }

    private static String describe(RegistryException e) {
        if (e instanceof ProtocolException protocol) {
            return e.getKind() + "/" + e.getErrorCode() + " (HTTP " + protocol.getStatus() + "): " + e.getMessage();
        }
        return e.getKind() + "/" + e.getErrorCode() + ": " + e.getMessage();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
