package com.hyperagi.nacosagent.controller;

import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import com.hyperagi.nacosagent.registration.InstanceRegistrationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 节点健康检查控制器
 *
 * <p>提供存活探针和注册状态：
 * <ul>
 *   <li>/ ：存活检查，固定返回 OK</li>
 *   <li>/health ：注册状态，已连接返回 200，未连接返回 206</li>
 *   <li>/debug ：脱敏后的配置和连接统计</li>
 * </ul>
 */
@RestController
public class AgentHealthController {

    private final Logger logger = LoggerFactory.getLogger(AgentHealthController.class);

    private final InstanceRegistrationManager registrationManager;
    private final RegistryProperties properties;

    public AgentHealthController(InstanceRegistrationManager registrationManager,
                                 RegistryProperties properties) {
        this.registrationManager = registrationManager;
        this.properties = properties;
    }

    @GetMapping("/")
    public ResponseEntity<String> root() {
        return ResponseEntity.ok("OK");
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean connected = registrationManager.isConnected();

        Map<String, Object> health = new LinkedHashMap<>(registrationManager.describeInstance());
        health.put("status", connected ? "UP" : "DEGRADED");
        health.put("connectionStats", registrationManager.getStats().toMap());
        health.put("timestamp", System.currentTimeMillis());

        logger.debug("健康检查请求: {}", health);
        return ResponseEntity.status(connected ? HttpStatus.OK : HttpStatus.PARTIAL_CONTENT).body(health);
    }

    @GetMapping("/debug")
    public ResponseEntity<Map<String, Object>> debug() {
        RegistryProperties.Instance instance = properties.getInstance();

        Map<String, Object> environment = new LinkedHashMap<>();
        environment.put("NACOS_SERVER", properties.getServer());
        environment.put("PUBLIC_IP", instance.getIp());
        environment.put("PORT", instance.getPort());
        environment.put("SERVICE_NAME", instance.getServiceName());
        environment.put("WALLET_ADDRESS", maskWallet(instance.getWalletAddress()));
        environment.put("NODE", instance.getEffectiveNode());
        environment.put("NACOS_GROUP", instance.getGroup());
        environment.put("NACOS_CLUSTER", instance.getCluster());
        environment.put("NACOS_USERNAME", emptyToNull(properties.getUsername()));
        environment.put("NACOS_PASSWORD", isEmpty(properties.getPassword()) ? null : "***");

        Map<String, Object> debug = new LinkedHashMap<>();
        debug.put("environment", environment);
        debug.put("connectionStats", registrationManager.getStats().toMap());
        debug.put("isConnected", registrationManager.isConnected());
        debug.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(debug);
    }

    /**
     * 钱包地址只保留前 10 位和后 6 位
     */
    static String maskWallet(String wallet) {
        if (isEmpty(wallet)) {
            return null;
        }
        if (wallet.length() <= 16) {
            return wallet;
        }
        return wallet.substring(0, 10) + "..." + wallet.substring(wallet.length() - 6);
    }

    private static String emptyToNull(String value) {
        return isEmpty(value) ? null : value;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
