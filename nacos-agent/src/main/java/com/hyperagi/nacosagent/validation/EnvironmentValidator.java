package com.hyperagi.nacosagent.validation;

import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import com.hyperagi.nacosagent.config.properties.ReconnectPolicy;
import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 启动环境校验
 * <p>
 * 校验注册所需配置：钱包地址、公网 IP、服务名、Nacos 地址、端口；
 * 可选项：分组、集群、节点标识；认证信息和各项超时
 */
@Component
public class EnvironmentValidator {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final Pattern IPV4_PATTERN = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");

    /**
     * 只接受完整写法（8 组），不支持 :: 缩写
     */
    private static final Pattern IPV6_PATTERN = Pattern.compile("^(?:[0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}$");

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private static final Pattern SERVER_PATTERN = Pattern.compile("^https?://[a-zA-Z0-9.-]+(:\\d+)?(/.*)?$");

    private final RegistryProperties properties;
    private final ReconnectPolicy reconnectPolicy;

    public EnvironmentValidator(RegistryProperties properties, ReconnectPolicy reconnectPolicy) {
        this.properties = properties;
        this.reconnectPolicy = reconnectPolicy;
    }

    /**
     * 执行全部校验
     */
    public ValidationReport validate() {
        RegistryProperties.Instance instance = properties.getInstance();
        ValidationReport report = new ValidationReport();

        // 必需项
        checkWalletAddress(report, instance.getWalletAddress());
        checkIp(report, instance.getIp());
        checkServiceName(report, instance.getServiceName());
        checkServer(report, properties.getServer());
        checkPort(report, instance.getPort());

        // 可选项
        checkOptionalName(report, "NACOS_GROUP", "分组", instance.getGroup());
        checkOptionalName(report, "NACOS_CLUSTER", "集群", instance.getCluster());
        if (isBlank(instance.getNode())) {
            report.info("NODE", "使用 PUBLIC_IP 作为节点标识");
        } else {
            report.info("NODE", "节点标识: " + instance.getNode());
        }

        checkCredentials(report, properties.getUsername(), properties.getPassword());

        checkPositive(report, "NACOS_HTTP_TIMEOUT", "HTTP 超时时间", properties.getHttpTimeout());
        checkPositive(report, "MAX_RECONNECT_DELAY", "最大重连延迟", reconnectPolicy.getMaxDelay());
        checkPositive(report, "INITIAL_RECONNECT_DELAY", "初始重连延迟", reconnectPolicy.getInitialDelay());
        checkPositive(report, "HEARTBEAT_INTERVAL", "心跳间隔", properties.getHeartbeat().getInterval());

        return report;
    }

    /**
     * 校验并在失败时抛出异常，异常信息包含全部错误项
     *
     * @throws ConfigException 存在任一错误项
     */
    public ValidationReport validateOrFail() {
        ValidationReport report = validate();
        report.getEntries().forEach(entry -> {
            switch (entry.level()) {
                case OK -> logger.info("✅ {}", entry);
                case INFO -> logger.info("ℹ️ {}", entry);
                case ERROR -> logger.error("❌ {}", entry);
            }
        });

        if (!report.isValid()) {
            String errors = report.getErrors().stream()
                    .map(ValidationReport.Entry::toString)
                    .collect(Collectors.joining("; "));
            throw new ConfigException("环境变量校验失败: " + errors);
        }

        logger.info("环境变量校验通过");
        return report;
    }

    // ==================== 单项校验 ====================

    private void checkWalletAddress(ValidationReport report, String address) {
        if (isBlank(address)) {
            report.error("WALLET_ADDRESS", "未设置");
        } else if (!WalletAddressValidator.isValid(address)) {
            report.error("WALLET_ADDRESS", "无效的钱包地址格式: " + address);
        } else {
            report.ok("WALLET_ADDRESS", "钱包地址格式正确");
        }
    }

    private void checkIp(ValidationReport report, String ip) {
        if (isBlank(ip)) {
            report.error("PUBLIC_IP", "未设置");
        } else if (IPV4_PATTERN.matcher(ip).matches()) {
            report.ok("PUBLIC_IP", "IPv4 地址格式正确");
        } else if (IPV6_PATTERN.matcher(ip).matches()) {
            report.ok("PUBLIC_IP", "IPv6 地址格式正确");
        } else {
            report.error("PUBLIC_IP", "无效的 IP 地址格式: " + ip);
        }
    }

    private void checkServiceName(ValidationReport report, String serviceName) {
        if (isBlank(serviceName)) {
            report.error("SERVICE_NAME", "未设置");
        } else if (!NAME_PATTERN.matcher(serviceName).matches()) {
            report.error("SERVICE_NAME", "服务名称包含无效字符: " + serviceName + "（只允许字母、数字、连字符和下划线）");
        } else {
            report.ok("SERVICE_NAME", "服务名称格式正确");
        }
    }

    private void checkServer(ValidationReport report, String server) {
        if (isBlank(server)) {
            report.error("NACOS_SERVER", "未设置");
            return;
        }

        List<String> servers = Arrays.stream(server.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (servers.isEmpty()) {
            report.error("NACOS_SERVER", "未设置");
            return;
        }

        for (String srv : servers) {
            String url = srv.contains("://") ? srv : "http://" + srv;
            if (!SERVER_PATTERN.matcher(url).matches()) {
                report.error("NACOS_SERVER", "无效的 Nacos 服务器地址格式: " + url);
                return;
            }
        }
        report.ok("NACOS_SERVER", "Nacos 服务器地址格式正确: " + servers.size() + " 个服务器");
    }

    private void checkPort(ValidationReport report, int port) {
        if (port >= 1 && port <= 65535) {
            report.ok("PORT", "端口号有效: " + port);
        } else {
            report.error("PORT", "端口号超出范围: " + port + "（应在 1-65535 之间）");
        }
    }

    private void checkOptionalName(ValidationReport report, String key, String label, String value) {
        if (isBlank(value)) {
            report.info(key, "未设置" + label + "，使用默认值");
        } else if (NAME_PATTERN.matcher(value).matches()) {
            report.ok(key, label + "名称格式正确");
        } else {
            report.error(key, label + "名称包含无效字符: " + value);
        }
    }

    private void checkCredentials(ValidationReport report, String username, String password) {
        boolean hasUser = !isBlank(username);
        boolean hasPassword = !isBlank(password);
        if (!hasUser && !hasPassword) {
            report.info("NACOS_CREDENTIALS", "未设置认证信息（使用匿名访问）");
        } else if (hasUser && hasPassword) {
            report.ok("NACOS_CREDENTIALS", "认证信息已设置: username=" + username + ", password=***");
        } else {
            report.error("NACOS_CREDENTIALS", "认证信息不完整：用户名和密码必须同时设置或同时为空");
        }
    }

    private void checkPositive(ValidationReport report, String key, String label, Duration value) {
        if (value == null) {
            report.info(key, "使用默认值（" + label + "）");
        } else if (value.isNegative() || value.isZero()) {
            report.error(key, value + " - 必须大于 0（" + label + "）");
        } else {
            report.ok(key, value + "（" + label + "）");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
