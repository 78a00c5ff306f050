package com.hyperagi.nacosagent.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * 注册中心配置属性
 * <p>
 * application.yml 中每一项都以环境变量为默认值（NACOS_SERVER、SERVICE_NAME、PUBLIC_IP 等）。
 * 时间类环境变量沿用纯数字秒的写法（HEARTBEAT_INTERVAL=5），不带单位时按秒解析。
 */
@Component
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /**
     * Nacos 服务器地址，支持逗号分隔，只使用第一个
     */
    private String server = "http://nacos.hyperagi.network:80";

    private String username = "";

    private String password = "";

    /**
     * 单次请求超时（秒，允许小数，如 NACOS_HTTP_TIMEOUT=5.0）
     */
    private double httpTimeoutSeconds = 8.0;

    /**
     * accessToken 最长缓存时间（服务端返回更短时以服务端为准）
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration tokenTtl = Duration.ofSeconds(18000);

    private Instance instance = new Instance();

    private Heartbeat heartbeat = new Heartbeat();

    private Registration registration = new Registration();

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public double getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public void setHttpTimeoutSeconds(double httpTimeoutSeconds) {
        this.httpTimeoutSeconds = httpTimeoutSeconds;
    }

    public Duration getHttpTimeout() {
        return Duration.ofMillis(Math.round(httpTimeoutSeconds * 1000));
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public void setTokenTtl(Duration tokenTtl) {
        this.tokenTtl = tokenTtl;
    }

    public Instance getInstance() {
        return instance;
    }

    public void setInstance(Instance instance) {
        this.instance = instance;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public void setHeartbeat(Heartbeat heartbeat) {
        this.heartbeat = heartbeat;
    }

    public Registration getRegistration() {
        return registration;
    }

    public void setRegistration(Registration registration) {
        this.registration = registration;
    }

    /**
     * 本节点注册信息
     */
    public static class Instance {
        private String serviceName = "";
        private String group = "DEFAULT_GROUP";
        private String cluster = "";
        private String ip = "";
        private int port = 11434;
        private double weight = 1.0;
        private boolean ephemeral = true;

        /**
         * 钱包地址，作为实例元数据 walletAddress 上报
         */
        private String walletAddress = "";

        /**
         * 节点标识，为空时使用 ip
         */
        private String node = "";

        public String getServiceName() {
            return serviceName;
        }

        public void setServiceName(String serviceName) {
            this.serviceName = serviceName;
        }

        public String getGroup() {
            return group;
        }

        public void setGroup(String group) {
            this.group = group;
        }

        public String getCluster() {
            return cluster;
        }

        public void setCluster(String cluster) {
            this.cluster = cluster;
        }

        public String getIp() {
            return ip;
        }

        public void setIp(String ip) {
            this.ip = ip;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public boolean isEphemeral() {
            return ephemeral;
        }

        public void setEphemeral(boolean ephemeral) {
            this.ephemeral = ephemeral;
        }

        public String getWalletAddress() {
            return walletAddress;
        }

        public void setWalletAddress(String walletAddress) {
            this.walletAddress = walletAddress;
        }

        public String getNode() {
            return node;
        }

        public void setNode(String node) {
            this.node = node;
        }

        public String getEffectiveNode() {
            return node == null || node.isBlank() ? ip : node;
        }
    }

    /**
     * 心跳配置
     */
    public static class Heartbeat {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration interval = Duration.ofSeconds(5);

        /**
         * 连续失败多少次后判定为断开
         */
        private int maxConsecutiveFailures = 3;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getMaxConsecutiveFailures() {
            return maxConsecutiveFailures;
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = maxConsecutiveFailures;
        }
    }

    /**
     * 启动注册流程开关
     */
    public static class Registration {
        private boolean enabled = true;
        private boolean validateOnStartup = true;
        private boolean preflightOnStartup = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isValidateOnStartup() {
            return validateOnStartup;
        }

        public void setValidateOnStartup(boolean validateOnStartup) {
            this.validateOnStartup = validateOnStartup;
        }

        public boolean isPreflightOnStartup() {
            return preflightOnStartup;
        }

        public void setPreflightOnStartup(boolean preflightOnStartup) {
            this.preflightOnStartup = preflightOnStartup;
        }
    }
}
