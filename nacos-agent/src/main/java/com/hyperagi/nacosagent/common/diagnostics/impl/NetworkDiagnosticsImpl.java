package com.hyperagi.nacosagent.common.diagnostics.impl;

import com.hyperagi.nacosagent.common.diagnostics.api.NetworkDiagnostics;
import com.hyperagi.nacosagent.common.diagnostics.model.PreflightReport;
import com.hyperagi.nacosagent.common.diagnostics.model.ProbeResult;
import com.hyperagi.nacosagent.common.diagnostics.model.ServerAddress;
import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 网络诊断服务实现
 */
@Service
public class NetworkDiagnosticsImpl implements NetworkDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(NetworkDiagnosticsImpl.class);

    /**
     * 依次尝试的健康检查路径（部分网关没有 /nacos 前缀）
     */
    static final List<String> HEALTH_PATHS = List.of(
            "/nacos/v1/console/health",
            "/v1/console/health",
            "/nacos/",
            "/"
    );

    private static final int MAX_BODY_PREVIEW = 128;

    private final RestTemplate restTemplate;
    private final int tcpTimeoutMs;

    @Autowired
    public NetworkDiagnosticsImpl(@Value("${registry.diagnostics.tcp-timeout-ms:3000}") int tcpTimeoutMs,
                                  @Value("${registry.diagnostics.http-timeout-ms:5000}") int httpTimeoutMs) {
        this(createRestTemplate(httpTimeoutMs), tcpTimeoutMs);
    }

    public NetworkDiagnosticsImpl(RestTemplate restTemplate, int tcpTimeoutMs) {
        this.restTemplate = restTemplate;
        this.tcpTimeoutMs = tcpTimeoutMs;
    }

    @Override
    public ProbeResult checkDns(String host) {
        try {
            InetAddress[] addresses = InetAddress.getAllByName(host);
            String resolved = Arrays.stream(addresses)
                    .map(InetAddress::getHostAddress)
                    .distinct()
                    .sorted()
                    .collect(Collectors.joining(", ", "[", "]"));
            logger.info("DNS OK: {} -> {}", host, resolved);
            return ProbeResult.ok("DNS", host, resolved);
        } catch (UnknownHostException e) {
            logger.error("DNS FAIL: {} not resolvable: {}", host, e.getMessage());
            return ProbeResult.fail("DNS", host, e.getMessage());
        }
    }

    @Override
    public ProbeResult checkTcp(String host, int port, int timeoutMs) {
        String target = host + ":" + port;
        long startTime = System.currentTimeMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            long elapsed = System.currentTimeMillis() - startTime;
            logger.info("TCP OK: {} reachable ({} ms)", target, elapsed);
            return ProbeResult.ok("TCP", target, elapsed + " ms");
        } catch (IOException e) {
            logger.error("TCP FAIL: {} not reachable: {}", target, e.getMessage());
            return ProbeResult.fail("TCP", target, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public ProbeResult checkLocalPort(int port) {
        String target = "0.0.0.0:" + port;
        try (ServerSocket serverSocket = new ServerSocket()) {
            serverSocket.setReuseAddress(false);
            serverSocket.bind(new InetSocketAddress(port));
            logger.info("PORT OK: {} available for binding", target);
            return ProbeResult.ok("PORT", target, "available");
        } catch (IOException e) {
            logger.error("PORT FAIL: {} cannot bind: {}", target, e.getMessage());
            return ProbeResult.fail("PORT", target, e.getMessage());
        }
    }

    @Override
    public ProbeResult probeHttpHealth(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;

        for (String path : HEALTH_PATHS) {
            String url = base + path;
            try {
                ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
                if (response.getStatusCode().is2xxSuccessful()) {
                    String preview = preview(response.getBody());
                    logger.info("HTTP PROBE OK {} status={} body={}", url, response.getStatusCode().value(), preview);
                    return ProbeResult.ok("HTTP", url, "status=" + response.getStatusCode().value());
                }
                logger.warn("HTTP PROBE {} HTTP {}", url, response.getStatusCode().value());
            } catch (HttpStatusCodeException e) {
                logger.warn("HTTP PROBE {} HTTP {}", url, e.getStatusCode().value());
            } catch (RestClientException e) {
                logger.warn("HTTP PROBE {} error={}", url, e.getMessage());
            }
        }

        logger.warn("HTTP PROBE failed on all known health endpoints");
        return ProbeResult.fail("HTTP", base, "no health endpoint answered 2xx");
    }

    @Override
    public PreflightReport runPreflight(String server, int localPort) {
        ServerAddress address = ServerAddress.parse(server);
        logger.info("开始预检: server={}, localPort={}", address, localPort > 0 ? localPort : "-");

        PreflightReport report = new PreflightReport(address);
        report.addRequired(checkDns(address.host()));
        report.addRequired(checkTcp(address.host(), address.port(), tcpTimeoutMs));
        if (localPort > 0) {
            report.addRequired(checkLocalPort(localPort));
        }
        report.setHttpProbe(probeHttpHealth(address.baseUrl()));

        logger.info("预检完成: 必需项={}, 失败={}, HTTP 探测={}",
                report.getRequiredProbes().size(), report.getFailures().size(),
                report.getHttpProbe().ok() ? "OK" : "FAIL");
        return report;
    }

    @Override
    public PreflightReport preflightOrFail(String server, int localPort) {
        PreflightReport report = runPreflight(server, localPort);
        if (!report.isPassed()) {
            throw new ConfigException("Preflight checks failed: " + report.getFailures());
        }
        return report;
    }

    // ==================== 私有辅助方法 ====================

    private static RestTemplate createRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    private static String preview(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_PREVIEW ? body : body.substring(0, MAX_BODY_PREVIEW);
    }
}
