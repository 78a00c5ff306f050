package com.hyperagi.nacosagent.common.diagnostics.api;

import com.hyperagi.nacosagent.common.diagnostics.model.PreflightReport;
import com.hyperagi.nacosagent.common.diagnostics.model.ProbeResult;

/**
 * 网络诊断服务接口
 *
 * 核心功能：
 * 1. DNS 解析、TCP 连通性、本地端口占用检查
 * 2. 注册中心 HTTP 健康探测
 * 3. 启动前预检
 *
 * 所有探测只返回结果、记录日志，不抛异常；只有 {@link #preflightOrFail} 会中断启动。
 */
public interface NetworkDiagnostics {

    /**
     * DNS 解析
     */
    ProbeResult checkDns(String host);

    /**
     * TCP 连接
     *
     * @param host      主机
     * @param port      端口
     * @param timeoutMs 超时时间（毫秒）
     */
    ProbeResult checkTcp(String host, int port, int timeoutMs);

    /**
     * 本地端口是否可绑定（未被占用）
     */
    ProbeResult checkLocalPort(int port);

    /**
     * 依次探测 Nacos 常见健康检查路径，第一个 2xx 即视为成功
     *
     * @param baseUrl scheme://host:port
     */
    ProbeResult probeHttpHealth(String baseUrl);

    /**
     * 执行完整预检
     *
     * @param server    注册中心地址（支持逗号分隔，取第一个）
     * @param localPort 本地服务端口，小于等于 0 时跳过端口检查
     */
    PreflightReport runPreflight(String server, int localPort);

    /**
     * 执行预检，必需项失败时抛出 ConfigException
     */
    PreflightReport preflightOrFail(String server, int localPort);
}
