package com.hyperagi.nacosagent.common.diagnostics.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 启动前预检报告
 * <p>
 * DNS、TCP、本地端口为必需项；HTTP 健康探测只做参考，不影响结果
 */
public class PreflightReport {

    private final ServerAddress server;
    private final List<ProbeResult> requiredProbes = new ArrayList<>();
    private ProbeResult httpProbe;

    public PreflightReport(ServerAddress server) {
        this.server = server;
    }

    public void addRequired(ProbeResult probe) {
        requiredProbes.add(probe);
    }

    public void setHttpProbe(ProbeResult httpProbe) {
        this.httpProbe = httpProbe;
    }

    public ServerAddress getServer() {
        return server;
    }

    public List<ProbeResult> getRequiredProbes() {
        return List.copyOf(requiredProbes);
    }

    public ProbeResult getHttpProbe() {
        return httpProbe;
    }

    public boolean isPassed() {
        return requiredProbes.stream().allMatch(ProbeResult::ok);
    }

    public List<ProbeResult> getFailures() {
        return requiredProbes.stream().filter(probe -> !probe.ok()).toList();
    }
}
