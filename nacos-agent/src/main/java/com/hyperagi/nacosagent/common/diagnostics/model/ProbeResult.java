package com.hyperagi.nacosagent.common.diagnostics.model;

/**
 * 单项探测结果
 *
 * @param name   探测项（DNS / TCP / PORT / HTTP）
 * @param target 探测目标
 * @param ok     是否通过
 * @param detail 说明信息（解析出的地址、错误原因、HTTP 状态等）
 */
public record ProbeResult(String name, String target, boolean ok, String detail) {

    public static ProbeResult ok(String name, String target, String detail) {
        return new ProbeResult(name, target, true, detail);
    }

    public static ProbeResult fail(String name, String target, String detail) {
        return new ProbeResult(name, target, false, detail);
    }

    @Override
    public String toString() {
        return name + " " + (ok ? "OK" : "FAIL") + ": " + target + (detail == null ? "" : " (" + detail + ")");
    }
}
