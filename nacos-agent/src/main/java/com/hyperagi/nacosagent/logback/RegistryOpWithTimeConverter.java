package com.hyperagi.nacosagent.logback;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.hyperagi.nacosagent.common.registry.impl.NacosHttpNamingClient;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Logback 转换器：标出日志属于哪一次注册中心调用
 * <p>
 * NacosHttpNamingClient 在每次调用期间把操作名写入 MDC（registryOp），取值为
 * listInstances、getServiceDetail、registerInstance、deregisterInstance、sendHeartbeat、login。
 * 输出 [sendHeartbeat_HHmmss]，时间取自日志事件本身，便于把同一次心跳的请求、重试、失败日志对上；
 * 调用之外的日志只输出 [_HHmmss]。
 * <p>
 * 可选参数为时区，例如 %registryOp{UTC}，缺省使用系统时区。
 */
public class RegistryOpWithTimeConverter extends ClassicConverter {

    private static final String TIME_PATTERN = "HHmmss";

    private DateTimeFormatter formatter = DateTimeFormatter.ofPattern(TIME_PATTERN).withZone(ZoneId.systemDefault());

    @Override
    public void start() {
        String zoneOption = getFirstOption();
        if (zoneOption != null && !zoneOption.isBlank()) {
            try {
                formatter = DateTimeFormatter.ofPattern(TIME_PATTERN).withZone(ZoneId.of(zoneOption.trim()));
            } catch (DateTimeException e) {
                addError("无效的时区参数: " + zoneOption + "，使用系统时区", e);
            }
        }
        super.start();
    }

    @Override
    public String convert(ILoggingEvent event) {
        String operation = event.getMDCPropertyMap().get(NacosHttpNamingClient.MDC_OPERATION_KEY);
        String time = formatter.format(Instant.ofEpochMilli(event.getTimeStamp()));
        return (operation == null ? "" : operation) + "_" + time;
    }
}
