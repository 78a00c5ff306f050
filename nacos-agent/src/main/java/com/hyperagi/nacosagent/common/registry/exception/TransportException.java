package com.hyperagi.nacosagent.common.registry.exception;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;

/**
 * 传输层异常：DNS 解析失败、连接被拒绝、超时、TLS 握手失败等
 * <p>
 * 客户端不做重试，原始异常作为 cause 保留
 */
public class TransportException extends RegistryException {

    public TransportException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    /**
     * 将 OkHttp 抛出的 IOException 归类
     *
     * @param e        原始异常
     * @param canceled 调用是否被主动取消
     * @param target   请求目标（用于错误信息）
     */
    public static TransportException from(IOException e, boolean canceled, String target) {
        // callTimeout 触发时 OkHttp 同样会 cancel 调用，因此超时判断必须在前
        if (e instanceof InterruptedIOException) {
            return new TransportException(ErrorCode.TIMEOUT, "请求超时: " + target, e);
        }
        if (e instanceof UnknownHostException) {
            return new TransportException(ErrorCode.DNS_FAILURE, "DNS 解析失败: " + target, e);
        }
        if (e instanceof ConnectException || e instanceof NoRouteToHostException) {
            return new TransportException(ErrorCode.CONNECTION_REFUSED, "连接失败: " + target, e);
        }
        if (e instanceof SSLException) {
            return new TransportException(ErrorCode.TLS_FAILURE, "TLS 握手失败: " + target, e);
        }
        if (canceled) {
            return new TransportException(ErrorCode.CANCELLED, "请求已取消: " + target, e);
        }
        return new TransportException(ErrorCode.IO_ERROR, "网络错误: " + target + ", " + e.getMessage(), e);
    }

    @Override
    public String getKind() {
        return "transport";
    }
}
