package com.hyperagi.nacosagent.common.registry.exception;

import java.util.Locale;

/**
 * 协议层异常：HTTP 状态码非 2xx，或服务端在响应体中明确拒绝
 */
public class ProtocolException extends RegistryException {

    private static final int MAX_MESSAGE_LENGTH = 512;

    private final int status;
    private final String serverMessage;

    public ProtocolException(int status, ErrorCode errorCode, String serverMessage) {
        super(errorCode, "HTTP " + status + " [" + errorCode + "]: " + abbreviate(serverMessage));
        this.status = status;
        this.serverMessage = serverMessage;
    }

    /**
     * 按状态码和响应体构造异常
     * <p>
     * Nacos 对部分资源缺失返回 400 + "not found" 文本，这种情况同样归为 NOT_FOUND
     */
    public static ProtocolException fromResponse(int status, String body) {
        ErrorCode code = ErrorCode.fromHttpStatus(status);
        if (code == ErrorCode.BAD_REQUEST && body != null
                && body.toLowerCase(Locale.ROOT).contains("not found")) {
            code = ErrorCode.NOT_FOUND;
        }
        return new ProtocolException(status, code, body);
    }

    public int getStatus() {
        return status;
    }

    public String getServerMessage() {
        return serverMessage;
    }

    public boolean isNotFound() {
        return getErrorCode() == ErrorCode.NOT_FOUND;
    }

    public boolean isAuthFailure() {
        return getErrorCode() == ErrorCode.UNAUTHORIZED || getErrorCode() == ErrorCode.FORBIDDEN;
    }

    @Override
    public String getKind() {
        return "protocol";
    }

    private static String abbreviate(String text) {
        if (text == null || text.isBlank()) {
            return "<empty>";
        }
        String trimmed = text.trim();
        return trimmed.length() <= MAX_MESSAGE_LENGTH ? trimmed : trimmed.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
