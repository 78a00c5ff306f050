package com.hyperagi.nacosagent.common.registry.exception;

/**
 * 注册中心调用错误子码
 * <p>
 * 与异常类型配合使用：异常类型表示错误大类，子码表示具体原因
 */
public enum ErrorCode {

    // ==================== 传输层 ====================

    TIMEOUT("timeout"),
    DNS_FAILURE("dns_failure"),
    CONNECTION_REFUSED("connection_refused"),
    TLS_FAILURE("tls_failure"),
    CANCELLED("cancelled"),
    IO_ERROR("io_error"),

    // ==================== 协议层 ====================

    BAD_REQUEST("bad_request"),
    UNAUTHORIZED("unauthorized"),
    FORBIDDEN("forbidden"),
    NOT_FOUND("not_found"),
    CONFLICT("conflict"),
    SERVER_ERROR("server_error"),
    HTTP_ERROR("http_error"),

    // ==================== 解析 ====================

    INVALID_JSON("invalid_json"),
    MISSING_FIELD("missing_field"),

    // ==================== 配置 ====================

    INVALID_CONFIG("invalid_config");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * 小写下划线形式，用于日志和 HTTP 响应
     */
    public String getCode() {
        return code;
    }

    /**
     * 按 HTTP 状态码映射协议层子码
     */
    public static ErrorCode fromHttpStatus(int status) {
        return switch (status) {
            case 400 -> BAD_REQUEST;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 409 -> CONFLICT;
            default -> status >= 500 ? SERVER_ERROR : HTTP_ERROR;
        };
    }

    @Override
    public String toString() {
        return code;
    }
}
