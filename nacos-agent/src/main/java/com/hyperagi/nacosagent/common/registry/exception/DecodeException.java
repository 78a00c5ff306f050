package com.hyperagi.nacosagent.common.registry.exception;

/**
 * 响应解析异常：响应体不是合法 JSON，或缺少当前操作必需的字段
 */
public class DecodeException extends RegistryException {

    public DecodeException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public DecodeException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static DecodeException missingField(String operation, String field) {
        return new DecodeException(ErrorCode.MISSING_FIELD, operation + " 响应缺少必需字段: " + field);
    }

    @Override
    public String getKind() {
        return "decode";
    }
}
