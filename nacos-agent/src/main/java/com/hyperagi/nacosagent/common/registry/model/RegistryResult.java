package com.hyperagi.nacosagent.common.registry.model;

import com.hyperagi.nacosagent.common.registry.exception.ErrorCode;

/**
 * 注册 / 注销结果
 */
public class RegistryResult {
    private boolean success;
    private String message;
    private ErrorCode errorCode;

    public static RegistryResult success(String message) {
        RegistryResult result = new RegistryResult();
        result.setSuccess(true);
        result.setMessage(message);
        return result;
    }

    /**
     * 幂等成功：目标本就不存在，成功但带 NOT_FOUND 子码
     */
    public static RegistryResult notFound(String message) {
        RegistryResult result = success(message);
        result.setErrorCode(ErrorCode.NOT_FOUND);
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public boolean isNotFound() {
        return errorCode == ErrorCode.NOT_FOUND;
    }

    @Override
    public String toString() {
        return "RegistryResult{" +
                "success=" + success +
                ", message='" + message + '\'' +
                ", errorCode=" + errorCode +
                '}';
    }
}
