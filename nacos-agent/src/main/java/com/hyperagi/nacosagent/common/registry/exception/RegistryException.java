package com.hyperagi.nacosagent.common.registry.exception;

/**
 * 注册中心调用异常基类
 * <p>
 * 四个子类分别对应传输、协议、解析、配置错误，调用方按类型区分处理，
 * 具体原因通过 {@link #getErrorCode()} 获取
 */
public abstract class RegistryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RegistryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RegistryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 错误大类名称（transport / protocol / decode / config）
     */
    public abstract String getKind();
}
