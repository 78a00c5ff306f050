package com.hyperagi.nacosagent.common.registry.exception;

/**
 * 配置异常：必需配置缺失或格式错误
 */
public class ConfigException extends RegistryException {

    public ConfigException(String message) {
        super(ErrorCode.INVALID_CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIG, message, cause);
    }

    @Override
    public String getKind() {
        return "config";
    }
}
