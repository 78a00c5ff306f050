package com.hyperagi.nacosagent.config;

import com.hyperagi.nacosagent.common.registry.exception.ConfigException;
import com.hyperagi.nacosagent.common.registry.exception.ProtocolException;
import com.hyperagi.nacosagent.common.registry.exception.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器
 * <p>
 * 注册中心异常统一转换为 JSON 响应
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<Map<String, Object>> handleProtocol(ProtocolException e) {
        logger.warn("注册中心返回错误: status={}, code={}, message={}",
                e.getStatus(), e.getErrorCode(), e.getServerMessage());

        HttpStatus status = e.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
        Map<String, Object> body = errorBody(e);
        body.put("status", e.getStatus());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, Object>> handleConfig(ConfigException e) {
        logger.error("注册中心配置错误: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(e));
    }

    /**
     * 传输错误、解码错误
     */
    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> handleRegistry(RegistryException e) {
        logger.warn("注册中心调用失败: kind={}, code={}, message={}",
                e.getKind(), e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorBody(e));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("errorCode", "bad_request");
        body.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    private static Map<String, Object> errorBody(RegistryException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("errorCode", e.getErrorCode().getCode());
        body.put("message", e.getMessage());
        return body;
    }
}
