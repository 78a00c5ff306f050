package com.hyperagi.nacosagent.controller;

import com.hyperagi.nacosagent.common.registry.api.NamingClient;
import com.hyperagi.nacosagent.common.registry.model.ServiceDetail;
import com.hyperagi.nacosagent.common.registry.model.ServiceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 注册中心查询 Controller
 *
 * 透传实例列表、服务详情查询；错误由 GlobalExceptionHandler 统一转换
 */
@RestController
@RequestMapping("/api/registry")
public class RegistryQueryController {

    private final Logger logger = LoggerFactory.getLogger(RegistryQueryController.class);

    private final NamingClient namingClient;

    public RegistryQueryController(NamingClient namingClient) {
        this.namingClient = namingClient;
    }

    /**
     * 查询实例列表
     *
     * GET /api/registry/services/{serviceName}/instances
     */
    @GetMapping("/services/{serviceName}/instances")
    public ResponseEntity<Map<String, Object>> listInstances(
            @PathVariable String serviceName,
            @RequestParam(required = false) String groupName,
            @RequestParam(required = false) String clusters,
            @RequestParam(defaultValue = "false") boolean healthyOnly) {
        logger.debug("查询实例列表: serviceName={}, groupName={}, clusters={}, healthyOnly={}",
                serviceName, groupName, clusters, healthyOnly);

        ServiceSnapshot snapshot = namingClient.listInstances(serviceName, groupName, clusters, healthyOnly);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", snapshot);
        response.put("total", snapshot.size());
        return ResponseEntity.ok(response);
    }

    /**
     * 查询服务详情
     *
     * GET /api/registry/services/{serviceName}
     */
    @GetMapping("/services/{serviceName}")
    public ResponseEntity<Map<String, Object>> getServiceDetail(
            @PathVariable String serviceName,
            @RequestParam(required = false) String groupName) {
        logger.debug("查询服务详情: serviceName={}, groupName={}", serviceName, groupName);

        ServiceDetail detail = namingClient.getServiceDetail(serviceName, groupName);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", detail);
        return ResponseEntity.ok(response);
    }
}
