package com.hyperagi.nacosagent.common.registry.model;

import java.util.List;

/**
 * 实例列表查询结果（只读快照，不做本地缓存）
 */
public class ServiceSnapshot {
    private final String serviceName;
    private final String groupName;
    private final String clusters;
    private final long cacheMillis;
    private final List<ServiceInstance> instances;

    public ServiceSnapshot(String serviceName, String groupName, String clusters,
                           long cacheMillis, List<ServiceInstance> instances) {
        this.serviceName = serviceName;
        this.groupName = groupName;
        this.clusters = clusters;
        this.cacheMillis = cacheMillis;
        this.instances = List.copyOf(instances);
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getGroupName() {
        return groupName;
    }

    public String getClusters() {
        return clusters;
    }

    public long getCacheMillis() {
        return cacheMillis;
    }

    public List<ServiceInstance> getInstances() {
        return instances;
    }

    public int size() {
        return instances.size();
    }

    public long healthyCount() {
        return instances.stream().filter(ServiceInstance::isHealthy).count();
    }
}
