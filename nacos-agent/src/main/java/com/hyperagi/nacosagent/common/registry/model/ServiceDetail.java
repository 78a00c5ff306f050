package com.hyperagi.nacosagent.common.registry.model;

import java.util.List;
import java.util.Map;

/**
 * 服务详情（不含实例列表）
 */
public class ServiceDetail {
    private final String name;
    private final String groupName;
    private final List<String> clusters;
    private final double protectThreshold;
    private final Integer instanceCount;
    private final Map<String, String> metadata;

    public ServiceDetail(String name, String groupName, List<String> clusters, double protectThreshold,
                         Integer instanceCount, Map<String, String> metadata) {
        this.name = name;
        this.groupName = groupName;
        this.clusters = List.copyOf(clusters);
        this.protectThreshold = protectThreshold;
        this.instanceCount = instanceCount;
        this.metadata = Map.copyOf(metadata);
    }

    public String getName() {
        return name;
    }

    public String getGroupName() {
        return groupName;
    }

    public List<String> getClusters() {
        return clusters;
    }

    public double getProtectThreshold() {
        return protectThreshold;
    }

    /**
     * 服务端未返回实例数时为 null
     */
    public Integer getInstanceCount() {
        return instanceCount;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }
}
