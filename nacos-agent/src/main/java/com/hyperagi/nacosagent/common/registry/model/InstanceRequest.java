package com.hyperagi.nacosagent.common.registry.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 注册 / 注销 / 心跳请求参数
 * <p>
 * 除 serviceName、ip、port 外均为可选，null 表示不传给服务端
 */
public class InstanceRequest {
    private String serviceName;
    private String ip;
    private int port;
    private Double weight;
    private String clusterName;
    private String groupName;
    private Boolean ephemeral;
    private Map<String, String> metadata = new LinkedHashMap<>();

    public static InstanceRequest of(String serviceName, String ip, int port) {
        InstanceRequest request = new InstanceRequest();
        request.setServiceName(serviceName);
        request.setIp(ip);
        request.setPort(port);
        return request;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public Double getWeight() {
        return weight;
    }

    public void setWeight(Double weight) {
        this.weight = weight;
    }

    public String getClusterName() {
        return clusterName;
    }

    public void setClusterName(String clusterName) {
        this.clusterName = clusterName;
    }

    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(String groupName) {
        this.groupName = groupName;
    }

    public Boolean getEphemeral() {
        return ephemeral;
    }

    public void setEphemeral(Boolean ephemeral) {
        this.ephemeral = ephemeral;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = metadata;
    }

    public String describe() {
        return serviceName + " -> " + ip + ":" + port;
    }

    @Override
    public String toString() {
        return "InstanceRequest{" +
                "serviceName='" + serviceName + '\'' +
                ", ip='" + ip + '\'' +
                ", port=" + port +
                ", weight=" + weight +
                ", clusterName='" + clusterName + '\'' +
                ", groupName='" + groupName + '\'' +
                ", ephemeral=" + ephemeral +
                ", metadata=" + metadata +
                '}';
    }
}
