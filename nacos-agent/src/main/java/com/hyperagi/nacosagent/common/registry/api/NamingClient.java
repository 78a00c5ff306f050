package com.hyperagi.nacosagent.common.registry.api;

import com.hyperagi.nacosagent.common.registry.model.AccessToken;
import com.hyperagi.nacosagent.common.registry.model.HeartbeatResult;
import com.hyperagi.nacosagent.common.registry.model.InstanceRequest;
import com.hyperagi.nacosagent.common.registry.model.RegistryResult;
import com.hyperagi.nacosagent.common.registry.model.ServiceDetail;
import com.hyperagi.nacosagent.common.registry.model.ServiceSnapshot;

import java.io.Closeable;

/**
 * 注册中心命名服务客户端
 *
 * 核心功能：
 * 1. 查询实例列表 / 服务详情
 * 2. 注册 / 注销实例
 * 3. 发送心跳
 *
 * 所有调用同步阻塞，受请求超时约束；客户端内部不做定时任务，
 * 周期性心跳由调用方负责。失败以
 * {@link com.hyperagi.nacosagent.common.registry.exception.RegistryException} 子类抛出。
 */
public interface NamingClient extends Closeable {

    /**
     * 查询实例列表
     *
     * @param serviceName 服务名
     * @param groupName   分组，null 表示服务端默认分组
     * @param clusters    集群过滤，逗号分隔，null 表示不过滤
     * @param healthyOnly 是否只返回健康实例
     * @return 实例快照
     */
    ServiceSnapshot listInstances(String serviceName, String groupName, String clusters, boolean healthyOnly);

    /**
     * 查询实例列表（默认分组、不过滤）
     */
    default ServiceSnapshot listInstances(String serviceName) {
        return listInstances(serviceName, null, null, false);
    }

    /**
     * 查询服务详情
     *
     * @param serviceName 服务名
     * @param groupName   分组，null 表示服务端默认分组
     * @return 服务详情
     */
    ServiceDetail getServiceDetail(String serviceName, String groupName);

    default ServiceDetail getServiceDetail(String serviceName) {
        return getServiceDetail(serviceName, null);
    }

    /**
     * 注册实例（服务端按 upsert 处理）
     *
     * @param request 实例参数
     * @return 注册结果
     * @throws IllegalArgumentException 端口不在 1-65535 范围内
     */
    RegistryResult registerInstance(InstanceRequest request);

    /**
     * 注销实例
     * <p>
     * 幂等：实例不存在时返回成功，但 errorCode 为 NOT_FOUND
     *
     * @param request 实例参数
     * @return 注销结果
     */
    RegistryResult deregisterInstance(InstanceRequest request);

    /**
     * 发送一次心跳
     * <p>
     * 实例未注册时抛出 NOT_FOUND 的 ProtocolException，不会静默成功
     *
     * @param request 实例参数
     * @return 心跳结果
     */
    HeartbeatResult sendHeartbeat(InstanceRequest request);

    /**
     * 使用配置的用户名密码登录，换取 accessToken
     */
    AccessToken login();

    /**
     * 取消在途请求并释放连接
     */
    @Override
    void close();
}
