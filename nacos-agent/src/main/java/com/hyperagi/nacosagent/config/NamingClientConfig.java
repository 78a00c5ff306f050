package com.hyperagi.nacosagent.config;

import com.hyperagi.nacosagent.common.registry.api.NamingClient;
import com.hyperagi.nacosagent.common.registry.impl.NacosHttpNamingClient;
import com.hyperagi.nacosagent.common.registry.model.EndpointConfig;
import com.hyperagi.nacosagent.config.properties.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 注册中心客户端配置
 */
@Configuration
public class NamingClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(NamingClientConfig.class);

    @Bean
    public EndpointConfig endpointConfig(RegistryProperties properties) {
        EndpointConfig config = new EndpointConfig(
                properties.getServer(),
                properties.getUsername(),
                properties.getPassword(),
                properties.getHttpTimeout(),
                properties.getTokenTtl()
        );
        logger.info("初始化注册中心端点: {}", config);
        return config;
    }

    @Bean(destroyMethod = "close")
    public NamingClient namingClient(EndpointConfig endpointConfig) {
        return new NacosHttpNamingClient(endpointConfig);
    }
}
