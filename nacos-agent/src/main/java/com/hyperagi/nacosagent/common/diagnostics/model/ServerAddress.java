package com.hyperagi.nacosagent.common.diagnostics.model;

import com.hyperagi.nacosagent.common.registry.exception.ConfigException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * 注册中心地址解析结果
 * <p>
 * 支持 http://host:port、https://host:port、host:port、host 四种写法，
 * 逗号分隔的多个地址只取第一个；未写端口时 http 取 80，https 取 443
 */
public record ServerAddress(String scheme, String host, int port) {

    public static ServerAddress parse(String server) {
        if (server == null || server.isBlank()) {
            throw new ConfigException("Nacos 服务器地址未配置");
        }

        String first = server.split(",")[0].trim();
        String withScheme = first.contains("://") ? first : "http://" + first;

        URI uri;
        try {
            uri = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new ConfigException("无效的 Nacos 服务器地址: " + server, e);
        }

        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase();
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new ConfigException("无效的 Nacos 服务器地址: " + server);
        }

        int port = uri.getPort();
        if (port < 0) {
            port = "https".equals(scheme) ? 443 : 80;
        }
        return new ServerAddress(scheme, host, port);
    }

    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
