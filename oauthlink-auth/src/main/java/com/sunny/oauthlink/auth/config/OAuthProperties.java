package com.sunny.oauthlink.auth.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OAuth 配置属性
 * 承载资源所有者、防火墙与路由配置项并完成参数绑定
 *
 * @author Sunny
 * @date 2026-01-01
 */
@Data
@ConfigurationProperties(prefix = "oauth")
public class OAuthProperties {

    /**
     * 是否启用账号绑定（connect）流程
     */
    private boolean connect = false;

    /**
     * 当前生效的防火墙名称
     */
    private String firewallName = "main";

    private Map<String, Firewall> firewalls = new LinkedHashMap<>();

    /**
     * 路由名 -> URI 模板
     */
    private Map<String, String> routes = new LinkedHashMap<>();

    private Map<String, ResourceOwner> resourceOwners = new LinkedHashMap<>();

    @Data
    public static class Firewall {
        /**
         * 资源所有者名称 -> 回调检查路径，按配置顺序生效
         */
        private Map<String, String> resourceOwners = new LinkedHashMap<>();
    }

    @Data
    public static class ResourceOwner {
        private String authorizationUrl;
        private String clientId;
        private String scope;
    }
}
