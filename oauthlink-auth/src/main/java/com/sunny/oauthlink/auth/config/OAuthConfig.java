package com.sunny.oauthlink.auth.config;

import com.sunny.oauthlink.auth.flow.AuthenticationStateReader;
import com.sunny.oauthlink.auth.flow.BaseUrlResolver;
import com.sunny.oauthlink.auth.flow.OAuthFlowCoordinator;
import com.sunny.oauthlink.auth.flow.OAuthRouter;
import com.sunny.oauthlink.auth.flow.support.RouteTableRouter;
import com.sunny.oauthlink.auth.flow.support.SecurityContextAuthenticationStateReader;
import com.sunny.oauthlink.auth.flow.support.ServletBaseUrlResolver;
import com.sunny.oauthlink.auth.owner.ResourceOwner;
import com.sunny.oauthlink.auth.owner.ResourceOwnerMap;
import com.sunny.oauthlink.auth.owner.provider.GenericOAuth2ResourceOwner;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OAuth 配置
 * 负责资源所有者映射、路由与流程编排器的装配
 *
 * @author Sunny
 * @date 2026-01-01
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(OAuthProperties.class)
public class OAuthConfig {

    private final OAuthProperties properties;

    @Bean
    public ResourceOwnerMap resourceOwnerMap(ObjectProvider<ResourceOwner> customResourceOwners) {
        OAuthProperties.Firewall firewall = properties.getFirewalls().get(properties.getFirewallName());
        if (firewall == null) {
            throw new IllegalStateException("防火墙未配置: " + properties.getFirewallName());
        }

        List<ResourceOwner> resourceOwners = new ArrayList<>();
        properties.getResourceOwners().forEach((name, owner) -> resourceOwners.add(
                new GenericOAuth2ResourceOwner(name, owner.getAuthorizationUrl(), owner.getClientId(), owner.getScope())));
        customResourceOwners.orderedStream().forEach(resourceOwners::add);

        ResourceOwnerMap resourceOwnerMap = new ResourceOwnerMap(resourceOwners, firewall.getResourceOwners());
        log.info("OAuth 资源所有者已加载: firewall={}, owners={}",
                properties.getFirewallName(), resourceOwnerMap.getResourceOwnerNames());
        return resourceOwnerMap;
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthRouter oauthRouter() {
        return new RouteTableRouter(properties.getRoutes());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthenticationStateReader authenticationStateReader() {
        return new SecurityContextAuthenticationStateReader();
    }

    @Bean
    @ConditionalOnMissingBean
    public BaseUrlResolver baseUrlResolver() {
        return new ServletBaseUrlResolver();
    }

    @Bean
    public OAuthFlowCoordinator oauthFlowCoordinator(ResourceOwnerMap resourceOwnerMap,
                                                     OAuthRouter oauthRouter,
                                                     AuthenticationStateReader authenticationStateReader,
                                                     BaseUrlResolver baseUrlResolver) {
        return new OAuthFlowCoordinator(
                resourceOwnerMap,
                oauthRouter,
                authenticationStateReader,
                baseUrlResolver,
                properties.isConnect());
    }
}
