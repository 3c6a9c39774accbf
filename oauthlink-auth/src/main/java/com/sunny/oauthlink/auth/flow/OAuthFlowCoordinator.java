package com.sunny.oauthlink.auth.flow;

import com.sunny.oauthlink.auth.owner.ResourceOwner;
import com.sunny.oauthlink.auth.owner.ResourceOwnerMap;
import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.NotFoundException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * OAuth 登录/绑定流程编排
 * 负责选择资源所有者、确定回调地址并委托资源所有者生成授权地址
 *
 * @author Sunny
 * @date 2026-01-01
 */
@Slf4j
public class OAuthFlowCoordinator {

    public static final String CONNECT_SERVICE_ROUTE = "connect-service";
    public static final String SERVICE_REDIRECT_ROUTE = "service-redirect";
    public static final String SERVICE_PARAMETER = "service";

    private final ResourceOwnerMap resourceOwnerMap;
    private final OAuthRouter router;
    private final AuthenticationStateReader authenticationStateReader;
    private final BaseUrlResolver baseUrlResolver;
    private final boolean connect;

    public OAuthFlowCoordinator(ResourceOwnerMap resourceOwnerMap,
                                OAuthRouter router,
                                AuthenticationStateReader authenticationStateReader,
                                BaseUrlResolver baseUrlResolver,
                                boolean connect) {
        this.resourceOwnerMap = resourceOwnerMap;
        this.router = router;
        this.authenticationStateReader = authenticationStateReader;
        this.baseUrlResolver = baseUrlResolver;
        this.connect = connect;
    }

    public List<String> listProviders() {
        return resourceOwnerMap.getResourceOwnerNames();
    }

    public String buildAuthorizationUrl(String name) {
        return buildAuthorizationUrl(name, null, Map.of());
    }

    public String buildAuthorizationUrl(String name, String redirectUrl) {
        return buildAuthorizationUrl(name, redirectUrl, Map.of());
    }

    public String buildAuthorizationUrl(String name, String redirectUrl, Map<String, String> extraParameters) {
        ResourceOwner resourceOwner = getResourceOwner(name);
        String checkPath = resourceOwnerMap.getResourceOwnerCheckPath(name);

        String effectiveRedirectUrl;
        if (!connect || !authenticationStateReader.isAuthenticatedAtLeastRemembered()) {
            effectiveRedirectUrl = generateUri(checkPath);
            log.debug("授权回调使用检查路径: provider={}, redirect={}", name, effectiveRedirectUrl);
        } else if (redirectUrl == null) {
            effectiveRedirectUrl = router.generate(CONNECT_SERVICE_ROUTE, Map.of(SERVICE_PARAMETER, name), true);
            log.debug("授权回调使用绑定路由: provider={}, redirect={}", name, effectiveRedirectUrl);
        } else {
            effectiveRedirectUrl = redirectUrl;
        }

        return resourceOwner.getAuthorizationUrl(
                effectiveRedirectUrl,
                extraParameters == null ? Map.of() : extraParameters);
    }

    public String buildLoginUrl(String name) {
        // 仅校验资源所有者存在
        getResourceOwner(name);

        return router.generate(SERVICE_REDIRECT_ROUTE, Map.of(SERVICE_PARAMETER, name), false);
    }

    private ResourceOwner getResourceOwner(String name) {
        ResourceOwner resourceOwner = resourceOwnerMap.getResourceOwnerByName(name);
        if (resourceOwner == null) {
            throw new NotFoundException(
                    ErrorType.RESOURCE_OWNER_NOT_FOUND,
                    name == null ? Map.of() : Map.of("name", name),
                    "No resource owner with name '%s'.",
                    name);
        }
        return resourceOwner;
    }

    /**
     * 检查路径可以是绝对地址、以 / 开头的路径或路由名
     */
    private String generateUri(String path) {
        if (path == null || path.isEmpty() || path.startsWith("http")) {
            return path;
        }
        if (path.charAt(0) == '/') {
            return baseUrlResolver.resolveAbsoluteFromPath(path);
        }
        return router.generate(path, Map.of(), true);
    }
}
