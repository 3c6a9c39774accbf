package com.sunny.oauthlink.auth.owner.provider;

import com.sunny.oauthlink.auth.owner.ResourceOwner;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * 通用 OAuth2 资源所有者
 * 仅根据配置拼装授权地址，不发起任何网络请求
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class GenericOAuth2ResourceOwner implements ResourceOwner {

    private static final String DEFAULT_RESPONSE_TYPE = "code";

    private final String name;
    private final String authorizationUrl;
    private final String clientId;
    private final String scope;

    public GenericOAuth2ResourceOwner(String name, String authorizationUrl, String clientId, String scope) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("资源所有者名称不能为空");
        }
        if (!StringUtils.hasText(authorizationUrl)) {
            throw new IllegalArgumentException("授权地址不能为空: " + name);
        }
        if (!StringUtils.hasText(clientId)) {
            throw new IllegalArgumentException("clientId 不能为空: " + name);
        }
        this.name = name;
        this.authorizationUrl = authorizationUrl.trim();
        this.clientId = clientId.trim();
        this.scope = StringUtils.hasText(scope) ? scope.trim() : null;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getAuthorizationUrl(String redirectUrl, Map<String, String> extraParameters) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("response_type", DEFAULT_RESPONSE_TYPE);
        parameters.put("client_id", clientId);
        if (redirectUrl != null) {
            parameters.put("redirect_uri", redirectUrl);
        }
        if (scope != null) {
            parameters.put("scope", scope);
        }
        if (extraParameters != null) {
            parameters.putAll(extraParameters);
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(authorizationUrl);
        parameters.forEach((key, value) -> builder.queryParam(encode(key), encode(value)));
        return builder.build(true).toUriString();
    }

    private String encode(String value) {
        return UriUtils.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
