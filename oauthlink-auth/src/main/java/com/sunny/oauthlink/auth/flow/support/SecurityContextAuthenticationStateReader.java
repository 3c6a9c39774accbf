package com.sunny.oauthlink.auth.flow.support;

import com.sunny.oauthlink.auth.flow.AuthenticationStateReader;
import org.springframework.security.authentication.AuthenticationTrustResolver;
import org.springframework.security.authentication.AuthenticationTrustResolverImpl;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * 基于 Spring Security 上下文的认证状态读取
 * 已认证且非匿名即视为至少 remember-me 认证
 */
public class SecurityContextAuthenticationStateReader implements AuthenticationStateReader {

    private final AuthenticationTrustResolver trustResolver = new AuthenticationTrustResolverImpl();

    @Override
    public boolean isAuthenticatedAtLeastRemembered() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        return authentication != null
                && authentication.isAuthenticated()
                && !trustResolver.isAnonymous(authentication);
    }
}
