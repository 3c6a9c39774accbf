package com.sunny.oauthlink.auth.flow;

/**
 * 当前主体认证状态读取能力
 */
public interface AuthenticationStateReader {

    /**
     * 当前主体是否至少通过 remember-me 认证
     */
    boolean isAuthenticatedAtLeastRemembered();
}
