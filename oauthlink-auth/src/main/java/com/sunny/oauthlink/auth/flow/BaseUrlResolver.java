package com.sunny.oauthlink.auth.flow;

/**
 * 基于当前请求解析绝对地址
 */
public interface BaseUrlResolver {

    String resolveAbsoluteFromPath(String path);
}
