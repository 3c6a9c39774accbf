package com.sunny.oauthlink.auth.flow;

import java.util.Map;

/**
 * 命名路由生成能力
 */
public interface OAuthRouter {

    /**
     * 按路由名生成地址
     *
     * @param routeName  路由名
     * @param parameters 路由参数
     * @param absolute   是否生成带 scheme/host 的绝对地址
     */
    String generate(String routeName, Map<String, String> parameters, boolean absolute);
}
