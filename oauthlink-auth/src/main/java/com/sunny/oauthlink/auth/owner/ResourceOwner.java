package com.sunny.oauthlink.auth.owner;

import java.util.Map;

/**
 * 资源所有者（第三方身份提供方）抽象
 */
public interface ResourceOwner {
    /**
     * 返回资源所有者标识（github/google/twitter）
     */
    String getName();

    /**
     * 构建提供方授权地址
     *
     * @param redirectUrl     授权完成后的回调地址
     * @param extraParameters 附加到授权地址的参数
     */
    String getAuthorizationUrl(String redirectUrl, Map<String, String> extraParameters);
}
