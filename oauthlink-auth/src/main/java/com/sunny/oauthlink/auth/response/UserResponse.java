package com.sunny.oauthlink.auth.response;

import java.util.Map;

/**
 * 第三方用户信息响应
 * 不同实现以不同方式从提供方原始响应中取出用户字段
 */
public interface UserResponse {

    Map<String, Object> getResponse();

    /**
     * 提供方侧的唯一用户标识
     */
    Object getUsername();

    Object getNickname();

    Object getRealName();

    Object getEmail();

    Object getFirstName();

    Object getLastName();

    Object getProfilePicture();
}
