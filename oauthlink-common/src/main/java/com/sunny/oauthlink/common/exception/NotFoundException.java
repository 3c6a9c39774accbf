package com.sunny.oauthlink.common.exception;

import com.sunny.oauthlink.common.constant.Code;
import java.util.Map;

/**
 * 查找失败（404），资源所有者或命名路由不存在
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class NotFoundException extends OAuthLinkRuntimeException {

    public NotFoundException(String type, Map<String, String> context, String message, Object... args) {
        super(null, Code.NOT_FOUND, type, context, message, args);
    }
}
