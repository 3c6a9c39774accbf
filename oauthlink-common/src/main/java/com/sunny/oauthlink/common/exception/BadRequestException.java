package com.sunny.oauthlink.common.exception;

import com.sunny.oauthlink.common.constant.Code;
import java.util.Map;

/**
 * 请求参数异常（400）
 * 缺少 OAuth 参数、不支持的签名方法、无法解析的用户信息响应
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class BadRequestException extends OAuthLinkRuntimeException {

    public BadRequestException(String type, Map<String, String> context, String message, Object... args) {
        super(null, Code.BAD_REQUEST, type, context, message, args);
    }

    public BadRequestException(Throwable cause,
                               String type,
                               Map<String, String> context,
                               String message,
                               Object... args) {
        super(cause, Code.BAD_REQUEST, type, context, message, args);
    }
}
