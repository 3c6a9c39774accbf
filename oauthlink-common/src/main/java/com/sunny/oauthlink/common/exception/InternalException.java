package com.sunny.oauthlink.common.exception;

import com.sunny.oauthlink.common.constant.Code;
import com.sunny.oauthlink.common.constant.ErrorType;
import java.util.Map;

/**
 * 服务端异常（500）
 * 签名密钥不可用、签名计算失败等非调用方可修正的错误
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class InternalException extends OAuthLinkRuntimeException {

    /**
     * 无具体类型的兜底内部错误
     */
    public InternalException(String message) {
        super(null, Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, Map.of(), message);
    }

    public InternalException(String type, Map<String, String> context, String message, Object... args) {
        super(null, Code.INTERNAL_ERROR, type, context, message, args);
    }

    public InternalException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.INTERNAL_ERROR, type, context, message, args);
    }
}
