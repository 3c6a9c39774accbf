package com.sunny.oauthlink.common.exception;

import java.util.Map;

/**
 * OAuthLink 运行时异常基类
 * code 对应 HTTP 状态，type 为业务错误类型，context 为定位问题用的键值
 *
 * <p>消息按 {@link String#format} 模板处理，无参数时原样使用。
 *
 * @author Sunny
 * @date 2026-01-01
 */
public abstract class OAuthLinkRuntimeException extends RuntimeException {

    private final int code;
    private final String type;
    private final Map<String, String> context;

    protected OAuthLinkRuntimeException(Throwable cause,
                                        int code,
                                        String type,
                                        Map<String, String> context,
                                        String message,
                                        Object... args) {
        super(format(message, args), cause);
        this.code = code;
        this.type = type;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public int getCode() {
        return code;
    }

    public String getType() {
        return type;
    }

    public Map<String, String> getContext() {
        return context;
    }

    /**
     * 本服务的异常均不可重试
     */
    public boolean isRetryable() {
        return false;
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
