package com.sunny.oauthlink.common.constant;

/**
 * 统一错误类型常量
 * 业务语义统一通过 type 字段传递
 *
 * @author Sunny
 * @date 2026-02-23
 */
public final class ErrorType {

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static final String OAUTH_PARAMETER_REQUIRED = "OAUTH_PARAMETER_REQUIRED";
    public static final String OAUTH_SIGNATURE_METHOD_UNSUPPORTED = "OAUTH_SIGNATURE_METHOD_UNSUPPORTED";
    public static final String OAUTH_SIGNATURE_KEY_INVALID = "OAUTH_SIGNATURE_KEY_INVALID";
    public static final String OAUTH_SIGNATURE_FAILED = "OAUTH_SIGNATURE_FAILED";
    public static final String RESOURCE_OWNER_NOT_FOUND = "RESOURCE_OWNER_NOT_FOUND";
    public static final String ROUTE_NOT_FOUND = "ROUTE_NOT_FOUND";
    public static final String USER_RESPONSE_INVALID = "USER_RESPONSE_INVALID";

    private ErrorType() {
    }
}
