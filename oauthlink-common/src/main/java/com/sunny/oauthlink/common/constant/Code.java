package com.sunny.oauthlink.common.constant;

/**
 * 统一错误码常量
 * 全项目仅允许使用该集合中的状态码
 *
 * @author Sunny
 * @date 2026-02-23
 */
public final class Code {

    public static final int OK = 0;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int INTERNAL_ERROR = 500;

    private Code() {
    }
}
