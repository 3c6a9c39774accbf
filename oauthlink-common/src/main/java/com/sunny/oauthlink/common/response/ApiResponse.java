package com.sunny.oauthlink.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sunny.oauthlink.common.constant.Code;

/**
 * Api响应模型
 * 定义Api响应数据结构
 *
 * @author Sunny
 * @date 2026-01-01
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private int code;
    private T data;

    public ApiResponse() {
    }

    public ApiResponse(int code, T data) {
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(Code.OK, data);
    }
}
