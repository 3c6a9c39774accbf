package com.sunny.oauthlink.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 错误响应体
 * 空字段不输出，stack 仅在服务端错误时携带
 *
 * @author Sunny
 * @date 2026-01-01
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private int code;

    private String type;

    private String message;

    private Map<String, String> context;

    private String traceId;

    private Boolean retryable;

    private List<String> stack;

    public static ErrorResponse of(int code,
                                   String type,
                                   String message,
                                   Map<String, String> context,
                                   String traceId,
                                   Boolean retryable,
                                   List<String> stack) {
        return new ErrorResponse(code, type, message, context, traceId, retryable, stack);
    }
}
