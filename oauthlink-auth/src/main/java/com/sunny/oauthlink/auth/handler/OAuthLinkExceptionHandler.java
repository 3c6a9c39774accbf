package com.sunny.oauthlink.auth.handler;

import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.ExceptionMapper;
import com.sunny.oauthlink.common.exception.NotFoundException;
import com.sunny.oauthlink.common.exception.OAuthLinkRuntimeException;
import com.sunny.oauthlink.common.response.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * OAuth 接口统一异常输出
 * 未知资源所有者、签名参数错误等按 {@link ExceptionMapper} 归一为 ErrorResponse，
 * 5xx 记 ERROR 并附带堆栈，其余记 WARN
 *
 * @author Sunny
 * @date 2026-01-01
 */
@Slf4j
@RestControllerAdvice
public class OAuthLinkExceptionHandler {

    @ExceptionHandler(OAuthLinkRuntimeException.class)
    public ErrorResponse handleOAuthLinkRuntimeException(OAuthLinkRuntimeException exception,
                                                         HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    /**
     * 未映射的路径（如宿主应用未实现的绑定回调）按 404 输出
     */
    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ErrorResponse handleNoHandlerFound(Exception exception,
                                              HttpServletRequest request,
                                              HttpServletResponse response) {
        String path = request.getRequestURI();
        return buildErrorResponse(new NotFoundException(
                ErrorType.NOT_FOUND,
                Map.of("path", path),
                "No handler found for %s.",
                path), response);
    }

    @ExceptionHandler(Exception.class)
    public ErrorResponse handleException(Exception exception, HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    private ErrorResponse buildErrorResponse(Throwable throwable, HttpServletResponse response) {
        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(throwable);
        if (detail.serverError()) {
            log.error("OAuth 服务异常: type={}, message={}", detail.type(), detail.message(), throwable);
        } else {
            log.warn("OAuth 请求异常: type={}, message={}, context={}", detail.type(), detail.message(), detail.context());
        }

        response.setStatus(detail.httpStatus());
        return ErrorResponse.of(
                detail.errorCode(),
                detail.type(),
                detail.message(),
                detail.context().isEmpty() ? null : detail.context(),
                detail.traceId(),
                detail.retryable() ? Boolean.TRUE : null,
                detail.serverError() ? detail.stack() : null);
    }
}
