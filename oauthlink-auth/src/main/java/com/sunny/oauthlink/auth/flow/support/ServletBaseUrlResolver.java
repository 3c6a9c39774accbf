package com.sunny.oauthlink.auth.flow.support;

import com.sunny.oauthlink.auth.flow.BaseUrlResolver;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * 基于当前 Servlet 请求的 scheme/host/contextPath 拼接绝对地址
 */
public class ServletBaseUrlResolver implements BaseUrlResolver {

    @Override
    public String resolveAbsoluteFromPath(String path) {
        return ServletUriComponentsBuilder.fromCurrentContextPath()
                .path(path)
                .build()
                .toUriString();
    }
}
