package com.sunny.oauthlink.auth.flow.support;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ServletBaseUrlResolverTest {

    private final ServletBaseUrlResolver resolver = new ServletBaseUrlResolver();

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void resolveAbsoluteFromPath_shouldPrefixSchemeHostAndContextPath() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setServerName("app.example.com");
        request.setServerPort(8080);
        request.setContextPath("/auth");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals("http://app.example.com:8080/auth/login/check-github",
                resolver.resolveAbsoluteFromPath("/login/check-github"));
    }

    @Test
    void resolveAbsoluteFromPath_shouldOmitDefaultPort() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setServerName("app.example.com");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals("http://app.example.com/login/check-github",
                resolver.resolveAbsoluteFromPath("/login/check-github"));
    }
}
