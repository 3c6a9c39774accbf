package com.sunny.oauthlink.auth.flow.support;

import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.NotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RouteTableRouterTest {

    private RouteTableRouter router;

    @BeforeEach
    void setUp() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setScheme("https");
        request.setServerName("app.example.com");
        request.setServerPort(443);
        request.setContextPath("/auth");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        router = new RouteTableRouter(Map.of(
                "connect-service", "/connect/service/{service}",
                "service-redirect", "/connect/{service}",
                "google_check", "/login/check-google",
                "connect-confirm", "/connect/confirm?step=1&service={service}"));
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void generate_shouldBuildAbsoluteUrlFromCurrentRequest() {
        String url = router.generate("connect-service", Map.of("service", "github"), true);

        assertEquals("https://app.example.com/auth/connect/service/github", url);
    }

    @Test
    void generate_shouldBuildRelativePathWithContextPath() {
        String url = router.generate("service-redirect", Map.of("service", "google"), false);

        assertEquals("/auth/connect/google", url);
    }

    @Test
    void generate_shouldAppendUndeclaredParametersAsQuery() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("service", "google");
        parameters.put("target", "a b");

        String url = router.generate("service-redirect", parameters, false);

        assertEquals("/auth/connect/google?target=a%20b", url);
    }

    @Test
    void generate_shouldHandleRouteWithoutParameters() {
        assertEquals("https://app.example.com/auth/login/check-google",
                router.generate("google_check", Map.of(), true));
    }

    @Test
    void generate_shouldKeepQueryDeclaredInTemplate() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("service", "github");
        parameters.put("target", "/home");

        assertEquals("/auth/connect/confirm?step=1&service=github&target=/home",
                router.generate("connect-confirm", parameters, false));
        assertEquals("https://app.example.com/auth/connect/confirm?step=1&service=github",
                router.generate("connect-confirm", Map.of("service", "github"), true));
    }

    @Test
    void generate_shouldRejectUnknownRoute() {
        NotFoundException exception = assertThrows(NotFoundException.class,
                () -> router.generate("missing", Map.of(), true));

        assertEquals(ErrorType.ROUTE_NOT_FOUND, exception.getType());
        assertEquals("missing", exception.getContext().get("route"));
    }
}
