package com.sunny.oauthlink.auth.flow.support;

import com.sunny.oauthlink.auth.flow.OAuthRouter;
import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.NotFoundException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriTemplate;

/**
 * 基于配置路由表的路由生成器
 * 路由模板中未声明的参数以查询参数形式追加
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class RouteTableRouter implements OAuthRouter {

    private final Map<String, String> routes;

    public RouteTableRouter(Map<String, String> routes) {
        this.routes = routes == null ? Map.of() : Map.copyOf(routes);
    }

    @Override
    public String generate(String routeName, Map<String, String> parameters, boolean absolute) {
        String template = routeName == null ? null : routes.get(routeName);
        if (template == null) {
            throw new NotFoundException(
                    ErrorType.ROUTE_NOT_FOUND,
                    routeName == null ? Map.of() : Map.of("route", routeName),
                    "Unable to generate a URL for the named route \"%s\" as such route does not exist.",
                    routeName);
        }

        Map<String, String> variables = new HashMap<>();
        Map<String, String> queryParameters = new LinkedHashMap<>();
        List<String> templateVariables = new UriTemplate(template).getVariableNames();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                variables.put(key, value);
                if (!templateVariables.contains(key)) {
                    queryParameters.put(key, value);
                }
            });
        }

        // 模板可带查询串，路径与查询分别拼接到当前 contextPath 之后
        UriComponents templateComponents = UriComponentsBuilder.fromUriString(template).build();
        UriComponentsBuilder builder = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path(templateComponents.getPath());
        if (templateComponents.getQuery() != null) {
            builder.query(templateComponents.getQuery());
        }
        queryParameters.keySet().forEach(key -> builder.queryParam(key, "{" + key + "}"));
        UriComponents components = builder.buildAndExpand(variables).encode();

        if (absolute) {
            return components.toUriString();
        }
        String query = components.getQuery();
        return query == null ? components.getPath() : components.getPath() + "?" + query;
    }
}
