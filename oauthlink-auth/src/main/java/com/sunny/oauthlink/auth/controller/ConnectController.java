package com.sunny.oauthlink.auth.controller;

import com.sunny.oauthlink.auth.dto.ResourceOwnerItem;
import com.sunny.oauthlink.auth.flow.OAuthFlowCoordinator;
import com.sunny.oauthlink.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.view.RedirectView;

/**
 * OAuth 跳转控制器
 * 负责资源所有者列表与授权跳转
 *
 * <p>绑定回调 {@code /connect/service/{service}} 由宿主应用提供，这里只负责发起跳转。
 *
 * @author Sunny
 * @date 2026-01-01
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "OAuth登录", description = "第三方登录跳转接口")
public class ConnectController {

    private final OAuthFlowCoordinator oauthFlowCoordinator;

    /**
     * 资源所有者列表
     */
    @Operation(summary = "查询可用的第三方登录方式")
    @GetMapping("/oauth/resource-owners")
    public ApiResponse<List<ResourceOwnerItem>> resourceOwners() {
        List<ResourceOwnerItem> items = oauthFlowCoordinator.listProviders().stream()
                .map(name -> new ResourceOwnerItem(name, oauthFlowCoordinator.buildLoginUrl(name)))
                .toList();
        return ApiResponse.ok(items);
    }

    /**
     * 跳转到资源所有者授权页
     */
    @Operation(summary = "跳转到第三方授权页")
    @GetMapping("/connect/{service}")
    public RedirectView redirectToService(@PathVariable("service") String service) {
        RedirectView redirectView = new RedirectView(oauthFlowCoordinator.buildAuthorizationUrl(service));
        redirectView.setExpandUriTemplateVariables(false);
        return redirectView;
    }
}
