package com.sunny.oauthlink.auth.controller;

import com.sunny.oauthlink.auth.flow.OAuthFlowCoordinator;
import com.sunny.oauthlink.auth.handler.OAuthLinkExceptionHandler;
import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.NotFoundException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ConnectControllerTest {

    @Mock
    private OAuthFlowCoordinator oauthFlowCoordinator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ConnectController(oauthFlowCoordinator))
                .setControllerAdvice(new OAuthLinkExceptionHandler())
                .build();
    }

    @Test
    void resourceOwners_shouldListProvidersWithLoginUrls() throws Exception {
        when(oauthFlowCoordinator.listProviders()).thenReturn(List.of("github", "google"));
        when(oauthFlowCoordinator.buildLoginUrl("github")).thenReturn("/connect/github");
        when(oauthFlowCoordinator.buildLoginUrl("google")).thenReturn("/connect/google");

        mockMvc.perform(get("/oauth/resource-owners"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.data[0].name").value("github"))
                .andExpect(jsonPath("$.data[0].loginUrl").value("/connect/github"))
                .andExpect(jsonPath("$.data[1].name").value("google"));
    }

    @Test
    void redirectToService_shouldRedirectToAuthorizationUrl() throws Exception {
        String authorizationUrl = "https://github.com/login/oauth/authorize?response_type=code&client_id=abc"
                + "&redirect_uri=http%3A%2F%2Flocalhost%2Flogin%2Fcheck-github&scope=user%3Aemail";
        when(oauthFlowCoordinator.buildAuthorizationUrl("github")).thenReturn(authorizationUrl);

        mockMvc.perform(get("/connect/github"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", authorizationUrl));
    }

    @Test
    void redirectToService_shouldRenderNotFoundForUnknownProvider() throws Exception {
        when(oauthFlowCoordinator.buildAuthorizationUrl("facebook")).thenThrow(new NotFoundException(
                ErrorType.RESOURCE_OWNER_NOT_FOUND,
                Map.of("name", "facebook"),
                "No resource owner with name '%s'.",
                "facebook"));

        mockMvc.perform(get("/connect/facebook"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404))
                .andExpect(jsonPath("$.type").value(ErrorType.RESOURCE_OWNER_NOT_FOUND))
                .andExpect(jsonPath("$.message").value("No resource owner with name 'facebook'."))
                .andExpect(jsonPath("$.context.name").value("facebook"))
                .andExpect(jsonPath("$.stack").doesNotExist());
    }

    @Test
    void connectCallback_shouldNotStartAnotherAuthorizationRedirect() throws Exception {
        mockMvc.perform(get("/connect/service/github"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value(ErrorType.NOT_FOUND))
                .andExpect(jsonPath("$.context.path").value("/connect/service/github"));

        verifyNoInteractions(oauthFlowCoordinator);
    }
}
