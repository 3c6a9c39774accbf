package com.sunny.oauthlink.auth.owner.provider;

import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GenericOAuth2ResourceOwnerTest {

    @Test
    void getAuthorizationUrl_shouldEncodeRedirectAndScope() {
        GenericOAuth2ResourceOwner owner = new GenericOAuth2ResourceOwner(
                "github", "https://github.com/login/oauth/authorize", "client-1", "user:email repo");

        String url = owner.getAuthorizationUrl("https://app.example.com/login/check-github", Map.of());

        assertEquals("https://github.com/login/oauth/authorize?response_type=code&client_id=client-1"
                + "&redirect_uri=https%3A%2F%2Fapp.example.com%2Flogin%2Fcheck-github"
                + "&scope=user%3Aemail%20repo", url);
    }

    @Test
    void getAuthorizationUrl_shouldLetExtraParametersOverrideDefaults() {
        GenericOAuth2ResourceOwner owner = new GenericOAuth2ResourceOwner(
                "google", "https://accounts.example.com/auth", "client-2", "openid");

        String url = owner.getAuthorizationUrl("https://app/cb", Map.of("scope", "email"));

        assertEquals("https://accounts.example.com/auth?response_type=code&client_id=client-2"
                + "&redirect_uri=https%3A%2F%2Fapp%2Fcb&scope=email", url);
    }

    @Test
    void getAuthorizationUrl_shouldOmitRedirectWhenAbsent() {
        GenericOAuth2ResourceOwner owner = new GenericOAuth2ResourceOwner(
                "github", "https://github.com/login/oauth/authorize", "client-1", null);

        assertEquals("https://github.com/login/oauth/authorize?response_type=code&client_id=client-1",
                owner.getAuthorizationUrl(null, null));
    }

    @Test
    void constructor_shouldRequireClientId() {
        assertThrows(IllegalArgumentException.class,
                () -> new GenericOAuth2ResourceOwner("github", "https://github.com/login/oauth/authorize", " ", null));
    }
}
