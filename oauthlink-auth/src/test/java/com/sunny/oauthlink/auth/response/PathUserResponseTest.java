package com.sunny.oauthlink.auth.response;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.BadRequestException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PathUserResponseTest {

    private PathUserResponse userResponse;

    @BeforeEach
    void setUp() {
        userResponse = new PathUserResponse(new ObjectMapper());
    }

    @Test
    void getValueForPath_shouldWalkNestedPath() {
        userResponse.setPaths(Map.of(UserResponsePaths.IDENTIFIER, "a.b.c"));
        userResponse.setResponse(Map.of("a", Map.of("b", Map.of("c", 42))));

        assertEquals(42, userResponse.getUsername());
    }

    @Test
    void getValueForPath_shouldReturnNullForMissingStep() {
        userResponse.setPaths(Map.of(UserResponsePaths.IDENTIFIER, "a.b.c"));
        userResponse.setResponse(Map.of("a", Map.of("b", Map.of())));

        assertNull(userResponse.getUsername());
    }

    @Test
    void getValueForPath_shouldReturnNullWhenIntermediateIsNotObject() {
        userResponse.setPaths(Map.of(UserResponsePaths.IDENTIFIER, "a.b"));
        userResponse.setResponse(Map.of("a", "scalar"));

        assertNull(userResponse.getUsername());
    }

    @Test
    void getValueForPath_shouldReturnNullForEmptyResponse() {
        userResponse.setPaths(Map.of(UserResponsePaths.IDENTIFIER, "id"));
        userResponse.setResponse(Map.of());

        assertNull(userResponse.getUsername());
    }

    @Test
    void getValueForPath_shouldKeepExplicitNullLeaf() {
        Map<String, Object> response = new HashMap<>();
        response.put("id", null);
        userResponse.setPaths(Map.of(UserResponsePaths.IDENTIFIER, "id"));
        userResponse.setResponse(response);

        assertNull(userResponse.getUsername());
    }

    @Test
    void setPaths_shouldMergeWithDefaults() {
        userResponse.setPaths(Map.of(UserResponsePaths.NICKNAME, "login"));
        userResponse.setResponse(Map.of("login", "bob", "email", "bob@example.com"));

        assertEquals("bob", userResponse.getNickname());
        assertNull(userResponse.getEmail());
        assertNull(userResponse.getFirstName());
        assertNull(userResponse.getLastName());
        assertEquals(5, userResponse.getPaths().size());
    }

    @Test
    void setPaths_shouldResolveNestedNicknamePath() {
        userResponse.setPaths(Map.of(UserResponsePaths.NICKNAME, "user.login"));
        userResponse.setResponse(Map.of("user", Map.of("login", "bob")));

        assertEquals("bob", userResponse.getNickname());
        assertNull(userResponse.getEmail());
    }

    @Test
    void setResponse_shouldDecodeJsonObject() {
        userResponse.setPaths(Map.of(
                UserResponsePaths.IDENTIFIER, "id",
                UserResponsePaths.REALNAME, "profile.name",
                UserResponsePaths.PROFILE_PICTURE, "profile.avatar"));
        userResponse.setResponse("{\"id\":\"u-1\",\"profile\":{\"name\":\"Sunny\",\"avatar\":\"https://cdn/a.png\"}}");

        assertEquals("u-1", userResponse.getUsername());
        assertEquals("Sunny", userResponse.getRealName());
        assertEquals("https://cdn/a.png", userResponse.getProfilePicture());
    }

    @Test
    void setResponse_shouldRejectInvalidJson() {
        BadRequestException exception = assertThrows(BadRequestException.class,
                () -> userResponse.setResponse("{not json"));

        assertEquals(ErrorType.USER_RESPONSE_INVALID, exception.getType());
        assertEquals("Not a valid JSON response.", exception.getMessage());
    }

    @Test
    void setResponse_shouldRejectNullText() {
        assertThrows(BadRequestException.class, () -> userResponse.setResponse((String) null));
    }
}
