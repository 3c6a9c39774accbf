package com.sunny.oauthlink.auth.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.BadRequestException;
import java.util.Map;

/**
 * 按路径配置解析用户信息
 * 单次会话内使用，不支持并发修改路径配置
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class PathUserResponse implements UserResponse {

    private static final TypeReference<Map<String, Object>> RESPONSE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private UserResponsePaths paths = UserResponsePaths.defaults();
    private Map<String, Object> response;

    public PathUserResponse(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Object> getResponse() {
        return response;
    }

    public void setResponse(Map<String, Object> response) {
        this.response = response;
    }

    /**
     * 以 JSON 对象文本设置响应
     */
    public void setResponse(String response) {
        try {
            Map<String, Object> decoded = response == null ? null : objectMapper.readValue(response, RESPONSE_TYPE);
            if (decoded == null) {
                throw new BadRequestException(ErrorType.USER_RESPONSE_INVALID, Map.of(), "Not a valid JSON response.");
            }
            this.response = decoded;
        } catch (JsonProcessingException ex) {
            throw new BadRequestException(ex, ErrorType.USER_RESPONSE_INVALID, Map.of(), "Not a valid JSON response.");
        }
    }

    @Override
    public Object getUsername() {
        return getValueForPath(UserResponsePaths.IDENTIFIER);
    }

    @Override
    public Object getNickname() {
        return getValueForPath(UserResponsePaths.NICKNAME);
    }

    @Override
    public Object getRealName() {
        return getValueForPath(UserResponsePaths.REALNAME);
    }

    @Override
    public Object getEmail() {
        return getValueForPath(UserResponsePaths.EMAIL);
    }

    @Override
    public Object getFirstName() {
        return getValueForPath(UserResponsePaths.FIRST_NAME);
    }

    @Override
    public Object getLastName() {
        return getValueForPath(UserResponsePaths.LAST_NAME);
    }

    @Override
    public Object getProfilePicture() {
        return getValueForPath(UserResponsePaths.PROFILE_PICTURE);
    }

    public Map<String, String> getPaths() {
        return paths.asMap();
    }

    public void setPaths(Map<String, String> paths) {
        this.paths = this.paths.merge(paths);
    }

    /**
     * 按字段名对应的路径逐级取值，任一级缺失返回 null
     */
    public Object getValueForPath(String name) {
        if (response == null || response.isEmpty()) {
            return null;
        }

        String path = paths.getPath(name);
        if (path == null || path.isEmpty()) {
            return null;
        }

        Object value = response;
        for (String step : path.split("\\.", -1)) {
            if (!(value instanceof Map<?, ?> level) || !level.containsKey(step)) {
                return null;
            }
            value = level.get(step);
        }
        return value;
    }
}
