package com.sunny.oauthlink.auth.response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 用户字段取值路径配置
 * 字段名 -> 以 . 分隔的路径，null 表示未配置
 *
 * @author Sunny
 * @date 2026-01-01
 */
public final class UserResponsePaths {

    public static final String IDENTIFIER = "identifier";
    public static final String NICKNAME = "nickname";
    public static final String REALNAME = "realname";
    public static final String EMAIL = "email";
    public static final String PROFILE_PICTURE = "profilepicture";
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";

    private static final UserResponsePaths DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(IDENTIFIER, null);
        defaults.put(NICKNAME, null);
        defaults.put(REALNAME, null);
        defaults.put(EMAIL, null);
        defaults.put(PROFILE_PICTURE, null);
        DEFAULTS = new UserResponsePaths(defaults);
    }

    private final Map<String, String> paths;

    private UserResponsePaths(Map<String, String> paths) {
        this.paths = Collections.unmodifiableMap(paths);
    }

    public static UserResponsePaths defaults() {
        return DEFAULTS;
    }

    /**
     * 合并覆盖项：同名键以覆盖项为准，其余键保持原值
     */
    public UserResponsePaths merge(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(paths);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new UserResponsePaths(merged);
    }

    public String getPath(String name) {
        return paths.get(name);
    }

    public Map<String, String> asMap() {
        return paths;
    }
}
