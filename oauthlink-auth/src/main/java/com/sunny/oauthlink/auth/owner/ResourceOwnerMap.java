package com.sunny.oauthlink.auth.owner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 资源所有者映射
 * 维护单个防火墙下 名称 -> 资源所有者 / 回调检查路径 的只读映射，保持配置顺序
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ResourceOwnerMap {

    private final Map<String, ResourceOwner> resourceOwners;
    private final Map<String, String> checkPaths;

    /**
     * @param possibleResourceOwners 可用的资源所有者
     * @param checkPaths             名称 -> 回调检查路径，迭代顺序即对外顺序
     */
    public ResourceOwnerMap(List<ResourceOwner> possibleResourceOwners, Map<String, String> checkPaths) {
        Map<String, ResourceOwner> available = new LinkedHashMap<>();
        if (possibleResourceOwners != null) {
            for (ResourceOwner resourceOwner : possibleResourceOwners) {
                available.put(resourceOwner.getName(), resourceOwner);
            }
        }

        Map<String, ResourceOwner> owners = new LinkedHashMap<>();
        Map<String, String> paths = new LinkedHashMap<>();
        if (checkPaths != null) {
            checkPaths.forEach((name, checkPath) -> {
                ResourceOwner resourceOwner = available.get(name);
                if (resourceOwner == null) {
                    throw new IllegalStateException("资源所有者未定义: " + name);
                }
                owners.put(name, resourceOwner);
                paths.put(name, checkPath);
            });
        }
        this.resourceOwners = Collections.unmodifiableMap(owners);
        this.checkPaths = Collections.unmodifiableMap(paths);
    }

    /**
     * 未注册时返回 null
     */
    public ResourceOwner getResourceOwnerByName(String name) {
        return name == null ? null : resourceOwners.get(name);
    }

    public String getResourceOwnerCheckPath(String name) {
        return name == null ? null : checkPaths.get(name);
    }

    public List<String> getResourceOwnerNames() {
        return List.copyOf(resourceOwners.keySet());
    }

    public Map<String, ResourceOwner> getResourceOwners() {
        return resourceOwners;
    }
}
