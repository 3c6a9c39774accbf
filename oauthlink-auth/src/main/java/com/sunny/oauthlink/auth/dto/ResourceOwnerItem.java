package com.sunny.oauthlink.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 资源所有者列表项
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceOwnerItem {
    private String name;
    private String loginUrl;
}
