package com.sunny.oauthlink.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 认证启动类
 * 负责服务启动与基础组件装配
 *
 * @author Sunny
 * @date 2026-01-01
 */
@SpringBootApplication
public class OAuthLinkApplication {
    public static void main(String[] args) {
        SpringApplication.run(OAuthLinkApplication.class, args);
    }
}
