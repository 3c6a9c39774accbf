package com.sunny.oauthlink.auth.security.signature;

import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.BadRequestException;
import java.util.Map;

/**
 * OAuth1 签名方法枚举
 * 定义 oauth_signature_method 取值
 *
 * @author Sunny
 * @date 2026-01-01
 */
public enum SignatureMethod {
    HMAC_SHA1("HMAC-SHA1"),
    RSA_SHA1("RSA-SHA1"),
    PLAINTEXT("PLAINTEXT");

    private final String value;

    SignatureMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 按协议取值解析，区分大小写
     */
    public static SignatureMethod fromValue(String value) {
        for (SignatureMethod method : values()) {
            if (method.value.equals(value)) {
                return method;
            }
        }
        throw unsupported(value);
    }

    static BadRequestException unsupported(String value) {
        return new BadRequestException(
                ErrorType.OAUTH_SIGNATURE_METHOD_UNSUPPORTED,
                value == null ? Map.of() : Map.of("signatureMethod", value),
                "Unknown signature method selected %s.",
                value);
    }
}
