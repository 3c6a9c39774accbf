package com.sunny.oauthlink.auth.security.signature;

import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.BadRequestException;
import com.sunny.oauthlink.common.exception.InternalException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Arrays;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.web.util.UriUtils;

/**
 * OAuth1 请求签名工具
 * 负责生成签名基串并按 HMAC-SHA1 / RSA-SHA1 / PLAINTEXT 计算签名
 *
 * <p>纯函数实现，无状态，可并发调用。时间戳与 nonce 由调用方通过参数传入。
 *
 * @author Sunny
 * @date 2026-01-01
 */
public final class OAuthSignatureUtil {

    public static final String OAUTH_CONSUMER_KEY = "oauth_consumer_key";
    public static final String OAUTH_TIMESTAMP = "oauth_timestamp";
    public static final String OAUTH_NONCE = "oauth_nonce";
    public static final String OAUTH_VERSION = "oauth_version";
    public static final String OAUTH_SIGNATURE_METHOD = "oauth_signature_method";
    public static final String OAUTH_SIGNATURE = "oauth_signature";

    private static final List<String> REQUIRED_PARAMETERS = List.of(
            OAUTH_CONSUMER_KEY,
            OAUTH_TIMESTAMP,
            OAUTH_NONCE,
            OAUTH_VERSION,
            OAUTH_SIGNATURE_METHOD);

    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final String RSA_ALGORITHM = "SHA1withRSA";

    private static final Comparator<String> BYTE_ORDER = (left, right) -> Arrays.compareUnsigned(
            left.getBytes(StandardCharsets.UTF_8),
            right.getBytes(StandardCharsets.UTF_8));

    private OAuthSignatureUtil() {
    }

    public static String sign(String method, String url, Map<String, String> parameters, String clientSecret) {
        return sign(method, url, parameters, clientSecret, "", SignatureMethod.HMAC_SHA1);
    }

    public static String sign(String method,
                              String url,
                              Map<String, String> parameters,
                              String clientSecret,
                              String tokenSecret) {
        return sign(method, url, parameters, clientSecret, tokenSecret, SignatureMethod.HMAC_SHA1);
    }

    /**
     * 按协议字符串选择签名方法，未知取值抛出参数异常
     */
    public static String sign(String method,
                              String url,
                              Map<String, String> parameters,
                              String clientSecret,
                              String tokenSecret,
                              String signatureMethod) {
        validateParameters(parameters);
        return sign(method, url, parameters, clientSecret, tokenSecret, SignatureMethod.fromValue(signatureMethod));
    }

    public static String sign(String method,
                              String url,
                              Map<String, String> parameters,
                              String clientSecret,
                              String tokenSecret,
                              SignatureMethod signatureMethod) {
        String baseString = buildBaseString(method, url, parameters);
        if (signatureMethod == null) {
            throw SignatureMethod.unsupported(null);
        }
        String secret = tokenSecret == null ? "" : tokenSecret;
        byte[] signature = switch (signatureMethod) {
            case HMAC_SHA1 -> hmacSha1(baseString, clientSecret, secret);
            case RSA_SHA1 -> rsaSha1(baseString, clientSecret, secret);
            case PLAINTEXT -> baseString.getBytes(StandardCharsets.UTF_8);
        };
        return Base64.getEncoder().encodeToString(signature);
    }

    /**
     * 生成签名基串：METHOD&encode(url)&encode(排序后的参数串)
     */
    public static String buildBaseString(String method, String url, Map<String, String> parameters) {
        validateParameters(parameters);

        Map<String, String> sorted = new TreeMap<>(BYTE_ORDER);
        sorted.putAll(parameters);
        sorted.remove(OAUTH_SIGNATURE);

        StringJoiner query = new StringJoiner("&");
        sorted.forEach((key, value) -> {
            if (value != null) {
                query.add(encode(key) + "=" + encode(value));
            }
        });

        return method.toUpperCase(Locale.ROOT) + "&" + encode(url) + "&" + encode(query.toString());
    }

    /**
     * RFC 3986 百分号编码，仅保留 unreserved 字符
     */
    public static String encode(String value) {
        return UriUtils.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static void validateParameters(Map<String, String> parameters) {
        for (String parameter : REQUIRED_PARAMETERS) {
            if (parameters == null || parameters.get(parameter) == null) {
                throw new BadRequestException(
                        ErrorType.OAUTH_PARAMETER_REQUIRED,
                        Map.of("parameter", parameter),
                        "Parameter \"%s\" must be set.",
                        parameter);
            }
        }
    }

    private static byte[] hmacSha1(String baseString, String clientSecret, String tokenSecret) {
        String key = encode(clientSecret) + "&" + encode(tokenSecret);
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new InternalException(ex, ErrorType.OAUTH_SIGNATURE_FAILED, Map.of(), "HMAC-SHA1 签名失败");
        }
    }

    private static byte[] rsaSha1(String baseString, String keyPath, String passphrase) {
        PrivateKey privateKey = OAuthPrivateKeyLoader.loadPrivateKey(keyPath, passphrase);
        try {
            Signature signer = Signature.getInstance(RSA_ALGORITHM);
            signer.initSign(privateKey);
            signer.update(baseString.getBytes(StandardCharsets.UTF_8));
            return signer.sign();
        } catch (GeneralSecurityException ex) {
            throw new InternalException(ex, ErrorType.OAUTH_SIGNATURE_FAILED, Map.of(), "RSA-SHA1 签名失败");
        }
    }
}
