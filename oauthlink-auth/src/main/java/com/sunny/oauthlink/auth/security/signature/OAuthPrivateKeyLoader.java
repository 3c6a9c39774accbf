package com.sunny.oauthlink.auth.security.signature;

import com.sunny.oauthlink.common.constant.ErrorType;
import com.sunny.oauthlink.common.exception.InternalException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.AlgorithmParameters;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * RSA-SHA1 签名私钥加载器
 * 支持 PKCS#8、加密 PKCS#8 与 PKCS#1 三种 PEM 格式
 *
 * @author Sunny
 * @date 2026-01-01
 */
@Slf4j
public final class OAuthPrivateKeyLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String RSA_ALGORITHM = "RSA";
    private static final String PKCS8_TYPE = "PRIVATE KEY";
    private static final String ENCRYPTED_PKCS8_TYPE = "ENCRYPTED PRIVATE KEY";
    private static final String PKCS1_TYPE = "RSA PRIVATE KEY";
    private static final String PBES2_NAME = "PBES2";
    private static final String PBES2_OID = "1.2.840.113549.1.5.13";

    /**
     * AlgorithmIdentifier { rsaEncryption, NULL }
     */
    private static final byte[] RSA_ALGORITHM_IDENTIFIER = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
            (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private OAuthPrivateKeyLoader() {
    }

    public static PrivateKey loadPrivateKey(String path, String passphrase) {
        if (path == null || path.isBlank()) {
            throw keyInvalid(null, path, "RSA 私钥路径不能为空");
        }
        try {
            return parsePrivateKey(readPem(path), passphrase);
        } catch (InternalException ex) {
            log.warn("RSA 私钥加载失败: path={}, reason={}", path, ex.getMessage());
            throw ex;
        } catch (IOException ex) {
            log.warn("RSA 私钥读取失败: path={}, reason={}", path, ex.getMessage());
            throw keyInvalid(ex, path, "读取 RSA 私钥失败: " + path);
        }
    }

    public static PrivateKey parsePrivateKey(String pem, String passphrase) {
        if (pem == null || pem.isBlank()) {
            throw keyInvalid(null, null, "RSA 私钥 PEM 不能为空");
        }
        if (pem.contains("Proc-Type:")) {
            throw keyInvalid(null, null, "不支持 OpenSSL 传统加密格式私钥，请转换为 PKCS#8");
        }
        try {
            if (pem.contains(beginMarker(ENCRYPTED_PKCS8_TYPE))) {
                return decryptPkcs8(parsePem(pem, ENCRYPTED_PKCS8_TYPE), passphrase);
            }
            if (pem.contains(beginMarker(PKCS1_TYPE))) {
                return generatePrivate(wrapPkcs1(parsePem(pem, PKCS1_TYPE)));
            }
            if (pem.contains(beginMarker(PKCS8_TYPE))) {
                return generatePrivate(parsePem(pem, PKCS8_TYPE));
            }
        } catch (InternalException ex) {
            throw ex;
        } catch (Exception ex) {
            throw keyInvalid(ex, null, "解析 RSA 私钥失败");
        }
        throw keyInvalid(null, null, "未识别的 RSA 私钥 PEM 类型");
    }

    private static PrivateKey decryptPkcs8(byte[] der, String passphrase) throws Exception {
        if (passphrase == null || passphrase.isEmpty()) {
            throw keyInvalid(null, null, "加密私钥缺少口令");
        }
        EncryptedPrivateKeyInfo info = new EncryptedPrivateKeyInfo(der);
        AlgorithmParameters parameters = info.getAlgParameters();
        String algorithm = info.getAlgName();
        // PBES2 需要使用参数中的具体 PRF/Cipher 组合名称
        if (parameters != null && (PBES2_NAME.equalsIgnoreCase(algorithm) || PBES2_OID.equals(algorithm))) {
            algorithm = parameters.toString();
        }
        PBEKeySpec keySpec = new PBEKeySpec(passphrase.toCharArray());
        try {
            SecretKey secretKey = SecretKeyFactory.getInstance(algorithm).generateSecret(keySpec);
            Cipher cipher = Cipher.getInstance(algorithm);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, parameters);
            return KeyFactory.getInstance(RSA_ALGORITHM).generatePrivate(info.getKeySpec(cipher));
        } finally {
            keySpec.clearPassword();
        }
    }

    private static PrivateKey generatePrivate(byte[] pkcs8) throws Exception {
        return KeyFactory.getInstance(RSA_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
    }

    /**
     * PrivateKeyInfo ::= SEQUENCE { version 0, AlgorithmIdentifier, OCTET STRING(RSAPrivateKey) }
     */
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(new byte[]{0x02, 0x01, 0x00});
        body.writeBytes(RSA_ALGORITHM_IDENTIFIER);
        body.write(0x04);
        body.writeBytes(derLength(pkcs1.length));
        body.writeBytes(pkcs1);

        byte[] content = body.toByteArray();
        ByteArrayOutputStream sequence = new ByteArrayOutputStream();
        sequence.write(0x30);
        sequence.writeBytes(derLength(content.length));
        sequence.writeBytes(content);
        return sequence.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[]{(byte) length};
        }
        if (length <= 0xff) {
            return new byte[]{(byte) 0x81, (byte) length};
        }
        if (length <= 0xffff) {
            return new byte[]{(byte) 0x82, (byte) (length >> 8), (byte) length};
        }
        return new byte[]{(byte) 0x83, (byte) (length >> 16), (byte) (length >> 8), (byte) length};
    }

    private static byte[] parsePem(String pem, String type) {
        int begin = pem.indexOf(beginMarker(type));
        int end = pem.indexOf("-----END " + type + "-----");
        if (begin < 0 || end < begin) {
            throw keyInvalid(null, null, type + " PEM 格式错误");
        }
        String normalized = pem.substring(begin + beginMarker(type).length(), end).replaceAll("\\s+", "");
        if (normalized.isEmpty()) {
            throw keyInvalid(null, null, type + " PEM 内容为空");
        }
        return Base64.getDecoder().decode(normalized);
    }

    private static String beginMarker(String type) {
        return "-----BEGIN " + type + "-----";
    }

    private static String readPem(String path) throws IOException {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resource = path.substring(CLASSPATH_PREFIX.length());
            while (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            if (classLoader == null) {
                classLoader = OAuthPrivateKeyLoader.class.getClassLoader();
            }
            try (InputStream inputStream = classLoader.getResourceAsStream(resource)) {
                if (inputStream == null) {
                    throw new IOException("classpath 资源不存在: " + resource);
                }
                return new String(inputStream.readAllBytes(), StandardCharsets.US_ASCII);
            }
        }

        return Files.readString(Path.of(path), StandardCharsets.US_ASCII);
    }

    private static InternalException keyInvalid(Throwable cause, String path, String message) {
        Map<String, String> context = path == null ? Map.of() : Map.of("keyPath", path);
        return new InternalException(cause, ErrorType.OAUTH_SIGNATURE_KEY_INVALID, context, message);
    }
}
