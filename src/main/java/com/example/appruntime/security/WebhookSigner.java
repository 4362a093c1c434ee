package com.example.appruntime.security;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

/**
 * Webhook 载荷的 HMAC-SHA256 签名。
 */
@Component
public class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private static final String HMAC_SHA256 = "HmacSHA256";

    /**
     * 对发送的原始字节计算签名。
     *
     * @param body   请求体原始字节
     * @param secret 应用的 Webhook 密钥
     * @return 小写十六进制签名
     */
    public String sign(byte[] body, String secret) {
        try {
            SecretKeySpec secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(secretKey);
            return bytesToHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * 将字节数组转为十六进制字符串。
     */
    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
