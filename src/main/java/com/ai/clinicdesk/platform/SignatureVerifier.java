package com.ai.clinicdesk.platform;

import org.apache.commons.lang3.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 webhook signatures in the {@code sha256=<hex>} form Meta uses.
 */
public final class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private SignatureVerifier() {
    }

    /**
     * A blank secret disables verification. A missing or malformed header fails it.
     */
    public static boolean verify(String secret, byte[] body, String header) {
        if (StringUtils.isBlank(secret)) {
            return true;
        }
        if (StringUtils.isBlank(header)) {
            return false;
        }
        String received = StringUtils.removeStart(header.trim(), PREFIX).toLowerCase();
        byte[] expected = sign(secret, body).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, received.getBytes(StandardCharsets.US_ASCII));
    }

    public static String sign(String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
