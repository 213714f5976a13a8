package uk.gegc.imagestudio.features.payment.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the {@code x-paystack-signature} header: lowercase hex HMAC-SHA512 of the raw request body,
 * keyed with the Paystack secret key.
 */
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final PaystackProperties properties;

    public boolean verify(String rawPayload, String signature) {
        if (rawPayload == null || !StringUtils.hasText(signature) || !StringUtils.hasText(properties.getSecretKey())) {
            return false;
        }
        byte[] expected = sign(rawPayload).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    public String sign(String rawPayload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(properties.getSecretKey().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawPayload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA512 is not available", e);
        }
    }
}
