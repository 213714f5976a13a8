package uk.gegc.imagestudio.features.audit.application;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Scrubs personal data from free text before it is persisted in an audit record.
 */
@Component
public class PiiSanitizer {

    public static final int MAX_TEXT_LENGTH = 500;

    /**
     * Detail keys that carry the user's instruction. They are stored scrubbed, plus a SHA-256
     * hash of the raw text under {@code <key>Hash} so identical prompts can be correlated.
     */
    static final Set<String> INSTRUCTION_KEYS = Set.of("instruction", "prompt");

    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern CARD = Pattern.compile("\\b\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern IP_ADDRESS = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");
    private static final Pattern PHONE = Pattern.compile("(\\+?\\d{1,3}[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");

    // Card, SSN and IP run before phone so their digit runs are not half-eaten by the phone pattern
    public String sanitize(String text) {
        if (text == null) {
            return null;
        }
        String sanitized = EMAIL.matcher(text).replaceAll("[EMAIL_REDACTED]");
        sanitized = CARD.matcher(sanitized).replaceAll("[CARD_REDACTED]");
        sanitized = SSN.matcher(sanitized).replaceAll("[SSN_REDACTED]");
        sanitized = IP_ADDRESS.matcher(sanitized).replaceAll("[IP_REDACTED]");
        sanitized = PHONE.matcher(sanitized).replaceAll("[PHONE_REDACTED]");

        if (sanitized.length() > MAX_TEXT_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TEXT_LENGTH - 3) + "...";
        }
        return sanitized;
    }

    public String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public Map<String, Object> sanitizeDetails(Map<String, ?> details) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (details == null) {
            return out;
        }
        details.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (INSTRUCTION_KEYS.contains(key) && value instanceof String text) {
                out.put(key, sanitize(text));
                out.put(key + "Hash", hash(text));
                return;
            }
            if (isIdentifierKey(key)) {
                out.put(key, String.valueOf(value));
                return;
            }
            out.put(key, sanitizeValue(value));
        });
        return out;
    }

    // System-generated identifiers are stored verbatim: long digit runs in gateway references would otherwise read as phone numbers
    static boolean isIdentifierKey(String key) {
        return key.equals("id") || key.endsWith("Id") || key.toLowerCase(Locale.ROOT).endsWith("reference");
    }

    private Object sanitizeValue(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof UUID || value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> copy = new LinkedHashMap<>();
            nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return sanitizeDetails(copy);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item != null) {
                    copy.add(sanitizeValue(item));
                }
            }
            return copy;
        }
        return sanitize(String.valueOf(value));
    }
}
