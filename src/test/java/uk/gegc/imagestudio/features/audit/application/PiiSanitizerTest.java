package uk.gegc.imagestudio.features.audit.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PiiSanitizer")
class PiiSanitizerTest {

    private final PiiSanitizer sanitizer = new PiiSanitizer();

    @Test
    @DisplayName("redacts e-mail, card, SSN, IP and phone numbers")
    void redactsPersonalData() {
        String text = "mail jane.doe@example.com card 4111 1111 1111 1111 ssn 123-45-6789 "
                + "from 192.168.1.20 call 555-123-4567";

        String sanitized = sanitizer.sanitize(text);

        assertThat(sanitized)
                .contains("[EMAIL_REDACTED]", "[CARD_REDACTED]", "[SSN_REDACTED]", "[IP_REDACTED]", "[PHONE_REDACTED]")
                .doesNotContain("jane.doe", "4111", "123-45-6789", "192.168", "555-123");
    }

    @Test
    @DisplayName("truncates long text")
    void truncates() {
        String sanitized = sanitizer.sanitize("x".repeat(800));

        assertThat(sanitized).hasSize(PiiSanitizer.MAX_TEXT_LENGTH).endsWith("...");
    }

    @Test
    @DisplayName("instruction details are scrubbed and hashed")
    void hashesInstruction() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("instruction", "make me look like bob@example.com");
        details.put("cost", 5);

        Map<String, Object> sanitized = sanitizer.sanitizeDetails(details);

        assertThat(sanitized.get("instruction")).isEqualTo("make me look like [EMAIL_REDACTED]");
        assertThat(sanitized.get("instructionHash"))
                .isEqualTo(sanitizer.hash("make me look like bob@example.com"));
        assertThat((String) sanitized.get("instructionHash")).hasSize(64);
        assertThat(sanitized.get("cost")).isEqualTo(5);
    }

    @Test
    @DisplayName("identifiers are kept verbatim and nulls are dropped")
    void identifiersVerbatim() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reference", "T1234567890123");
        details.put("admissionId", "555-123-4567");
        details.put("reason", null);

        Map<String, Object> sanitized = sanitizer.sanitizeDetails(details);

        assertThat(sanitized)
                .containsEntry("reference", "T1234567890123")
                .containsEntry("admissionId", "555-123-4567")
                .doesNotContainKey("reason");
    }

    @Test
    @DisplayName("nested maps and lists are sanitized")
    @SuppressWarnings("unchecked")
    void nested() {
        Map<String, Object> details = Map.of(
                "customer", Map.of("email", "a@b.io"),
                "notes", List.of("reach me at c@d.io"));

        Map<String, Object> sanitized = sanitizer.sanitizeDetails(details);

        assertThat((Map<String, Object>) sanitized.get("customer")).containsEntry("email", "[EMAIL_REDACTED]");
        assertThat((List<Object>) sanitized.get("notes")).containsExactly("reach me at [EMAIL_REDACTED]");
    }
}
