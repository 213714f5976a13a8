package uk.gegc.imagestudio.features.policy.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.imagestudio.features.policy.application.ContentPolicyEngine;
import uk.gegc.imagestudio.features.policy.application.PolicyProperties;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyRule;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
public class KeywordContentPolicyEngine implements ContentPolicyEngine {

    static final String FACE_EDIT_REASON = "Face detected in image. Only cosmetic edits (hair, makeup, lighting, "
            + "background) are allowed. Edits must preserve facial structure and identity.";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CLAUSE_SEPARATOR = Pattern.compile("[,;.]|\\b(?:and|then|also)\\b");

    private final int maxInstructionLength;
    private final List<String> forbiddenTerms;
    private final List<String> highRiskTerms;
    private final List<String> cosmeticTerms;
    private final List<String> faceIntentTerms;

    public KeywordContentPolicyEngine(PolicyProperties properties) {
        this.maxInstructionLength = properties.getMaxInstructionLength();
        this.forbiddenTerms = compile(properties.getForbiddenTerms());
        this.highRiskTerms = compile(properties.getHighRiskTerms());
        this.cosmeticTerms = compile(properties.getCosmeticTerms());
        this.faceIntentTerms = compile(properties.getFaceIntentTerms());
    }

    @Override
    public PolicyDecision evaluate(String instructionText, int facesDetected, boolean preserveIdentity) {
        String text = normalize(instructionText);
        int faces = Math.max(0, facesDetected);

        if (text.length() > maxInstructionLength) {
            return PolicyDecision.deny(RiskLevel.HIGH, faces, PolicyRule.INSTRUCTION_TOO_LONG, null,
                    "Instruction exceeds " + maxInstructionLength + " characters.");
        }

        Optional<String> forbidden = firstMatch(forbiddenTerms, text);
        if (forbidden.isPresent()) {
            String term = forbidden.get();
            return PolicyDecision.deny(RiskLevel.HIGH, faces, PolicyRule.FORBIDDEN_TERM, term,
                    "Forbidden identity manipulation detected: \"" + term + "\". "
                            + "Edits that alter, replace, or impersonate identity are not allowed.");
        }

        Optional<String> highRisk = firstMatch(highRiskTerms, text);
        if (highRisk.isPresent()) {
            String term = highRisk.get();
            return PolicyDecision.deny(RiskLevel.HIGH, faces, PolicyRule.HIGH_RISK_TERM, term,
                    "High-risk facial structure modification detected: \"" + term + "\". "
                            + "Edits must preserve facial structure and proportions.");
        }

        if (faces > 0 && preserveIdentity) {
            for (String clause : CLAUSE_SEPARATOR.split(text)) {
                Optional<String> faceIntent = firstMatch(faceIntentTerms, clause);
                if (faceIntent.isPresent() && firstMatch(cosmeticTerms, clause).isEmpty()) {
                    log.debug("Face-directed clause without cosmetic intent: '{}'", clause.trim());
                    return PolicyDecision.deny(RiskLevel.MEDIUM, faces, PolicyRule.FACE_EDIT_NOT_COSMETIC,
                            faceIntent.get(), FACE_EDIT_REASON);
                }
            }
            return PolicyDecision.allow(RiskLevel.MEDIUM, faces, PolicyRule.FACE_EDIT_COSMETIC);
        }

        return PolicyDecision.allow(RiskLevel.LOW, faces, PolicyRule.NO_RESTRICTION);
    }

    static String normalize(String instructionText) {
        if (instructionText == null) {
            return "";
        }
        return WHITESPACE.matcher(instructionText.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Substring match on normalized text: "deepfakes" matches "deepfake".
     */
    private static Optional<String> firstMatch(List<String> terms, String text) {
        return terms.stream().filter(text::contains).findFirst();
    }

    private static List<String> compile(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .map(KeywordContentPolicyEngine::normalize)
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
    }
}
