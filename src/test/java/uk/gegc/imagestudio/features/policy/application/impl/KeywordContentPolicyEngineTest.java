package uk.gegc.imagestudio.features.policy.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.imagestudio.features.policy.application.PolicyProperties;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyRule;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeywordContentPolicyEngine")
class KeywordContentPolicyEngineTest {

    private KeywordContentPolicyEngine engine;

    @BeforeEach
    void setUp() {
        PolicyProperties properties = new PolicyProperties();
        properties.setMaxInstructionLength(200);
        properties.setForbiddenTerms(List.of("swap face", "face swap", "look like", "deepfake", "change identity"));
        properties.setHighRiskTerms(List.of("reshape face", "different nose", "change jawline drastically"));
        properties.setCosmeticTerms(List.of("hair color", "hair", "lighting", "makeup", "background"));
        properties.setFaceIntentTerms(List.of("face", "facial", "person", "portrait"));
        engine = new KeywordContentPolicyEngine(properties);
    }

    @Nested
    @DisplayName("Identity manipulation")
    class Forbidden {

        @Test
        @DisplayName("forbidden term denies with HIGH risk and names the term")
        void forbiddenTermDenied() {
            PolicyDecision decision = engine.evaluate("Please SWAP   FACE with my friend", 1, true);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(decision.rule()).isEqualTo(PolicyRule.FORBIDDEN_TERM);
            assertThat(decision.matchedTerm()).isEqualTo("swap face");
            assertThat(decision.primaryReason()).contains("swap face");
        }

        @Test
        @DisplayName("forbidden term wins even when a cosmetic term is present")
        void forbiddenBeatsCosmetic() {
            PolicyDecision decision = engine.evaluate("change hair color and make me look like a movie star", 1, true);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(decision.rule()).isEqualTo(PolicyRule.FORBIDDEN_TERM);
        }

        @Test
        @DisplayName("forbidden term is denied even with no faces detected")
        void forbiddenWithoutFaces() {
            PolicyDecision decision = engine.evaluate("create a deepfake", 0, false);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.HIGH);
        }

        @ParameterizedTest
        @ValueSource(strings = {"create deepfakes of my neighbour", "make him impersonates the president",
                "swap faces with my friend"})
        @DisplayName("inflected forms of forbidden terms are denied")
        void inflectedFormsDenied(String instruction) {
            PolicyProperties properties = new PolicyProperties();
            properties.setForbiddenTerms(List.of("swap face", "deepfake", "impersonate"));
            KeywordContentPolicyEngine strict = new KeywordContentPolicyEngine(properties);

            PolicyDecision decision = strict.evaluate(instruction, 0, false);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(decision.rule()).isEqualTo(PolicyRule.FORBIDDEN_TERM);
        }
    }

    @Nested
    @DisplayName("Structural changes")
    class HighRisk {

        @Test
        @DisplayName("high-risk term denies with HIGH risk")
        void highRiskDenied() {
            PolicyDecision decision = engine.evaluate("give her a different nose", 1, true);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(decision.rule()).isEqualTo(PolicyRule.HIGH_RISK_TERM);
            assertThat(decision.matchedTerm()).isEqualTo("different nose");
        }
    }

    @Nested
    @DisplayName("Images with faces")
    class Faces {

        @Test
        @DisplayName("cosmetic-only edit is allowed with MEDIUM risk")
        void cosmeticAllowed() {
            PolicyDecision decision = engine.evaluate("Change hair color to auburn and soften the lighting", 2, true);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(decision.rule()).isEqualTo(PolicyRule.FACE_EDIT_COSMETIC);
            assertThat(decision.facesDetected()).isEqualTo(2);
        }

        @Test
        @DisplayName("a face-directed clause with a cosmetic term is allowed")
        void faceClauseWithCosmetic() {
            PolicyDecision decision = engine.evaluate("add makeup to the face", 1, true);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("a cosmetic term elsewhere does not cover a face-directed clause")
        void residualFaceClauseDenied() {
            PolicyDecision decision = engine.evaluate("change hair color, then make the face thinner", 1, true);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(decision.rule()).isEqualTo(PolicyRule.FACE_EDIT_NOT_COSMETIC);
            assertThat(decision.primaryReason()).isEqualTo(KeywordContentPolicyEngine.FACE_EDIT_REASON);
        }

        @Test
        @DisplayName("plural face references still count as face-directed")
        void pluralFacesDenied() {
            PolicyDecision decision = engine.evaluate("make both faces thinner", 2, true);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(decision.rule()).isEqualTo(PolicyRule.FACE_EDIT_NOT_COSMETIC);
            assertThat(decision.matchedTerm()).isEqualTo("face");
        }

        @Test
        @DisplayName("face-directed edits are allowed when identity need not be preserved")
        void notPreservingIdentity() {
            PolicyDecision decision = engine.evaluate("make the face thinner", 1, false);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.LOW);
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @ParameterizedTest
        @ValueSource(strings = {"make the sky purple", "add a cat", "   ", ""})
        @DisplayName("ambiguous or empty prompts are allowed with LOW risk")
        void ambiguousAllowed(String instruction) {
            PolicyDecision decision = engine.evaluate(instruction, 0, true);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(decision.reasons()).isEmpty();
        }

        @Test
        @DisplayName("overlong instruction is denied")
        void tooLong() {
            PolicyDecision decision = engine.evaluate("a".repeat(201), 0, false);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.rule()).isEqualTo(PolicyRule.INSTRUCTION_TOO_LONG);
        }

        @Test
        @DisplayName("normalize trims, lowercases and collapses whitespace")
        void normalize() {
            assertThat(KeywordContentPolicyEngine.normalize("  Swap\t\nFACE  now ")).isEqualTo("swap face now");
            assertThat(KeywordContentPolicyEngine.normalize(null)).isEmpty();
        }
    }
}
