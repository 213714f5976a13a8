package uk.gegc.imagestudio.features.policy.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword vocabularies for the content policy. Terms are matched case-insensitively on word boundaries.
 */
@Configuration
@ConfigurationProperties(prefix = "policy")
@Validated
@Data
public class PolicyProperties {

    @Positive
    private int maxInstructionLength = 2000;

    /**
     * Identity manipulation; always denied.
     */
    private List<String> forbiddenTerms = new ArrayList<>();

    /**
     * Facial structure changes; always denied.
     */
    private List<String> highRiskTerms = new ArrayList<>();

    /**
     * Edits allowed on images with faces when identity must be preserved.
     */
    private List<String> cosmeticTerms = new ArrayList<>();

    /**
     * Words that mark an edit clause as directed at a face or person.
     */
    private List<String> faceIntentTerms = new ArrayList<>();
}
