package uk.gegc.imagestudio.features.ratelimit.application;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateWindow;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RateLimitProperties")
class RateLimitPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private static RateLimitProperties withOperation(String name) {
        RateLimitProperties properties = new RateLimitProperties();
        RateLimitProperties.OperationLimit limit = new RateLimitProperties.OperationLimit();
        limit.setLimit(10);
        properties.getOperations().put(name, limit);
        return properties;
    }

    @Test
    @DisplayName("plain operation class names are accepted")
    void plainNamesAccepted() {
        assertThat(validator.validate(withOperation("edit"))).isEmpty();
    }

    @Test
    @DisplayName("a class name containing the key separator is rejected")
    void separatorRejected() {
        Set<ConstraintViolation<RateLimitProperties>> violations = validator.validate(withOperation("edit|bulk"));

        assertThat(violations).singleElement()
                .satisfies(violation -> assertThat(violation.getPropertyPath().toString())
                        .isEqualTo("operationNamesValid"));
    }

    @Test
    @DisplayName("distinct pairs never share a window key")
    void keysStayDistinct() {
        assertThat(RateWindow.keyOf("u1", "edit"))
                .isNotEqualTo(RateWindow.keyOf("u2", "edit"));
    }
}
