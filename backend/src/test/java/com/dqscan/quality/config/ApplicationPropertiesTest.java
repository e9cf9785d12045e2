package com.dqscan.quality.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

@DisplayName("ApplicationProperties Tests")
class ApplicationPropertiesTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @Test
  @DisplayName("Should ship documented defaults")
  void shouldShipDefaults() {
    ApplicationProperties properties = new ApplicationProperties();

    assertThat(properties.getOutlier().getIqrMultiplier()).isEqualTo(1.5);
    assertThat(properties.getOutlier().getSemantic().getTrees()).isEqualTo(100);
    assertThat(properties.getOutlier().getSemantic().getSampleSize()).isEqualTo(256);
    assertThat(properties.getOutlier().getSemantic().getContamination()).isEqualTo(0.05);
    assertThat(properties.getTarget().getVocabulary())
        .containsExactly("label", "target", "class", "outcome", "y");
    assertThat(properties.getLabel().getFolds()).isEqualTo(5);
    assertThat(properties.getLabel().getMinRows()).isEqualTo(5);
    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  @DisplayName("Should reject out-of-range nested thresholds")
  void shouldRejectInvalidThresholds() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getOutlier().getSemantic().setContamination(0.9);
    properties.getLabel().setFolds(1);
    properties.getExecution().setTimeoutSeconds(0);

    Set<ConstraintViolation<ApplicationProperties>> violations = validator.validate(properties);

    assertThat(violations)
        .extracting(v -> v.getPropertyPath().toString())
        .containsExactlyInAnyOrder(
            "outlier.semantic.contamination", "label.folds", "execution.timeoutSeconds");
  }
}
