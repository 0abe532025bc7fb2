package com.issuesla.gold.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlaThresholdPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesForOrderedPositiveThresholds() {
    assertTrue(validator.validate(new SlaThresholdProperties(4.0d, 16.0d, 40.0d)).isEmpty());
  }

  @Test
  void validationFailsWhenMediumIsNotAboveHigh() {
    assertFalse(validator.validate(new SlaThresholdProperties(24.0d, 24.0d, 120.0d)).isEmpty());
  }

  @Test
  void validationFailsWhenThresholdIsNegative() {
    assertFalse(validator.validate(new SlaThresholdProperties(-1.0d, 72.0d, 120.0d)).isEmpty());
  }
}
