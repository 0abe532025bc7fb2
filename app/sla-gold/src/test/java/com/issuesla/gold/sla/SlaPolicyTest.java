package com.issuesla.gold.sla;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.issuesla.gold.model.Priority;
import org.junit.jupiter.api.Test;

class SlaPolicyTest {

  @Test
  void defaultsMatchDataDictionary() {
    final SlaPolicy policy = SlaPolicy.defaults();

    assertThat(policy.expectedHours(Priority.HIGH)).isEqualTo(24.0d);
    assertThat(policy.expectedHours(Priority.MEDIUM)).isEqualTo(72.0d);
    assertThat(policy.expectedHours(Priority.LOW)).isEqualTo(120.0d);
  }

  @Test
  void expectedHoursParsesRawPriority() {
    assertThat(SlaPolicy.defaults().expectedHours("medium")).isEqualTo(72.0d);
  }

  @Test
  void customThresholdsAreApplied() {
    final SlaPolicy policy = SlaPolicy.of(8.0d, 40.0d, 96.0d);

    assertThat(policy.expectedHours(Priority.HIGH)).isEqualTo(8.0d);
    assertThat(policy.thresholds()).hasSize(3);
  }

  @Test
  void unknownPriorityIsSurfacedNotDefaulted() {
    assertThatThrownBy(() -> SlaPolicy.defaults().expectedHours("Critical"))
        .isInstanceOf(UnknownPriorityException.class)
        .extracting(ex -> ((UnknownPriorityException) ex).priority())
        .isEqualTo("Critical");
    assertThatThrownBy(() -> SlaPolicy.defaults().expectedHours((Priority) null))
        .isInstanceOf(UnknownPriorityException.class);
  }

  @Test
  void rejectsNonPositiveOrUnorderedThresholds() {
    assertThatThrownBy(() -> SlaPolicy.of(0.0d, 72.0d, 120.0d))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("positive");
    assertThatThrownBy(() -> SlaPolicy.of(72.0d, 24.0d, 120.0d))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("high < medium < low");
    assertThatThrownBy(() -> SlaPolicy.of(24.0d, 72.0d, 72.0d))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNonFiniteThresholds() {
    assertThatThrownBy(() -> SlaPolicy.of(24.0d, 72.0d, Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("finite");
    assertThatThrownBy(() -> SlaPolicy.of(Double.NaN, 72.0d, 120.0d))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void thresholdTableIsImmutable() {
    assertThatThrownBy(() -> SlaPolicy.defaults().thresholds().put(Priority.HIGH, 1.0d))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
