package io.b2mash.boq.boq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BoqProjectStatusTest {

  @Test
  void allowedTransitions_draft() {
    assertThat(BoqProjectStatus.DRAFT.allowedTransitions())
        .containsExactlyInAnyOrder(BoqProjectStatus.SUBMITTED, BoqProjectStatus.FINALIZED);
  }

  @Test
  void allowedTransitions_submitted() {
    assertThat(BoqProjectStatus.SUBMITTED.allowedTransitions())
        .containsExactly(BoqProjectStatus.FINALIZED);
  }

  @Test
  void allowedTransitions_finalized() {
    assertThat(BoqProjectStatus.FINALIZED.allowedTransitions()).isEmpty();
  }

  @Test
  void canTransitionTo_backward_returns_false() {
    assertThat(BoqProjectStatus.SUBMITTED.canTransitionTo(BoqProjectStatus.DRAFT)).isFalse();
    assertThat(BoqProjectStatus.FINALIZED.canTransitionTo(BoqProjectStatus.SUBMITTED)).isFalse();
  }

  @Test
  void canTransitionTo_self_returns_false() {
    for (BoqProjectStatus status : BoqProjectStatus.values()) {
      assertThat(status.canTransitionTo(status))
          .as("Self-transition should be disallowed for %s", status)
          .isFalse();
    }
  }

  @Test
  void from_acceptsWireValueInAnyCase() {
    assertThat(BoqProjectStatus.from("submitted")).isEqualTo(BoqProjectStatus.SUBMITTED);
    assertThat(BoqProjectStatus.from(" FINALIZED ")).isEqualTo(BoqProjectStatus.FINALIZED);
    assertThat(BoqProjectStatus.DRAFT.wireValue()).isEqualTo("draft");
  }

  @Test
  void from_rejectsUnknownValue() {
    assertThatThrownBy(() -> BoqProjectStatus.from("archived"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BoqProjectStatus.from(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
