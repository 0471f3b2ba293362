package io.b2mash.boq.boq;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BoqVersionStatusTest {

  @Test
  void draft_canBeSubmitted() {
    assertThat(BoqVersionStatus.DRAFT.canTransitionTo(BoqVersionStatus.SUBMITTED)).isTrue();
    assertThat(BoqVersionStatus.DRAFT.isTerminal()).isFalse();
  }

  @Test
  void submitted_isTerminal() {
    assertThat(BoqVersionStatus.SUBMITTED.allowedTransitions()).isEmpty();
    assertThat(BoqVersionStatus.SUBMITTED.canTransitionTo(BoqVersionStatus.DRAFT)).isFalse();
    assertThat(BoqVersionStatus.SUBMITTED.isTerminal()).isTrue();
  }
}
