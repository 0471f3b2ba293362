package io.b2mash.boq.submission;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SubmissionStatusTest {

  @Test
  void of_mapsTriStateColumn() {
    assertThat(SubmissionStatus.of(null)).isEqualTo(SubmissionStatus.PENDING);
    assertThat(SubmissionStatus.of(true)).isEqualTo(SubmissionStatus.APPROVED);
    assertThat(SubmissionStatus.of(false)).isEqualTo(SubmissionStatus.REJECTED);
  }

  @Test
  void wireValue_isLowerCase() {
    assertThat(SubmissionStatus.PENDING.wireValue()).isEqualTo("pending");
  }
}
