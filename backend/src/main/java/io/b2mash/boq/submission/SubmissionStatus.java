package io.b2mash.boq.submission;

import java.util.Locale;

/**
 * Review status of a material submission, derived from the tri-state {@code approved} column.
 * Once a submission leaves PENDING it never changes again.
 */
public enum SubmissionStatus {
  PENDING,
  APPROVED,
  REJECTED;

  public static SubmissionStatus of(Boolean approved) {
    if (approved == null) {
      return PENDING;
    }
    return approved ? APPROVED : REJECTED;
  }

  /** Lower-case form used in API responses, e.g. {@code "pending"}. */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
