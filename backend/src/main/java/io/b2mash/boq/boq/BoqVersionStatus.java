package io.b2mash.boq.boq;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** A submitted version is locked: its items and edits can no longer change. */
public enum BoqVersionStatus {
  DRAFT,
  SUBMITTED;

  private static final Map<BoqVersionStatus, Set<BoqVersionStatus>> ALLOWED_TRANSITIONS =
      Map.of(DRAFT, Set.of(SUBMITTED), SUBMITTED, Set.of());

  public Set<BoqVersionStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(BoqVersionStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == SUBMITTED;
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static BoqVersionStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Version status must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
