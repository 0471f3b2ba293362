package io.b2mash.boq.boq;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** BOQ project lifecycle. Transitions only move forward. */
public enum BoqProjectStatus {
  DRAFT,
  SUBMITTED,
  FINALIZED;

  private static final Map<BoqProjectStatus, Set<BoqProjectStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(SUBMITTED, FINALIZED),
          SUBMITTED, Set.of(FINALIZED),
          FINALIZED, Set.of());

  public Set<BoqProjectStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(BoqProjectStatus target) {
    return allowedTransitions().contains(target);
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parses {@code "draft"}, {@code "SUBMITTED"} etc. */
  public static BoqProjectStatus from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Project status must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
