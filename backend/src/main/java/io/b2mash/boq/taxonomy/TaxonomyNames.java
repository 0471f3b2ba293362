package io.b2mash.boq.taxonomy;

import io.b2mash.boq.exception.InvalidStateException;

/** Name normalization shared by the catalog registries. */
public final class TaxonomyNames {

  private TaxonomyNames() {}

  /** Returns the trimmed name, or throws when it is null or blank. */
  public static String require(String name, String field) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid " + field, field + " must not be blank");
    }
    return name.trim();
  }

  /** Trims an optional value; blank becomes null. */
  public static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
