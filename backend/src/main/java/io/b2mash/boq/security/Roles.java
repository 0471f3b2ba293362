package io.b2mash.boq.security;

import java.util.Locale;
import java.util.Set;

/**
 * Centralized role constants used across authentication and authorization.
 *
 * <p>Roles come from the {@code role} claim of the bearer JWT. Spring authorities are the {@code
 * ROLE_} prefixed, upper-cased versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // "role" claim values
  public static final String USER = "user";
  public static final String ADMIN = "admin";
  public static final String SUPPLIER = "supplier";
  public static final String SOFTWARE_TEAM = "software_team";
  public static final String PURCHASE_TEAM = "purchase_team";
  public static final String CONTRACTOR = "contractor";
  public static final String PRE_SALES = "pre_sales";

  public static final Set<String> ALL =
      Set.of(USER, ADMIN, SUPPLIER, SOFTWARE_TEAM, PURCHASE_TEAM, CONTRACTOR, PRE_SALES);

  /** Review staff: may approve, reject and list pending catalog entries. */
  public static final Set<String> STAFF = Set.of(ADMIN, SOFTWARE_TEAM, PURCHASE_TEAM);

  private Roles() {}

  public static boolean isStaff(String role) {
    return role != null && STAFF.contains(role);
  }

  /** Maps a claim value to its granted authority, e.g. {@code software_team -> ROLE_SOFTWARE_TEAM}. */
  public static String toAuthority(String role) {
    return "ROLE_" + role.toUpperCase(Locale.ROOT);
  }
}
