package io.b2mash.boq.security;

import java.util.Locale;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts application claims from the bearer JWT.
 *
 * <p>Token format: {@code { "sub": "user_123", "role": "supplier" }}
 */
public final class JwtClaimUtils {

  private static final String ROLE_CLAIM = "role";

  /** Extracts the role, lower-cased, or null when absent or not one of {@link Roles#ALL}. */
  public static String extractRole(Jwt jwt) {
    Object value = jwt.getClaim(ROLE_CLAIM);
    if (value instanceof String str) {
      String role = str.trim().toLowerCase(Locale.ROOT);
      if (Roles.ALL.contains(role)) {
        return role;
      }
    }
    return null;
  }

  private JwtClaimUtils() {}
}
