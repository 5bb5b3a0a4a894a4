package io.mylab.lab.labplatform.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

/**
 * Role held by an organization through a delegated access grant. Ordered weakest first: {@code
 * viewer < processor < analyzer < client}.
 *
 * <p>This lattice is unrelated to {@link PlatformRole}; the two are separate types so they cannot be
 * compared with each other.
 */
public enum GrantRole {
  VIEWER("viewer"),
  PROCESSOR("processor"),
  ANALYZER("analyzer"),
  CLIENT("client");

  private final String value;

  GrantRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Returns true if this role ranks at or above {@code required}. */
  public boolean isAtLeast(GrantRole required) {
    return compareTo(required) >= 0;
  }

  /**
   * Returns true iff {@code actual} ranks at or above {@code required} in the grant-role lattice. A
   * null actual role is never sufficient.
   */
  public static boolean hasSufficientRole(GrantRole actual, GrantRole required) {
    if (required == null) {
      return true;
    }
    return actual != null && actual.isAtLeast(required);
  }

  @JsonCreator
  public static GrantRole fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (GrantRole role : values()) {
        if (role.value.equals(normalized)) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown grant role '"
            + value
            + "', expected one of "
            + Arrays.stream(values()).map(GrantRole::value).toList());
  }
}
