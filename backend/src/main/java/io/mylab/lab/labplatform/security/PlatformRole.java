package io.mylab.lab.labplatform.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

/**
 * Platform role of a user, either organization-wide (JWT {@code o.rol} claim) or per project
 * ({@code project_team_assignments.assigned_role}). Ordered weakest first: {@code viewer <
 * scientist < manager < admin}.
 */
public enum PlatformRole {
  VIEWER("viewer"),
  SCIENTIST("scientist"),
  MANAGER("manager"),
  ADMIN("admin");

  private final String value;

  PlatformRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Spring Security authority, e.g. {@code ROLE_MANAGER}. */
  public String authority() {
    return "ROLE_" + name();
  }

  public boolean isAtLeast(PlatformRole required) {
    return compareTo(required) >= 0;
  }

  @JsonCreator
  public static PlatformRole fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (PlatformRole role : values()) {
        if (role.value.equals(normalized)) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown platform role '"
            + value
            + "', expected one of "
            + Arrays.stream(values()).map(PlatformRole::value).toList());
  }
}
