package io.mylab.lab.labplatform.permission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mylab.lab.labplatform.override.AccessLevel;
import java.util.Locale;
import java.util.Optional;

/** Action names evaluated by the role permission matrix. */
public enum Action {
  VIEW("view", AccessLevel.VIEW),
  DOWNLOAD("download", AccessLevel.DOWNLOAD),
  CREATE("create", null),
  EDIT("edit", AccessLevel.EDIT),
  DELETE("delete", null),
  SHARE("share", null);

  private final String value;
  private final AccessLevel requiredLevel;

  Action(String value, AccessLevel requiredLevel) {
    this.value = value;
    this.requiredLevel = requiredLevel;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Access level an override must reach for this action. Empty for create, delete and share, which
   * overrides do not gate.
   */
  public Optional<AccessLevel> requiredAccessLevel() {
    return Optional.ofNullable(requiredLevel);
  }

  @JsonCreator
  public static Action fromValue(String value) {
    return parse(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown action '" + value + "'"));
  }

  public static Optional<Action> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Action action : values()) {
      if (action.value.equals(normalized)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
