package io.mylab.lab.labplatform.override;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Override access depth: {@code view(0) < download(1) < edit(2)}. */
public enum AccessLevel {
  VIEW("view"),
  DOWNLOAD("download"),
  EDIT("edit");

  private final String value;

  AccessLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int rank() {
    return ordinal();
  }

  /** Returns true if an override at this level permits work requiring {@code required}. */
  public boolean permits(AccessLevel required) {
    return required.rank() <= rank();
  }

  @JsonCreator
  public static AccessLevel fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AccessLevel level : values()) {
        if (level.value.equals(normalized)) {
          return level;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown access level '" + value + "', expected view, download or edit");
  }
}
