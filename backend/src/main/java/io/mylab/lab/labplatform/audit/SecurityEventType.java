package io.mylab.lab.labplatform.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Security log event kinds, each with the severity it is recorded at. */
public enum SecurityEventType {
  AUTH_FAILURE(SecuritySeverity.HIGH),
  ACCESS_DENIED(SecuritySeverity.MEDIUM);

  private final SecuritySeverity severity;

  SecurityEventType(SecuritySeverity severity) {
    this.severity = severity;
  }

  public SecuritySeverity severity() {
    return severity;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SecurityEventType fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
