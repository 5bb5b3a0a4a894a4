package io.mylab.lab.labplatform.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SecuritySeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SecuritySeverity fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
