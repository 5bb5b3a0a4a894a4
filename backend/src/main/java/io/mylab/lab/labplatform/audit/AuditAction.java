package io.mylab.lab.labplatform.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AuditAction {
  CREATE,
  READ,
  UPDATE,
  DELETE,
  SHARE,
  UPLOAD,
  DOWNLOAD;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AuditAction fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
