package io.mylab.lab.labplatform.resource;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of workspace-owned lab data subject to access control. Each constant knows the table that
 * stores its rows and the column recording the owning workspace.
 */
public enum ResourceType {
  PROJECT("project", "projects", "workspace_id"),
  SAMPLE("sample", "samples", "workspace_id"),
  DERIVED_SAMPLE("derived_sample", "derived_samples", "owner_workspace_id"),
  BATCH("batch", "batches", "workspace_id"),
  ANALYSIS("analysis", "analyses", "workspace_id"),
  DOCUMENT("document", "documents", "workspace_id"),
  REPORT("report", "reports", "workspace_id");

  private final String value;
  private final String table;
  private final String ownerColumn;

  ResourceType(String value, String table, String ownerColumn) {
    this.value = value;
    this.table = table;
    this.ownerColumn = ownerColumn;
  }

  @JsonValue
  public String value() {
    return value;
  }

  String table() {
    return table;
  }

  String ownerColumn() {
    return ownerColumn;
  }

  /** Types guarded by the ownership/grant policy. Reports are shared only through overrides. */
  public boolean supportsGrants() {
    return this != REPORT;
  }

  /** Types whose rows record the project they belong to. */
  public boolean isProjectScoped() {
    return this != PROJECT && this != DERIVED_SAMPLE;
  }

  /** Types that accept per-user access-level overrides. */
  public boolean supportsOverrides() {
    return this == REPORT || this == SAMPLE;
  }

  /**
   * Parses a resource type name. Accepts the snake-case value ({@code derived_sample}) and the
   * PascalCase name ({@code DerivedSample}), case-insensitively. Returns empty for anything else.
   */
  public static Optional<ResourceType> parse(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String normalized = name.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    for (ResourceType type : values()) {
      if (type.value.replace("_", "").equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
