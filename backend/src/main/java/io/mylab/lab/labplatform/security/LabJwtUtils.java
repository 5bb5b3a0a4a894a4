package io.mylab.lab.labplatform.security;

import java.util.Map;
import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts the lab platform org claims from the nested "o" object.
 *
 * <p>Format: {@code { "sub": "<user uuid>", "o": { "id": "<org uuid>", "ws": "<workspace uuid>",
 * "rol": "manager" } }}
 */
public final class LabJwtUtils {

  private static final String ORG_CLAIM = "o";

  /** Extracts the organization id ({@code o.id}). */
  public static String extractOrgId(Jwt jwt) {
    return extractNestedClaim(jwt, "id");
  }

  /** Extracts the workspace id ({@code o.ws}). */
  public static String extractWorkspaceId(Jwt jwt) {
    return extractNestedClaim(jwt, "ws");
  }

  /** Extracts the platform role ({@code o.rol}). */
  public static String extractRole(Jwt jwt) {
    return extractNestedClaim(jwt, "rol");
  }

  /**
   * Builds the request principal from the token. Returns null when any claim is missing or
   * malformed.
   */
  public static Principal toPrincipal(Jwt jwt) {
    try {
      String subject = jwt.getSubject();
      String orgId = extractOrgId(jwt);
      String workspaceId = extractWorkspaceId(jwt);
      String role = extractRole(jwt);
      if (subject == null || orgId == null || workspaceId == null || role == null) {
        return null;
      }
      return new Principal(
          UUID.fromString(subject),
          UUID.fromString(workspaceId),
          UUID.fromString(orgId),
          PlatformRole.fromValue(role));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String extractNestedClaim(Jwt jwt, String key) {
    Object orgClaim = jwt.getClaim(ORG_CLAIM);
    if (orgClaim instanceof Map<?, ?> map) {
      Object value = map.get(key);
      if (value instanceof String str) {
        return str;
      }
    }
    return null;
  }

  private LabJwtUtils() {}
}
