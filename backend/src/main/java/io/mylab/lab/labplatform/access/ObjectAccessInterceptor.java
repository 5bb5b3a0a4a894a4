package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.exception.ForbiddenException;
import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.grant.GrantContext;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces {@link RequireObjectAccess} and {@link RequireResharePermission}. Input is validated
 * before any lookup: an unknown type or a missing or malformed id is a 400. Denials become 403s
 * handled by {@code GlobalExceptionHandler}.
 */
@Component
public class ObjectAccessInterceptor implements HandlerInterceptor {

  /** Request attribute holding the {@link GrantContext} when access came through a grant. */
  public static final String GRANT_CONTEXT_ATTRIBUTE =
      ObjectAccessInterceptor.class.getName() + ".grant";

  static final String ACCESS_CHECKED_ATTRIBUTE =
      ObjectAccessInterceptor.class.getName() + ".checked";

  private final ObjectAccessService objectAccessService;

  public ObjectAccessInterceptor(ObjectAccessService objectAccessService) {
    this.objectAccessService = objectAccessService;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return true;
    }
    var objectAccess = handlerMethod.getMethodAnnotation(RequireObjectAccess.class);
    if (objectAccess != null) {
      checkObjectAccess(objectAccess, request);
    }
    if (handlerMethod.hasMethodAnnotation(RequireResharePermission.class)) {
      checkResharePermission(request);
    }
    return true;
  }

  private void checkObjectAccess(RequireObjectAccess annotation, HttpServletRequest request) {
    Map<String, String> uriVariables = uriVariables(request);
    String typeName =
        annotation.value().isEmpty()
            ? uriVariables.get(annotation.typeParam())
            : annotation.value();
    ResourceType type =
        ResourceType.parse(typeName)
            .filter(ResourceType::supportsGrants)
            .orElseThrow(
                () -> new InvalidRequestException("Invalid object type", "Invalid object type"));

    String rawId = uriVariables.get(annotation.idParam());
    if (rawId == null || rawId.isBlank()) {
      rawId = request.getParameter(annotation.idParam());
    }
    if (rawId == null || rawId.isBlank()) {
      throw new InvalidRequestException("Object ID required", "Object ID required");
    }
    UUID objectId;
    try {
      objectId = UUID.fromString(rawId.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid object ID", "Object ID must be a UUID");
    }

    GrantRole minimumRole =
        annotation.minimumRole().isEmpty() ? null : GrantRole.fromValue(annotation.minimumRole());

    AccessDecision decision =
        objectAccessService.checkAccess(
            RequestScopes.requirePrincipal(), type, objectId, minimumRole);
    if (!decision.allowed()) {
      throw new ForbiddenException(
              "Access denied", "Access denied: " + decision.reason(), type.value(), objectId)
          .securityEventRecorded();
    }

    request.setAttribute(ACCESS_CHECKED_ATTRIBUTE, Boolean.TRUE);
    if (decision.grant() != null) {
      request.setAttribute(GRANT_CONTEXT_ATTRIBUTE, decision.grant());
    }
  }

  private void checkResharePermission(HttpServletRequest request) {
    if (request.getAttribute(ACCESS_CHECKED_ATTRIBUTE) == null) {
      throw new ForbiddenException(
          "Access denied", "Access denied: re-sharing requires an object access check");
    }
    if (request.getAttribute(GRANT_CONTEXT_ATTRIBUTE) instanceof GrantContext grant
        && !grant.canReshare()) {
      throw new ForbiddenException("Access denied", "Access denied: re-sharing not permitted");
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> uriVariables(HttpServletRequest request) {
    Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
  }

  /** The grant that authorized this request, or null for owners and unguarded handlers. */
  public static GrantContext currentGrant(HttpServletRequest request) {
    return request.getAttribute(GRANT_CONTEXT_ATTRIBUTE) instanceof GrantContext grant
        ? grant
        : null;
  }
}
