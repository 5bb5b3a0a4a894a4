package io.mylab.lab.labplatform.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/** Writes the {@link Audited} entry once a handler has completed with a 2xx or 3xx status. */
@Component
public class AuditInterceptor implements HandlerInterceptor {

  private static final Logger log = LoggerFactory.getLogger(AuditInterceptor.class);

  private final AuditService auditService;

  public AuditInterceptor(AuditService auditService) {
    this.auditService = auditService;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    if (ex != null || response.getStatus() >= 400) {
      return;
    }
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return;
    }
    Audited audited = handlerMethod.getMethodAnnotation(Audited.class);
    if (audited == null) {
      return;
    }
    try {
      record(audited, request, response);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record audit entry for {} {}: {}",
          request.getMethod(),
          request.getRequestURI(),
          e.getMessage());
    }
  }

  private void record(Audited audited, HttpServletRequest request, HttpServletResponse response) {
    Map<String, String> uriVariables = uriVariables(request);
    String objectType =
        audited.objectType().isEmpty()
            ? uriVariables.get(audited.typeParam())
            : audited.objectType();
    String rawId = uriVariables.get(audited.idParam());
    if (rawId == null) {
      rawId = request.getParameter(audited.idParam());
    }
    if (objectType == null || rawId == null) {
      log.debug("No object reference for audited call {}", request.getRequestURI());
      return;
    }

    var details = new HashMap<String, Object>();
    details.put("method", request.getMethod());
    details.put("url", request.getRequestURI());
    details.put("status", response.getStatus());
    auditService.log(
        AuditRecordBuilder.builder()
            .objectType(objectType)
            .objectId(UUID.fromString(rawId))
            .action(audited.action())
            .details(details)
            .metadata(RequestMetadata.of(request))
            .build());
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> uriVariables(HttpServletRequest request) {
    Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
  }
}
