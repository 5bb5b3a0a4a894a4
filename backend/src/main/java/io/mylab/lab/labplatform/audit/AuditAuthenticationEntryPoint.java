package io.mylab.lab.labplatform.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs authentication failures and records an {@code auth_failure} security event before
 * delegating to {@link BearerTokenAuthenticationEntryPoint} for the 401 response. The event is
 * queued, so recording it never delays or changes the response.
 */
@Component
public class AuditAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AuditAuthenticationEntryPoint.class);

  private final BearerTokenAuthenticationEntryPoint delegate;
  private final AuditService auditService;

  public AuditAuthenticationEntryPoint(AuditService auditService) {
    this.delegate = new BearerTokenAuthenticationEntryPoint();
    this.auditService = auditService;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        request.getRemoteAddr());

    try {
      auditService.logSecurityEvent(
          SecurityEventBuilder.event(SecurityEventType.AUTH_FAILURE)
              .reason(authException.getMessage())
              .details(Map.of("path", request.getRequestURI(), "method", request.getMethod()))
              .request(request)
              .build());
    } catch (RuntimeException e) {
      log.warn("Failed to record auth failure event: {}", e.getMessage());
    }

    delegate.commence(request, response, authException);
  }
}
