package io.mylab.lab.labplatform.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class PrincipalLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_USER_ID = "userId";
  private static final String MDC_WORKSPACE_ID = "workspaceId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Principal principal = RequestScopes.getPrincipalOrNull();
      if (principal != null) {
        MDC.put(MDC_USER_ID, principal.id().toString());
        MDC.put(MDC_WORKSPACE_ID, principal.workspaceId().toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_WORKSPACE_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
