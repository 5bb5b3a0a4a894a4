package io.mylab.lab.labplatform.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the {@link Principal} from the verified JWT and binds it to {@link RequestScopes} for
 * the rest of the request. Tokens without complete lab platform claims are rejected with 403.
 */
@Component
public class PrincipalFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(PrincipalFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      // Unauthenticated paths (actuator) continue unbound
      filterChain.doFilter(request, response);
      return;
    }

    Principal principal = LabJwtUtils.toPrincipal(jwtAuth.getToken());
    if (principal == null) {
      log.warn(
          "Rejecting token with incomplete org claims: path={}, sub={}",
          request.getRequestURI(),
          jwtAuth.getToken().getSubject());
      response.sendError(HttpServletResponse.SC_FORBIDDEN, "Workspace context missing");
      return;
    }

    RequestScopes.bindPrincipal(principal);
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }
}
