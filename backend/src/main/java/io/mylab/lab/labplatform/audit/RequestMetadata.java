package io.mylab.lab.labplatform.audit;

import io.mylab.lab.labplatform.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/** Client IP and user agent of the current HTTP request, or nulls outside one. */
record RequestMetadata(String ipAddress, String userAgent) {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  static RequestMetadata current() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return of(servletAttrs.getRequest());
    }
    return new RequestMetadata(null, null);
  }

  static RequestMetadata of(HttpServletRequest request) {
    String ua = request.getHeader("User-Agent");
    if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
      ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
    }
    return new RequestMetadata(ClientIpResolver.resolve(request), ua);
  }
}
