package io.mylab.lab.labplatform.security;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the client IP address from a servlet request behind the platform's load balancer. */
public final class ClientIpResolver {

  private static final int MAX_IP_LENGTH = 45;

  private ClientIpResolver() {}

  /**
   * Returns the first X-Forwarded-For hop, then X-Real-IP, then {@code request.getRemoteAddr()}.
   * Values longer than an IPv6 literal are truncated to fit the log column.
   */
  public static String resolve(HttpServletRequest request) {
    String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded != null && !forwarded.isBlank()) {
      return truncate(forwarded.split(",")[0].trim());
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return truncate(realIp.trim());
    }
    return truncate(request.getRemoteAddr());
  }

  private static String truncate(String ip) {
    if (ip == null || ip.length() <= MAX_IP_LENGTH) {
      return ip;
    }
    return ip.substring(0, MAX_IP_LENGTH);
  }
}
