package io.mylab.lab.labplatform.security;

import io.mylab.lab.labplatform.exception.PrincipalNotBoundException;

/**
 * Thread-bound request context. {@link PrincipalFilter} binds the principal before the rest of the
 * chain runs and clears it in a {@code finally} block.
 */
public final class RequestScopes {

  private static final ThreadLocal<Principal> PRINCIPAL = new ThreadLocal<>();

  private RequestScopes() {}

  public static void bindPrincipal(Principal principal) {
    PRINCIPAL.set(principal);
  }

  public static boolean isPrincipalBound() {
    return PRINCIPAL.get() != null;
  }

  /** Returns the current principal. Throws if not bound by the filter chain. */
  public static Principal requirePrincipal() {
    Principal principal = PRINCIPAL.get();
    if (principal == null) {
      throw new PrincipalNotBoundException();
    }
    return principal;
  }

  /** Returns the current principal, or null if not bound. */
  public static Principal getPrincipalOrNull() {
    return PRINCIPAL.get();
  }

  public static void clear() {
    PRINCIPAL.remove();
  }
}
