package io.mylab.lab.labplatform.grant;

/** How the recipient organization works with a shared object. */
public enum AccessMode {
  /** Recipient works with the object inside the platform. */
  PLATFORM,
  /** Recipient received an offline copy; the grant records the hand-off. */
  OFFLINE
}
