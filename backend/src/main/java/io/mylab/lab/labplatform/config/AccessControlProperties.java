package io.mylab.lab.labplatform.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for the access decision path.
 *
 * @param lookupTimeout transaction timeout bounding every query of a single decision
 * @param grantExpiryBuffer grants expiring within this window are already treated as expired
 * @param ownershipCache bounds for the resource owner cache
 * @param permissionRefreshInterval how often the role permission snapshot is re-read
 */
@ConfigurationProperties(prefix = "access-control")
public record AccessControlProperties(
    Duration lookupTimeout,
    Duration grantExpiryBuffer,
    OwnershipCache ownershipCache,
    Duration permissionRefreshInterval) {

  public AccessControlProperties {
    if (lookupTimeout == null) {
      lookupTimeout = Duration.ofSeconds(5);
    }
    if (grantExpiryBuffer == null) {
      grantExpiryBuffer = Duration.ofSeconds(30);
    }
    if (ownershipCache == null) {
      ownershipCache = new OwnershipCache(0, null);
    }
    if (permissionRefreshInterval == null) {
      permissionRefreshInterval = Duration.ofMinutes(5);
    }
  }

  /** Transaction timeout in whole seconds, at least one. */
  public int lookupTimeoutSeconds() {
    return (int) Math.max(1, lookupTimeout.toSeconds());
  }

  public record OwnershipCache(long maximumSize, Duration expireAfterWrite) {

    public OwnershipCache {
      if (maximumSize <= 0) {
        maximumSize = 50_000;
      }
      if (expireAfterWrite == null) {
        expireAfterWrite = Duration.ofHours(1);
      }
    }
  }

  /** Defaults, for tests and for wiring outside Spring. */
  public static AccessControlProperties defaults() {
    return new AccessControlProperties(null, null, null, null);
  }
}
