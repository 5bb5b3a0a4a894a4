package io.mylab.lab.labplatform.access;

/** One step of an access decision. Implementations must not throw for a plain "no access". */
public interface AccessPolicy {

  /** Stable name used in decision logs. */
  String name();

  PolicyResult decide(AccessRequest request);
}
