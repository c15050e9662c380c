package io.github.panghy.indexbuild.node;

/**
 * Liveness of a registered worker.
 */
public enum NodeState {
  /** Renewing its lease and eligible for new jobs. */
  LIVE,
  /** Announced graceful shutdown; still addressable but excluded from placement. */
  STOPPING,
  /** Lease expired or health check failed for too long; no longer addressable. */
  GONE
}
