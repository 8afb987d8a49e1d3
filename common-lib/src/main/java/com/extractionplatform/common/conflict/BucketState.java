package com.extractionplatform.common.conflict;

/**
 * Lifecycle of one {@code (section, key)} bucket.
 *
 * <pre>
 *   OPEN ──(disagreeing finding)──▶ RESOLVED | UNRESOLVED
 * </pre>
 * A bucket whose findings all agree stays OPEN.
 */
public enum BucketState {
    OPEN,
    RESOLVED,
    UNRESOLVED
}
