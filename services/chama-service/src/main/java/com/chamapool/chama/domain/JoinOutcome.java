package com.chamapool.chama.domain;

/**
 * Result of a join call: admitted directly, or parked as a request for admin approval.
 */
public enum JoinOutcome {
    ADMITTED,
    REQUESTED
}
