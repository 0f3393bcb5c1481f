package com.techportfolio.common.exception;

/**
 * Failure taxonomy shared by every stage of the read, aggregation, streaming and
 * dispatch pipeline.
 */
public enum ErrorKind {

    /** Caller input violates an invariant. Never retried. */
    VALIDATION,

    /** Storage unavailable or timed out. Retried with backoff before surfacing. */
    STORAGE,

    /** A dependent fetch of a join failed after the primary fetch succeeded. */
    AGGREGATION,

    /** A subscriber's bounded buffer was exceeded. Terminates that subscriber only. */
    OVERFLOW,

    /** The audit sink call failed or timed out. Logged, never surfaced to the writer. */
    PUBLISH
}
