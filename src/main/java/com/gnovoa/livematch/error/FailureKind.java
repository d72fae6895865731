package com.gnovoa.livematch.error;

/** Typed reasons an engine operation can be rejected. */
public enum FailureKind {
    ACCESS_DENIED,
    NOT_FOUND,
    INVALID_TRANSITION,
    INVALID_REFERENCE,
    PLAYER_NOT_ON_PITCH,
    CONFLICT,
    QUOTA_EXCEEDED,
    /** A malformed entry of a batch; single operations reject bad input with IllegalArgumentException. */
    INVALID_INPUT
}
