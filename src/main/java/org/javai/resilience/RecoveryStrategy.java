package org.javai.resilience;

/**
 * The recovery a caller is advised to take for a classified error.
 * This is advisory, not a command.
 */
public enum RecoveryStrategy {
    /** Retry the operation. */
    RETRY,

    /** Use an alternative approach or data source. */
    FALLBACK,

    /** Skip this step and continue. */
    SKIP,

    /** Continue with reduced functionality. */
    DEGRADE,

    /** Stop the current operation. */
    ABORT
}
