package org.javai.resilience;

/**
 * How serious a classified error is. Declaration order is significance order,
 * so {@link #compareTo} can be used to compare severities.
 */
public enum Severity {
    /**
     * Minor issue, the system continues normally.
     */
    LOW,

    /**
     * Moderate issue, some functionality may be affected.
     */
    MEDIUM,

    /**
     * Serious issue with significant impact on functionality.
     */
    HIGH,

    /**
     * System-threatening issue requiring immediate attention.
     */
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
