package io.llmops.platform.runtime.alert;

/**
 * Evaluation status of an alert rule.
 *
 * <pre>
 * OK → PENDING → FIRING → RESOLVED → OK
 *        ↓                    ↓
 *        OK                PENDING
 * </pre>
 */
public enum AlertStatus {
    /**
     * The condition does not hold.
     */
    OK,

    /**
     * The condition holds but not yet for the rule's full duration.
     */
    PENDING,

    /**
     * The condition has held continuously for at least the rule's duration.
     */
    FIRING,

    /**
     * The condition stopped holding while firing. Lasts one evaluation.
     */
    RESOLVED
}
