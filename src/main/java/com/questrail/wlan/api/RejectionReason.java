package com.questrail.wlan.api;

/**
 * RejectionReason
 * -----------------------------------------------------------------------------
 * Identifies why a change request was not applied.
 *
 * Three of the values name a guardrail that vetoed the request. The remaining
 * value, {@link #UNKNOWN_ACCESS_POINT}, is a lookup failure: no guardrail ran,
 * and callers are expected to treat it differently (fix the id rather than
 * wait and resubmit).
 */
public enum RejectionReason
{
    /**
     * The target access point is not registered.
     */
    UNKNOWN_ACCESS_POINT(false),

    /**
     * Non-emergency change submitted during peak hour.
     */
    PEAK_HOUR_BLOCKED(true),

    /**
     * The change budget since the last applied change has not yet elapsed.
     * Resubmitting after the budget window is the expected remedy.
     */
    BUDGET_NOT_ELAPSED(true),

    /**
     * The requested power differs from the current power by less than the
     * hysteresis threshold.
     */
    HYSTERESIS_TOO_SMALL(true);

    private final boolean policyRejection;

    RejectionReason(boolean policyRejection) {
        this.policyRejection = policyRejection;
    }

    /**
     * Returns {@code true} when a guardrail vetoed the request, {@code false}
     * for lookup failures.
     */
    public boolean isPolicyRejection() {
        return policyRejection;
    }
}
