package com.questrail.wlan.config;

/**
 * GuardrailPolicy
 * -----------------------------------------------------------------------------
 * Fixed policy parameters consumed by the guardrail chain.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>changeBudgetMinutes</b>: Minimum spacing, in minutes, between two
 *       accepted changes that actually alter the same access point.</li>
 *   <li><b>hysteresisThresholdDb</b>: Minimum absolute transmit power delta, in
 *       dB, a power change must carry to be accepted. Channel changes are not
 *       subject to it.</li>
 * </ul>
 *
 * <p>The policy says <em>what</em> is allowed. It holds no per-device state and
 * never reads a clock; callers supply time with every request.</p>
 */
public record GuardrailPolicy(
        int changeBudgetMinutes,
        int hysteresisThresholdDb
) {
    public static final int DEFAULT_CHANGE_BUDGET_MINUTES = 4 * 60;
    public static final int DEFAULT_HYSTERESIS_THRESHOLD_DB = 2;

    /**
     * Canonical constructor with validation.
     */
    public GuardrailPolicy {
        if (changeBudgetMinutes < 0) {
            throw new IllegalArgumentException("changeBudgetMinutes must be non-negative");
        }
        if (hysteresisThresholdDb < 0) {
            throw new IllegalArgumentException("hysteresisThresholdDb must be non-negative");
        }
    }

    /**
     * Returns the {@code lastChangeTimeMinutes} value given to a freshly
     * registered access point: far enough in the past that a request at any
     * non-negative time clears the change budget.
     */
    public int initialLastChangeTimeMinutes() {
        return -changeBudgetMinutes - 1;
    }

    /**
     * Creates a policy with the standard values.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>changeBudgetMinutes: 240 (four hours)</li>
     *   <li>hysteresisThresholdDb: 2</li>
     * </ul>
     *
     * @return the standard policy
     */
    public static GuardrailPolicy defaults() {
        return new GuardrailPolicy(DEFAULT_CHANGE_BUDGET_MINUTES, DEFAULT_HYSTERESIS_THRESHOLD_DB);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int changeBudgetMinutes = DEFAULT_CHANGE_BUDGET_MINUTES;
        private int hysteresisThresholdDb = DEFAULT_HYSTERESIS_THRESHOLD_DB;

        public Builder withChangeBudgetMinutes(int minutes) {
            this.changeBudgetMinutes = minutes;
            return this;
        }

        public Builder withHysteresisThresholdDb(int thresholdDb) {
            this.hysteresisThresholdDb = thresholdDb;
            return this;
        }

        public GuardrailPolicy build() {
            return new GuardrailPolicy(changeBudgetMinutes, hysteresisThresholdDb);
        }
    }
}
