package com.questrail.wlan.api;

import java.util.Objects;

/**
 * ChangeDecision
 * -----------------------------------------------------------------------------
 * The definitive verdict for one submitted {@link ChangeRequest}.
 *
 * <h2>Accepted vs. changed</h2>
 * Acceptance and state change are reported separately. A request can clear
 * every guardrail and still leave the access point untouched, for example
 * when it asks for the channel the access point already uses. In that case
 * the decision is {@link Accepted} with {@link Accepted#stateChanged()} equal
 * to {@code false}, and the last-change time does not advance.
 *
 * <h2>Rejections</h2>
 * A {@link Rejected} decision names exactly one {@link RejectionReason}: the
 * first guardrail in the chain that failed, or the lookup failure. Rejections
 * never mutate state.
 */
public sealed interface ChangeDecision
        permits ChangeDecision.Accepted, ChangeDecision.Rejected
{
    /**
     * Returns {@code true} if the request cleared the guardrail chain.
     */
    boolean accepted();

    /**
     * The request cleared every guardrail.
     *
     * @param resultingState the access point as stored after the decision
     * @param stateChanged   whether the channel or power actually changed
     */
    record Accepted(AccessPoint resultingState, boolean stateChanged) implements ChangeDecision {
        public Accepted {
            Objects.requireNonNull(resultingState, "resultingState");
        }

        @Override
        public boolean accepted() {
            return true;
        }
    }

    /**
     * The request was refused.
     *
     * @param reason which guardrail fired, or the lookup failure
     * @param detail short human-readable diagnostic
     */
    record Rejected(RejectionReason reason, String detail) implements ChangeDecision {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean accepted() {
            return false;
        }
    }
}
