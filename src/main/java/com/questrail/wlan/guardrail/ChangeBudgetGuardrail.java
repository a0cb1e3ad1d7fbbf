package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.api.RejectionReason;

import java.util.Optional;

/**
 * Rate limits changes per access point.
 * <p>
 * A request is refused while fewer than {@code budgetMinutes} have passed
 * since the last change that actually altered the access point. A current
 * time earlier than the recorded change yields a negative elapsed time and
 * is refused the same way. Emergency requests are not exempt.
 */
public final class ChangeBudgetGuardrail implements Guardrail
{
    private final int budgetMinutes;

    public ChangeBudgetGuardrail(int budgetMinutes) {
        if (budgetMinutes < 0) {
            throw new IllegalArgumentException("budgetMinutes must be non-negative");
        }
        this.budgetMinutes = budgetMinutes;
    }

    public int budgetMinutes() {
        return budgetMinutes;
    }

    @Override
    public Optional<ChangeDecision.Rejected> check(AccessPoint current,
                                                   ChangeRequest request,
                                                   GuardrailContext context) {
        // long: int minute values at the extremes must not wrap
        long elapsed = (long) context.currentTimeMinutes() - current.lastChangeTimeMinutes();
        if (elapsed < budgetMinutes) {
            return Optional.of(new ChangeDecision.Rejected(
                    RejectionReason.BUDGET_NOT_ELAPSED,
                    "last change " + elapsed + " min ago, budget " + budgetMinutes + " min"));
        }
        return Optional.empty();
    }
}
