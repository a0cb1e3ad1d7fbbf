package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.config.GuardrailPolicy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GuardrailEvaluator
 * -----------------------------------------------------------------------------
 * Pure, deterministic decision engine for access point change requests.
 *
 * <h2>Role in the architecture</h2>
 * Given a snapshot of one {@link AccessPoint}, a {@link ChangeRequest} and the
 * caller's {@link GuardrailContext}, the evaluator computes:
 * <ul>
 *   <li>the {@link ChangeDecision}</li>
 *   <li>the access point state that should be stored as a result</li>
 * </ul>
 *
 * It is intentionally:
 * <ul>
 *   <li>Pure (no I/O, no clock, no shared state)</li>
 *   <li>Deterministic</li>
 * </ul>
 *
 * Writing the new state back is the caller's job (see {@code GuardrailEngine}).
 *
 * <h2>Rule chain</h2>
 * Guardrails run in list order and the first rejection wins; later guardrails
 * are not consulted. The standard chain is:
 * <ol>
 *   <li>{@link TimeWindowGuardrail}</li>
 *   <li>{@link ChangeBudgetGuardrail}</li>
 *   <li>{@link HysteresisGuardrail}</li>
 * </ol>
 * The order is observable: a peak-hour request that is also inside the change
 * budget is reported as {@code PEAK_HOUR_BLOCKED}.
 *
 * <h2>Applying an accepted request</h2>
 * Each requested field is written only if it differs from the stored value.
 * The last-change time moves to the current time only if at least one field
 * was written; an accepted request that changes nothing leaves it alone.
 */
public final class GuardrailEvaluator
{
    /**
     * Result of evaluating a request against an access point.
     *
     * @param newState the state to store; equal to the input on rejection or no-op
     * @param decision the verdict
     */
    public record Result(AccessPoint newState, ChangeDecision decision) {}

    private final List<Guardrail> chain;

    public GuardrailEvaluator(List<? extends Guardrail> chain) {
        Objects.requireNonNull(chain, "chain");
        this.chain = List.copyOf(chain);
    }

    /**
     * Builds the standard time window, budget, hysteresis chain for {@code policy}.
     */
    public static GuardrailEvaluator standard(GuardrailPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return new GuardrailEvaluator(List.of(
                new TimeWindowGuardrail(),
                new ChangeBudgetGuardrail(policy.changeBudgetMinutes()),
                new HysteresisGuardrail(policy.hysteresisThresholdDb())
        ));
    }

    public List<Guardrail> chain() {
        return chain;
    }

    public Result evaluate(AccessPoint current, ChangeRequest request, GuardrailContext context) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context");

        for (Guardrail guardrail : chain) {
            Optional<ChangeDecision.Rejected> rejection = guardrail.check(current, request, context);
            if (rejection.isPresent()) {
                return new Result(current, rejection.get());
            }
        }

        return apply(current, request, context.currentTimeMinutes());
    }

    private Result apply(AccessPoint current, ChangeRequest request, int now) {
        AccessPoint updated = current;
        boolean changed = false;

        if (request.newChannel().isPresent()
                && request.newChannel().getAsInt() != updated.channel()) {
            updated = updated.withChannel(request.newChannel().getAsInt());
            changed = true;
        }

        if (request.newPowerDb().isPresent()
                && request.newPowerDb().getAsInt() != updated.powerDb()) {
            updated = updated.withPowerDb(request.newPowerDb().getAsInt());
            changed = true;
        }

        if (changed) {
            updated = updated.withLastChangeTimeMinutes(now);
        }

        return new Result(updated, new ChangeDecision.Accepted(updated, changed));
    }
}
