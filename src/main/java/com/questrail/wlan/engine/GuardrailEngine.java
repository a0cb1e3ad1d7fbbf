package com.questrail.wlan.engine;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.api.GuardrailController;
import com.questrail.wlan.api.RejectionReason;
import com.questrail.wlan.api.UnknownAccessPointException;
import com.questrail.wlan.config.GuardrailPolicy;
import com.questrail.wlan.guardrail.GuardrailContext;
import com.questrail.wlan.guardrail.GuardrailEvaluator;
import com.questrail.wlan.observability.AccessPointStateChangeEvent;
import com.questrail.wlan.observability.ChangeEvaluatedEvent;
import com.questrail.wlan.observability.GuardrailObservabilitySink;
import com.questrail.wlan.observability.LookupFailureEvent;
import com.questrail.wlan.observability.NullObservabilitySink;
import com.questrail.wlan.store.NetworkStateStore;

import java.util.Objects;
import java.util.Optional;

/**
 * GuardrailEngine
 * -----------------------------------------------------------------------------
 * Default {@link GuardrailController}: wires the pure {@link GuardrailEvaluator}
 * to the {@link NetworkStateStore}.
 *
 * <h2>Submission flow</h2>
 * <pre>
 *   submit(id, request, now, peak)
 *       → store.modify(id)
 *           → snapshot read
 *           → evaluator.evaluate()    (pure, no lock held)
 *           → compare-and-replace     (re-evaluate on conflict)
 *       ← decision
 *   → observability sink
 * </pre>
 *
 * Read, evaluate and write happen inside one {@code modify} call, so two
 * concurrent submissions for the same access point cannot both commit against
 * the same last-change time. No lock is held while the chain runs, so a slow
 * guardrail for one access point never delays another. Sink callbacks run
 * after the commit.
 */
public final class GuardrailEngine implements GuardrailController
{
    private final NetworkStateStore store;
    private final GuardrailPolicy policy;
    private final GuardrailEvaluator evaluator;
    private final GuardrailObservabilitySink observabilitySink;

    private GuardrailEngine(NetworkStateStore store,
                            GuardrailPolicy policy,
                            GuardrailEvaluator evaluator,
                            GuardrailObservabilitySink observabilitySink) {
        this.store = store;
        this.policy = policy;
        this.evaluator = evaluator;
        this.observabilitySink = observabilitySink;
    }

    public GuardrailPolicy policy() {
        return policy;
    }

    public NetworkStateStore store() {
        return store;
    }

    @Override
    public void register(String id, int channel, int powerDb) {
        store.add(AccessPoint.of(id, channel, powerDb, policy));
    }

    @Override
    public Optional<AccessPoint> query(String id) {
        return store.find(id);
    }

    @Override
    public ChangeDecision submit(String id, ChangeRequest request, int currentTimeMinutes, boolean peakHour) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(request, "request");

        GuardrailContext context = new GuardrailContext(currentTimeMinutes, peakHour);

        Transition transition;
        try {
            transition = store.modify(id, current -> {
                GuardrailEvaluator.Result result = evaluator.evaluate(current, request, context);
                return new NetworkStateStore.Modification<>(
                        result.newState(),
                        new Transition(current, result.decision()));
            });
        } catch (UnknownAccessPointException e) {
            observabilitySink.onLookupFailure(new LookupFailureEvent(id, "submit"));
            ChangeDecision rejected = new ChangeDecision.Rejected(
                    RejectionReason.UNKNOWN_ACCESS_POINT, e.getMessage());
            observabilitySink.onChangeEvaluated(
                    new ChangeEvaluatedEvent(id, request, currentTimeMinutes, peakHour, rejected));
            return rejected;
        }

        ChangeDecision decision = transition.decision();
        observabilitySink.onChangeEvaluated(
                new ChangeEvaluatedEvent(id, request, currentTimeMinutes, peakHour, decision));

        if (decision instanceof ChangeDecision.Accepted a && a.stateChanged()) {
            observabilitySink.onStateChange(
                    new AccessPointStateChangeEvent(transition.before(), a.resultingState()));
        }

        return decision;
    }

    /**
     * What happened inside one {@code modify} call.
     */
    private record Transition(AccessPoint before, ChangeDecision decision) {}

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NetworkStateStore store;
        private GuardrailPolicy policy = GuardrailPolicy.defaults();
        private GuardrailEvaluator evaluator;
        private GuardrailObservabilitySink observabilitySink;

        /**
         * Uses an existing store. If not set, a store reporting to the
         * engine's observability sink is created. If set without an
         * observability sink, the engine reports to the store's sink.
         */
        public Builder withStore(NetworkStateStore store) {
            this.store = store;
            return this;
        }

        public Builder withPolicy(GuardrailPolicy policy) {
            this.policy = policy;
            return this;
        }

        /**
         * Replaces the standard chain derived from the policy.
         */
        public Builder withEvaluator(GuardrailEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder withObservabilitySink(GuardrailObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * @throws IllegalStateException if both a store and a sink are set and
         *         the store reports registrations to a different sink
         */
        public GuardrailEngine build() {
            Objects.requireNonNull(policy, "policy");

            GuardrailObservabilitySink effectiveSink;
            NetworkStateStore effectiveStore;
            if (store == null) {
                effectiveSink = observabilitySink != null ? observabilitySink : NullObservabilitySink.INSTANCE;
                effectiveStore = new NetworkStateStore(effectiveSink);
            } else if (observabilitySink == null) {
                effectiveSink = store.observabilitySink();
                effectiveStore = store;
            } else if (store.observabilitySink() != observabilitySink) {
                throw new IllegalStateException(
                        "Store reports registrations to a different observability sink than the engine");
            } else {
                effectiveSink = observabilitySink;
                effectiveStore = store;
            }
            GuardrailEvaluator effectiveEvaluator = evaluator != null
                    ? evaluator
                    : GuardrailEvaluator.standard(policy);

            return new GuardrailEngine(effectiveStore, policy, effectiveEvaluator, effectiveSink);
        }
    }
}
