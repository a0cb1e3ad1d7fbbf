package com.questrail.wlan.observability;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GuardrailObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGuardrailObservabilitySink implements GuardrailObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGuardrailObservabilitySink.class);

    @Override
    public void onAccessPointRegistered(AccessPointRegisteredEvent event) {
        AccessPoint ap = event.accessPoint();
        if (event.isReplacement()) {
            log.info("Replaced AP {} (Ch: {}, Pwr: {}dB)", ap.id(), ap.channel(), ap.powerDb());
        } else {
            log.info("Added AP {} (Ch: {}, Pwr: {}dB)", ap.id(), ap.channel(), ap.powerDb());
        }
    }

    @Override
    public void onChangeEvaluated(ChangeEvaluatedEvent event) {
        ChangeDecision decision = event.decision();

        if (decision instanceof ChangeDecision.Rejected r) {
            log.info("AP {} at T={}: REJECT {} ({})",
                event.accessPointId(),
                event.currentTimeMinutes(),
                r.reason(),
                r.detail());
        } else if (decision instanceof ChangeDecision.Accepted a) {
            if (a.stateChanged()) {
                log.info("AP {} at T={}: ACCEPT, all guardrails passed",
                    event.accessPointId(),
                    event.currentTimeMinutes());
            } else {
                log.info("AP {} at T={}: ACCEPT, no state change occurred",
                    event.accessPointId(),
                    event.currentTimeMinutes());
            }
        }
    }

    @Override
    public void onStateChange(AccessPointStateChangeEvent event) {
        String id = event.newState().id();
        if (event.isChannelChange()) {
            log.info("AP {}: channel {} -> {}", id, event.oldState().channel(), event.newState().channel());
        }
        if (event.isPowerChange()) {
            log.info("AP {}: power {}dB -> {}dB", id, event.oldState().powerDb(), event.newState().powerDb());
        }
    }

    @Override
    public void onLookupFailure(LookupFailureEvent event) {
        log.warn("AP '{}' not found in network state ({})", event.accessPointId(), event.operation());
    }
}
