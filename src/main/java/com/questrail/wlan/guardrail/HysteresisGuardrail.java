package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.api.RejectionReason;

import java.util.Optional;

/**
 * Refuses power adjustments too small to be worth making.
 * <p>
 * Only requests that carry a power value are checked. Channel-only requests
 * pass regardless of the current power.
 */
public final class HysteresisGuardrail implements Guardrail
{
    private final int thresholdDb;

    public HysteresisGuardrail(int thresholdDb) {
        if (thresholdDb < 0) {
            throw new IllegalArgumentException("thresholdDb must be non-negative");
        }
        this.thresholdDb = thresholdDb;
    }

    public int thresholdDb() {
        return thresholdDb;
    }

    @Override
    public Optional<ChangeDecision.Rejected> check(AccessPoint current,
                                                   ChangeRequest request,
                                                   GuardrailContext context) {
        if (request.newPowerDb().isEmpty()) {
            return Optional.empty();
        }

        long delta = Math.abs((long) request.newPowerDb().getAsInt() - current.powerDb());
        if (delta < thresholdDb) {
            return Optional.of(new ChangeDecision.Rejected(
                    RejectionReason.HYSTERESIS_TOO_SMALL,
                    "delta " + delta + " dB, threshold " + thresholdDb + " dB"));
        }
        return Optional.empty();
    }
}
