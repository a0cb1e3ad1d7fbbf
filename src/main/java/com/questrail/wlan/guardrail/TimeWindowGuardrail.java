package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.api.RejectionReason;

import java.util.Optional;

/**
 * Blocks non-emergency changes during peak hour.
 * <p>
 * This is the only guardrail an emergency request bypasses.
 */
public final class TimeWindowGuardrail implements Guardrail
{
    @Override
    public Optional<ChangeDecision.Rejected> check(AccessPoint current,
                                                   ChangeRequest request,
                                                   GuardrailContext context) {
        if (context.peakHour() && !request.emergency()) {
            return Optional.of(new ChangeDecision.Rejected(
                    RejectionReason.PEAK_HOUR_BLOCKED,
                    "peak hour, non-emergency"));
        }
        return Optional.empty();
    }
}
