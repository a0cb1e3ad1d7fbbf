package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.api.RejectionReason;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowGuardrailTest {

    private final TimeWindowGuardrail guardrail = new TimeWindowGuardrail();
    private final AccessPoint ap = AccessPoint.of("AP-1", 6, 20);

    @Test
    void blocksNonEmergencyDuringPeak() {
        Optional<ChangeDecision.Rejected> r = guardrail.check(ap, ChangeRequest.channel(1),
                new GuardrailContext(800, true));

        assertEquals(RejectionReason.PEAK_HOUR_BLOCKED, r.orElseThrow().reason());
    }

    @Test
    void emergencyBypassesPeak() {
        assertTrue(guardrail.check(ap, ChangeRequest.channel(1).asEmergency(),
                new GuardrailContext(800, true)).isEmpty());
    }

    @Test
    void offPeakAlwaysPasses() {
        assertTrue(guardrail.check(ap, ChangeRequest.channel(1),
                new GuardrailContext(800, false)).isEmpty());
        assertTrue(guardrail.check(ap, ChangeRequest.empty(),
                new GuardrailContext(800, false)).isEmpty());
    }
}
