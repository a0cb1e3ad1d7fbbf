package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeRequest;
import com.questrail.wlan.api.RejectionReason;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HysteresisGuardrailTest {

    private final HysteresisGuardrail guardrail = new HysteresisGuardrail(2);
    private final AccessPoint ap = AccessPoint.of("AP-1", 6, 20);
    private final GuardrailContext ctx = new GuardrailContext(500, false);

    @Test
    void rejectsDeltaBelowThresholdInEitherDirection() {
        var up = guardrail.check(ap, ChangeRequest.powerDb(21), ctx);
        var down = guardrail.check(ap, ChangeRequest.powerDb(19), ctx);

        assertEquals(RejectionReason.HYSTERESIS_TOO_SMALL, up.orElseThrow().reason());
        assertTrue(up.orElseThrow().detail().contains("delta 1 dB"));
        assertEquals(RejectionReason.HYSTERESIS_TOO_SMALL, down.orElseThrow().reason());
    }

    @Test
    void sameValueIsADeltaOfZero() {
        assertTrue(guardrail.check(ap, ChangeRequest.powerDb(20), ctx).isPresent());
    }

    @Test
    void acceptsDeltaAtThreshold() {
        assertTrue(guardrail.check(ap, ChangeRequest.powerDb(22), ctx).isEmpty());
        assertTrue(guardrail.check(ap, ChangeRequest.powerDb(18), ctx).isEmpty());
    }

    @Test
    void channelOnlyRequestIsNeverChecked() {
        assertTrue(guardrail.check(ap, ChangeRequest.channel(6), ctx).isEmpty());
        assertTrue(guardrail.check(ap, ChangeRequest.empty(), ctx).isEmpty());
    }

    @Test
    void zeroThresholdAcceptsEverything() {
        HysteresisGuardrail lenient = new HysteresisGuardrail(0);

        assertTrue(lenient.check(ap, ChangeRequest.powerDb(20), ctx).isEmpty());
    }
}
