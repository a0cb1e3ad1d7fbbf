package com.questrail.wlan.guardrail;

/**
 * Caller-supplied timing facts for one evaluation.
 *
 * @param currentTimeMinutes authoritative current time, in minutes since the
 *                           caller's epoch; not checked for monotonicity
 * @param peakHour           whether the caller considers this peak hour
 */
public record GuardrailContext(int currentTimeMinutes, boolean peakHour) {
}
