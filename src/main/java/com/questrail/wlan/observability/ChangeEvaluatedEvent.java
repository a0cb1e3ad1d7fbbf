package com.questrail.wlan.observability;

import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;

/**
 * Record representing the verdict for one submitted change request.
 * Emitted for every submission, accepted or not.
 */
public record ChangeEvaluatedEvent(
    String accessPointId,
    ChangeRequest request,
    int currentTimeMinutes,
    boolean peakHour,
    ChangeDecision decision
) {
}
