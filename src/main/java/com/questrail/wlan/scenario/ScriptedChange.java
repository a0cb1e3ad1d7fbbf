package com.questrail.wlan.scenario;

import com.questrail.wlan.api.ChangeRequest;

import java.util.Objects;

/**
 * One step of a {@link ChangeScript}: a request submitted for an access point
 * at a given simulated time.
 */
public record ScriptedChange(
        String accessPointId,
        ChangeRequest request,
        int timeMinutes,
        boolean peakHour
) {
    public ScriptedChange {
        Objects.requireNonNull(accessPointId, "accessPointId");
        Objects.requireNonNull(request, "request");
    }
}
