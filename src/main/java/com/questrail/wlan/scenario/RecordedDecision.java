package com.questrail.wlan.scenario;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;

import java.util.Optional;

/**
 * RecordedDecision
 * ----------------
 *
 * The outcome of replaying one {@link ScriptedChange}: the decision and the
 * access point as stored immediately afterwards (empty if the id was never
 * registered).
 */
public record RecordedDecision(
        ScriptedChange step,
        ChangeDecision decision,
        Optional<AccessPoint> stateAfter
) {
    public boolean accepted() {
        return decision.accepted();
    }

    @Override
    public String toString() {
        String verdict = decision instanceof ChangeDecision.Rejected r
                ? "REJECTED(" + r.reason() + ")"
                : "ACCEPTED";
        return step.accessPointId() + "@T=" + step.timeMinutes() + " " + verdict;
    }
}
