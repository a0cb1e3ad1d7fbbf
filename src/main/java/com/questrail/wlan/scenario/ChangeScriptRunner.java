package com.questrail.wlan.scenario;

import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.GuardrailController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ChangeScriptRunner
 * ------------------
 *
 * Replays a {@link ChangeScript} against a {@link GuardrailController} and
 * records every decision together with the resulting stored state.
 *
 * The runner adds no behavior of its own: no retries, no reordering, no
 * clock. Registration of the access points is left to the caller.
 */
public final class ChangeScriptRunner
{
    private final GuardrailController controller;

    public ChangeScriptRunner(GuardrailController controller) {
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    public List<RecordedDecision> run(ChangeScript script) {
        Objects.requireNonNull(script, "script");

        List<RecordedDecision> recorded = new ArrayList<>(script.size());
        for (ScriptedChange step : script.steps()) {
            ChangeDecision decision = controller.submit(
                    step.accessPointId(),
                    step.request(),
                    step.timeMinutes(),
                    step.peakHour());
            recorded.add(new RecordedDecision(step, decision, controller.query(step.accessPointId())));
        }
        return Collections.unmodifiableList(recorded);
    }
}
