package com.questrail.wlan.scenario;

import com.questrail.wlan.api.ChangeRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ChangeScript
 * ------------
 *
 * An ordered, immutable sequence of change submissions.
 *
 * Useful for building sequences (budget edges, peak-hour emergencies, no-op
 * requests) declaratively and replaying them with {@link ChangeScriptRunner}.
 * Steps are replayed exactly in the order given; times are not sorted.
 */
public final class ChangeScript
{
    private final List<ScriptedChange> steps;

    private ChangeScript(List<ScriptedChange> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static ChangeScript of(List<ScriptedChange> steps) {
        Objects.requireNonNull(steps, "steps");
        return new ChangeScript(steps);
    }

    public List<ScriptedChange> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<ScriptedChange> steps = new ArrayList<>();

        public Builder submit(String accessPointId, ChangeRequest request, int timeMinutes) {
            return submit(accessPointId, request, timeMinutes, false);
        }

        public Builder submitDuringPeak(String accessPointId, ChangeRequest request, int timeMinutes) {
            return submit(accessPointId, request, timeMinutes, true);
        }

        public Builder submit(String accessPointId, ChangeRequest request, int timeMinutes, boolean peakHour) {
            steps.add(new ScriptedChange(accessPointId, request, timeMinutes, peakHour));
            return this;
        }

        public ChangeScript build() {
            return new ChangeScript(steps);
        }
    }
}
