package com.questrail.wlan.api;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * ChangeRequest
 * -----------------------------------------------------------------------------
 * A proposed change to one access point's channel and/or transmit power.
 *
 * <h2>Partial requests</h2>
 * Each field is optional. An empty field means "no change requested" and is
 * never confused with "set to the current value": the latter still flows
 * through the update-if-different step and simply produces no change.
 * <p>
 * A request with neither field present is legal. If it clears the guardrail
 * chain it is accepted as a no-op.
 *
 * <h2>Emergency</h2>
 * {@link #emergency()} bypasses the peak-hour time window and nothing else.
 * Emergency requests are still rate limited and still subject to hysteresis.
 */
public record ChangeRequest(
        OptionalInt newChannel,
        OptionalInt newPowerDb,
        boolean emergency
) {
    public ChangeRequest {
        Objects.requireNonNull(newChannel, "newChannel");
        Objects.requireNonNull(newPowerDb, "newPowerDb");
    }

    public static ChangeRequest channel(int channel) {
        return builder().withChannel(channel).build();
    }

    public static ChangeRequest powerDb(int powerDb) {
        return builder().withPowerDb(powerDb).build();
    }

    /**
     * Request that asks for nothing.
     */
    public static ChangeRequest empty() {
        return builder().build();
    }

    public boolean isEmpty() {
        return newChannel.isEmpty() && newPowerDb.isEmpty();
    }

    /**
     * Returns a copy of this request with the emergency flag set.
     */
    public ChangeRequest asEmergency() {
        return new ChangeRequest(newChannel, newPowerDb, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OptionalInt newChannel = OptionalInt.empty();
        private OptionalInt newPowerDb = OptionalInt.empty();
        private boolean emergency;

        public Builder withChannel(int channel) {
            this.newChannel = OptionalInt.of(channel);
            return this;
        }

        public Builder withPowerDb(int powerDb) {
            this.newPowerDb = OptionalInt.of(powerDb);
            return this;
        }

        public Builder withEmergency(boolean emergency) {
            this.emergency = emergency;
            return this;
        }

        public ChangeRequest build() {
            return new ChangeRequest(newChannel, newPowerDb, emergency);
        }
    }
}
