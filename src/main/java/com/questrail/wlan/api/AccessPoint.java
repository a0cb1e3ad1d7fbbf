package com.questrail.wlan.api;

import com.questrail.wlan.config.GuardrailPolicy;

import java.util.Objects;

/**
 * AccessPoint
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one managed radio unit.
 *
 * <h2>Intent</h2>
 * This class captures everything the guardrail chain needs to know about a
 * single access point: its identity, its current operating channel and
 * transmit power, and when a change last actually altered it.
 *
 * It deliberately contains no policy; transitions are produced by the
 * evaluator and written back through the state store.
 *
 * <h2>Last change time</h2>
 * {@link #lastChangeTimeMinutes()} is expressed in minutes since an arbitrary,
 * caller-defined epoch. It advances only when an accepted request alters the
 * channel or the power. A newly registered access point starts at
 * {@link GuardrailPolicy#initialLastChangeTimeMinutes()} so its first request
 * is never blocked by the change budget.
 */
public final class AccessPoint
{
    private final String id;
    private final int channel;
    private final int powerDb;
    private final int lastChangeTimeMinutes;

    private AccessPoint(String id, int channel, int powerDb, int lastChangeTimeMinutes) {
        this.id = Objects.requireNonNull(id, "id");
        this.channel = channel;
        this.powerDb = powerDb;
        this.lastChangeTimeMinutes = lastChangeTimeMinutes;
    }

    public String id() {
        return id;
    }

    public int channel() {
        return channel;
    }

    public int powerDb() {
        return powerDb;
    }

    public int lastChangeTimeMinutes() {
        return lastChangeTimeMinutes;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * New access point under the default policy.
     */
    public static AccessPoint of(String id, int channel, int powerDb) {
        return of(id, channel, powerDb, GuardrailPolicy.defaults());
    }

    /**
     * New access point whose initial last-change time clears the budget of
     * {@code policy}.
     */
    public static AccessPoint of(String id, int channel, int powerDb, GuardrailPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return new AccessPoint(id, channel, powerDb, policy.initialLastChangeTimeMinutes());
    }

    /**
     * Access point with an explicit last-change time, e.g. when restoring a
     * known record.
     */
    public static AccessPoint restored(String id, int channel, int powerDb, int lastChangeTimeMinutes) {
        return new AccessPoint(id, channel, powerDb, lastChangeTimeMinutes);
    }

    // ---------------------------------------------------------------------
    // State transition helpers
    // ---------------------------------------------------------------------

    public AccessPoint withChannel(int newChannel) {
        return new AccessPoint(id, newChannel, powerDb, lastChangeTimeMinutes);
    }

    public AccessPoint withPowerDb(int newPowerDb) {
        return new AccessPoint(id, channel, newPowerDb, lastChangeTimeMinutes);
    }

    public AccessPoint withLastChangeTimeMinutes(int minutes) {
        return new AccessPoint(id, channel, powerDb, minutes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessPoint that)) return false;
        return channel == that.channel
                && powerDb == that.powerDb
                && lastChangeTimeMinutes == that.lastChangeTimeMinutes
                && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, channel, powerDb, lastChangeTimeMinutes);
    }

    @Override
    public String toString() {
        return id + "(ch=" + channel + ", pwr=" + powerDb + "dB, lastChange=" + lastChangeTimeMinutes + ")";
    }
}
