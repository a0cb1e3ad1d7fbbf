package com.questrail.wlan.store;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.UnknownAccessPointException;
import com.questrail.wlan.observability.AccessPointRegisteredEvent;
import com.questrail.wlan.observability.GuardrailObservabilitySink;
import com.questrail.wlan.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * NetworkStateStore
 * -----------------------------------------------------------------------------
 * Owns every {@link AccessPoint} record, keyed by access point id.
 *
 * <h2>Role in the architecture</h2>
 * The store is the leaf of the system: the engine never keeps its own copy of
 * a record, it reads and writes through this class.
 *
 * <h2>Threading model</h2>
 * Records are immutable and held in a {@link ConcurrentHashMap}. The unit of
 * atomicity is one id:
 * <ul>
 *   <li>{@link #modify} evaluates against a snapshot and commits with a
 *       compare-and-replace, retrying on conflict, so read-evaluate-write for
 *       one access point behaves as a single critical section</li>
 *   <li>no lock is held while a {@link #modify} function runs, so a slow
 *       evaluation for one id never delays another id</li>
 *   <li>operations on different ids carry no ordering guarantee</li>
 * </ul>
 * Functions passed to {@link #modify} must be free of side effects.
 */
public final class NetworkStateStore
{
    /**
     * Result of a {@link #modify} function.
     *
     * @param updated the record to store (may be the same instance)
     * @param outcome whatever the caller wants returned from {@code modify}
     */
    public record Modification<R>(AccessPoint updated, R outcome) {
        public Modification {
            Objects.requireNonNull(updated, "updated");
        }
    }

    private final ConcurrentHashMap<String, AccessPoint> records = new ConcurrentHashMap<>();
    private final GuardrailObservabilitySink observabilitySink;

    public NetworkStateStore() {
        this(NullObservabilitySink.INSTANCE);
    }

    public NetworkStateStore(GuardrailObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Inserts {@code ap}, replacing any record with the same id. No range
     * validation is performed.
     */
    public void add(AccessPoint ap) {
        Objects.requireNonNull(ap, "ap");
        AccessPoint previous = records.put(ap.id(), ap);
        observabilitySink.onAccessPointRegistered(
                new AccessPointRegisteredEvent(ap, Optional.ofNullable(previous)));
    }

    /**
     * Returns the current record for {@code id}.
     *
     * @throws UnknownAccessPointException if no record exists
     */
    public AccessPoint get(String id) {
        Objects.requireNonNull(id, "id");
        AccessPoint ap = records.get(id);
        if (ap == null) {
            throw new UnknownAccessPointException(id);
        }
        return ap;
    }

    public Optional<AccessPoint> find(String id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(records.get(id));
    }

    /**
     * Atomically reads the record for {@code id}, passes it to {@code fn},
     * and stores the record {@code fn} returns.
     * <p>
     * {@code fn} runs outside any map lock against an immutable snapshot. The
     * result is committed only if the stored record is still equal to that
     * snapshot; otherwise {@code fn} is run again on the fresh record. An
     * update equal to the snapshot is not written. {@code fn} may therefore
     * be invoked more than once and must be free of side effects.
     *
     * @return the outcome produced by the committed invocation of {@code fn}
     * @throws UnknownAccessPointException if no record exists; nothing is inserted
     */
    public <R> R modify(String id, Function<AccessPoint, Modification<R>> fn) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fn, "fn");

        while (true) {
            AccessPoint current = records.get(id);
            if (current == null) {
                throw new UnknownAccessPointException(id);
            }

            Modification<R> m = fn.apply(current);
            AccessPoint updated = m.updated();
            if (!updated.id().equals(id)) {
                throw new IllegalStateException("Modification changed record id " + id + " -> " + updated.id());
            }

            if (updated.equals(current) || records.replace(id, current, updated)) {
                return m.outcome();
            }
        }
    }

    public GuardrailObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    public Set<String> ids() {
        return Set.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }
}
