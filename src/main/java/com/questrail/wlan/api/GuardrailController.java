package com.questrail.wlan.api;

import java.util.Optional;

/**
 * GuardrailController
 * -----------------------------------------------------------------------------
 * The in-process surface a caller (a CLI, a controller loop, a planner) uses
 * to drive the guardrail engine.
 *
 * <h2>What a GuardrailController IS</h2>
 * <ul>
 *   <li>The owner of every managed {@link AccessPoint} record</li>
 *   <li>The single place where change requests are admitted or refused</li>
 * </ul>
 *
 * <h2>What a GuardrailController IS NOT</h2>
 * <ul>
 *   <li>It is <b>not</b> a planner; it never proposes configurations</li>
 *   <li>It does <b>not</b> read a clock or decide what counts as peak hour</li>
 *   <li>It does <b>not</b> retry; callers own any retry policy</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Implementations must make each {@link #submit} atomic per access point:
 * concurrent submissions for the same id are serialized, submissions for
 * different ids do not wait on each other.
 */
public interface GuardrailController
{
    /**
     * Registers an access point, replacing any existing record with the same
     * id. The new record's last-change time is set so the first request is
     * never rate limited.
     */
    void register(String id, int channel, int powerDb);

    /**
     * Returns the current record for {@code id}, or empty if none exists.
     */
    Optional<AccessPoint> query(String id);

    /**
     * Evaluates {@code request} against the guardrail chain and, on
     * acceptance, applies it.
     *
     * @param id                 target access point
     * @param request            the proposed change
     * @param currentTimeMinutes authoritative current time, in minutes
     * @param peakHour           whether the caller considers this peak hour
     * @return the decision; never {@code null}
     */
    ChangeDecision submit(String id, ChangeRequest request, int currentTimeMinutes, boolean peakHour);
}
