package com.questrail.wlan.guardrail;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.ChangeDecision;
import com.questrail.wlan.api.ChangeRequest;

import java.util.Optional;

/**
 * Guardrail
 * -----------------------------------------------------------------------------
 * A single policy check that can veto a proposed change.
 *
 * Guardrails are stateless predicates over a snapshot of one access point.
 * They never mutate anything and never read a clock; time arrives through
 * {@link GuardrailContext}.
 */
public interface Guardrail
{
    /**
     * Checks {@code request} against {@code current}.
     *
     * @return a rejection if this guardrail vetoes the request, otherwise empty
     */
    Optional<ChangeDecision.Rejected> check(AccessPoint current,
                                            ChangeRequest request,
                                            GuardrailContext context);
}
