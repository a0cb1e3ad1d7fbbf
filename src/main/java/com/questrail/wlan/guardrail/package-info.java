/**
 * Guardrail chain
 * =============================================================================
 *
 * <p>Pure admission logic for access point change requests. Nothing in this
 * package touches the state store, a clock, or a logger.</p>
 *
 * <pre>
 *   AccessPoint snapshot + ChangeRequest + GuardrailContext
 *        → TimeWindowGuardrail     (peak hour, emergency bypass)
 *        → ChangeBudgetGuardrail   (minimum spacing between real changes)
 *        → HysteresisGuardrail     (minimum power delta, power requests only)
 *            → GuardrailEvaluator.Result (new state + decision)
 * </pre>
 *
 * <p>The first guardrail to reject ends the evaluation.</p>
 */
package com.questrail.wlan.guardrail;
