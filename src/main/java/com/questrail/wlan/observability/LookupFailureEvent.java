package com.questrail.wlan.observability;

/**
 * Record representing an operation that named an access point the store
 * does not know.
 */
public record LookupFailureEvent(
    String accessPointId,
    String operation
) {
}
