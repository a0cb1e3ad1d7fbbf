package com.questrail.wlan.observability;

import com.questrail.wlan.api.AccessPoint;

import java.util.Optional;

/**
 * Record representing an access point being added to the state store.
 *
 * @param accessPoint the record as stored
 * @param replaced    the record it overwrote, if the id was already registered
 */
public record AccessPointRegisteredEvent(
    AccessPoint accessPoint,
    Optional<AccessPoint> replaced
) {
    public boolean isReplacement() {
        return replaced.isPresent();
    }
}
