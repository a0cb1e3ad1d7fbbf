package com.questrail.wlan.observability;

import com.questrail.wlan.api.AccessPoint;

/**
 * Record representing an accepted change that actually altered an access
 * point. Not emitted for rejections or for accepted no-op requests.
 */
public record AccessPointStateChangeEvent(
    AccessPoint oldState,
    AccessPoint newState
) {
    public boolean isChannelChange() {
        return oldState.channel() != newState.channel();
    }

    public boolean isPowerChange() {
        return oldState.powerDb() != newState.powerDb();
    }
}
