package com.questrail.wlan.api;

/**
 * Indicates that an access point id has no record in the state store.
 */
public final class UnknownAccessPointException extends RuntimeException
{
    private final String accessPointId;

    public UnknownAccessPointException(String accessPointId) {
        super("Unknown access point: " + accessPointId);
        this.accessPointId = accessPointId;
    }

    public String accessPointId() {
        return accessPointId;
    }
}
