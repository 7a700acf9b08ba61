package io.imagerollout.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Status reported by a broker or hypervisor service behind an endpoint.
 * Anything other than OK makes the endpoint unusable for the run.
 */
public enum ServiceStatus {
    OK,
    DEGRADED,
    OFFLINE,
    @JsonEnumDefaultValue
    UNKNOWN
}
