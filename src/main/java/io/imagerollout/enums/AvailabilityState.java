package io.imagerollout.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Summary state of a managed machine as reported by the broker.
 */
public enum AvailabilityState {
    AVAILABLE,
    IN_USE,
    OFF,
    UNREGISTERED,
    @JsonEnumDefaultValue
    UNKNOWN
}
