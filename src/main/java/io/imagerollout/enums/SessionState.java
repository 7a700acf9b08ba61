package io.imagerollout.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Activity state of a user session.
 * INACTIVE covers disconnected sessions and sessions with no connected client.
 * States the broker reports that are not listed here decode as UNKNOWN and are never restart-eligible.
 */
public enum SessionState {
    ACTIVE,
    INACTIVE,
    @JsonEnumDefaultValue
    UNKNOWN
}
