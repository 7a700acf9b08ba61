package io.imagerollout.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Terminal result of an asynchronous power action.
 * Anything other than SUCCEEDED, including an unrecognised outcome, counts as a failure.
 */
public enum PowerActionOutcome {
    SUCCEEDED,
    FAILED,
    CANCELED,
    LOST,
    @JsonEnumDefaultValue
    UNKNOWN;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
