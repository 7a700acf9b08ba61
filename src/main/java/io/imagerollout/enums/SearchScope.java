package io.imagerollout.enums;

/**
 * Which inventory passes a run performs.
 */
public enum SearchScope {
    AVAILABLE_MACHINES("AvailableMachines"),
    MACHINES_WITH_SESSIONS("MachinesWithSessions"),
    BOTH("Both");

    private final String value;

    SearchScope(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean includesAvailableMachines() {
        return this != MACHINES_WITH_SESSIONS;
    }

    public boolean includesSessions() {
        return this != AVAILABLE_MACHINES;
    }

    /**
     * Parse a scope from either its display value ("AvailableMachines") or its constant name.
     */
    public static SearchScope fromString(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Search scope cannot be null or empty");
        }
        String trimmed = text.trim();
        for (SearchScope scope : values()) {
            if (scope.value.equalsIgnoreCase(trimmed) || scope.name().equalsIgnoreCase(trimmed)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown search scope: " + text);
    }
}
