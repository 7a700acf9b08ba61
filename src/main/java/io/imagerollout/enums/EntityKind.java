package io.imagerollout.enums;

/**
 * Kind of desktop entity an inventory pass works on.
 */
public enum EntityKind {
    MACHINE("AvailableMachine"),
    SESSION("Session");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
