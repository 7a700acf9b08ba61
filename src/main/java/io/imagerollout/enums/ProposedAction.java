package io.imagerollout.enums;

/**
 * Remedial action planned for a desktop.
 */
public enum ProposedAction {
    NONE("None"),
    NAG("Nag"),
    RESTART("Restart");

    private final String value;

    ProposedAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
