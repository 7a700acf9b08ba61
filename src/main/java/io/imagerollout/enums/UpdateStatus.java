package io.imagerollout.enums;

/**
 * Update status of a desktop relative to the target disk image.
 *
 * <ul>
 *   <li><strong>INELIGIBLE</strong> - Disk image is not part of the managed image family</li>
 *   <li><strong>UNKNOWN</strong> - Disk image could not be resolved</li>
 *   <li><strong>RESTART_REQUIRED</strong> - Desktop runs an older version of the managed image</li>
 *   <li><strong>UPDATE_COMPLETED</strong> - Desktop already runs the target version</li>
 * </ul>
 */
public enum UpdateStatus {
    INELIGIBLE("Ineligible"),
    UNKNOWN("Unknown"),
    RESTART_REQUIRED("RestartRequired"),
    UPDATE_COMPLETED("UpdateCompleted");

    private final String value;

    UpdateStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
