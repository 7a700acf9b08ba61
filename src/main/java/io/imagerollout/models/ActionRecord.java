package io.imagerollout.models;

import io.imagerollout.enums.ProposedAction;
import io.imagerollout.enums.UpdateStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of analysing one desktop: its update status and the action planned for it.
 * Produced once per pass and never mutated; execution re-checks live state instead.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ActionRecord {

    private final DesktopEntity entity;
    private final UpdateStatus updateStatus;
    private final ProposedAction proposedAction;

    public String getSiteId() {
        return entity.getSiteId();
    }

    public String getEndpoint() {
        return entity.getEndpoint();
    }
}
