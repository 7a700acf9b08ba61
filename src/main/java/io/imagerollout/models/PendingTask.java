package io.imagerollout.models;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * Power action submitted to a broker and not yet observed in a terminal state.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class PendingTask {

    private final String taskId;
    private final String endpoint;
    private final String siteId;
    private final String machineName;
    private final OffsetDateTime submittedAt;
}
