package io.imagerollout.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.imagerollout.enums.EntityKind;
import io.imagerollout.enums.SessionState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * A user session on a managed desktop.
 * The id is the session identifier; restarts are issued against {@link #getMachineId()}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session implements DesktopEntity {

    @JsonProperty("id")
    private String id;

    @JsonProperty("machine_id")
    private String machineId;

    @JsonProperty("machine_name")
    private String machineName;

    @JsonProperty("dns_name")
    private String dnsName;

    @JsonProperty("user_name")
    private String userName;

    @JsonProperty("desktop_group")
    private String desktopGroup;

    @JsonProperty("session_state")
    private SessionState sessionState;

    @JsonProperty("session_state_change_time")
    private OffsetDateTime sessionStateChangeTime;

    @JsonProperty("site_id")
    private String siteId;

    @JsonIgnore
    private String endpoint;

    @JsonIgnore
    private String diskImage;

    public Session(String id, String machineId, String machineName, String dnsName, String desktopGroup,
                   SessionState sessionState, OffsetDateTime sessionStateChangeTime) {
        this.id = id;
        this.machineId = machineId;
        this.machineName = machineName;
        this.dnsName = dnsName;
        this.desktopGroup = desktopGroup;
        this.sessionState = sessionState;
        this.sessionStateChangeTime = sessionStateChangeTime;
    }

    @JsonIgnore
    public boolean isActive() {
        return sessionState == SessionState.ACTIVE;
    }

    /**
     * True only when the broker positively reported the session as inactive.
     */
    @JsonIgnore
    public boolean isInactive() {
        return sessionState == SessionState.INACTIVE;
    }

    /**
     * Time elapsed since the session last changed state, or {@link Duration#ZERO} when the broker
     * did not report a change time.
     */
    public Duration idleDuration(OffsetDateTime now) {
        if (sessionStateChangeTime == null || sessionStateChangeTime.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(sessionStateChangeTime, now);
    }

    @Override
    @JsonIgnore
    public EntityKind getKind() {
        return EntityKind.SESSION;
    }
}
