package io.imagerollout.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.imagerollout.enums.AvailabilityState;
import io.imagerollout.enums.EntityKind;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An unoccupied managed desktop.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Machine implements DesktopEntity {

    @JsonProperty("id")
    private String id;

    @JsonProperty("machine_name")
    private String machineName;

    @JsonProperty("dns_name")
    private String dnsName;

    @JsonProperty("desktop_group")
    private String desktopGroup;

    @JsonProperty("availability_state")
    private AvailabilityState availabilityState;

    @JsonProperty("site_id")
    private String siteId;

    // Set by the inventory collector, never by the broker
    @JsonIgnore
    private String endpoint;

    @JsonIgnore
    private String diskImage;

    public Machine(String id, String machineName, String dnsName, String desktopGroup, AvailabilityState availabilityState) {
        this.id = id;
        this.machineName = machineName;
        this.dnsName = dnsName;
        this.desktopGroup = desktopGroup;
        this.availabilityState = availabilityState;
    }

    @JsonIgnore
    public boolean isAvailable() {
        return availabilityState == AvailabilityState.AVAILABLE;
    }

    @Override
    @JsonIgnore
    public EntityKind getKind() {
        return EntityKind.MACHINE;
    }
}
