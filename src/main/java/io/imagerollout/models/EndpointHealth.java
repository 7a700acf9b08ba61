package io.imagerollout.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.imagerollout.enums.ServiceStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health of the two services an endpoint must expose before it can be used.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EndpointHealth {

    @JsonProperty("broker_status")
    private ServiceStatus brokerStatus;

    @JsonProperty("hypervisor_status")
    private ServiceStatus hypervisorStatus;

    public static EndpointHealth offline() {
        return new EndpointHealth(ServiceStatus.OFFLINE, ServiceStatus.OFFLINE);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return brokerStatus == ServiceStatus.OK && hypervisorStatus == ServiceStatus.OK;
    }
}
