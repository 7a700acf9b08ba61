package io.imagerollout.health;

import io.imagerollout.broker.BrokerClient;
import io.imagerollout.broker.BrokerException;
import io.imagerollout.models.EndpointHealth;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks one healthy endpoint per site.
 *
 * Candidates are examined in the given order. An endpoint qualifies when both its broker and
 * hypervisor services report OK and it can name its site. The first qualifying endpoint of a site is
 * bound to it; later endpoints of the same site are dropped.
 */
@Slf4j
public class EndpointHealthSelector {

    private final BrokerClient brokerClient;

    public EndpointHealthSelector(BrokerClient brokerClient) {
        this.brokerClient = brokerClient;
    }

    /**
     * @param candidates endpoint addresses in priority order
     * @return site identity to endpoint, in discovery order
     * @throws NoHealthyEndpointException if no candidate qualifies
     */
    public Map<String, String> select(List<String> candidates) throws NoHealthyEndpointException {
        log.info("Checking health of {} candidate endpoint(s)", candidates.size());
        Map<String, String> selected = new LinkedHashMap<>();

        for (String endpoint : candidates) {
            EndpointHealth health = probe(endpoint);
            if (!health.isHealthy()) {
                log.warn("Endpoint {} is unhealthy (broker: {}, hypervisor: {}) - skipping",
                        endpoint, health.getBrokerStatus(), health.getHypervisorStatus());
                continue;
            }

            Optional<String> siteId = lookupSite(endpoint);
            if (siteId.isEmpty()) {
                continue;
            }

            String existing = selected.get(siteId.get());
            if (existing != null) {
                log.info("Endpoint {} belongs to site {} already served by {} - discarding duplicate",
                        endpoint, siteId.get(), existing);
                continue;
            }
            selected.put(siteId.get(), endpoint);
            log.info("Selected endpoint {} for site {}", endpoint, siteId.get());
        }

        if (selected.isEmpty()) {
            log.error("No healthy endpoint found among {}", candidates);
            throw new NoHealthyEndpointException(candidates);
        }
        log.info("Selected {} endpoint(s) for {} site(s): {}", selected.size(), selected.size(), selected);
        return selected;
    }

    private EndpointHealth probe(String endpoint) {
        try {
            EndpointHealth health = brokerClient.probe(endpoint);
            return health != null ? health : EndpointHealth.offline();
        } catch (RuntimeException e) {
            log.warn("Health probe for endpoint {} failed: {}", endpoint, e.getMessage());
            return EndpointHealth.offline();
        }
    }

    private Optional<String> lookupSite(String endpoint) {
        try {
            Optional<String> siteId = brokerClient.siteOf(endpoint);
            if (siteId.isEmpty()) {
                log.warn("Endpoint {} did not report a site identity - skipping", endpoint);
            }
            return siteId;
        } catch (BrokerException e) {
            log.warn("Failed to read site identity from endpoint {}: {} - skipping", endpoint, e.getMessage());
            return Optional.empty();
        }
    }
}
