package io.imagerollout.inventory;

import io.imagerollout.broker.BrokerClient;
import io.imagerollout.broker.BrokerException;
import io.imagerollout.enums.EntityKind;
import io.imagerollout.models.DesktopEntity;
import io.imagerollout.models.Machine;
import io.imagerollout.models.Session;
import io.imagerollout.util.GlobPattern;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects the desktops of one site and annotates each with the disk image it runs.
 *
 * Note: This is a shared component across all sites. Methods accept the site and endpoint as
 * parameters instead of storing them as fields.
 */
@Slf4j
public class InventoryCollector {

    private final BrokerClient brokerClient;
    private final DiskImageResolver diskImageResolver;
    private final GlobPattern groupFilter;
    private final int maxRecords;

    public InventoryCollector(BrokerClient brokerClient, DiskImageResolver diskImageResolver,
                              String groupFilter, int maxRecords) {
        this.brokerClient = brokerClient;
        this.diskImageResolver = diskImageResolver;
        this.groupFilter = GlobPattern.compile(groupFilter);
        this.maxRecords = maxRecords;
    }

    /**
     * Available machines of the site, each annotated with its disk image (null if unresolved).
     * A listing failure yields an empty list.
     */
    public List<Machine> collectAvailableMachines(String siteId, String endpoint) {
        log.info("[Site: {}] Collecting available machines from {} (group filter '{}')", siteId, endpoint, groupFilter);
        try {
            List<Machine> machines = brokerClient.listAvailableMachines(endpoint, groupFilter.toString(), maxRecords);
            return annotate(siteId, endpoint, machines, EntityKind.MACHINE);
        } catch (BrokerException e) {
            log.error("[Site: {}] Failed to list available machines from {}: {}", siteId, endpoint, e.getMessage());
            return List.of();
        }
    }

    /**
     * Sessions of the site, each annotated with the disk image of its host (null if unresolved).
     * A listing failure yields an empty list.
     */
    public List<Session> collectSessions(String siteId, String endpoint) {
        log.info("[Site: {}] Collecting sessions from {} (group filter '{}')", siteId, endpoint, groupFilter);
        try {
            List<Session> sessions = brokerClient.listSessions(endpoint, groupFilter.toString(), maxRecords);
            return annotate(siteId, endpoint, sessions, EntityKind.SESSION);
        } catch (BrokerException e) {
            log.error("[Site: {}] Failed to list sessions from {}: {}", siteId, endpoint, e.getMessage());
            return List.of();
        }
    }

    private <T extends DesktopEntity> List<T> annotate(String siteId, String endpoint, List<T> listed, EntityKind kind) {
        if (listed == null || listed.isEmpty()) {
            log.info("[Site: {}] No {} records found", siteId, kind.getValue());
            return List.of();
        }

        List<T> entities = new ArrayList<>();
        for (T entity : listed) {
            if (!groupFilter.matchesAll() && !groupFilter.matches(entity.getDesktopGroup())) {
                log.debug("[Site: {}] Dropping {} in desktop group '{}' outside filter '{}'",
                        siteId, entity.getMachineName(), entity.getDesktopGroup(), groupFilter);
                continue;
            }
            if (entities.size() >= maxRecords) {
                log.warn("[Site: {}] {} result truncated at {} records", siteId, kind.getValue(), maxRecords);
                break;
            }
            entity.setSiteId(siteId);
            entity.setEndpoint(endpoint);
            entities.add(entity);
        }
        log.info("[Site: {}] Found {} {} record(s)", siteId, entities.size(), kind.getValue());
        if (entities.isEmpty()) {
            return entities;
        }

        Map<String, String> diskImages = diskImageResolver.resolve(entities.stream().map(DesktopEntity::getDnsName).toList());
        int unresolved = 0;
        for (T entity : entities) {
            String diskImage = entity.getDnsName() != null ? diskImages.get(entity.getDnsName()) : null;
            entity.setDiskImage(diskImage);
            if (diskImage == null) {
                unresolved++;
            }
        }
        if (unresolved > 0) {
            log.warn("[Site: {}] Disk image unresolved for {} of {} {} record(s)", siteId, unresolved, entities.size(), kind.getValue());
        }
        return entities;
    }
}
