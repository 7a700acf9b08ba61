package io.imagerollout.broker;

import io.imagerollout.models.EndpointHealth;
import io.imagerollout.models.Machine;
import io.imagerollout.models.PowerActionStatus;
import io.imagerollout.models.Session;

import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the virtual desktop broker and hypervisor management API.
 * Every call addresses one endpoint explicitly; the client itself holds no per-site state.
 */
public interface BrokerClient {

    // =================================================================
    // ENDPOINT OPERATIONS
    // =================================================================

    /**
     * Probe broker and hypervisor service health. Never throws: failures are reported as OFFLINE.
     */
    EndpointHealth probe(String endpoint);

    /**
     * Site identity the endpoint belongs to, empty if the endpoint does not report one.
     */
    Optional<String> siteOf(String endpoint) throws BrokerException;

    // =================================================================
    // INVENTORY OPERATIONS
    // =================================================================

    /**
     * List available (unoccupied) machines in desktop groups matching the glob filter.
     */
    List<Machine> listAvailableMachines(String endpoint, String groupFilter, int maxRecords) throws BrokerException;

    /**
     * List sessions in desktop groups matching the glob filter.
     */
    List<Session> listSessions(String endpoint, String groupFilter, int maxRecords) throws BrokerException;

    /**
     * Fetch the live state of one machine, empty if the broker no longer knows it.
     */
    Optional<Machine> refreshMachine(String endpoint, String machineId) throws BrokerException;

    /**
     * Fetch the live state of one session, empty if the session has ended.
     */
    Optional<Session> refreshSession(String endpoint, String sessionId) throws BrokerException;

    // =================================================================
    // ACTION OPERATIONS
    // =================================================================

    /**
     * Submit an asynchronous restart power action.
     *
     * @return identifier of the power action task
     */
    String submitRestart(String endpoint, String machineId) throws BrokerException;

    /**
     * Send a message to the user of a session.
     *
     * @return true if the broker accepted the message
     */
    boolean submitNotification(String endpoint, String sessionId, String title, String text) throws BrokerException;

    /**
     * Current status of a power action task.
     */
    PowerActionStatus pollTask(String endpoint, String taskId) throws BrokerException;
}
