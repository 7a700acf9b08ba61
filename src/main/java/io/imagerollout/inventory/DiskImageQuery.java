package io.imagerollout.inventory;

import java.time.Duration;
import java.util.Optional;

/**
 * Remote query for the disk image a host is currently running.
 */
public interface DiskImageQuery {

    /**
     * Ask one host for its disk image identifier.
     *
     * @param host host name to query
     * @param timeout upper bound for this single request
     * @return the identifier, or empty if the host reports none
     * @throws Exception if the host cannot be queried
     */
    Optional<String> queryDiskImage(String host, Duration timeout) throws Exception;
}
