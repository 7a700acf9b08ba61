package io.imagerollout.health;

import java.util.List;

/**
 * Thrown when none of the candidate endpoints is healthy. Aborts the run before any analysis.
 */
public class NoHealthyEndpointException extends Exception {

    public NoHealthyEndpointException(List<String> candidates) {
        super("No healthy broker endpoint found among " + candidates.size() + " candidate(s): " + candidates);
    }
}
