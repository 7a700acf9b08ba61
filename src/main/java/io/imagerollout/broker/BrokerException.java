package io.imagerollout.broker;

import lombok.Getter;

/**
 * Exception thrown when a call to a broker endpoint fails.
 * Carries the endpoint and, when the failure came from an HTTP response, its status code.
 */
@Getter
public class BrokerException extends Exception {

    private final String endpoint;
    private final int statusCode;

    public BrokerException(String endpoint, String message) {
        this(endpoint, -1, message, null);
    }

    public BrokerException(String endpoint, String message, Throwable cause) {
        this(endpoint, -1, message, cause);
    }

    public BrokerException(String endpoint, int statusCode, String message) {
        this(endpoint, statusCode, message, null);
    }

    public BrokerException(String endpoint, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }
}
