package com.chainscope.common.error;

/**
 * Transport failure, HTTP error status or timeout while talking to a backend.
 */
public class NetworkException extends ExplorerException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
