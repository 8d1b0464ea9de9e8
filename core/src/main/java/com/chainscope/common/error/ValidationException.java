package com.chainscope.common.error;

/**
 * Malformed caller input (address, hash, hex data). Raised before any network call.
 */
public class ValidationException extends ExplorerException {

    public ValidationException(String message) {
        super(message);
    }
}
