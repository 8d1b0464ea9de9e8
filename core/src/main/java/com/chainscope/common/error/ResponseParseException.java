package com.chainscope.common.error;

/**
 * Backend answered but the payload is not what the protocol promises (missing result field,
 * non-hex quantity, unexpected JSON type).
 */
public class ResponseParseException extends ExplorerException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
