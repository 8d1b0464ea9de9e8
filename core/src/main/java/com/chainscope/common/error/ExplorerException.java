package com.chainscope.common.error;

/**
 * Base of every error surfaced by the data core. All subclasses are non-fatal: the caller may
 * retry, show the message, or fall back to another source.
 */
public abstract class ExplorerException extends RuntimeException {

    protected ExplorerException(String message) {
        super(message);
    }

    protected ExplorerException(String message, Throwable cause) {
        super(message, cause);
    }
}
