package com.chainscope.common.error;

/**
 * A well-formed request rejected by the backend: JSON-RPC error object, or an indexed API
 * response with status "0" that is not an empty result.
 */
public class BlockchainException extends ExplorerException {

    private final Integer code;

    public BlockchainException(String message) {
        this(message, null);
    }

    public BlockchainException(String message, Integer code) {
        super(message);
        this.code = code;
    }

    /** JSON-RPC error code, or null when the backend did not supply one. */
    public Integer getCode() {
        return code;
    }
}
