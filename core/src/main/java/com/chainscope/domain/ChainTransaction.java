package com.chainscope.domain;

import java.math.BigInteger;

/**
 * Transaction as returned by eth_getTransactionByHash or inside a full block.
 *
 * @param blockNumber null while pending
 * @param blockHash   null while pending
 * @param to          null for contract creation
 */
public record ChainTransaction(
        String hash,
        Long blockNumber,
        String blockHash,
        Long transactionIndex,
        String from,
        String to,
        BigInteger value,
        BigInteger gas,
        BigInteger gasPrice,
        BigInteger maxFeePerGas,
        BigInteger maxPriorityFeePerGas,
        long nonce,
        String input
) {

    public boolean isPending() {
        return blockNumber == null;
    }

    /** True when the address is sender or recipient (case-insensitive). */
    public boolean involves(String address) {
        if (address == null) {
            return false;
        }
        return address.equalsIgnoreCase(from) || address.equalsIgnoreCase(to);
    }
}
