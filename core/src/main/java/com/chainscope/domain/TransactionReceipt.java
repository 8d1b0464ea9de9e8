package com.chainscope.domain;

import java.math.BigInteger;

/**
 * @param success           null on pre-Byzantium receipts without a status field
 * @param effectiveGasPrice null on nodes that predate EIP-1559 receipts
 * @param contractAddress   set only for contract creation
 */
public record TransactionReceipt(
        String transactionHash,
        Long blockNumber,
        BigInteger gasUsed,
        BigInteger effectiveGasPrice,
        Boolean success,
        String contractAddress
) {
}
