package com.chainscope.domain;

import java.math.BigInteger;
import java.util.List;

/**
 * Fully assembled view of one transaction.
 *
 * @param blockNumber     null while pending
 * @param method          first four bytes of input, empty for plain transfers
 * @param gasUsed         zero while pending
 * @param gasPrice        effective gas price paid
 * @param fee             gasUsed × gasPrice
 * @param confirmations   max(0, head - blockNumber)
 * @param contractAddress contract created by the transaction, if any
 * @param transfers       native transfer first, then token, then internal transfers
 */
public record TransactionDetails(
        String hash,
        Long blockNumber,
        String blockHash,
        Long transactionIndex,
        String from,
        String to,
        BigInteger value,
        BigInteger gasLimit,
        BigInteger gasUsed,
        BigInteger gasPrice,
        BigInteger fee,
        long nonce,
        String input,
        String method,
        TransactionStatus status,
        long confirmations,
        String contractAddress,
        List<Transfer> transfers
) {

    public TransactionDetails {
        transfers = transfers == null ? List.of() : List.copyOf(transfers);
    }
}
