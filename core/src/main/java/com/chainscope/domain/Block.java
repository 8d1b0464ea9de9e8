package com.chainscope.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Block header plus its transactions. {@code transactions} is empty unless the block was fetched
 * with full transaction objects; {@code transactionHashes} is always populated.
 *
 * @param baseFeePerGas null before London
 */
public record Block(
        long number,
        String hash,
        String parentHash,
        Instant timestamp,
        String miner,
        BigInteger gasUsed,
        BigInteger gasLimit,
        BigInteger baseFeePerGas,
        List<String> transactionHashes,
        List<ChainTransaction> transactions
) {

    public Block {
        transactionHashes = transactionHashes == null ? List.of() : List.copyOf(transactionHashes);
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public int transactionCount() {
        return transactionHashes.size();
    }
}
