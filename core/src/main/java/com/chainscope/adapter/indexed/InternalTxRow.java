package com.chainscope.adapter.indexed;

import com.chainscope.domain.InternalTransaction;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Locale;

/**
 * Row of {@code account/txlistinternal}. Queries by transaction hash omit {@code hash}, so the
 * caller may supply it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record InternalTxRow(
        String hash,
        String blockNumber,
        String timeStamp,
        String from,
        String to,
        String value,
        String gas,
        String gasUsed,
        String type
) {

    InternalTransaction toDomain(String parentHash) {
        String txHash = hash != null ? hash : parentHash;
        Rows.require("txlistinternal", "hash", txHash);
        Rows.require("txlistinternal", "blockNumber", blockNumber);
        Rows.require("txlistinternal", "from", from);
        Rows.require("txlistinternal", "to", to);
        Rows.require("txlistinternal", "value", value);
        Rows.require("txlistinternal", "timeStamp", timeStamp);
        return new InternalTransaction(
                txHash.toLowerCase(Locale.ROOT),
                Long.parseLong(blockNumber),
                Instant.ofEpochSecond(Long.parseLong(timeStamp)),
                from.toLowerCase(Locale.ROOT),
                to.isEmpty() ? null : to.toLowerCase(Locale.ROOT),
                new BigInteger(value),
                Rows.hasText(gas) ? new BigInteger(gas) : BigInteger.ZERO,
                Rows.hasText(gasUsed) ? new BigInteger(gasUsed) : BigInteger.ZERO,
                Rows.hasText(type) ? type : "call"
        );
    }
}
