package com.chainscope.adapter.indexed;

import com.chainscope.domain.TokenTransfer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Locale;

/**
 * Row of {@code account/tokentx}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record TokenTxRow(
        String hash,
        String blockNumber,
        String timeStamp,
        String from,
        String to,
        String contractAddress,
        String value,
        String tokenName,
        String tokenSymbol,
        String tokenDecimal,
        String tokenID,
        String logIndex
) {

    static final int DEFAULT_DECIMALS = 18;

    TokenTransfer toDomain() {
        Rows.require("tokentx", "hash", hash);
        Rows.require("tokentx", "from", from);
        Rows.require("tokentx", "to", to);
        Rows.require("tokentx", "value", value);
        Rows.require("tokentx", "timeStamp", timeStamp);
        return new TokenTransfer(
                hash.toLowerCase(Locale.ROOT),
                Rows.hasText(blockNumber) ? Long.parseLong(blockNumber) : 0L,
                Instant.ofEpochSecond(Long.parseLong(timeStamp)),
                from.toLowerCase(Locale.ROOT),
                to.toLowerCase(Locale.ROOT),
                contractAddress != null ? contractAddress.toLowerCase(Locale.ROOT) : "",
                tokenName != null ? tokenName : "Unknown",
                tokenSymbol != null ? tokenSymbol : "",
                Rows.intOrDefault(tokenDecimal, DEFAULT_DECIMALS),
                new BigInteger(value),
                Rows.hasText(tokenID) ? tokenID : null,
                Rows.hasText(logIndex) ? Rows.intOrDefault(logIndex, 0) : null
        );
    }
}
