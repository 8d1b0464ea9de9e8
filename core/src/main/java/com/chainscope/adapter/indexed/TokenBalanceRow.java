package com.chainscope.adapter.indexed;

import com.chainscope.domain.TokenBalance;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Row of {@code account/tokenlist}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record TokenBalanceRow(String contractAddress, String balance, String name, String symbol, String decimals) {

    TokenBalance toDomain() {
        Rows.require("tokenlist", "contractAddress", contractAddress);
        Rows.require("tokenlist", "balance", balance);
        return new TokenBalance(
                contractAddress.toLowerCase(Locale.ROOT),
                name != null ? name : "Unknown",
                symbol != null ? symbol : "",
                Rows.intOrDefault(decimals, TokenTxRow.DEFAULT_DECIMALS),
                new BigInteger(balance)
        );
    }
}
