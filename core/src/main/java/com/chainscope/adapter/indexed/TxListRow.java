package com.chainscope.adapter.indexed;

import com.chainscope.domain.AddressTransaction;
import com.chainscope.domain.TransactionStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Locale;

/**
 * Row of {@code account/txlist}. All fields arrive as strings; any may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record TxListRow(
        String hash,
        String blockNumber,
        String timeStamp,
        String from,
        String to,
        String value,
        String gasPrice,
        String gasUsed,
        String isError,
        String functionName,
        String methodId,
        String method,
        String input
) {

    AddressTransaction toDomain() {
        Rows.require("txlist", "hash", hash);
        Rows.require("txlist", "blockNumber", blockNumber);
        Rows.require("txlist", "timeStamp", timeStamp);
        Rows.require("txlist", "from", from);
        Rows.require("txlist", "to", to);
        Rows.require("txlist", "value", value);
        Rows.require("txlist", "gasPrice", gasPrice);
        Rows.require("txlist", "gasUsed", gasUsed);
        Rows.require("txlist", "isError", isError);
        BigInteger fee = new BigInteger(gasUsed).multiply(new BigInteger(gasPrice));
        return new AddressTransaction(
                hash.toLowerCase(Locale.ROOT),
                resolveMethodName(),
                Long.parseLong(blockNumber),
                Instant.ofEpochSecond(Long.parseLong(timeStamp)),
                from.toLowerCase(Locale.ROOT),
                to.isEmpty() ? null : to.toLowerCase(Locale.ROOT),
                new BigInteger(value),
                fee,
                status(isError)
        );
    }

    /**
     * Function name, then method id, then the generic method field, then the selector taken from
     * the input data; empty when none is present.
     */
    String resolveMethodName() {
        if (Rows.hasText(functionName)) return functionName;
        if (Rows.hasText(methodId) && !"0x".equals(methodId)) return methodId;
        if (Rows.hasText(method)) return method;
        if (input != null && input.length() >= 10) return input.substring(0, 10);
        return "";
    }

    static TransactionStatus status(String isError) {
        if ("0".equals(isError)) return TransactionStatus.SUCCESS;
        if ("1".equals(isError)) return TransactionStatus.FAILED;
        return TransactionStatus.UNKNOWN;
    }
}
