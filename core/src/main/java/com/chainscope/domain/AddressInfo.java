package com.chainscope.domain;

import java.time.Instant;

/**
 * Overview of one account, composed from balance, nonce and code probe.
 *
 * @param balance          wei as a decimal string
 * @param transactionCount nonce of the account
 * @param contract         true when the address holds code
 */
public record AddressInfo(
        String address,
        String balance,
        long transactionCount,
        boolean contract,
        Instant lastUpdated
) {
}
