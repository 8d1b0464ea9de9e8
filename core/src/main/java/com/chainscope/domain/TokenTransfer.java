package com.chainscope.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * ERC-20/721 transfer event as listed by the indexed API.
 *
 * @param value   raw on-chain amount (not scaled by decimals)
 * @param tokenId  set for NFT transfers only
 * @param logIndex position of the Transfer log in its block; null when the source omits it
 */
public record TokenTransfer(
        String transactionHash,
        long blockNumber,
        Instant timestamp,
        String from,
        String to,
        String contractAddress,
        String tokenName,
        String tokenSymbol,
        int tokenDecimals,
        BigInteger value,
        String tokenId,
        Integer logIndex
) {

    public BigDecimal amount() {
        return new BigDecimal(value, tokenDecimals);
    }

    public TokenMeta tokenMeta() {
        return new TokenMeta(contractAddress, tokenName, tokenSymbol, tokenDecimals, tokenId);
    }
}
