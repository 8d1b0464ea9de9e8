package com.chainscope.domain;

/**
 * Token metadata attached to a token {@link Transfer}.
 */
public record TokenMeta(String contractAddress, String name, String symbol, int decimals, String tokenId) {
}
