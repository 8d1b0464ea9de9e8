package com.chainscope.cache;

/**
 * Entity kinds held by {@link CacheStore}. Each kind has its own bounded collection and TTL.
 */
public enum CacheKind {
    /** {@code Block} keyed by block number. */
    BLOCKS,
    /** {@code ChainTransaction} keyed by hash. */
    TRANSACTIONS,
    /** {@code AddressInfo} keyed by address. */
    ADDRESSES,
    /** {@code ContractInfo} keyed by address. */
    CONTRACTS,
    /** {@code TokenInfo} keyed by contract address. */
    TOKENS,
    /** List of {@code AddressTransaction} keyed by address. */
    ADDRESS_TRANSACTIONS,
    /** List of {@code TokenTransfer} keyed by address. */
    TOKEN_TRANSFERS,
    /** List of {@code InternalTransaction} keyed by address or transaction hash. */
    INTERNAL_TRANSACTIONS,
    /** List of {@code TokenBalance} keyed by address. */
    TOKEN_BALANCES,
    /** {@code Optional<String>} reverse name keyed by address. */
    ENS_NAMES
}
