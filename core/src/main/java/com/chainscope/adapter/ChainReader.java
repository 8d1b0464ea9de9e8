package com.chainscope.adapter;

import com.chainscope.domain.Block;
import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.TransactionReceipt;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Logical reads both backends can answer. Implementations never block; a {@code Mono} that
 * completes empty means "not found" (unknown block or transaction).
 * <p>
 * Failures are signalled as {@link com.chainscope.common.error.ExplorerException} subclasses.
 */
public interface ChainReader {

    /** Short name used in log lines, e.g. "rpc" or "etherscan". */
    String sourceName();

    Mono<BigInteger> getBalance(String address);

    Mono<Long> getTransactionCount(String address);

    /** Deployed bytecode, "0x" for externally owned accounts. */
    Mono<String> getCode(String address);

    Mono<Long> getBlockNumber();

    Mono<Block> getBlockByNumber(long number, boolean fullTransactions);

    Mono<Block> getLatestBlock(boolean fullTransactions);

    Mono<ChainTransaction> getTransaction(String hash);

    Mono<TransactionReceipt> getTransactionReceipt(String hash);

    Mono<BigInteger> getGasPrice();

    Mono<Long> getChainId();
}
