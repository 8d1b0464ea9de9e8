package com.chainscope.service;

import com.chainscope.adapter.ChainReader;
import com.chainscope.adapter.indexed.EtherscanAdapter;
import com.chainscope.adapter.rpc.EnsReverseResolver;
import com.chainscope.adapter.rpc.Erc20MetadataReader;
import com.chainscope.adapter.rpc.NodeRpcAdapter;
import com.chainscope.cache.CacheKind;
import com.chainscope.cache.CacheStats;
import com.chainscope.cache.CacheStore;
import com.chainscope.common.error.ValidationException;
import com.chainscope.common.validation.InputValidator;
import com.chainscope.config.NetworkProperties;
import com.chainscope.domain.AddressInfo;
import com.chainscope.domain.AddressTransaction;
import com.chainscope.domain.Block;
import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.ContractInfo;
import com.chainscope.domain.GasPrices;
import com.chainscope.domain.InternalTransaction;
import com.chainscope.domain.KnownChain;
import com.chainscope.domain.TokenBalance;
import com.chainscope.domain.TokenInfo;
import com.chainscope.domain.TokenTransfer;
import com.chainscope.domain.TransactionDetails;
import com.chainscope.domain.TransactionReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Source-agnostic read API for the front end.
 * <p>
 * Reads are cache-aside with write-through. Operations both backends can answer go to the
 * indexed API when a key is configured and the node is not local, otherwise to the node. Balance
 * and transaction details retry once on the node when the indexed API fails. History lists exist
 * only on the indexed API and degrade to an empty list. Validation errors surface before any
 * network call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExplorerDataService {

    private final CacheStore cache;
    private final NodeRpcAdapter rpc;
    private final EtherscanAdapter indexed;
    private final Erc20MetadataReader erc20MetadataReader;
    private final EnsReverseResolver ensReverseResolver;
    private final NetworkProperties networkProperties;
    private final Clock clock;

    /** Balance, nonce and code probe fetched concurrently. */
    public Mono<AddressInfo> getAddressInfo(String address) {
        return Mono.defer(() -> {
            String key = InputValidator.requireAddress(address);
            Optional<AddressInfo> cached = cache.get(CacheKind.ADDRESSES, key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return Mono.zip(balanceOf(key), rpc.getTransactionCount(key), rpc.getCode(key))
                    .map(t -> new AddressInfo(key, t.getT1().toString(), t.getT2(), hasCode(t.getT3()), clock.instant()))
                    .doOnNext(info -> cache.put(CacheKind.ADDRESSES, key, info));
        });
    }

    /** Wei balance; not cached on its own. */
    public Mono<BigInteger> getAddressBalance(String address) {
        return Mono.defer(() -> balanceOf(InputValidator.requireAddress(address)));
    }

    public Mono<List<AddressTransaction>> getAddressTransactions(String address) {
        return Mono.defer(() -> indexedList("address transactions", CacheKind.ADDRESS_TRANSACTIONS,
                InputValidator.requireAddress(address), indexed::getAddressTransactions));
    }

    public Mono<List<TokenTransfer>> getTokenTransfers(String address) {
        return Mono.defer(() -> indexedList("token transfers", CacheKind.TOKEN_TRANSFERS,
                InputValidator.requireAddress(address), indexed::getTokenTransfers));
    }

    public Mono<List<InternalTransaction>> getInternalTransactions(String address) {
        return Mono.defer(() -> indexedList("internal transactions", CacheKind.INTERNAL_TRANSACTIONS,
                InputValidator.requireAddress(address), indexed::getInternalTransactions));
    }

    public Mono<List<TokenBalance>> getTokenBalances(String address) {
        return Mono.defer(() -> indexedList("token balances", CacheKind.TOKEN_BALANCES,
                InputValidator.requireAddress(address), indexed::getTokenBalances));
    }

    /**
     * Transaction, receipt and head are fetched concurrently from one source (retried once on the
     * node), then token and internal transfers concurrently. Completes empty for unknown hashes.
     */
    public Mono<TransactionDetails> getTransactionDetails(String txHash) {
        return Mono.defer(() -> {
            String hash = InputValidator.requireTxHash(txHash);
            return withFallback("transaction details", source -> fetchTransactionCore(source, hash))
                    .flatMap(core -> {
                        ChainTransaction tx = core.transaction();
                        Mono<List<TokenTransfer>> sent = getTokenTransfers(tx.from());
                        Mono<List<TokenTransfer>> received = tx.to() != null
                                ? getTokenTransfers(tx.to())
                                : Mono.just(List.of());
                        Mono<List<InternalTransaction>> internal = indexedList("internal transactions",
                                CacheKind.INTERNAL_TRANSACTIONS, hash, indexed::getInternalTransactionsByHash);
                        return Mono.zip(sent, received, internal).map(t -> {
                            List<TokenTransfer> tokenTransfers = new ArrayList<>(t.getT1());
                            tokenTransfers.addAll(t.getT2());
                            return TransactionDetailsAssembler.assemble(tx, core.receipt(), core.currentBlock(),
                                    tokenTransfers, t.getT3());
                        });
                    });
        });
    }

    /** Block with transaction hashes only. Completes empty for blocks beyond the head. */
    public Mono<Block> getBlockByNumber(long number) {
        return Mono.defer(() -> {
            InputValidator.requireBlockNumber(number);
            Optional<Block> cached = cache.get(CacheKind.BLOCKS, number);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return preferredSource().getBlockByNumber(number, false)
                    .doOnNext(block -> cache.put(CacheKind.BLOCKS, block.number(), block));
        });
    }

    /** Always fetched; the result is cached under its number. */
    public Mono<Block> getLatestBlock() {
        return Mono.defer(() -> preferredSource().getLatestBlock(false)
                .doOnNext(block -> cache.put(CacheKind.BLOCKS, block.number(), block)));
    }

    /**
     * @param to    null for contract deployment
     * @param data  null for plain transfers
     * @param value null for zero value
     */
    public Mono<BigInteger> estimateGas(String from, String to, String data, BigInteger value) {
        return Mono.defer(() -> {
            String sender = InputValidator.requireAddress(from);
            String recipient = to != null ? InputValidator.requireAddress(to) : null;
            String payload = InputValidator.requireHexDataOrNull(data);
            if (value != null && value.signum() < 0) {
                throw new ValidationException("Negative value: " + value);
            }
            return rpc.estimateGas(sender, recipient, payload, value);
        });
    }

    public Mono<GasPrices> getGasPrices() {
        return Mono.defer(() -> preferredSource().getGasPrice()
                .map(price -> GasPrices.fromStandard(price, clock.instant())));
    }

    /**
     * Reverse name of the address. Short-circuits to empty off mainnet or on a local node; "no
     * name" is a successful empty result.
     */
    public Mono<Optional<String>> resolveName(String address) {
        return Mono.defer(() -> {
            String key = InputValidator.requireAddress(address);
            if (networkProperties.getChainId() != KnownChain.ETHEREUM.getChainId() || networkProperties.isLocalNode()) {
                return Mono.just(Optional.<String>empty());
            }
            Optional<Optional<String>> cached = cache.get(CacheKind.ENS_NAMES, key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return ensReverseResolver.reverseLookup(key)
                    .doOnNext(name -> cache.put(CacheKind.ENS_NAMES, key, name));
        });
    }

    /** Verified source metadata from the indexed API; empty when unavailable. */
    public Mono<ContractInfo> getContractInfo(String address) {
        return Mono.defer(() -> {
            String key = InputValidator.requireAddress(address);
            Optional<ContractInfo> cached = cache.get(CacheKind.CONTRACTS, key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            if (!indexedPreferred()) {
                return Mono.<ContractInfo>empty();
            }
            return indexed.getContractInfo(key)
                    .doOnNext(info -> cache.put(CacheKind.CONTRACTS, key, info))
                    .onErrorResume(e -> {
                        log.warn("Contract info for {} unavailable from {}: {}", key, indexed.sourceName(), e.getMessage());
                        return Mono.empty();
                    });
        });
    }

    public Mono<TokenInfo> getTokenInfo(String contractAddress) {
        return Mono.defer(() -> {
            String key = InputValidator.requireAddress(contractAddress);
            Optional<TokenInfo> cached = cache.get(CacheKind.TOKENS, key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return erc20MetadataReader.read(key)
                    .doOnNext(info -> cache.put(CacheKind.TOKENS, key, info));
        });
    }

    /** Chain id reported by the node. */
    public Mono<Long> testConnection() {
        return rpc.getChainId()
                .doOnNext(id -> log.info("Connected to {} (chain {})", rpc.getEndpointUrl(), KnownChain.displayNameOf(id)));
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clearAll();
    }

    boolean indexedPreferred() {
        return indexed.isConfigured() && !networkProperties.isLocalNode();
    }

    private ChainReader preferredSource() {
        return indexedPreferred() ? indexed : rpc;
    }

    private Mono<BigInteger> balanceOf(String address) {
        return withFallback("balance", source -> source.getBalance(address));
    }

    /** Runs on the preferred source; an indexed API failure is logged and retried once on the node. */
    private <T> Mono<T> withFallback(String operation, Function<ChainReader, Mono<T>> call) {
        if (!indexedPreferred()) {
            return call.apply(rpc);
        }
        return call.apply(indexed).onErrorResume(e -> {
            log.warn("{} via {} failed, retrying via {}: {}", operation, indexed.sourceName(), rpc.sourceName(), e.getMessage());
            return call.apply(rpc);
        });
    }

    private <T> Mono<List<T>> indexedList(String operation,
                                          CacheKind kind,
                                          String key,
                                          Function<String, Mono<List<T>>> fetch) {
        Optional<List<T>> cached = cache.get(kind, key);
        if (cached.isPresent()) {
            return Mono.just(cached.get());
        }
        if (!indexedPreferred()) {
            return Mono.just(List.of());
        }
        return fetch.apply(key)
                .map(List::copyOf)
                .doOnNext(list -> cache.put(kind, key, list))
                .onErrorResume(e -> {
                    log.warn("{} for {} unavailable from {}: {}", operation, key, indexed.sourceName(), e.getMessage());
                    return Mono.just(List.of());
                });
    }

    private Mono<TransactionCore> fetchTransactionCore(ChainReader source, String hash) {
        Optional<ChainTransaction> cachedTx = cache.get(CacheKind.TRANSACTIONS, hash);
        Mono<ChainTransaction> tx = cachedTx.map(Mono::just).orElseGet(() -> source.getTransaction(hash)
                .doOnNext(t -> {
                    if (!t.isPending()) {
                        cache.put(CacheKind.TRANSACTIONS, hash, t);
                    }
                }));
        Mono<Optional<TransactionReceipt>> receipt = source.getTransactionReceipt(hash)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        return Mono.zip(tx, receipt, source.getBlockNumber())
                .map(t -> new TransactionCore(t.getT1(), t.getT2().orElse(null), t.getT3()));
    }

    private static boolean hasCode(String code) {
        return code != null && !code.isEmpty() && !"0x".equals(code) && !"0x0".equals(code);
    }

    private record TransactionCore(ChainTransaction transaction, TransactionReceipt receipt, long currentBlock) {
    }
}
