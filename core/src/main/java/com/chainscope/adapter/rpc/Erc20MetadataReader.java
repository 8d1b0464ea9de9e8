package com.chainscope.adapter.rpc;

import com.chainscope.common.error.ExplorerException;
import com.chainscope.domain.TokenInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads ERC-20 name, symbol, decimals and total supply via eth_call. The four calls run
 * concurrently. A call that reverts or returns garbage yields the default for that field.
 */
@Slf4j
@RequiredArgsConstructor
public class Erc20MetadataReader {

    /** name() selector. */
    private static final String NAME_SELECTOR = "0x06fdde03";
    /** symbol() selector. */
    private static final String SYMBOL_SELECTOR = "0x95d89b41";
    /** decimals() selector. */
    private static final String DECIMALS_SELECTOR = "0x313ce567";
    /** totalSupply() selector. */
    private static final String TOTAL_SUPPLY_SELECTOR = "0x18160ddd";

    /** Used when decimals() is missing or out of range. */
    public static final int DEFAULT_DECIMALS = 18;

    private final NodeRpcAdapter rpc;
    private final Clock clock;

    public Mono<TokenInfo> read(String contractAddress) {
        Mono<String> name = field(contractAddress, NAME_SELECTOR, "name()", AbiDecoding::decodeString)
                .defaultIfEmpty("");
        Mono<String> symbol = field(contractAddress, SYMBOL_SELECTOR, "symbol()", AbiDecoding::decodeString)
                .defaultIfEmpty("");
        Mono<Integer> decimals = field(contractAddress, DECIMALS_SELECTOR, "decimals()", Erc20MetadataReader::decodeDecimals)
                .defaultIfEmpty(DEFAULT_DECIMALS);
        Mono<Optional<BigInteger>> supply = field(contractAddress, TOTAL_SUPPLY_SELECTOR, "totalSupply()", AbiDecoding::decodeUint)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        return Mono.zip(name, symbol, decimals, supply)
                .map(t -> new TokenInfo(contractAddress, t.getT1(), t.getT2(), t.getT3(),
                        t.getT4().orElse(null), clock.instant()));
    }

    static int decodeDecimals(String hex) {
        BigInteger value = AbiDecoding.decodeUint(hex);
        if (value == null || value.compareTo(BigInteger.valueOf(255)) > 0) return DEFAULT_DECIMALS;
        return value.intValue();
    }

    /** Empty when the call fails or its return data does not decode. */
    private <T> Mono<T> field(String contractAddress, String selector, String label, Function<String, T> decoder) {
        return rpc.call(contractAddress, selector)
                .mapNotNull(decoder)
                .onErrorResume(ExplorerException.class, e -> {
                    log.debug("eth_call {} unusable for {}: {}", label, contractAddress, e.getMessage());
                    return Mono.empty();
                });
    }
}
