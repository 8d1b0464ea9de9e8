package com.chainscope.adapter.rpc;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * ENS reverse lookup over eth_call: registry {@code resolver(namehash)} and then the resolver's
 * {@code name(namehash)} for {@code <address>.addr.reverse}. Only meaningful on Ethereum mainnet.
 */
@Slf4j
@RequiredArgsConstructor
public class EnsReverseResolver {

    /** ENS registry with fallback, same address on mainnet since 2020. */
    static final String ENS_REGISTRY = "0x00000000000c2e074ec69a0dfb2997ba6c7d2e1e";
    /** resolver(bytes32) selector. */
    private static final String RESOLVER_SELECTOR = "0x0178b8bf";
    /** name(bytes32) selector. */
    private static final String NAME_SELECTOR = "0x691f3431";

    private final NodeRpcAdapter rpc;

    /**
     * @return the primary name, or empty when no reverse record or resolver is set
     */
    public Mono<Optional<String>> reverseLookup(String address) {
        String node = namehash(address.toLowerCase(Locale.ROOT).substring(2) + ".addr.reverse");
        String nodeArg = Numeric.cleanHexPrefix(node);
        return rpc.call(ENS_REGISTRY, RESOLVER_SELECTOR + nodeArg)
                .mapNotNull(AbiDecoding::decodeAddress)
                .flatMap(resolver -> {
                    if (AbiDecoding.isZeroAddress(resolver)) {
                        log.debug("No reverse resolver for {}", address);
                        return Mono.just(Optional.<String>empty());
                    }
                    return rpc.call(resolver, NAME_SELECTOR + nodeArg)
                            .map(AbiDecoding::decodeString)
                            .map(name -> name.isBlank() ? Optional.<String>empty() : Optional.of(name));
                })
                .defaultIfEmpty(Optional.empty());
    }

    /** EIP-137 namehash, 0x-prefixed. */
    static String namehash(String name) {
        byte[] node = new byte[32];
        if (!name.isEmpty()) {
            String[] labels = name.split("\\.");
            for (int i = labels.length - 1; i >= 0; i--) {
                byte[] labelHash = Hash.sha3(labels[i].getBytes(StandardCharsets.UTF_8));
                byte[] concat = new byte[64];
                System.arraycopy(node, 0, concat, 0, 32);
                System.arraycopy(labelHash, 0, concat, 32, 32);
                node = Hash.sha3(concat);
            }
        }
        return Numeric.toHexString(node);
    }
}
