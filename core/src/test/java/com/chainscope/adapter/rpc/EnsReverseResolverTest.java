package com.chainscope.adapter.rpc;

import com.chainscope.common.error.BlockchainException;
import com.chainscope.common.error.ResponseParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnsReverseResolverTest {

    private static final String ADDRESS = "0xd8da6bf26964af9d7eed9e03e53415d37aa96045";
    private static final String RESOLVER = "0x4976fb03c32e5b8cfe2b6ccb31c09ba78ebaba41";
    private static final String ZERO_WORD = "0x" + "0".repeat(64);

    @Mock
    NodeRpcAdapter rpc;

    @Test
    @DisplayName("namehash matches the published vectors")
    void namehashVectors() {
        assertThat(EnsReverseResolver.namehash("")).isEqualTo(ZERO_WORD);
        assertThat(EnsReverseResolver.namehash("eth"))
                .isEqualTo("0x93cdeb708b7545dc668eb9280176169d1c33cfd8ed6f04690a0bcc88a93fc4ae");
        assertThat(EnsReverseResolver.namehash("foo.eth"))
                .isEqualTo("0xde9b09fd7c5f901e23a3f19fecc54828e9c848539801e86591bd9801b019f84f");
    }

    @Test
    @DisplayName("resolver name() result is decoded")
    void resolvesName() {
        when(rpc.call(eq(EnsReverseResolver.ENS_REGISTRY), startsWith("0x0178b8bf")))
                .thenReturn(Mono.just("0x" + "0".repeat(24) + RESOLVER.substring(2)));
        when(rpc.call(eq(RESOLVER), startsWith("0x691f3431")))
                .thenReturn(Mono.just(abiString("766974616c696b2e657468", 11)));

        Optional<String> name = new EnsReverseResolver(rpc).reverseLookup(ADDRESS).block();

        assertThat(name).contains("vitalik.eth");
    }

    @Test
    @DisplayName("no resolver set means no name, without calling a resolver")
    void noResolver() {
        when(rpc.call(eq(EnsReverseResolver.ENS_REGISTRY), anyString())).thenReturn(Mono.just(ZERO_WORD));

        Optional<String> name = new EnsReverseResolver(rpc).reverseLookup(ADDRESS).block();

        assertThat(name).isEmpty();
        verify(rpc, never()).call(eq(RESOLVER), anyString());
    }

    @Test
    @DisplayName("short registry data means no name")
    void shortRegistryData() {
        when(rpc.call(eq(EnsReverseResolver.ENS_REGISTRY), anyString())).thenReturn(Mono.just("0x"));

        Optional<String> name = new EnsReverseResolver(rpc).reverseLookup(ADDRESS).block();

        assertThat(name).isEmpty();
    }

    @Test
    @DisplayName("non-hex registry data is a parse error")
    void nonHexRegistryData() {
        when(rpc.call(eq(EnsReverseResolver.ENS_REGISTRY), anyString())).thenReturn(Mono.just("0x" + "zz".repeat(32)));

        assertThatThrownBy(() -> new EnsReverseResolver(rpc).reverseLookup(ADDRESS).block())
                .isInstanceOf(ResponseParseException.class);
    }

    @Test
    @DisplayName("registry failure propagates")
    void registryFailure() {
        when(rpc.call(eq(EnsReverseResolver.ENS_REGISTRY), anyString()))
                .thenReturn(Mono.error(new BlockchainException("execution reverted")));

        assertThatThrownBy(() -> new EnsReverseResolver(rpc).reverseLookup(ADDRESS).block())
                .isInstanceOf(BlockchainException.class);
    }

    static String abiString(String dataHex, int length) {
        String offset = "0".repeat(62) + "20";
        String len = String.format("%064x", length);
        String data = dataHex + "0".repeat(64 - dataHex.length());
        return "0x" + offset + len + data;
    }
}
