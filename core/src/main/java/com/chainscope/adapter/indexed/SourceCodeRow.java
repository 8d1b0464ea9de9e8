package com.chainscope.adapter.indexed;

import com.chainscope.domain.ContractInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Row of {@code contract/getsourcecode}. Unverified contracts come back with an empty source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SourceCodeRow(
        @JsonProperty("SourceCode") String sourceCode,
        @JsonProperty("ABI") String abi,
        @JsonProperty("ContractName") String contractName,
        @JsonProperty("CompilerVersion") String compilerVersion
) {

    ContractInfo toDomain(String address, Instant now) {
        if (!Rows.hasText(sourceCode)) {
            return new ContractInfo(address, null, null, null, null, false, now);
        }
        return new ContractInfo(address, contractName, sourceCode, abi, compilerVersion, true, now);
    }
}
