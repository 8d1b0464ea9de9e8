package com.chainscope.domain;

import java.math.BigInteger;

/**
 * One value movement inside a transaction.
 *
 * @param token null for NATIVE and INTERNAL transfers
 */
public record Transfer(TransferKind kind, String from, String to, BigInteger value, TokenMeta token) {

    public static Transfer nativeTransfer(String from, String to, BigInteger value) {
        return new Transfer(TransferKind.NATIVE, from, to, value, null);
    }
}
