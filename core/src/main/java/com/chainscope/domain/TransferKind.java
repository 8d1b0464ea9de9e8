package com.chainscope.domain;

public enum TransferKind {
    NATIVE,
    TOKEN,
    INTERNAL
}
