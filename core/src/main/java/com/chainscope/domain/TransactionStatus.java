package com.chainscope.domain;

public enum TransactionStatus {
    PENDING,
    SUCCESS,
    FAILED,
    UNKNOWN
}
