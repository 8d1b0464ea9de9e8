package com.chainscope.adapter.rpc;

/**
 * Header notification from a {@code newHeads} push subscription.
 */
public record BlockHead(long number, String hash) {
}
