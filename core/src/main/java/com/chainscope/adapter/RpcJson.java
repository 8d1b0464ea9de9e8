package com.chainscope.adapter;

import com.chainscope.common.error.ResponseParseException;
import com.chainscope.domain.Block;
import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.TransactionReceipt;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps JSON-RPC result objects (node responses and the indexed API proxy module, which shares
 * their shape) to domain records. Quantities are 0x-prefixed hex.
 */
public final class RpcJson {

    private RpcJson() {
    }

    public static BigInteger parseHexQuantity(String hex) {
        if (hex == null || !hex.startsWith("0x")) {
            throw new ResponseParseException("Expected 0x-prefixed quantity, got: " + hex);
        }
        String digits = hex.substring(2);
        if (digits.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw new ResponseParseException("Invalid hex quantity: " + hex, e);
        }
    }

    /** The node itself is a quantity string (e.g. an eth_getBalance result). */
    public static BigInteger quantityOf(JsonNode node) {
        if (!node.isTextual()) {
            throw new ResponseParseException("Expected quantity string, got " + node.getNodeType());
        }
        return parseHexQuantity(node.asText());
    }

    /** The node itself is a plain string result (code, call data, filter id). */
    public static String textOf(JsonNode node) {
        if (!node.isTextual()) {
            throw new ResponseParseException("Expected string result, got " + node.getNodeType());
        }
        return node.asText();
    }

    public static BigInteger quantity(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual()) {
            throw new ResponseParseException("Missing field " + field);
        }
        return parseHexQuantity(value.asText());
    }

    /** Null when the field is absent or JSON null. */
    public static BigInteger optionalQuantity(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return parseHexQuantity(value.asText());
    }

    public static Long optionalLong(JsonNode node, String field) {
        BigInteger value = optionalQuantity(node, field);
        return value != null ? value.longValueExact() : null;
    }

    public static String optionalText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    public static String lowerOrNull(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }

    public static ChainTransaction toTransaction(JsonNode tx) {
        if (!tx.isObject()) {
            throw new ResponseParseException("Transaction is not an object: " + tx.getNodeType());
        }
        String hash = optionalText(tx, "hash");
        String from = optionalText(tx, "from");
        if (hash == null || from == null) {
            throw new ResponseParseException("Transaction without hash or sender");
        }
        return new ChainTransaction(
                hash.toLowerCase(Locale.ROOT),
                optionalLong(tx, "blockNumber"),
                lowerOrNull(optionalText(tx, "blockHash")),
                optionalLong(tx, "transactionIndex"),
                from.toLowerCase(Locale.ROOT),
                lowerOrNull(optionalText(tx, "to")),
                quantity(tx, "value"),
                quantity(tx, "gas"),
                optionalQuantity(tx, "gasPrice"),
                optionalQuantity(tx, "maxFeePerGas"),
                optionalQuantity(tx, "maxPriorityFeePerGas"),
                quantity(tx, "nonce").longValueExact(),
                tx.path("input").asText("0x")
        );
    }

    public static TransactionReceipt toReceipt(JsonNode receipt) {
        if (!receipt.isObject()) {
            throw new ResponseParseException("Receipt is not an object: " + receipt.getNodeType());
        }
        BigInteger status = optionalQuantity(receipt, "status");
        return new TransactionReceipt(
                lowerOrNull(optionalText(receipt, "transactionHash")),
                optionalLong(receipt, "blockNumber"),
                quantity(receipt, "gasUsed"),
                optionalQuantity(receipt, "effectiveGasPrice"),
                status != null ? status.signum() == 1 : null,
                lowerOrNull(optionalText(receipt, "contractAddress"))
        );
    }

    /** Accepts blocks with either hash-only or full transaction arrays. */
    public static Block toBlock(JsonNode block) {
        if (!block.isObject()) {
            throw new ResponseParseException("Block is not an object: " + block.getNodeType());
        }
        List<String> hashes = new ArrayList<>();
        List<ChainTransaction> transactions = new ArrayList<>();
        for (JsonNode tx : block.path("transactions")) {
            if (tx.isTextual()) {
                hashes.add(tx.asText().toLowerCase(Locale.ROOT));
            } else {
                ChainTransaction parsed = toTransaction(tx);
                hashes.add(parsed.hash());
                transactions.add(parsed);
            }
        }
        return new Block(
                quantity(block, "number").longValueExact(),
                lowerOrNull(optionalText(block, "hash")),
                lowerOrNull(optionalText(block, "parentHash")),
                Instant.ofEpochSecond(quantity(block, "timestamp").longValueExact()),
                lowerOrNull(optionalText(block, "miner")),
                quantity(block, "gasUsed"),
                quantity(block, "gasLimit"),
                optionalQuantity(block, "baseFeePerGas"),
                hashes,
                transactions
        );
    }

    public static String toHexQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static String toHexQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }
}
