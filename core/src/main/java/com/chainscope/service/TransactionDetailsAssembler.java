package com.chainscope.service;

import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.InternalTransaction;
import com.chainscope.domain.TokenTransfer;
import com.chainscope.domain.TransactionDetails;
import com.chainscope.domain.TransactionReceipt;
import com.chainscope.domain.TransactionStatus;
import com.chainscope.domain.Transfer;
import com.chainscope.domain.TransferKind;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pure assembly of {@link TransactionDetails} from the fetched parts.
 */
final class TransactionDetailsAssembler {

    private TransactionDetailsAssembler() {
    }

    /**
     * @param receipt        null while pending
     * @param currentBlock   chain head at fetch time
     * @param tokenTransfers token transfers of sender and recipient, any transaction
     * @param internal       internal transactions, any parent
     */
    static TransactionDetails assemble(ChainTransaction tx,
                                       TransactionReceipt receipt,
                                       long currentBlock,
                                       List<TokenTransfer> tokenTransfers,
                                       List<InternalTransaction> internal) {
        BigInteger gasUsed = receipt != null ? receipt.gasUsed() : BigInteger.ZERO;
        BigInteger gasPrice = effectiveGasPrice(tx, receipt);
        return new TransactionDetails(
                tx.hash(),
                tx.blockNumber(),
                tx.blockHash(),
                tx.transactionIndex(),
                tx.from(),
                tx.to(),
                tx.value(),
                tx.gas(),
                gasUsed,
                gasPrice,
                gasUsed.multiply(gasPrice),
                tx.nonce(),
                tx.input(),
                methodSelector(tx.input()),
                status(tx, receipt),
                tx.blockNumber() != null ? confirmations(currentBlock, tx.blockNumber()) : 0L,
                receipt != null ? receipt.contractAddress() : null,
                transfers(tx, tokenTransfers, internal)
        );
    }

    static long confirmations(long currentBlock, long txBlock) {
        return Math.max(0L, currentBlock - txBlock);
    }

    static BigInteger effectiveGasPrice(ChainTransaction tx, TransactionReceipt receipt) {
        if (receipt != null && receipt.effectiveGasPrice() != null) {
            return receipt.effectiveGasPrice();
        }
        return tx.gasPrice() != null ? tx.gasPrice() : BigInteger.ZERO;
    }

    static TransactionStatus status(ChainTransaction tx, TransactionReceipt receipt) {
        if (tx.isPending() || receipt == null) return TransactionStatus.PENDING;
        if (receipt.success() == null) return TransactionStatus.UNKNOWN;
        return receipt.success() ? TransactionStatus.SUCCESS : TransactionStatus.FAILED;
    }

    static String methodSelector(String input) {
        return input != null && input.length() >= 10 ? input.substring(0, 10) : "";
    }

    /**
     * Native first, then token transfers, then internal transfers. The sender's and recipient's
     * token lists overlap, so token rows collapse on (hash, log index); rows without a log index
     * collapse only when fully equal.
     */
    static List<Transfer> transfers(ChainTransaction tx,
                                    List<TokenTransfer> tokenTransfers,
                                    List<InternalTransaction> internal) {
        List<Transfer> ordered = new ArrayList<>();
        if (tx.value() != null && tx.value().signum() > 0) {
            ordered.add(Transfer.nativeTransfer(tx.from(), tx.to(), tx.value()));
        }
        Set<Object> seenTokenRows = new HashSet<>();
        for (TokenTransfer t : tokenTransfers) {
            if (tx.hash().equalsIgnoreCase(t.transactionHash()) && seenTokenRows.add(tokenRowKey(t))) {
                ordered.add(new Transfer(TransferKind.TOKEN, t.from(), t.to(), t.value(), t.tokenMeta()));
            }
        }
        for (InternalTransaction t : internal) {
            if (tx.hash().equalsIgnoreCase(t.parentTransactionHash())) {
                ordered.add(new Transfer(TransferKind.INTERNAL, t.from(), t.to(), t.value(), null));
            }
        }
        return ordered;
    }

    private static Object tokenRowKey(TokenTransfer t) {
        if (t.logIndex() == null) {
            return t;
        }
        return List.of(t.transactionHash().toLowerCase(Locale.ROOT), t.logIndex());
    }
}
