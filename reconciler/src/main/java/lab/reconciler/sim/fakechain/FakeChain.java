package lab.reconciler.sim.fakechain;

import lab.reconciler.adapter.BroadcastRejectedException;
import lab.reconciler.adapter.RpcUnavailableException;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory ledger-of-blocks standing in for a real chain. Tests and the local "mock" mode
 * drive it directly: mine blocks, drop transactions to simulate a reorg, take the RPC down,
 * or script what the next broadcast does.
 */
public class FakeChain {

    public enum NextOutcome {
        ACCEPT,
        REJECT,
        /** Relayed, but the caller sees a timeout. */
        TIMEOUT,
        /** Accepted by the node, never mined. */
        DROP,
        /** Mined with a failed status. */
        REVERT
    }

    public record SimTransfer(
            String txHash,
            String fromAddress,
            String toAddress,
            String token,
            BigDecimal amount,
            long blockHeight,
            long indexInBlock,
            boolean success
    ) {}

    private final String chain;
    private final String nativeSymbol;
    private final BigDecimal transferFee;
    private final List<SimTransfer> transfers = new ArrayList<>();
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final Deque<NextOutcome> scriptedOutcomes = new ArrayDeque<>();
    private final AtomicLong txCounter = new AtomicLong();
    private long height;
    private volatile boolean rpcDown;
    private int broadcastCount;

    public FakeChain(String chain, String nativeSymbol, BigDecimal transferFee, long startHeight) {
        this.chain = chain;
        this.nativeSymbol = nativeSymbol;
        this.transferFee = transferFee;
        this.height = startHeight;
    }

    public String chain() {
        return chain;
    }

    public synchronized long height() {
        checkAvailable();
        return height;
    }

    public synchronized long mine(int blocks) {
        height += blocks;
        return height;
    }

    /** Credits {@code to} in the next block and mines it. */
    public synchronized SimTransfer deposit(String to, String token, BigDecimal amount) {
        height++;
        SimTransfer transfer = record(newTxHash(), "0xexternal", to, token, amount, height, true);
        credit(to, token, amount);
        return transfer;
    }

    public synchronized void fund(String address, String token, BigDecimal amount) {
        credit(address, token, amount);
    }

    /** Removes a transaction as a reorg would; balances are rolled back too. */
    public synchronized boolean dropTransaction(String txHash) {
        Optional<SimTransfer> found = transfers.stream().filter(t -> t.txHash().equalsIgnoreCase(txHash)).findFirst();
        found.ifPresent(transfer -> {
            transfers.remove(transfer);
            if (transfer.success()) {
                credit(transfer.toAddress(), transfer.token(), transfer.amount().negate());
            }
        });
        return found.isPresent();
    }

    /** Re-includes a transaction at another height, as when a reorg re-mines it later. */
    public synchronized void moveTransaction(String txHash, long newHeight) {
        for (int i = 0; i < transfers.size(); i++) {
            SimTransfer t = transfers.get(i);
            if (t.txHash().equalsIgnoreCase(txHash)) {
                transfers.set(i, new SimTransfer(t.txHash(), t.fromAddress(), t.toAddress(), t.token(), t.amount(),
                        newHeight, t.indexInBlock(), t.success()));
                return;
            }
        }
        throw new IllegalArgumentException("unknown transaction " + txHash);
    }

    public synchronized List<SimTransfer> transfersTo(String address, String token, long fromHeight, long toHeight) {
        checkAvailable();
        return transfers.stream()
                .filter(SimTransfer::success)
                .filter(t -> t.toAddress().equalsIgnoreCase(address))
                .filter(t -> t.token().equalsIgnoreCase(token))
                .filter(t -> t.blockHeight() >= fromHeight && t.blockHeight() <= toHeight && t.blockHeight() <= height)
                .sorted(Comparator.comparingLong(SimTransfer::blockHeight).thenComparingLong(SimTransfer::indexInBlock))
                .toList();
    }

    public synchronized Optional<SimTransfer> findMined(String txHash) {
        checkAvailable();
        return transfers.stream()
                .filter(t -> t.txHash().equalsIgnoreCase(txHash))
                .filter(t -> t.blockHeight() <= height)
                .findFirst();
    }

    public synchronized BigDecimal balanceOf(String address, String token) {
        checkAvailable();
        return balances.getOrDefault(key(address, token), BigDecimal.ZERO);
    }

    public BigDecimal transferFee() {
        return transferFee;
    }

    /**
     * Applies a signed transfer according to the next scripted outcome (ACCEPT when none is
     * queued). Accepted transfers land in the next block and wait to be mined.
     */
    public synchronized String submit(String txHash, String from, String to, String token, BigDecimal amount) {
        checkAvailable();
        broadcastCount++;
        NextOutcome outcome = scriptedOutcomes.isEmpty() ? NextOutcome.ACCEPT : scriptedOutcomes.poll();
        if (outcome == NextOutcome.REJECT) {
            throw new BroadcastRejectedException(chain, "scripted rejection");
        }
        if (outcome == NextOutcome.DROP) {
            return txHash;
        }

        BigDecimal nativeBalance = balances.getOrDefault(key(from, nativeSymbol), BigDecimal.ZERO);
        boolean nativeTransfer = token.equalsIgnoreCase(nativeSymbol);
        BigDecimal nativeNeeded = nativeTransfer ? amount.add(transferFee) : transferFee;
        if (nativeBalance.compareTo(nativeNeeded) < 0) {
            throw new BroadcastRejectedException(chain, "insufficient funds for gas * price + value");
        }
        if (!nativeTransfer && balances.getOrDefault(key(from, token), BigDecimal.ZERO).compareTo(amount) < 0) {
            throw new BroadcastRejectedException(chain, "transfer amount exceeds balance");
        }

        boolean success = outcome != NextOutcome.REVERT;
        credit(from, nativeSymbol, transferFee.negate());
        if (success) {
            credit(from, token, amount.negate());
            credit(to, token, amount);
        }
        record(txHash, from, to, token, amount, height + 1, success);

        if (outcome == NextOutcome.TIMEOUT) {
            throw new RpcUnavailableException(chain, "read timed out");
        }
        return txHash;
    }

    public synchronized void enqueueOutcome(NextOutcome outcome) {
        scriptedOutcomes.add(outcome);
    }

    public void setRpcDown(boolean rpcDown) {
        this.rpcDown = rpcDown;
    }

    public synchronized int broadcastCount() {
        return broadcastCount;
    }

    public synchronized void reset(long startHeight) {
        transfers.clear();
        balances.clear();
        scriptedOutcomes.clear();
        height = startHeight;
        rpcDown = false;
        broadcastCount = 0;
    }

    public String newTxHash() {
        return "0x%064x".formatted(txCounter.incrementAndGet() + ((long) chain.hashCode() << 20));
    }

    private SimTransfer record(String txHash, String from, String to, String token, BigDecimal amount, long blockHeight, boolean success) {
        long index = transfers.stream().filter(t -> t.blockHeight() == blockHeight).count();
        SimTransfer transfer = new SimTransfer(txHash, from, to, token.toUpperCase(Locale.ROOT), amount, blockHeight, index, success);
        transfers.add(transfer);
        return transfer;
    }

    private void credit(String address, String token, BigDecimal delta) {
        balances.merge(key(address, token), delta, BigDecimal::add);
    }

    private void checkAvailable() {
        if (rpcDown) {
            throw new RpcUnavailableException(chain, "connect timed out");
        }
    }

    private static String key(String address, String token) {
        return address.toLowerCase(Locale.ROOT) + "|" + token.toUpperCase(Locale.ROOT);
    }
}
