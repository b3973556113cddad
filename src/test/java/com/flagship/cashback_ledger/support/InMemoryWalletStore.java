package com.flagship.cashback_ledger.support;

import com.flagship.cashback_ledger.wallet.BalanceDelta;
import com.flagship.cashback_ledger.wallet.Wallet;
import com.flagship.cashback_ledger.wallet.WalletStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wallet store with the same compare-and-swap contract as the Mongo store.
 */
public class InMemoryWalletStore implements WalletStore {

    private final Map<String, Wallet> byOwner = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger casCalls = new AtomicInteger();
    private volatile int forcedConflicts;
    private final Map<String, RuntimeException> forcedFailures = new ConcurrentHashMap<>();

    @Override
    public Optional<Wallet> findByOwner(String ownerId) {
        return Optional.ofNullable(byOwner.get(ownerId));
    }

    @Override
    public Wallet ensureWallet(String ownerId) {
        return byOwner.computeIfAbsent(ownerId,
                owner -> Wallet.open("wallet-" + ids.incrementAndGet(), owner, Instant.now()));
    }

    @Override
    public synchronized Optional<Wallet> compareAndApply(Wallet expected, BalanceDelta delta, String transactionId) {
        casCalls.incrementAndGet();
        RuntimeException failure = forcedFailures.remove(expected.getOwnerId());
        if (failure != null) {
            throw failure;
        }
        if (forcedConflicts > 0) {
            forcedConflicts--;
            return Optional.empty();
        }
        Wallet current = byOwner.get(expected.getOwnerId());
        if (current == null || current.getVersion() != expected.getVersion()) {
            return Optional.empty();
        }
        Wallet next = current.apply(delta, transactionId, Instant.now());
        byOwner.put(next.getOwnerId(), next);
        return Optional.of(next);
    }

    /**
     * Makes the next {@code count} compare-and-swap calls lose, as if another writer got there first.
     */
    public void failNextCompareAndSwaps(int count) {
        this.forcedConflicts = count;
    }

    /**
     * Makes the next compare-and-swap on the owner's wallet throw, leaving the wallet unchanged.
     */
    public void failNextCompareAndSwapOf(String ownerId, RuntimeException failure) {
        forcedFailures.put(ownerId, failure);
    }

    public int compareAndSwapCalls() {
        return casCalls.get();
    }

    /**
     * Applies a delta directly, standing in for a write that reached the wallet before a crash.
     */
    public synchronized Wallet applyDirectly(String ownerId, BalanceDelta delta, String transactionId) {
        Wallet next = ensureWallet(ownerId).apply(delta, transactionId, Instant.now());
        byOwner.put(ownerId, next);
        return next;
    }

    public long balanceOf(String ownerId) {
        return findByOwner(ownerId).map(Wallet::getAvailablePaise).orElse(0L);
    }

    public long pendingOf(String ownerId) {
        return findByOwner(ownerId).map(Wallet::getPendingPaise).orElse(0L);
    }
}
