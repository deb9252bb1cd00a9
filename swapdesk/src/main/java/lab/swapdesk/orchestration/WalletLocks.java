package lab.swapdesk.orchestration;

import lab.swapdesk.common.SwapInProgressException;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.domain.swap.Chain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * At most one swap or withdrawal in flight per wallet.
 */
@Component
@Slf4j
public class WalletLocks {

    private final ConcurrentHashMap<String, WalletLock> locks = new ConcurrentHashMap<>();
    private final Duration wait;

    @Autowired
    public WalletLocks(SwapDeskProperties properties) {
        this(properties.getExecution().getWalletLockWait());
    }

    public WalletLocks(Duration wait) {
        this.wait = wait;
    }

    public <T> T withLock(Chain chain, String walletAddress, Supplier<T> work) {
        String key = chain + ":" + walletAddress;
        WalletLock entry = retain(key);
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SwapInProgressException("interrupted while waiting for wallet " + walletAddress, e);
            }
            if (!acquired) {
                log.warn("event=wallet.lock.timeout chain={} wallet={} waitMs={}", chain, walletAddress, wait.toMillis());
                throw new SwapInProgressException("another operation on wallet %s did not finish within %ss"
                        .formatted(walletAddress, wait.toSeconds()));
            }
            try {
                return work.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(key);
        }
    }

    int trackedWallets() {
        return locks.size();
    }

    // Holder and waiter counts change only inside compute, so an entry is dropped exactly when nobody uses it.
    private WalletLock retain(String key) {
        return locks.compute(key, (k, existing) -> {
            WalletLock entry = existing == null ? new WalletLock() : existing;
            entry.users++;
            return entry;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class WalletLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
