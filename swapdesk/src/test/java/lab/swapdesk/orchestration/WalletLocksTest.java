package lab.swapdesk.orchestration;

import lab.swapdesk.common.SwapInProgressException;
import lab.swapdesk.domain.swap.Chain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalletLocksTest {

    private static final String WALLET = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String OTHER_WALLET = "7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU";

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void withLock_twoConcurrentSwapsOnSameWallet_runOneAtATime() throws Exception {
        WalletLocks locks = new WalletLocks(Duration.ofSeconds(5));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch firstInside = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        Future<String> first = pool.submit(() -> locks.withLock(Chain.SOLANA, WALLET, () -> {
            track(active, maxActive);
            firstInside.countDown();
            await(releaseFirst);
            active.decrementAndGet();
            return "first";
        }));
        assertThat(firstInside.await(2, TimeUnit.SECONDS)).isTrue();
        Future<String> second = pool.submit(() -> locks.withLock(Chain.SOLANA, WALLET, () -> {
            track(active, maxActive);
            active.decrementAndGet();
            return "second";
        }));

        Thread.sleep(200);
        assertThat(second.isDone()).isFalse();
        releaseFirst.countDown();

        assertThat(first.get(2, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(second.get(2, TimeUnit.SECONDS)).isEqualTo("second");
        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(locks.trackedWallets()).isZero();
    }

    @Test
    void withLock_holderOutlastsWait_raisesSwapInProgress() throws Exception {
        WalletLocks locks = new WalletLocks(Duration.ofMillis(100));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = pool.submit(() -> locks.withLock(Chain.TON, WALLET, () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> locks.withLock(Chain.TON, WALLET, () -> "never"))
                .isInstanceOfSatisfying(SwapInProgressException.class,
                        e -> assertThat(e.kind().isRetryable()).isTrue());

        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
        assertThat(locks.trackedWallets()).isZero();
    }

    @Test
    void withLock_differentWallets_runConcurrently() throws Exception {
        WalletLocks locks = new WalletLocks(Duration.ofSeconds(5));
        CyclicBarrier bothInside = new CyclicBarrier(2);

        Future<Integer> a = pool.submit(() -> locks.withLock(Chain.SOLANA, WALLET, () -> meet(bothInside)));
        Future<Integer> b = pool.submit(() -> locks.withLock(Chain.SOLANA, OTHER_WALLET, () -> meet(bothInside)));

        assertThat(a.get(3, TimeUnit.SECONDS)).isNotNegative();
        assertThat(b.get(3, TimeUnit.SECONDS)).isNotNegative();
    }

    @Test
    void withLock_sameAddressOnOtherChain_isIndependent() {
        WalletLocks locks = new WalletLocks(Duration.ofMillis(50));

        String result = locks.withLock(Chain.SOLANA, WALLET, () -> locks.withLock(Chain.TON, WALLET, () -> "nested"));

        assertThat(result).isEqualTo("nested");
    }

    @Test
    void withLock_failingWork_releasesAndEvictsWallet() {
        WalletLocks locks = new WalletLocks(Duration.ofMillis(50));

        assertThatThrownBy(() -> locks.withLock(Chain.SOLANA, WALLET, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.trackedWallets()).isZero();
        assertThat(locks.withLock(Chain.SOLANA, WALLET, () -> "again")).isEqualTo("again");
    }

    private static void track(AtomicInteger active, AtomicInteger maxActive) {
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static int meet(CyclicBarrier barrier) {
        try {
            return barrier.await(2, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException("wallets did not run concurrently", e);
        }
    }
}
