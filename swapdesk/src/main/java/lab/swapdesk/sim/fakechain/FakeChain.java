package lab.swapdesk.sim.fakechain;

import lab.swapdesk.adapter.ChainAdapter.TxStatus;
import lab.swapdesk.common.NetworkTimeoutException;
import lab.swapdesk.common.SubmissionFailedException;
import lab.swapdesk.domain.swap.Chain;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ledger behind the simulated adapters: balances, token metadata, spot prices and a queue of
 * scripted broadcast outcomes per wallet.
 */
@Slf4j
public class FakeChain {

    public enum NextOutcome {
        /** Accepted and confirmed at once. */
        ACCEPT,
        /** Explicitly refused; nothing lands. */
        REJECT,
        /** Lands and confirms, but the broadcast answer is lost. */
        TIMEOUT_DELIVERED,
        /** The broadcast answer is lost and the transaction never lands. */
        TIMEOUT_DROPPED,
        /** Lands, charges the fee and fails. */
        FAIL_ON_CHAIN,
        /** Lands and stays pending. */
        STAY_PENDING
    }

    /** Balance changes a transaction applies when it lands. Token deltas are for the sending wallet. */
    public record Effect(
            Chain chain,
            String wallet,
            long nativeDebitRaw,
            long nativeCreditRaw,
            String token,
            long tokenDelta,
            String recipient,
            long feeRaw
    ) {
    }

    private final Map<String, Long> nativeBalances = new ConcurrentHashMap<>();
    private final Map<String, Long> tokenBalances = new ConcurrentHashMap<>();
    private final Map<String, Integer> tokenDecimals = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> tokenPriceNative = new ConcurrentHashMap<>();
    private final Map<String, Deque<NextOutcome>> nextOutcomes = new ConcurrentHashMap<>();
    private final Map<String, TxStatus> txStatuses = new ConcurrentHashMap<>();
    private final Map<String, Long> sequences = new ConcurrentHashMap<>();

    public void setNativeBalance(Chain chain, String address, long raw) {
        nativeBalances.put(key(chain, address), raw);
    }

    public long nativeBalance(Chain chain, String address) {
        return nativeBalances.getOrDefault(key(chain, address), 0L);
    }

    public void setTokenBalance(Chain chain, String owner, String token, long raw) {
        tokenBalances.put(key(chain, owner, token), raw);
    }

    public long tokenBalance(Chain chain, String owner, String token) {
        return tokenBalances.getOrDefault(key(chain, owner, token), 0L);
    }

    public void listToken(Chain chain, String token, int decimals, BigDecimal priceNative) {
        tokenDecimals.put(key(chain, token), decimals);
        if (priceNative != null) {
            tokenPriceNative.put(key(chain, token), priceNative);
        }
    }

    public Optional<Integer> tokenDecimals(Chain chain, String token) {
        return Optional.ofNullable(tokenDecimals.get(key(chain, token)));
    }

    public Optional<BigDecimal> priceNative(Chain chain, String token) {
        return Optional.ofNullable(tokenPriceNative.get(key(chain, token)));
    }

    // Outcomes queue per wallet; broadcasts consume them in order and default to ACCEPT.
    public synchronized void scriptOutcome(Chain chain, String wallet, NextOutcome outcome) {
        nextOutcomes.computeIfAbsent(key(chain, wallet), k -> new ArrayDeque<>()).addLast(outcome);
    }

    /** Next per-wallet sequence number; keeps otherwise identical transactions distinct. */
    public long nextSequence(Chain chain, String wallet) {
        return sequences.merge(key(chain, wallet), 1L, Long::sum);
    }

    public TxStatus status(String txId) {
        return txStatuses.getOrDefault(txId, TxStatus.NOT_FOUND);
    }

    public synchronized void broadcast(String txId, Effect effect) {
        if (txStatuses.containsKey(txId)) {
            throw new SubmissionFailedException("transaction " + txId + " already processed");
        }
        NextOutcome outcome = consumeOutcome(effect.chain(), effect.wallet());
        log.info("event=fakechain.broadcast chain={} wallet={} txId={} outcome={}",
                effect.chain(), effect.wallet(), txId, outcome);
        switch (outcome) {
            case REJECT -> throw new SubmissionFailedException("simulated rejection of " + txId);
            case TIMEOUT_DROPPED -> throw new NetworkTimeoutException("simulated broadcast timeout", true, null);
            case FAIL_ON_CHAIN -> {
                debitNative(effect.chain(), effect.wallet(), effect.feeRaw());
                txStatuses.put(txId, TxStatus.FAILED);
            }
            case STAY_PENDING -> txStatuses.put(txId, TxStatus.PENDING);
            case ACCEPT, TIMEOUT_DELIVERED -> {
                apply(effect);
                txStatuses.put(txId, TxStatus.CONFIRMED);
                if (outcome == NextOutcome.TIMEOUT_DELIVERED) {
                    throw new NetworkTimeoutException("simulated timeout after delivery", true, null);
                }
            }
        }
    }

    private void apply(Effect effect) {
        long debit = Math.addExact(effect.nativeDebitRaw(), effect.feeRaw());
        if (nativeBalance(effect.chain(), effect.wallet()) < debit) {
            throw new SubmissionFailedException("simulated insufficient balance for fee and value");
        }
        if (effect.token() != null && effect.tokenDelta() < 0
                && tokenBalance(effect.chain(), effect.wallet(), effect.token()) < -effect.tokenDelta()) {
            throw new SubmissionFailedException("simulated insufficient token balance");
        }
        debitNative(effect.chain(), effect.wallet(), debit);
        nativeBalances.merge(key(effect.chain(), effect.wallet()), effect.nativeCreditRaw(), Long::sum);
        if (effect.token() != null) {
            tokenBalances.merge(key(effect.chain(), effect.wallet(), effect.token()), effect.tokenDelta(), Long::sum);
        }
        if (effect.recipient() != null) {
            nativeBalances.merge(key(effect.chain(), effect.recipient()), effect.nativeDebitRaw(), Long::sum);
        }
    }

    private void debitNative(Chain chain, String wallet, long raw) {
        nativeBalances.merge(key(chain, wallet), -raw, Long::sum);
    }

    private NextOutcome consumeOutcome(Chain chain, String wallet) {
        Deque<NextOutcome> queue = nextOutcomes.get(key(chain, wallet));
        NextOutcome next = queue == null ? null : queue.pollFirst();
        return next == null ? NextOutcome.ACCEPT : next;
    }

    private static String key(Chain chain, String... parts) {
        return chain + ":" + String.join(":", parts);
    }
}
