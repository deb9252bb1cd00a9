package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapter.TxStatus;
import lab.swapdesk.common.RpcUnavailableException;
import lab.swapdesk.common.SwapException;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.domain.txattempt.TxAttemptStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.List;

/**
 * Polls the chain for a broadcast transaction until it is final or the confirmation window closes.
 * Never re-broadcasts.
 */
@Component
@Slf4j
public class ConfirmationTracker {

    private final AttemptService attemptService;
    private final Duration timeout;
    private final Duration pollInterval;

    @Autowired
    public ConfirmationTracker(AttemptService attemptService, SwapDeskProperties properties) {
        this(attemptService,
                properties.getExecution().getConfirmationTimeout(),
                properties.getExecution().getConfirmationPollInterval());
    }

    public ConfirmationTracker(AttemptService attemptService, Duration timeout, Duration pollInterval) {
        this.attemptService = attemptService;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    /**
     * @param ambiguous the broadcast timed out, so the transaction may never have reached the network
     */
    public SwapOutcome track(ChainAdapter adapter, TxAttempt attempt, boolean ambiguous) {
        String txId = attempt.getTxId();
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean seen = false;
        int polls = 0;
        while (true) {
            polls++;
            TxStatus status = poll(adapter, txId);
            if (status == TxStatus.CONFIRMED) {
                attemptService.transition(attempt.getId(), TxAttemptStatus.CONFIRMED, null);
                log.info("event=confirmation.confirmed chain={} txId={} polls={}", adapter.getChain(), txId, polls);
                return SwapOutcome.CONFIRMED;
            }
            if (status == TxStatus.FAILED) {
                attemptService.transition(attempt.getId(), TxAttemptStatus.FAILED_ON_CHAIN, "transaction failed on chain");
                log.warn("event=confirmation.failed_on_chain chain={} txId={} polls={}", adapter.getChain(), txId, polls);
                return SwapOutcome.FAILED_ON_CHAIN;
            }
            seen |= status == TxStatus.PENDING;
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0 || !sleep(Math.min(pollInterval.toNanos(), remainingNanos))) {
                break;
            }
        }

        if (ambiguous && !seen) {
            log.warn("event=confirmation.unknown chain={} txId={} polls={} timeoutMs={}",
                    adapter.getChain(), txId, polls, timeout.toMillis());
            return SwapOutcome.UNKNOWN_OUTCOME;
        }
        if (ambiguous) {
            attemptService.transition(attempt.getId(), TxAttemptStatus.BROADCASTED, "seen on chain after broadcast timeout");
        }
        log.info("event=confirmation.window_closed chain={} txId={} polls={} timeoutMs={}",
                adapter.getChain(), txId, polls, timeout.toMillis());
        return SwapOutcome.SUBMITTED_UNCONFIRMED;
    }

    /**
     * One status query for an attempt still waiting on the chain.
     *
     * @throws RpcUnavailableException when the chain cannot be asked
     */
    public TxAttemptStatus refresh(ChainAdapter adapter, TxAttempt attempt) {
        if (!attempt.getStatus().awaitsChain()) {
            return attempt.getStatus();
        }
        TxStatus status;
        try {
            status = adapter.getTransactionStatus(attempt.getTxId());
        } catch (RestClientException e) {
            throw new RpcUnavailableException("status query failed for " + attempt.getTxId(), List.of(), e);
        }
        TxAttemptStatus next = switch (status) {
            case CONFIRMED -> TxAttemptStatus.CONFIRMED;
            case FAILED -> TxAttemptStatus.FAILED_ON_CHAIN;
            case PENDING -> TxAttemptStatus.BROADCASTED;
            case NOT_FOUND -> attempt.getStatus();
        };
        log.info("event=confirmation.refresh ref={} txId={} chainStatus={} journal={}",
                attempt.getClientReference(), attempt.getTxId(), status, next);
        return attemptService.transition(attempt.getId(), next, status == TxStatus.FAILED ? "transaction failed on chain" : null)
                .getStatus();
    }

    private static TxStatus poll(ChainAdapter adapter, String txId) {
        try {
            return adapter.getTransactionStatus(txId);
        } catch (SwapException | RestClientException e) {
            log.warn("event=confirmation.poll_failed chain={} txId={} error={}", adapter.getChain(), txId, e.getMessage());
            return TxStatus.NOT_FOUND;
        }
    }

    private static boolean sleep(long nanos) {
        if (nanos <= 0) {
            return true;
        }
        try {
            Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
