package lab.swapdesk.orchestration;

import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.common.SwapCancelledException;
import lab.swapdesk.common.SwapException;
import lab.swapdesk.common.SwapInProgressException;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.config.AsyncConfig;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for swaps: one worker task per swap, serialized per wallet, deduplicated by client reference.
 */
@Service
@Slf4j
public class SwapService {

    public static final String MDC_SWAP_REF_KEY = "swapRef";
    static final int MAX_REFERENCE_LENGTH = 64;

    private final SwapExecutor swapExecutor;
    private final AttemptService attemptService;
    private final ConfirmationTracker confirmationTracker;
    private final ChainAdapterRouter router;
    private final WalletLocks walletLocks;
    private final Executor workers;
    private final ConcurrentHashMap<String, SwapExecution> inFlight = new ConcurrentHashMap<>();

    public SwapService(SwapExecutor swapExecutor, AttemptService attemptService,
                       ConfirmationTracker confirmationTracker, ChainAdapterRouter router, WalletLocks walletLocks,
                       @Qualifier(AsyncConfig.SWAP_EXECUTOR) Executor workers) {
        this.swapExecutor = swapExecutor;
        this.attemptService = attemptService;
        this.confirmationTracker = confirmationTracker;
        this.router = router;
        this.walletLocks = walletLocks;
        this.workers = workers;
    }

    /**
     * Queues the swap and returns at once. A reference that is still running returns the running handle.
     */
    public SwapExecution submit(String clientReference, SwapRequest request) {
        String ref = normalizeReference(clientReference);
        SwapExecution fresh = new SwapExecution(ref, request.chain(), request.walletAddress());
        SwapExecution running = inFlight.putIfAbsent(ref, fresh);
        if (running != null) {
            log.info("event=swap.submit.joined ref={} stage={}", ref, running.getStage());
            return running;
        }
        try {
            CompletableFuture.runAsync(() -> run(fresh, request), workers);
        } catch (RejectedExecutionException e) {
            inFlight.remove(ref, fresh);
            throw new SwapInProgressException("swap queue is full, try again shortly", e);
        }
        log.info("event=swap.submit.queued ref={} chain={} wallet={}", ref, request.chain(), request.walletAddress());
        return fresh;
    }

    /**
     * Runs the swap and waits for its result.
     *
     * @throws SwapException of the kind the swap failed with
     */
    public SwapResult execute(String clientReference, SwapRequest request) {
        return await(submit(clientReference, request));
    }

    public Optional<SwapExecution> find(String clientReference) {
        return Optional.ofNullable(inFlight.get(clientReference));
    }

    /**
     * @return empty for an unknown reference; otherwise whether the swap will stop before broadcast
     */
    public Optional<CancelOutcome> cancel(String clientReference) {
        SwapExecution execution = inFlight.get(clientReference);
        if (execution == null) {
            return attemptService.isRecorded(clientReference)
                    ? Optional.of(new CancelOutcome(clientReference, false, null))
                    : Optional.empty();
        }
        boolean cancelled = execution.cancel();
        log.info("event=swap.cancel ref={} accepted={} stage={}", clientReference, cancelled, execution.getStage());
        return Optional.of(new CancelOutcome(clientReference, cancelled, execution.getStage()));
    }

    public Optional<SwapStatusView> status(String clientReference) {
        SwapExecution live = inFlight.get(clientReference);
        List<TxAttempt> attempts = attemptService.listAttempts(clientReference);
        if (live == null && attempts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SwapStatusView.of(clientReference, live == null ? null : live.getStage(), attempts));
    }

    /**
     * Asks the chain about the latest attempt that is still open and records the answer. Never re-broadcasts.
     */
    public Optional<SwapStatusView> sync(String clientReference) {
        List<TxAttempt> attempts = attemptService.listAttempts(clientReference);
        if (!attempts.isEmpty()) {
            TxAttempt latest = attempts.get(attempts.size() - 1);
            if (latest.getStatus().awaitsChain()) {
                confirmationTracker.refresh(router.resolve(latest.getChain()), latest);
            }
        }
        return status(clientReference);
    }

    private void run(SwapExecution execution, SwapRequest request) {
        MDC.put(MDC_SWAP_REF_KEY, execution.getClientReference());
        SwapResult result = null;
        RuntimeException failure = null;
        try {
            result = walletLocks.withLock(request.chain(), request.walletAddress(),
                    () -> swapExecutor.execute(execution, request));
            log.info("event=swap.done ref={} outcome={} txId={}", result.clientReference(), result.outcome(), result.txId());
        } catch (SwapCancelledException e) {
            log.info("event=swap.cancelled ref={}", execution.getClientReference());
            failure = e;
            journalCancel(execution, request);
        } catch (SwapException e) {
            log.warn("event=swap.failed ref={} kind={} retryable={} error={}",
                    execution.getClientReference(), e.kind(), e.kind().isRetryable(), e.getMessage());
            failure = e;
        } catch (RuntimeException e) {
            log.error("event=swap.failed ref={} error={}", execution.getClientReference(), e.toString(), e);
            failure = e;
        } finally {
            inFlight.remove(execution.getClientReference(), execution);
            MDC.remove(MDC_SWAP_REF_KEY);
        }
        // Complete only after leaving the in-flight table.
        if (failure == null) {
            execution.complete(result);
        } else {
            execution.fail(failure);
        }
    }

    private void journalCancel(SwapExecution execution, SwapRequest request) {
        try {
            attemptService.recordCancelled(execution.getClientReference(), request.chain(), request.operation(),
                    request.walletAddress(), request.counterAsset(), 0L);
        } catch (RuntimeException e) {
            log.error("event=swap.cancel.journal_failed ref={} error={}", execution.getClientReference(), e.toString(), e);
        }
    }

    static SwapResult await(SwapExecution execution) {
        try {
            return execution.result().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    static String normalizeReference(String clientReference) {
        if (clientReference == null || clientReference.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String ref = clientReference.trim();
        if (ref.length() > MAX_REFERENCE_LENGTH) {
            throw new InvalidInputException("client reference must be at most " + MAX_REFERENCE_LENGTH + " characters");
        }
        return ref;
    }

    public record CancelOutcome(String clientReference, boolean cancelled, SwapStage stage) {
    }
}
