package lab.swapdesk.orchestration;

import lab.swapdesk.common.SwapCancelledException;
import lab.swapdesk.domain.swap.Chain;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on one running swap: current stage, eventual result and cancellation.
 * Cancellation is honoured at the next stage boundary and refused once broadcasting has begun.
 */
public class SwapExecution {

    @Getter
    private final String clientReference;
    @Getter
    private final Chain chain;
    @Getter
    private final String walletAddress;
    private final CompletableFuture<SwapResult> result = new CompletableFuture<>();

    private SwapStage stage = SwapStage.QUEUED;
    private boolean cancelRequested;
    private boolean broadcasting;

    public SwapExecution(String clientReference, Chain chain, String walletAddress) {
        this.clientReference = clientReference;
        this.chain = chain;
        this.walletAddress = walletAddress;
    }

    public synchronized SwapStage getStage() {
        return stage;
    }

    /**
     * @return true if the swap will stop before broadcast, false if it already reached the network or finished
     */
    public synchronized boolean cancel() {
        if (cancelRequested) {
            return true;
        }
        if (broadcasting || stage.isFinal()) {
            return false;
        }
        cancelRequested = true;
        return true;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public CompletableFuture<SwapResult> result() {
        return result.copy();
    }

    synchronized void advance(SwapStage next) {
        checkNotCancelled();
        stage = next;
    }

    // From here on the swap can no longer be cancelled.
    synchronized void beginBroadcast() {
        checkNotCancelled();
        broadcasting = true;
    }

    // The network refused the transaction; nothing went out, so cancelling is possible again.
    synchronized void broadcastRejected() {
        broadcasting = false;
    }

    synchronized void enter(SwapStage next) {
        stage = next;
    }

    void complete(SwapResult swapResult) {
        enter(SwapStage.RECONCILED);
        result.complete(swapResult);
    }

    void fail(Throwable error) {
        enter(error instanceof SwapCancelledException ? SwapStage.CANCELLED : SwapStage.FAILED);
        result.completeExceptionally(error);
    }

    private void checkNotCancelled() {
        if (cancelRequested) {
            throw new SwapCancelledException("swap " + clientReference + " cancelled at stage " + stage);
        }
    }
}
