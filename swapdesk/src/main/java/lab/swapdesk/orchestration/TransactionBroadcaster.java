package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapter.SignedTransaction;
import lab.swapdesk.common.NetworkTimeoutException;
import lab.swapdesk.common.RpcUnavailableException;
import lab.swapdesk.common.SubmissionFailedException;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.domain.txattempt.TxAttemptStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * Hands one journaled transaction to the network exactly once and records what came back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionBroadcaster {

    public enum Delivery {
        ACKNOWLEDGED,
        /** No answer after the request may have left; only a status query can tell. */
        AMBIGUOUS
    }

    private final AttemptService attemptService;

    /**
     * @throws SubmissionFailedException when the network refused the transaction
     * @throws RpcUnavailableException   when no endpoint could be reached at all
     */
    public Delivery broadcast(ChainAdapter adapter, SignedTransaction transaction, TxAttempt attempt) {
        try {
            adapter.submit(transaction);
        } catch (NetworkTimeoutException e) {
            if (!e.isPossiblyDelivered()) {
                attemptService.transition(attempt.getId(), TxAttemptStatus.REJECTED, "not delivered: " + e.getMessage());
                throw e;
            }
            attemptService.transition(attempt.getId(), TxAttemptStatus.OUTCOME_UNKNOWN, e.getMessage());
            log.warn("event=broadcast.ambiguous chain={} txId={} error={}",
                    adapter.getChain(), transaction.txId(), e.getMessage());
            return Delivery.AMBIGUOUS;
        } catch (SubmissionFailedException | RpcUnavailableException e) {
            attemptService.transition(attempt.getId(), TxAttemptStatus.REJECTED, e.getMessage());
            log.warn("event=broadcast.rejected chain={} txId={} kind={} error={}",
                    adapter.getChain(), transaction.txId(), e.kind(), e.getMessage());
            throw e;
        } catch (RestClientException e) {
            attemptService.transition(attempt.getId(), TxAttemptStatus.REJECTED, e.getMessage());
            log.warn("event=broadcast.rejected chain={} txId={} error={}",
                    adapter.getChain(), transaction.txId(), e.getMessage());
            throw new SubmissionFailedException("broadcast refused: " + e.getMessage(), e);
        }
        attemptService.transition(attempt.getId(), TxAttemptStatus.BROADCASTED, null);
        log.info("event=broadcast.acknowledged chain={} txId={}", adapter.getChain(), transaction.txId());
        return Delivery.ACKNOWLEDGED;
    }
}
