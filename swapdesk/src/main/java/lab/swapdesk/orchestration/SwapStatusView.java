package lab.swapdesk.orchestration;

import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.domain.txattempt.TxAttemptStatus;

import java.time.Instant;
import java.util.List;

/**
 * What is known about a reference: the live stage while it runs, and its journaled attempts.
 *
 * @param stage  null once the operation is no longer running in this process
 * @param status status of the latest attempt, null before the first broadcast
 */
public record SwapStatusView(
        String clientReference,
        SwapStage stage,
        TxAttemptStatus status,
        String txId,
        String explorerUrl,
        List<AttemptView> attempts
) {

    public static SwapStatusView of(String clientReference, SwapStage stage, List<TxAttempt> attempts) {
        TxAttempt latest = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
        String txId = latest == null ? null : latest.getTxId();
        return new SwapStatusView(
                clientReference,
                stage,
                latest == null ? null : latest.getStatus(),
                txId,
                txId == null ? null : latest.getChain().explorerUrl(txId),
                attempts.stream().map(AttemptView::from).toList());
    }

    public record AttemptView(
            int attemptNo,
            Operation operation,
            TxAttemptStatus status,
            String txId,
            long amountRaw,
            long minOutputRaw,
            String detail,
            Instant createdAt,
            Instant updatedAt
    ) {
        static AttemptView from(TxAttempt attempt) {
            return new AttemptView(attempt.getAttemptNo(), attempt.getOperation(), attempt.getStatus(),
                    attempt.getTxId(), attempt.getAmountRaw(), attempt.getMinOutputRaw(), attempt.getDetail(),
                    attempt.getCreatedAt(), attempt.getUpdatedAt());
        }
    }
}
