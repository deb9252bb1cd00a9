package lab.swapdesk.orchestration;

import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.domain.txattempt.TxAttemptRepository;
import lab.swapdesk.domain.txattempt.TxAttemptStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Journal of broadcast attempts keyed by the caller's reference.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttemptService {

    private final TxAttemptRepository txAttemptRepository;
    private final Clock clock;

    // Persist the signed transaction's id before it is handed to the network.
    @Transactional
    public TxAttempt recordIntent(String clientReference, Chain chain, Operation operation, String walletAddress,
                                  String counterparty, long amountRaw, long minOutputRaw, String txId) {
        TxAttempt attempt = txAttemptRepository.save(TxAttempt.intent(clientReference, nextAttemptNo(clientReference),
                chain, operation, walletAddress, counterparty, amountRaw, minOutputRaw, txId, clock.instant()));
        log.info("event=attempt.intent.recorded ref={} attemptNo={} chain={} operation={} txId={}",
                clientReference, attempt.getAttemptNo(), chain, operation, txId);
        return attempt;
    }

    @Transactional
    public TxAttempt recordCancelled(String clientReference, Chain chain, Operation operation, String walletAddress,
                                     String counterparty, long amountRaw) {
        TxAttempt attempt = txAttemptRepository.save(TxAttempt.cancelled(clientReference, nextAttemptNo(clientReference),
                chain, operation, walletAddress, counterparty, amountRaw, clock.instant()));
        log.info("event=attempt.cancelled ref={} attemptNo={}", clientReference, attempt.getAttemptNo());
        return attempt;
    }

    @Transactional
    public TxAttempt transition(UUID attemptId, TxAttemptStatus next, String detail) {
        TxAttempt attempt = txAttemptRepository.findById(attemptId)
                .orElseThrow(() -> new IllegalStateException("unknown attempt " + attemptId));
        if (attempt.getStatus() == next) {
            return attempt;
        }
        TxAttemptStatus previous = attempt.getStatus();
        attempt.transitionTo(next, detail, clock.instant());
        TxAttempt saved = txAttemptRepository.save(attempt);
        log.info("event=attempt.transition ref={} attemptNo={} txId={} from={} to={}",
                saved.getClientReference(), saved.getAttemptNo(), saved.getTxId(), previous, next);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<TxAttempt> listAttempts(String clientReference) {
        return txAttemptRepository.findByClientReferenceOrderByAttemptNoAsc(clientReference);
    }

    @Transactional(readOnly = true)
    public boolean isRecorded(String clientReference) {
        return txAttemptRepository.existsByClientReference(clientReference);
    }

    private int nextAttemptNo(String clientReference) {
        return txAttemptRepository.findFirstByClientReferenceOrderByAttemptNoDesc(clientReference)
                .map(last -> last.getAttemptNo() + 1)
                .orElse(1);
    }
}
