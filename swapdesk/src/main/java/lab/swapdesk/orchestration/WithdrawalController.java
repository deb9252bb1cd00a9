package lab.swapdesk.orchestration;

import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
public class WithdrawalController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WithdrawalService withdrawalService;
    private final AttemptService attemptService;

    // A key that is already journaled answers with the journal instead of sending again.
    @PostMapping("/withdrawals")
    public ResponseEntity<?> create(
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody CreateWithdrawalRequest req
    ) {
        log.info("event=withdrawal.create.request chain={} amount={} destination={} idempotencyKeyPresent={}",
                req.chain(), req.amount(), req.destination(), idempotencyKey != null && !idempotencyKey.isBlank());
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            List<TxAttempt> attempts = attemptService.listAttempts(idempotencyKey.trim());
            if (!attempts.isEmpty()) {
                return ResponseEntity.ok(SwapStatusView.of(idempotencyKey.trim(), null, attempts));
            }
        }
        WithdrawalResult result = withdrawalService.withdraw(idempotencyKey, req.toWithdrawalRequest());
        log.info("event=withdrawal.create.response ref={} outcome={} txId={}",
                result.clientReference(), result.outcome(), result.txId());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/wallets/{chain}/{address}/max-withdrawable")
    public ResponseEntity<WithdrawalService.MaxWithdrawable> maxWithdrawable(
            @PathVariable String chain,
            @PathVariable String address
    ) {
        return ResponseEntity.ok(withdrawalService.maxWithdrawable(Chain.parse(chain), address));
    }
}
