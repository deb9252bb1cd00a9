package lab.swapdesk.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@RestController
@RequiredArgsConstructor
@RequestMapping("/swaps")
@Slf4j
public class SwapController {

    public static final String SWAP_REFERENCE_HEADER = "Swap-Reference";

    private final SwapService swapService;

    // Runs the swap and answers with its result. A reference seen before answers with its recorded view instead.
    @PostMapping
    public ResponseEntity<?> execute(
            @RequestHeader(value = SWAP_REFERENCE_HEADER, required = false) String reference,
            @RequestBody CreateSwapRequest req
    ) {
        log.info("event=swap.execute.request chain={} direction={} asset={} amount={} slippageBps={} referencePresent={}",
                req.chain(), req.direction(), req.counterAsset(), req.amount(), req.slippageBps(), reference != null);
        Optional<SwapStatusView> recorded = recorded(reference);
        if (recorded.isPresent()) {
            log.info("event=swap.execute.replayed ref={} status={}", reference, recorded.get().status());
            return ResponseEntity.ok(recorded.get());
        }
        SwapResult result = swapService.execute(reference, req.toSwapRequest());
        log.info("event=swap.execute.response ref={} outcome={} txId={}", result.clientReference(), result.outcome(), result.txId());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/async")
    public ResponseEntity<AsyncSwapAccepted> submit(
            @RequestHeader(value = SWAP_REFERENCE_HEADER, required = false) String reference,
            @RequestBody CreateSwapRequest req
    ) {
        SwapExecution execution = swapService.submit(reference, req.toSwapRequest());
        log.info("event=swap.submit.response ref={} stage={}", execution.getClientReference(), execution.getStage());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new AsyncSwapAccepted(execution.getClientReference(), execution.getStage(),
                        "/swaps/" + execution.getClientReference()));
    }

    @GetMapping("/{reference}")
    public ResponseEntity<SwapStatusView> status(@PathVariable String reference) {
        return ResponseEntity.of(swapService.status(reference));
    }

    // Cancelling after broadcast is refused; the swap keeps running to its result.
    @PostMapping("/{reference}/cancel")
    public ResponseEntity<SwapService.CancelOutcome> cancel(@PathVariable String reference) {
        return ResponseEntity.of(swapService.cancel(reference));
    }

    @PostMapping("/{reference}/sync")
    public ResponseEntity<SwapStatusView> sync(@PathVariable String reference) {
        log.info("event=swap.sync.request ref={}", reference);
        return ResponseEntity.of(swapService.sync(reference));
    }

    private Optional<SwapStatusView> recorded(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        return swapService.status(reference.trim());
    }

    public record AsyncSwapAccepted(String clientReference, SwapStage stage, String statusPath) {
    }
}
