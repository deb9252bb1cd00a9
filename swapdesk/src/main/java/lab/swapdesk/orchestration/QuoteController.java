package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lab.swapdesk.quote.QuoteRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequiredArgsConstructor
@Slf4j
public class QuoteController {

    private final ChainAdapterRouter router;
    private final QuoteRouter quoteRouter;

    // Read-only price check; slippage is applied so the caller sees the minimum the swap would enforce.
    @PostMapping("/quotes")
    public ResponseEntity<QuoteResponse> quote(@RequestBody QuoteQuery query) {
        Chain chain = Chain.parse(query.chain());
        SwapDirection direction = SwapDirection.parse(query.direction());
        ChainAdapter adapter = router.resolve(chain);
        if (query.counterAsset() == null || !adapter.validateAddress(query.counterAsset())) {
            throw new InvalidInputException("INVALID_ADDRESS: counterAsset=" + query.counterAsset() + " is not a " + chain + " address");
        }
        if (query.amount() == null || query.amount().signum() <= 0) {
            throw new InvalidInputException("AMOUNT_NOT_POSITIVE: amount=" + query.amount());
        }
        int slippageBps = query.slippageBps() == null ? CreateSwapRequest.DEFAULT_SLIPPAGE_BPS : query.slippageBps();
        int decimals = SwapExecutor.tokenDecimals(adapter, chain, query.counterAsset());
        QuoteRequest request = QuoteRequest.of(chain, direction, query.counterAsset(), query.amount(), decimals);
        Quote quote = quoteRouter.quote(request);
        long minOutputRaw = MinOutputCalculator.minOutput(quote.outputAmountRaw(), slippageBps);
        log.info("event=quote.response chain={} asset={} source={} outputRaw={}",
                chain, query.counterAsset(), quote.source(), quote.outputAmountRaw());
        return ResponseEntity.ok(new QuoteResponse(chain, direction, query.counterAsset(), request.amountRaw(),
                quote, request.outputDecimals(), minOutputRaw));
    }

    public record QuoteQuery(String chain, String direction, String counterAsset, BigDecimal amount, Integer slippageBps) {
    }

    public record QuoteResponse(
            Chain chain,
            SwapDirection direction,
            String counterAsset,
            long amountRaw,
            Quote quote,
            int outputDecimals,
            long minOutputRaw
    ) {
    }
}
