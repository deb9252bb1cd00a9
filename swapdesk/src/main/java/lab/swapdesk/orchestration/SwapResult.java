package lab.swapdesk.orchestration;

import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;

import java.math.BigDecimal;

/**
 * Result of a swap whose transaction reached the network.
 *
 * @param outputAmountRaw token received on a buy, net native received on a sell; null when unknown
 * @param gasConsumedRaw  native spent beyond the swapped amount on a buy; null when unknown
 */
public record SwapResult(
        String clientReference,
        Chain chain,
        Operation operation,
        SwapOutcome outcome,
        String txId,
        String explorerUrl,
        long amountRaw,
        long quotedOutputRaw,
        long minOutputRaw,
        Long outputAmountRaw,
        Long gasConsumedRaw,
        String quoteSource,
        BigDecimal priceImpactPct,
        int submissionAttempts
) {

    public boolean success() {
        return outcome.isSuccess();
    }
}
