package lab.swapdesk.orchestration;

import lab.swapdesk.domain.swap.Chain;

public record WithdrawalResult(
        String clientReference,
        Chain chain,
        SwapOutcome outcome,
        String txId,
        String explorerUrl,
        long amountRaw,
        Long gasConsumedRaw
) {

    public boolean success() {
        return outcome.isSuccess();
    }
}
