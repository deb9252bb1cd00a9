package lab.swapdesk.orchestration;

import lab.swapdesk.custody.WalletHandle;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.swap.SwapDirection;
import lab.swapdesk.orchestration.policy.OrderTerms;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * @param amount      display units of the asset being spent (native on a buy, token on a sell)
 * @param slippageBps 0..10000
 */
public record SwapRequest(
        Chain chain,
        WalletHandle wallet,
        SwapDirection direction,
        String counterAsset,
        BigDecimal amount,
        int slippageBps
) implements OrderTerms {

    public Operation operation() {
        return Operation.of(direction);
    }

    @Override
    public String walletAddress() {
        return wallet == null ? null : wallet.chainAddress();
    }

    @Override
    public Integer slippageLimitBps() {
        return slippageBps;
    }

    @Override
    public Map<String, String> counterpartyAddresses() {
        return Collections.singletonMap("counterAsset", counterAsset);
    }

    @Override
    public boolean spendsNative() {
        return direction == SwapDirection.NATIVE_TO_TOKEN;
    }
}
