package lab.swapdesk.orchestration;

import lab.swapdesk.custody.WalletHandle;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.orchestration.policy.OrderTerms;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * Native transfer out of a custodial wallet.
 *
 * @param comment optional text comment (TON only, ignored on Solana)
 */
public record WithdrawalRequest(
        Chain chain,
        WalletHandle wallet,
        String destination,
        BigDecimal amount,
        String comment
) implements OrderTerms {

    @Override
    public String walletAddress() {
        return wallet == null ? null : wallet.chainAddress();
    }

    @Override
    public Integer slippageLimitBps() {
        return null;
    }

    @Override
    public Map<String, String> counterpartyAddresses() {
        return Collections.singletonMap("destination", destination);
    }

    @Override
    public boolean spendsNative() {
        return true;
    }
}
