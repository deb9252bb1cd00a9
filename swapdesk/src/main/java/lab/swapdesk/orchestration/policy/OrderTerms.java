package lab.swapdesk.orchestration.policy;

import lab.swapdesk.domain.swap.Chain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * The request fields validation rules look at, shared by swaps and withdrawals.
 */
public interface OrderTerms {

    Chain chain();

    String walletAddress();

    BigDecimal amount();

    /** null when the operation has no slippage bound */
    Integer slippageLimitBps();

    /** Addresses the order sends to or trades against, keyed by field name. */
    Map<String, String> counterpartyAddresses();

    boolean spendsNative();
}
