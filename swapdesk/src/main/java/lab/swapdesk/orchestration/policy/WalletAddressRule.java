package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class WalletAddressRule implements OrderRule {

    @Override
    public RuleDecision evaluate(OrderTerms order, ChainAdapter adapter) {
        String wallet = order.walletAddress();
        if (wallet == null || !adapter.validateAddress(wallet)) {
            return RuleDecision.reject("INVALID_WALLET_ADDRESS: " + wallet + " is not a " + order.chain() + " address");
        }
        return RuleDecision.allow();
    }
}
