package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class PositiveAmountRule implements OrderRule {

    @Override
    public RuleDecision evaluate(OrderTerms order, ChainAdapter adapter) {
        if (order.amount() == null || order.amount().signum() <= 0) {
            return RuleDecision.reject("AMOUNT_NOT_POSITIVE: amount=" + order.amount());
        }
        return RuleDecision.allow();
    }
}
