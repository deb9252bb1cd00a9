package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.domain.swap.Chain;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Component
@Order(50)
public class MaxAmountRule implements OrderRule {

    private final Map<Chain, BigDecimal> maxNativeAmount;

    public MaxAmountRule(SwapDeskProperties properties) {
        this.maxNativeAmount = new EnumMap<>(properties.getPolicy().getMaxAmount());
    }

    @Override
    public RuleDecision evaluate(OrderTerms order, ChainAdapter adapter) {
        BigDecimal max = maxNativeAmount.get(order.chain());
        if (max != null && order.spendsNative() && order.amount().compareTo(max) > 0) {
            return RuleDecision.reject("AMOUNT_LIMIT_EXCEEDED: max=" + max + ", requested=" + order.amount());
        }
        return RuleDecision.allow();
    }
}
