package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.orchestration.MinOutputCalculator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
public class SlippageRangeRule implements OrderRule {

    @Override
    public RuleDecision evaluate(OrderTerms order, ChainAdapter adapter) {
        Integer bps = order.slippageLimitBps();
        if (bps != null && (bps < 0 || bps > MinOutputCalculator.MAX_SLIPPAGE_BPS)) {
            return RuleDecision.reject("SLIPPAGE_OUT_OF_RANGE: slippageBps=" + bps + ", allowed=0..10000");
        }
        return RuleDecision.allow();
    }
}
