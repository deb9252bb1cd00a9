package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.common.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the rules in order; the first rejection wins.
 */
@Component
@Slf4j
public class OrderValidator {

    private final List<OrderRule> rules;

    public OrderValidator(List<OrderRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public void validate(OrderTerms order, ChainAdapter adapter) {
        if (order.chain() == null) {
            throw new InvalidInputException("chain is required");
        }
        for (OrderRule rule : rules) {
            RuleDecision decision = rule.evaluate(order, adapter);
            if (!decision.allowed()) {
                log.info("event=order.validation.rejected chain={} wallet={} rule={} reason={}",
                        order.chain(), order.walletAddress(), rule.getClass().getSimpleName(), decision.reason());
                throw new InvalidInputException(decision.reason());
            }
        }
    }
}
