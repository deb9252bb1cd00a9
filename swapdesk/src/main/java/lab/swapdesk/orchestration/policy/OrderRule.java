package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;

/**
 * A local check on an order. Rules never perform I/O.
 */
public interface OrderRule {
    RuleDecision evaluate(OrderTerms order, ChainAdapter adapter);
}
