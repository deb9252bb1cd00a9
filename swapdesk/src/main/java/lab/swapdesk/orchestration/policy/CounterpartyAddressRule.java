package lab.swapdesk.orchestration.policy;

import lab.swapdesk.adapter.ChainAdapter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Order(40)
public class CounterpartyAddressRule implements OrderRule {

    @Override
    public RuleDecision evaluate(OrderTerms order, ChainAdapter adapter) {
        for (Map.Entry<String, String> field : order.counterpartyAddresses().entrySet()) {
            String address = field.getValue();
            if (address == null || !adapter.validateAddress(address)) {
                return RuleDecision.reject("INVALID_ADDRESS: %s=%s is not a %s address"
                        .formatted(field.getKey(), address, order.chain()));
            }
        }
        return RuleDecision.allow();
    }
}
