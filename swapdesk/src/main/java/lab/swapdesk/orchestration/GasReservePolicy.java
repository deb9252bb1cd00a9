package lab.swapdesk.orchestration;

import lab.swapdesk.common.Amounts;
import lab.swapdesk.common.InsufficientFundsException;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Native amount withheld per chain and operation so the network fee can always be paid.
 */
@Component
@Slf4j
public class GasReservePolicy {

    private final Map<Chain, Map<Operation, Long>> reservesRaw = new EnumMap<>(Chain.class);

    public GasReservePolicy(SwapDeskProperties properties) {
        Map<Chain, Map<Operation, BigDecimal>> configured = properties.getReserve().getNative();
        for (Chain chain : Chain.values()) {
            Map<Operation, Long> perOperation = new EnumMap<>(Operation.class);
            for (Operation operation : Operation.values()) {
                BigDecimal human = configured.getOrDefault(chain, Map.of()).get(operation);
                if (human == null || human.signum() < 0) {
                    throw new IllegalStateException("swapdesk.reserve.native.%s.%s must be configured and non-negative"
                            .formatted(chain, operation));
                }
                perOperation.put(operation, Amounts.toSmallestUnit(human, chain.getNativeDecimals()));
            }
            reservesRaw.put(chain, perOperation);
            log.info("event=gas_reserve.configured chain={} reservesRaw={}", chain, perOperation);
        }
    }

    public long reserveRaw(Chain chain, Operation operation) {
        return reservesRaw.get(chain).get(operation);
    }

    static void requireFunds(String asset, long requiredRaw, long availableRaw) {
        if (availableRaw < requiredRaw) {
            throw new InsufficientFundsException(asset, requiredRaw, availableRaw);
        }
    }
}
