package lab.swapdesk.adapter;

import lab.swapdesk.domain.swap.Chain;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ChainAdapterRouter {

    private final Map<Chain, ChainAdapter> adaptersByChain;

    // Build an immutable routing table once at startup and fail fast if two adapters claim the same chain.
    public ChainAdapterRouter(List<ChainAdapter> adapters) {
        this.adaptersByChain = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ChainAdapter::getChain,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple adapters found for chain: " + left.getChain());
                        }
                ));
    }

    public ChainAdapter resolve(Chain chain) {
        return Optional.ofNullable(adaptersByChain.get(chain))
                .orElseThrow(() -> new IllegalArgumentException("No adapter for chain: " + chain));
    }
}
