package lab.swapdesk.sim.fakechain;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.quote.PriceProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "swapdesk.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockChainConfig {

    @Bean
    public FakeChain fakeChain() {
        return new FakeChain();
    }

    @Bean
    public ChainAdapter simulatedSolanaAdapter(FakeChain fakeChain) {
        return new SimulatedChainAdapter(Chain.SOLANA, fakeChain);
    }

    @Bean
    public ChainAdapter simulatedTonAdapter(FakeChain fakeChain) {
        return new SimulatedChainAdapter(Chain.TON, fakeChain);
    }

    @Bean
    public PriceProvider simulatedPriceProvider(FakeChain fakeChain, Clock clock) {
        return new SimulatedPriceProvider(fakeChain, clock);
    }
}
