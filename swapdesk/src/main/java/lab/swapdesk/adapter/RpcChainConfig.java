package lab.swapdesk.adapter;

import lab.swapdesk.adapter.rpc.RestClients;
import lab.swapdesk.adapter.rpc.RetryPolicy;
import lab.swapdesk.adapter.rpc.RpcEndpointRotator;
import lab.swapdesk.adapter.solana.JupiterSwapClient;
import lab.swapdesk.adapter.solana.SolanaAdapter;
import lab.swapdesk.adapter.solana.SolanaRpcClient;
import lab.swapdesk.adapter.ton.StonfiClient;
import lab.swapdesk.adapter.ton.TonAdapter;
import lab.swapdesk.adapter.ton.TonApiClient;
import lab.swapdesk.config.SwapDeskProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;

@Configuration
@ConditionalOnProperty(prefix = "swapdesk.chain", name = "mode", havingValue = "rpc")
public class RpcChainConfig {

    @Bean
    public RetryPolicy rpcRetryPolicy(SwapDeskProperties properties) {
        SwapDeskProperties.RetryProperties retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(RestClient.Builder builder, SwapDeskProperties properties,
                                           RetryPolicy rpcRetryPolicy) {
        SwapDeskProperties.SolanaProperties solana = properties.getSolana();
        return new SolanaRpcClient(
                RestClients.withTimeout(builder, solana.getRpcTimeout()),
                new RpcEndpointRotator("solana-rpc", solana.getRpcUrls(), rpcRetryPolicy));
    }

    @Bean
    public JupiterSwapClient jupiterSwapClient(RestClient.Builder builder, SwapDeskProperties properties,
                                               RetryPolicy rpcRetryPolicy) {
        SwapDeskProperties.SolanaProperties solana = properties.getSolana();
        boolean keyed = solana.getJupiterApiKey() != null && !solana.getJupiterApiKey().isBlank();
        String base = keyed ? solana.getJupiterProBaseUrl() : solana.getJupiterBaseUrl();
        return new JupiterSwapClient(
                RestClients.withTimeout(builder, solana.getRpcTimeout()),
                new RpcEndpointRotator("jupiter", List.of(base), rpcRetryPolicy),
                solana.getJupiterApiKey());
    }

    @Bean
    public ChainAdapter solanaAdapter(SolanaRpcClient solanaRpcClient, JupiterSwapClient jupiterSwapClient) {
        return new SolanaAdapter(solanaRpcClient, jupiterSwapClient);
    }

    @Bean
    public TonApiClient tonApiClient(RestClient.Builder builder, SwapDeskProperties properties,
                                     RetryPolicy rpcRetryPolicy) {
        SwapDeskProperties.TonProperties ton = properties.getTon();
        return new TonApiClient(
                RestClients.withTimeout(builder, ton.getRpcTimeout()),
                new RpcEndpointRotator("tonapi", ton.getTonapiUrls(), rpcRetryPolicy),
                ton.getTonapiKey());
    }

    @Bean
    public StonfiClient stonfiClient(RestClient.Builder builder, SwapDeskProperties properties,
                                     RetryPolicy rpcRetryPolicy) {
        SwapDeskProperties.TonProperties ton = properties.getTon();
        return new StonfiClient(
                RestClients.withTimeout(builder, ton.getRpcTimeout()),
                new RpcEndpointRotator("stonfi", List.of(ton.getStonfiBaseUrl()), rpcRetryPolicy));
    }

    @Bean
    public ChainAdapter tonAdapter(TonApiClient tonApiClient, StonfiClient stonfiClient,
                                   SwapDeskProperties properties, Clock clock) {
        SwapDeskProperties.TonProperties ton = properties.getTon();
        return new TonAdapter(tonApiClient, stonfiClient, ton.getPtonMasterAddress(), ton.getSubwalletId(),
                ton.getMessageTtlSeconds(), clock);
    }
}
