package lab.swapdesk.quote.provider;

import lab.swapdesk.adapter.rpc.RestClients;
import lab.swapdesk.adapter.solana.JupiterSwapClient;
import lab.swapdesk.adapter.ton.StonfiClient;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.quote.PriceProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * External price sources used in rpc mode. The router orders them by {@link PriceProvider#priority()}.
 */
@Configuration
@ConditionalOnProperty(prefix = "swapdesk.chain", name = "mode", havingValue = "rpc")
public class QuoteProviderConfig {

    @Bean
    public RestClient quoteRestClient(RestClient.Builder builder, SwapDeskProperties properties) {
        return RestClients.withTimeout(builder, properties.getQuote().getProviderTimeout());
    }

    @Bean
    public NativeUsdPriceResolver nativeUsdPriceResolver(RestClient quoteRestClient, SwapDeskProperties properties) {
        return new NativeUsdPriceResolver(quoteRestClient, properties.getQuote().getCoingeckoBaseUrl());
    }

    @Bean
    public PriceProvider dexscreenerPriceProvider(RestClient quoteRestClient, SwapDeskProperties properties,
                                                  NativeUsdPriceResolver nativeUsdPriceResolver, Clock clock) {
        return new DexscreenerPriceProvider(quoteRestClient, properties.getQuote().getDexscreenerBaseUrl(),
                nativeUsdPriceResolver, clock);
    }

    @Bean
    public PriceProvider jupiterPriceProvider(RestClient quoteRestClient, SwapDeskProperties properties, Clock clock) {
        return new JupiterPriceProvider(quoteRestClient, properties.getQuote().getJupiterPriceBaseUrl(), clock);
    }

    @Bean
    @ConditionalOnExpression("!'${swapdesk.solana.jupiter-api-key:}'.isBlank()")
    public PriceProvider jupiterQuotePriceProvider(JupiterSwapClient jupiterSwapClient, Clock clock) {
        return new JupiterQuotePriceProvider(jupiterSwapClient, clock);
    }

    @Bean
    public PriceProvider tonApiRatesPriceProvider(RestClient quoteRestClient, SwapDeskProperties properties,
                                                  Clock clock) {
        return new TonApiRatesPriceProvider(quoteRestClient, properties.getTon().getTonapiUrls().get(0),
                properties.getTon().getTonapiKey(), clock);
    }

    @Bean
    public PriceProvider stonfiSimulatePriceProvider(StonfiClient stonfiClient, SwapDeskProperties properties,
                                                     Clock clock) {
        return new StonfiSimulatePriceProvider(stonfiClient, properties.getTon().getPtonMasterAddress(), clock);
    }
}
