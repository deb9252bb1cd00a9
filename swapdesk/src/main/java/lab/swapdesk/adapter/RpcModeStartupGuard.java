package lab.swapdesk.adapter;

import jakarta.annotation.PostConstruct;
import lab.swapdesk.config.SwapDeskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "swapdesk.chain", name = "mode", havingValue = "rpc")
public class RpcModeStartupGuard {

    private final SwapDeskProperties properties;

    @PostConstruct
    void validate() {
        requireEndpoints("swapdesk.solana.rpc-urls", properties.getSolana().getRpcUrls());
        requireEndpoints("swapdesk.ton.tonapi-urls", properties.getTon().getTonapiUrls());
        requireText("swapdesk.solana.jupiter-base-url", properties.getSolana().getJupiterBaseUrl());
        requireText("swapdesk.ton.stonfi-base-url", properties.getTon().getStonfiBaseUrl());
        requireText("swapdesk.ton.pton-master-address", properties.getTon().getPtonMasterAddress());
        if (properties.getTon().getTonapiKey() == null || properties.getTon().getTonapiKey().isBlank()) {
            log.warn("event=startup.tonapi.anonymous message=TonAPI calls run without a key and are heavily rate limited");
        }
        log.info("event=startup.rpc_mode solanaEndpoints={} tonapiEndpoints={}",
                properties.getSolana().getRpcUrls().size(), properties.getTon().getTonapiUrls().size());
    }

    private static void requireEndpoints(String property, List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty() || endpoints.stream().anyMatch(e -> e == null || e.isBlank())) {
            throw new IllegalStateException(property + " must list at least one endpoint in rpc mode");
        }
    }

    private static void requireText(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must be configured in rpc mode");
        }
    }
}
