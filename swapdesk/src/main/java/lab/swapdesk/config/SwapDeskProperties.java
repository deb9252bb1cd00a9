package lab.swapdesk.config;

import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Swap desk configuration. Documented in application.yml under swapdesk.
 */
@ConfigurationProperties(prefix = "swapdesk")
@Getter
@Setter
public class SwapDeskProperties {

    private ChainProperties chain = new ChainProperties();
    private SolanaProperties solana = new SolanaProperties();
    private TonProperties ton = new TonProperties();
    private QuoteProperties quote = new QuoteProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private RetryProperties retry = new RetryProperties();
    private ReserveProperties reserve = new ReserveProperties();
    private CustodyProperties custody = new CustodyProperties();
    private PolicyProperties policy = new PolicyProperties();

    @Getter
    @Setter
    public static class ChainProperties {
        /** mock: in-memory simulated chains; rpc: real Solana/TON endpoints. */
        private String mode = "mock";
    }

    @Getter
    @Setter
    public static class SolanaProperties {
        /** JSON-RPC endpoints in failover order. */
        private List<String> rpcUrls = new ArrayList<>(List.of("https://api.mainnet-beta.solana.com"));
        /** Jupiter swap API base for the free tier (quote + swap). */
        private String jupiterBaseUrl = "https://lite-api.jup.ag";
        /** Jupiter base used when an API key is configured. */
        private String jupiterProBaseUrl = "https://api.jup.ag";
        /** Optional Jupiter API key; enables the authenticated quote provider. */
        private String jupiterApiKey = "";
        /** Read timeout for RPC calls. */
        private Duration rpcTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class TonProperties {
        /** TonAPI base URLs in failover order. */
        private List<String> tonapiUrls = new ArrayList<>(List.of("https://tonapi.io"));
        /** Bearer token for TonAPI. */
        private String tonapiKey = "";
        /** STON.fi HTTP API base URL. */
        private String stonfiBaseUrl = "https://api.ston.fi";
        /** pTON master used as offer/ask address for the native side of STON.fi v2 swaps. */
        private String ptonMasterAddress = "EQBnGWMCf3-FZZq1W4IWcWiGAc3PHuZ0_H-7sad2oY00o83S";
        /** Wallet v4r2 subwallet id (698983191 + workchain on basechain). */
        private long subwalletId = 698983191L;
        /** Seconds an external message stays valid. */
        private int messageTtlSeconds = 60;
        private Duration rpcTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class QuoteProperties {
        /** Per-provider bound; a slower provider is skipped. */
        private Duration providerTimeout = Duration.ofSeconds(5);
        private String dexscreenerBaseUrl = "https://api.dexscreener.com";
        private String jupiterPriceBaseUrl = "https://lite-api.jup.ag";
        private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";
    }

    @Getter
    @Setter
    public static class ExecutionProperties {
        /** Attempts from TxBuilt onward after explicit rejections. */
        private int maxSubmissionAttempts = 3;
        private Duration confirmationTimeout = Duration.ofSeconds(30);
        private Duration confirmationPollInterval = Duration.ofSeconds(2);
        /** How long a request waits for another in-flight operation on the same wallet. */
        private Duration walletLockWait = Duration.ofSeconds(60);
        private int workerThreads = 8;
        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class RetryProperties {
        private long baseDelayMs = 250L;
        private double jitterFactor = 0.2;
        private int maxAttempts = 3;
    }

    public static class ReserveProperties {
        /** Native units withheld per chain and operation to pay network fees; bound from {@code reserve.native}. */
        private Map<Chain, Map<Operation, BigDecimal>> nativeReserves = defaults();

        public Map<Chain, Map<Operation, BigDecimal>> getNative() {
            return nativeReserves;
        }

        public void setNative(Map<Chain, Map<Operation, BigDecimal>> nativeReserves) {
            this.nativeReserves = nativeReserves;
        }

        private static Map<Chain, Map<Operation, BigDecimal>> defaults() {
            Map<Chain, Map<Operation, BigDecimal>> m = new EnumMap<>(Chain.class);
            Map<Operation, BigDecimal> solana = new EnumMap<>(Operation.class);
            solana.put(Operation.SWAP_BUY, new BigDecimal("0.003"));
            solana.put(Operation.SWAP_SELL, new BigDecimal("0.003"));
            solana.put(Operation.WITHDRAWAL, new BigDecimal("0.0001"));
            Map<Operation, BigDecimal> ton = new EnumMap<>(Operation.class);
            ton.put(Operation.SWAP_BUY, new BigDecimal("0.05"));
            ton.put(Operation.SWAP_SELL, new BigDecimal("0.3"));
            ton.put(Operation.WITHDRAWAL, new BigDecimal("0.01"));
            m.put(Chain.SOLANA, solana);
            m.put(Chain.TON, ton);
            return m;
        }
    }

    @Getter
    @Setter
    public static class CustodyProperties {
        /** Fernet key (urlsafe base64 of 32 bytes) the wallet secrets are encrypted with. */
        private String encryptionKey = "";
    }

    @Getter
    @Setter
    public static class PolicyProperties {
        /** Largest native amount one buy or withdrawal may spend, in display units. */
        private Map<Chain, BigDecimal> maxAmount = new EnumMap<>(Map.of(
                Chain.SOLANA, new BigDecimal("1000"),
                Chain.TON, new BigDecimal("100000")));
    }
}
