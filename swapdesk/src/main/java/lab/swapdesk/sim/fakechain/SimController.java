package lab.swapdesk.sim.fakechain;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.adapter.ton.TonAddress;
import lab.swapdesk.common.Amounts;
import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.custody.Ed25519KeyPair;
import lab.swapdesk.custody.SecretCodec;
import lab.swapdesk.domain.swap.Chain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Scripting surface for the simulated chains: wallets, balances, pools and broadcast outcomes.
 * Only present in mock mode.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@RequestMapping("/sim/{chain}")
@ConditionalOnProperty(prefix = "swapdesk.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class SimController {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final FakeChain fakeChain;
    private final SecretCodec secretCodec;
    private final ChainAdapterRouter chainAdapterRouter;

    public record CreateWalletRequest(BigDecimal nativeBalance) {
    }

    public record SimWallet(Chain chain, String address, String encryptedSecret, long nativeBalanceRaw) {
    }

    public record SetNativeBalance(BigDecimal amount) {
    }

    public record SetTokenBalance(long amountRaw) {
    }

    public record ListTokenRequest(String address, int decimals, BigDecimal priceNative) {
    }

    public record SimToken(Chain chain, String address, int decimals, BigDecimal priceNative) {
    }

    public record SimBalances(Chain chain, String address, long nativeBalanceRaw, String token, Long tokenBalanceRaw) {
    }

    // Random seed, encrypted with the desk's key.
    @PostMapping("/wallets")
    public ResponseEntity<SimWallet> createWallet(@PathVariable("chain") String chainName,
                                                  @RequestBody(required = false) CreateWalletRequest request) {
        Chain chain = Chain.parse(chainName);
        byte[] seed = new byte[Ed25519KeyPair.SEED_LENGTH];
        RANDOM.nextBytes(seed);
        String address;
        String encrypted;
        try (Ed25519KeyPair key = Ed25519KeyPair.fromSeed(seed)) {
            address = SimulatedChainAdapter.addressOf(chain, key.publicKey());
            encrypted = new String(secretCodec.encrypt(seed), StandardCharsets.US_ASCII);
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
        long balance = request == null || request.nativeBalance() == null
                ? 0L
                : Amounts.toSmallestUnit(request.nativeBalance(), chain.getNativeDecimals());
        fakeChain.setNativeBalance(chain, address, balance);
        log.info("event=sim.wallet.created chain={} address={} nativeRaw={}", chain, address, balance);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SimWallet(chain, address, encrypted, balance));
    }

    @PutMapping("/wallets/{address}/native")
    public SimBalances setNativeBalance(@PathVariable("chain") String chainName, @PathVariable String address,
                                        @RequestBody SetNativeBalance request) {
        Chain chain = Chain.parse(chainName);
        requireAddress(chain, address);
        fakeChain.setNativeBalance(chain, address, Amounts.toSmallestUnit(request.amount(), chain.getNativeDecimals()));
        return balances(chain, address, null);
    }

    @PutMapping("/wallets/{address}/tokens/{token}")
    public SimBalances setTokenBalance(@PathVariable("chain") String chainName, @PathVariable String address,
                                       @PathVariable String token, @RequestBody SetTokenBalance request) {
        Chain chain = Chain.parse(chainName);
        requireAddress(chain, address);
        fakeChain.setTokenBalance(chain, address, token, request.amountRaw());
        return balances(chain, address, token);
    }

    @GetMapping("/wallets/{address}")
    public SimBalances getBalances(@PathVariable("chain") String chainName, @PathVariable String address,
                                   @RequestParam(required = false) String token) {
        Chain chain = Chain.parse(chainName);
        requireAddress(chain, address);
        return balances(chain, address, token);
    }

    // Queues the outcome for the next broadcast from this wallet.
    @PostMapping("/wallets/{address}/next-outcome/{outcome}")
    public ResponseEntity<Void> scriptOutcome(@PathVariable("chain") String chainName, @PathVariable String address,
                                              @PathVariable FakeChain.NextOutcome outcome) {
        Chain chain = Chain.parse(chainName);
        requireAddress(chain, address);
        fakeChain.scriptOutcome(chain, address, outcome);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tokens")
    public ResponseEntity<SimToken> listToken(@PathVariable("chain") String chainName, @RequestBody ListTokenRequest request) {
        Chain chain = Chain.parse(chainName);
        String address = request.address() == null || request.address().isBlank()
                ? randomAddress(chain)
                : request.address().trim();
        requireAddress(chain, address);
        if (request.decimals() < 0 || request.decimals() > 18) {
            throw new InvalidInputException("token decimals must be between 0 and 18");
        }
        fakeChain.listToken(chain, address, request.decimals(), request.priceNative());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new SimToken(chain, address, request.decimals(), request.priceNative()));
    }

    private SimBalances balances(Chain chain, String address, String token) {
        Long tokenBalance = token == null ? null : fakeChain.tokenBalance(chain, address, token);
        return new SimBalances(chain, address, fakeChain.nativeBalance(chain, address), token, tokenBalance);
    }

    private void requireAddress(Chain chain, String address) {
        ChainAdapter adapter = chainAdapterRouter.resolve(chain);
        if (!adapter.validateAddress(address)) {
            throw new InvalidInputException("invalid " + chain + " address: " + address);
        }
    }

    private static String randomAddress(Chain chain) {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return chain == Chain.SOLANA
                ? SimulatedChainAdapter.addressOf(Chain.SOLANA, bytes)
                : new TonAddress(0, bytes).toUserFriendly(true, false);
    }
}
