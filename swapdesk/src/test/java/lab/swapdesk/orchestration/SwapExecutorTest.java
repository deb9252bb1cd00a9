package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapter.SignedTransaction;
import lab.swapdesk.adapter.ChainAdapter.SwapOrder;
import lab.swapdesk.adapter.ChainAdapter.UnsignedTransaction;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.common.InsufficientFundsException;
import lab.swapdesk.common.KeyDecryptionFailedException;
import lab.swapdesk.common.NoLiquidityDataException;
import lab.swapdesk.common.RpcUnavailableException;
import lab.swapdesk.common.SubmissionFailedException;
import lab.swapdesk.common.SwapCancelledException;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.custody.CustodialWallet;
import lab.swapdesk.custody.WalletHandle;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.swap.SwapDirection;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.orchestration.TransactionBroadcaster.Delivery;
import lab.swapdesk.orchestration.policy.OrderValidator;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SwapExecutorTest {

    private static final String WALLET = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    private static final long ONE_SOL = 1_000_000_000L;
    private static final long FEE = 5_000L;

    @Mock ChainAdapterRouter router;
    @Mock ChainAdapter adapter;
    @Mock ChainAdapter tonAdapter;
    @Mock QuoteRouter quoteRouter;
    @Mock CustodialWallet custodialWallet;
    @Mock AttemptService attemptService;
    @Mock TransactionBroadcaster broadcaster;
    @Mock ConfirmationTracker confirmationTracker;

    SwapExecutor executor;

    @BeforeEach
    void setUp() {
        SwapDeskProperties properties = new SwapDeskProperties();
        executor = new SwapExecutor(router, new OrderValidator(List.of()), quoteRouter,
                new GasReservePolicy(properties), custodialWallet, attemptService, broadcaster, confirmationTracker,
                properties);
        lenient().when(router.resolve(Chain.SOLANA)).thenReturn(adapter);
        lenient().when(adapter.getChain()).thenReturn(Chain.SOLANA);
        lenient().when(adapter.tokenDecimals(MINT)).thenReturn(6);
        lenient().when(quoteRouter.quote(any())).thenReturn(
                new Quote(1_000_000L, new BigDecimal("0.5"), "dexscreener", Instant.now(), null));
    }

    @Test
    void execute_buy_confirmsAndReconcilesOutputAndGas() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(2 * ONE_SOL, ONE_SOL - FEE);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L, 990_000L);
        stubBuildAndSign(ONE_SOL);
        TxAttempt attempt = stubIntent();
        when(broadcaster.broadcast(eq(adapter), any(), eq(attempt))).thenReturn(Delivery.ACKNOWLEDGED);
        when(confirmationTracker.track(adapter, attempt, false)).thenReturn(SwapOutcome.CONFIRMED);

        SwapExecution execution = execution();
        SwapResult result = executor.execute(execution, buy(new BigDecimal("1")));

        assertThat(result.outcome()).isEqualTo(SwapOutcome.CONFIRMED);
        assertThat(result.success()).isTrue();
        assertThat(result.txId()).isEqualTo("sig-1");
        assertThat(result.explorerUrl()).isEqualTo("https://solscan.io/tx/sig-1");
        assertThat(result.amountRaw()).isEqualTo(ONE_SOL);
        assertThat(result.quotedOutputRaw()).isEqualTo(1_000_000L);
        assertThat(result.minOutputRaw()).isEqualTo(950_000L);
        assertThat(result.outputAmountRaw()).isEqualTo(990_000L);
        assertThat(result.gasConsumedRaw()).isEqualTo(FEE);
        assertThat(result.submissionAttempts()).isEqualTo(1);
        assertThat(execution.getStage()).isEqualTo(SwapStage.SUBMITTED);

        verify(adapter).buildSwapTransaction(new SwapOrder(SwapDirection.NATIVE_TO_TOKEN, MINT, ONE_SOL, 950_000L, 500, WALLET));
        verify(attemptService).recordIntent("ref-1", Chain.SOLANA, Operation.SWAP_BUY, WALLET, MINT, ONE_SOL, 950_000L, "sig-1");
    }

    @Test
    void execute_buyWithoutRoomForReserve_failsBeforeAnythingIsBuilt() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(ONE_SOL + 2_000_000L);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);

        assertThatThrownBy(() -> executor.execute(execution(), buy(new BigDecimal("1"))))
                .isInstanceOfSatisfying(InsufficientFundsException.class, e -> {
                    assertThat(e.getRequiredRaw()).isEqualTo(ONE_SOL + 3_000_000L);
                    assertThat(e.getAvailableRaw()).isEqualTo(ONE_SOL + 2_000_000L);
                });
        verify(adapter, never()).buildSwapTransaction(any());
        verifyNoInteractions(custodialWallet, attemptService, broadcaster);
    }

    @Test
    void execute_noLiquidity_failsBeforeBalanceOrSigning() {
        doThrow(new NoLiquidityDataException("all providers failed")).when(quoteRouter).quote(any());

        assertThatThrownBy(() -> executor.execute(execution(), buy(new BigDecimal("1"))))
                .isInstanceOf(NoLiquidityDataException.class);
        verify(adapter, never()).getNativeBalance(anyString());
        verify(adapter, never()).buildSwapTransaction(any());
        verifyNoInteractions(custodialWallet, attemptService, broadcaster);
    }

    @Test
    void execute_tonMetadataSourceDown_failsAsNoLiquidityBeforeBalanceOrSigning() {
        String jetton = "EQCxE6mUtQJKFnGfaROTKOt1lZbDiiX1kCixRv7Nw2Id_sDs";
        when(router.resolve(Chain.TON)).thenReturn(tonAdapter);
        when(tonAdapter.tokenDecimals(jetton)).thenThrow(new RpcUnavailableException(
                "tonapi unavailable for jetton after 2 attempts", List.of("https://tonapi.test"),
                new ResourceAccessException("500 Internal Server Error")));
        SwapRequest request = new SwapRequest(Chain.TON, WalletHandle.of("EQTonWallet", "token"),
                SwapDirection.NATIVE_TO_TOKEN, jetton, new BigDecimal("1"), 500);

        assertThatThrownBy(() -> executor.execute(execution(), request))
                .isInstanceOfSatisfying(NoLiquidityDataException.class,
                        e -> assertThat(e.kind().isRetryable()).isTrue());
        verify(quoteRouter, never()).quote(any());
        verify(tonAdapter, never()).getNativeBalance(anyString());
        verify(tonAdapter, never()).buildSwapTransaction(any());
        verifyNoInteractions(custodialWallet, attemptService, broadcaster);
    }

    @Test
    void execute_sellWithoutEnoughTokens_fails() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(ONE_SOL);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(1_000_000L);

        SwapRequest sell = new SwapRequest(Chain.SOLANA, WalletHandle.of(WALLET, "token"),
                SwapDirection.TOKEN_TO_NATIVE, MINT, new BigDecimal("2"), 500);

        assertThatThrownBy(() -> executor.execute(execution(), sell))
                .isInstanceOfSatisfying(InsufficientFundsException.class,
                        e -> assertThat(e.getAsset()).isEqualTo(MINT));
        verify(adapter, never()).buildSwapTransaction(any());
    }

    @Test
    void execute_routeForwardingMoreThanTheBalance_failsBeforeSigning() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(2 * ONE_SOL);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);
        when(adapter.buildSwapTransaction(any())).thenReturn(unsigned(3 * ONE_SOL));

        assertThatThrownBy(() -> executor.execute(execution(), buy(new BigDecimal("1"))))
                .isInstanceOf(InsufficientFundsException.class);
        verifyNoInteractions(custodialWallet, attemptService);
    }

    @Test
    void execute_broadcastTimeout_isNeverResentAndEndsUnknown() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(2 * ONE_SOL);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);
        stubBuildAndSign(ONE_SOL);
        TxAttempt attempt = stubIntent();
        when(broadcaster.broadcast(eq(adapter), any(), eq(attempt))).thenReturn(Delivery.AMBIGUOUS);
        when(confirmationTracker.track(adapter, attempt, true)).thenReturn(SwapOutcome.UNKNOWN_OUTCOME);

        SwapResult result = executor.execute(execution(), buy(new BigDecimal("1")));

        assertThat(result.outcome()).isEqualTo(SwapOutcome.UNKNOWN_OUTCOME);
        assertThat(result.success()).isFalse();
        assertThat(result.txId()).isEqualTo("sig-1");
        assertThat(result.outputAmountRaw()).isNull();
        verify(broadcaster, times(1)).broadcast(any(), any(), any());
        verify(adapter, times(1)).buildSwapTransaction(any());
        verify(adapter, times(1)).getNativeBalance(WALLET);
    }

    @Test
    void execute_explicitRejection_rebuildsAndResignsUpToTheLimit() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(2 * ONE_SOL);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);
        stubBuildAndSign(ONE_SOL);
        TxAttempt attempt = stubIntent();
        when(broadcaster.broadcast(eq(adapter), any(), eq(attempt)))
                .thenThrow(new SubmissionFailedException("blockhash not found"))
                .thenReturn(Delivery.ACKNOWLEDGED);
        when(confirmationTracker.track(adapter, attempt, false)).thenReturn(SwapOutcome.SUBMITTED_UNCONFIRMED);

        SwapResult result = executor.execute(execution(), buy(new BigDecimal("1")));

        assertThat(result.outcome()).isEqualTo(SwapOutcome.SUBMITTED_UNCONFIRMED);
        assertThat(result.submissionAttempts()).isEqualTo(2);
        assertThat(result.gasConsumedRaw()).isNull();
        verify(adapter, times(2)).buildSwapTransaction(any());
        verify(custodialWallet, times(2)).sign(any(), eq(adapter), any());
    }

    @Test
    void execute_rejectedEveryTime_surfacesSubmissionFailure() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(2 * ONE_SOL);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);
        stubBuildAndSign(ONE_SOL);
        stubIntent();
        when(broadcaster.broadcast(eq(adapter), any(), any())).thenThrow(new SubmissionFailedException("rejected"));

        assertThatThrownBy(() -> executor.execute(execution(), buy(new BigDecimal("1"))))
                .isInstanceOf(SubmissionFailedException.class);
        verify(broadcaster, times(3)).broadcast(any(), any(), any());
        verifyNoInteractions(confirmationTracker);
    }

    @Test
    void execute_keyDecryptionFailure_neverReachesTheJournal() {
        when(adapter.getNativeBalance(WALLET)).thenReturn(2 * ONE_SOL);
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);
        when(adapter.buildSwapTransaction(any())).thenReturn(unsigned(ONE_SOL));
        when(custodialWallet.sign(any(), eq(adapter), any()))
                .thenThrow(new KeyDecryptionFailedException("secret token signature mismatch"));

        assertThatThrownBy(() -> executor.execute(execution(), buy(new BigDecimal("1"))))
                .isInstanceOf(KeyDecryptionFailedException.class);
        verifyNoInteractions(attemptService, broadcaster);
    }

    @Test
    void execute_reconcileFailure_keepsTheConfirmedOutcome() {
        when(adapter.getNativeBalance(WALLET))
                .thenReturn(2 * ONE_SOL)
                .thenThrow(new ResourceAccessException("rpc down"));
        when(adapter.getTokenBalance(WALLET, MINT)).thenReturn(0L);
        stubBuildAndSign(ONE_SOL);
        TxAttempt attempt = stubIntent();
        when(broadcaster.broadcast(eq(adapter), any(), eq(attempt))).thenReturn(Delivery.ACKNOWLEDGED);
        when(confirmationTracker.track(adapter, attempt, false)).thenReturn(SwapOutcome.CONFIRMED);

        SwapResult result = executor.execute(execution(), buy(new BigDecimal("1")));

        assertThat(result.outcome()).isEqualTo(SwapOutcome.CONFIRMED);
        assertThat(result.outputAmountRaw()).isNull();
        assertThat(result.gasConsumedRaw()).isNull();
    }

    @Test
    void execute_cancelledBeforeStart_stopsWithoutQuoting() {
        SwapExecution execution = execution();
        assertThat(execution.cancel()).isTrue();

        assertThatThrownBy(() -> executor.execute(execution, buy(new BigDecimal("1"))))
                .isInstanceOf(SwapCancelledException.class);
        verifyNoInteractions(quoteRouter, custodialWallet);
    }

    private void stubBuildAndSign(long value) {
        when(adapter.buildSwapTransaction(any())).thenReturn(unsigned(value));
        when(custodialWallet.sign(any(), eq(adapter), any()))
                .thenReturn(new SignedTransaction(Chain.SOLANA, "sig-1", new byte[]{1}));
    }

    private TxAttempt stubIntent() {
        TxAttempt attempt = TxAttempt.intent("ref-1", 1, Chain.SOLANA, Operation.SWAP_BUY, WALLET, MINT,
                ONE_SOL, 950_000L, "sig-1", Instant.now());
        when(attemptService.recordIntent(anyString(), any(), any(), anyString(), anyString(), anyLong(), anyLong(),
                anyString())).thenReturn(attempt);
        return attempt;
    }

    private static UnsignedTransaction unsigned(long value) {
        return new UnsignedTransaction(Chain.SOLANA, WALLET, "JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4", value,
                950_000L, 0L, new byte[]{0});
    }

    private static SwapExecution execution() {
        return new SwapExecution("ref-1", Chain.SOLANA, WALLET);
    }

    private static SwapRequest buy(BigDecimal amount) {
        return new SwapRequest(Chain.SOLANA, WalletHandle.of(WALLET, "token"), SwapDirection.NATIVE_TO_TOKEN,
                MINT, amount, 500);
    }
}
