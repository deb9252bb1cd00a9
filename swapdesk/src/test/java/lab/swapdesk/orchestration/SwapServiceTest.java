package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.common.NoLiquidityDataException;
import lab.swapdesk.common.SwapCancelledException;
import lab.swapdesk.custody.WalletHandle;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.swap.SwapDirection;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.domain.txattempt.TxAttemptStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SwapServiceTest {

    private static final String WALLET = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    @Mock SwapExecutor swapExecutor;
    @Mock AttemptService attemptService;
    @Mock ConfirmationTracker confirmationTracker;
    @Mock ChainAdapterRouter router;
    @Mock ChainAdapter adapter;

    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    SwapService swapService;

    @BeforeEach
    void setUp() {
        swapService = new SwapService(swapExecutor, attemptService, confirmationTracker, router,
                new WalletLocks(Duration.ofSeconds(2)), workers);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void execute_returnsResultAndForgetsTheReference() {
        SwapResult expected = result("ref-1");
        when(swapExecutor.execute(any(), eq(request()))).thenReturn(expected);

        SwapResult result = swapService.execute("ref-1", request());

        assertThat(result).isEqualTo(expected);
        assertThat(swapService.find("ref-1")).isEmpty();
    }

    @Test
    void submit_sameReferenceWhileRunning_joinsTheRunningSwap() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(swapExecutor.execute(any(), any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return result("ref-2");
        });

        SwapExecution first = swapService.submit("ref-2", request());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        SwapExecution second = swapService.submit("ref-2", request());
        release.countDown();

        assertThat(second).isSameAs(first);
        assertThat(SwapService.await(second).clientReference()).isEqualTo("ref-2");
        verify(swapExecutor, times(1)).execute(any(), any());
    }

    @Test
    void cancel_beforeBroadcast_stopsAtNextStageAndJournalsTheCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(swapExecutor.execute(any(), any())).thenAnswer(inv -> {
            SwapExecution execution = inv.getArgument(0);
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            execution.advance(SwapStage.VALIDATED);
            return result("ref-3");
        });

        SwapExecution execution = swapService.submit("ref-3", request());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        SwapService.CancelOutcome outcome = swapService.cancel("ref-3").orElseThrow();
        release.countDown();

        assertThat(outcome.cancelled()).isTrue();
        assertThatThrownBy(() -> SwapService.await(execution)).isInstanceOf(SwapCancelledException.class);
        assertThat(execution.getStage()).isEqualTo(SwapStage.CANCELLED);
        verify(attemptService).recordCancelled("ref-3", Chain.SOLANA, Operation.SWAP_BUY, WALLET, MINT, 0L);
    }

    @Test
    void cancel_afterBroadcastBegan_isRefused() {
        SwapExecution execution = new SwapExecution("ref-4", Chain.SOLANA, WALLET);
        execution.beginBroadcast();

        assertThat(execution.cancel()).isFalse();
        assertThat(execution.isCancelRequested()).isFalse();
    }

    @Test
    void cancel_unknownOrFinishedReference() {
        when(attemptService.isRecorded("gone")).thenReturn(true);
        when(attemptService.isRecorded("never")).thenReturn(false);

        assertThat(swapService.cancel("gone")).hasValueSatisfying(o -> assertThat(o.cancelled()).isFalse());
        assertThat(swapService.cancel("never")).isEmpty();
    }

    @Test
    void execute_failure_surfacesTheTypedError() {
        when(swapExecutor.execute(any(), any())).thenThrow(new NoLiquidityDataException("no quote"));

        assertThatThrownBy(() -> swapService.execute("ref-5", request()))
                .isInstanceOf(NoLiquidityDataException.class)
                .hasMessage("no quote");
        verify(attemptService, never()).recordCancelled(any(), any(), any(), any(), any(), eq(0L));
    }

    @Test
    void sync_refreshesOnlyAttemptsStillWaitingOnTheChain() {
        TxAttempt attempt = TxAttempt.intent("ref-6", 1, Chain.SOLANA, Operation.SWAP_BUY, WALLET, MINT,
                1L, 1L, "sig", Instant.now());
        when(attemptService.listAttempts("ref-6")).thenReturn(List.of(attempt));
        when(router.resolve(Chain.SOLANA)).thenReturn(adapter);

        assertThat(swapService.sync("ref-6")).isPresent();
        verifyNoInteractions(confirmationTracker);

        attempt.transitionTo(TxAttemptStatus.OUTCOME_UNKNOWN, null, Instant.now());
        swapService.sync("ref-6");
        verify(confirmationTracker).refresh(adapter, attempt);
    }

    @Test
    void normalizeReference_generatesOrBoundsTheReference() {
        assertThat(UUID.fromString(SwapService.normalizeReference(" "))).isNotNull();
        assertThat(SwapService.normalizeReference(" abc ")).isEqualTo("abc");
        assertThatThrownBy(() -> SwapService.normalizeReference("x".repeat(65)))
                .isInstanceOf(InvalidInputException.class);
    }

    private static SwapRequest request() {
        return new SwapRequest(Chain.SOLANA, WalletHandle.of(WALLET, "token"), SwapDirection.NATIVE_TO_TOKEN,
                MINT, new BigDecimal("0.1"), 500);
    }

    private static SwapResult result(String ref) {
        return new SwapResult(ref, Chain.SOLANA, Operation.SWAP_BUY, SwapOutcome.CONFIRMED, "sig",
                Chain.SOLANA.explorerUrl("sig"), 100_000_000L, 1_000L, 950L, 990L, 5_000L, "simulated", null, 1);
    }
}
