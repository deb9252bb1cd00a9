package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapter.SignedTransaction;
import lab.swapdesk.adapter.ChainAdapter.SwapOrder;
import lab.swapdesk.adapter.ChainAdapter.UnsignedTransaction;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.common.NoLiquidityDataException;
import lab.swapdesk.common.RpcUnavailableException;
import lab.swapdesk.common.SubmissionFailedException;
import lab.swapdesk.common.SwapException;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.custody.CustodialWallet;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.swap.SwapDirection;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.orchestration.TransactionBroadcaster.Delivery;
import lab.swapdesk.orchestration.policy.OrderValidator;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lab.swapdesk.quote.QuoteRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Runs one swap through Validated, Quoted, BalanceChecked, TxBuilt, Signed, Submitted and Reconciled.
 * Every step before Submitted is free of side effects; the broadcast itself is journaled first and never
 * repeated after a timeout.
 */
@Component
@Slf4j
public class SwapExecutor {

    private final ChainAdapterRouter router;
    private final OrderValidator validator;
    private final QuoteRouter quoteRouter;
    private final GasReservePolicy reserves;
    private final CustodialWallet custodialWallet;
    private final AttemptService attemptService;
    private final TransactionBroadcaster broadcaster;
    private final ConfirmationTracker confirmationTracker;
    private final int maxSubmissionAttempts;

    public SwapExecutor(ChainAdapterRouter router, OrderValidator validator, QuoteRouter quoteRouter,
                        GasReservePolicy reserves, CustodialWallet custodialWallet, AttemptService attemptService,
                        TransactionBroadcaster broadcaster, ConfirmationTracker confirmationTracker,
                        SwapDeskProperties properties) {
        this.router = router;
        this.validator = validator;
        this.quoteRouter = quoteRouter;
        this.reserves = reserves;
        this.custodialWallet = custodialWallet;
        this.attemptService = attemptService;
        this.broadcaster = broadcaster;
        this.confirmationTracker = confirmationTracker;
        this.maxSubmissionAttempts = Math.max(1, properties.getExecution().getMaxSubmissionAttempts());
    }

    public SwapResult execute(SwapExecution execution, SwapRequest request) {
        ChainAdapter adapter = router.resolve(request.chain());
        validator.validate(request, adapter);
        execution.advance(SwapStage.VALIDATED);
        log.info("event=swap.stage.validated ref={} chain={} wallet={} direction={} asset={} amount={} slippageBps={}",
                execution.getClientReference(), request.chain(), request.walletAddress(), request.direction(),
                request.counterAsset(), request.amount(), request.slippageBps());
        try {
            return run(execution, request, adapter);
        } catch (RestClientException e) {
            throw new RpcUnavailableException("%s call failed: %s".formatted(request.chain(), e.getMessage()), List.of(), e);
        }
    }

    private SwapResult run(SwapExecution execution, SwapRequest request, ChainAdapter adapter) {
        String ref = execution.getClientReference();
        Chain chain = request.chain();
        Operation operation = request.operation();
        boolean buy = request.direction() == SwapDirection.NATIVE_TO_TOKEN;
        String wallet = request.walletAddress();

        int tokenDecimals = tokenDecimals(adapter, chain, request.counterAsset());
        QuoteRequest quoteRequest = QuoteRequest.of(chain, request.direction(), request.counterAsset(),
                request.amount(), tokenDecimals);
        long amountRaw = quoteRequest.amountRaw();
        Quote quote = quoteRouter.quote(quoteRequest);
        long minOutputRaw = MinOutputCalculator.minOutput(quote.outputAmountRaw(), request.slippageBps());
        execution.advance(SwapStage.QUOTED);
        log.info("event=swap.stage.quoted ref={} source={} outputRaw={} minOutputRaw={} impactPct={}",
                ref, quote.source(), quote.outputAmountRaw(), minOutputRaw, quote.priceImpactPct());

        long reserveRaw = reserves.reserveRaw(chain, operation);
        long nativeBefore = adapter.getNativeBalance(wallet);
        long tokenBefore = adapter.getTokenBalance(wallet, request.counterAsset());
        if (buy) {
            GasReservePolicy.requireFunds(chain.getNativeSymbol(), Math.addExact(amountRaw, reserveRaw), nativeBefore);
        } else {
            GasReservePolicy.requireFunds(request.counterAsset(), amountRaw, tokenBefore);
            GasReservePolicy.requireFunds(chain.getNativeSymbol(), reserveRaw, nativeBefore);
        }
        execution.advance(SwapStage.BALANCE_CHECKED);
        log.info("event=swap.stage.balance_checked ref={} nativeRaw={} tokenRaw={} reserveRaw={}",
                ref, nativeBefore, tokenBefore, reserveRaw);

        SwapOrder order = new SwapOrder(request.direction(), request.counterAsset(), amountRaw, minOutputRaw,
                request.slippageBps(), wallet);
        for (int attemptNo = 1; ; attemptNo++) {
            UnsignedTransaction unsigned = adapter.buildSwapTransaction(order);
            // The router decides the forwarded value, which can exceed the static reserve.
            GasReservePolicy.requireFunds(chain.getNativeSymbol(), unsigned.nativeValueRaw(), nativeBefore);
            execution.advance(SwapStage.TX_BUILT);
            log.info("event=swap.stage.tx_built ref={} attemptNo={} valueRaw={} routeMinOutputRaw={}",
                    ref, attemptNo, unsigned.nativeValueRaw(), unsigned.routeMinOutputRaw());

            SignedTransaction signed = custodialWallet.sign(request.wallet(), adapter, unsigned);
            execution.advance(SwapStage.SIGNED);

            execution.beginBroadcast();
            TxAttempt attempt = attemptService.recordIntent(ref, chain, operation, wallet, request.counterAsset(),
                    amountRaw, minOutputRaw, signed.txId());
            Delivery delivery;
            try {
                delivery = broadcaster.broadcast(adapter, signed, attempt);
            } catch (SubmissionFailedException e) {
                execution.broadcastRejected();
                if (attemptNo >= maxSubmissionAttempts) {
                    log.warn("event=swap.submit.gave_up ref={} attempts={} error={}", ref, attemptNo, e.getMessage());
                    throw e;
                }
                log.warn("event=swap.submit.rejected ref={} attemptNo={} error={} next=rebuild", ref, attemptNo, e.getMessage());
                continue;
            }
            execution.enter(SwapStage.SUBMITTED);
            log.info("event=swap.stage.submitted ref={} txId={} delivery={}", ref, signed.txId(), delivery);

            SwapOutcome outcome = confirmationTracker.track(adapter, attempt, delivery == Delivery.AMBIGUOUS);
            return reconcile(ref, request, adapter, signed.txId(), outcome, amountRaw, quote, minOutputRaw,
                    nativeBefore, tokenBefore, attemptNo);
        }
    }

    // Nothing is priced yet, so an unreachable metadata source means no quote can be formed.
    static int tokenDecimals(ChainAdapter adapter, Chain chain, String asset) {
        try {
            return adapter.tokenDecimals(asset);
        } catch (RpcUnavailableException | RestClientException e) {
            log.warn("event=quote.metadata_unavailable chain={} asset={} error={}", chain, asset, e.getMessage());
            throw new NoLiquidityDataException("token metadata unavailable for %s on %s".formatted(asset, chain), e);
        }
    }

    // Best effort: the transaction is already on chain, so a failure here never fails the swap.
    private SwapResult reconcile(String ref, SwapRequest request, ChainAdapter adapter, String txId, SwapOutcome outcome,
                                 long amountRaw, Quote quote, long minOutputRaw, long nativeBefore, long tokenBefore,
                                 int attempts) {
        Long output = null;
        Long gas = null;
        if (outcome == SwapOutcome.CONFIRMED || outcome == SwapOutcome.FAILED_ON_CHAIN) {
            try {
                long nativeAfter = adapter.getNativeBalance(request.walletAddress());
                if (outcome == SwapOutcome.FAILED_ON_CHAIN) {
                    gas = nonNegative(nativeBefore - nativeAfter);
                } else if (request.direction() == SwapDirection.NATIVE_TO_TOKEN) {
                    long tokenAfter = adapter.getTokenBalance(request.walletAddress(), request.counterAsset());
                    gas = nonNegative(nativeBefore - nativeAfter - amountRaw);
                    output = nonNegative(tokenAfter - tokenBefore);
                } else {
                    output = nonNegative(nativeAfter - nativeBefore);
                }
            } catch (SwapException | RestClientException e) {
                log.warn("event=swap.reconcile.failed ref={} txId={} error={}", ref, txId, e.getMessage());
            }
        }
        SwapResult result = new SwapResult(ref, request.chain(), request.operation(), outcome, txId,
                request.chain().explorerUrl(txId), amountRaw, quote.outputAmountRaw(), minOutputRaw, output, gas,
                quote.source(), quote.priceImpactPct(), attempts);
        log.info("event=swap.stage.reconciled ref={} txId={} outcome={} outputRaw={} gasRaw={}",
                ref, txId, outcome, output, gas);
        return result;
    }

    private static Long nonNegative(long value) {
        return value >= 0 ? value : null;
    }
}
