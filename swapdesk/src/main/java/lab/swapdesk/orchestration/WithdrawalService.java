package lab.swapdesk.orchestration;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapter.SignedTransaction;
import lab.swapdesk.adapter.ChainAdapter.UnsignedTransaction;
import lab.swapdesk.adapter.ChainAdapterRouter;
import lab.swapdesk.common.Amounts;
import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.common.RpcUnavailableException;
import lab.swapdesk.common.SubmissionFailedException;
import lab.swapdesk.common.SwapException;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.custody.CustodialWallet;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lab.swapdesk.domain.txattempt.TxAttempt;
import lab.swapdesk.orchestration.TransactionBroadcaster.Delivery;
import lab.swapdesk.orchestration.policy.OrderValidator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.List;

/**
 * Native withdrawals, sharing the journal, wallet lock and confirmation tracking with swaps.
 */
@Service
@Slf4j
public class WithdrawalService {

    private final ChainAdapterRouter router;
    private final OrderValidator validator;
    private final GasReservePolicy reserves;
    private final CustodialWallet custodialWallet;
    private final AttemptService attemptService;
    private final TransactionBroadcaster broadcaster;
    private final ConfirmationTracker confirmationTracker;
    private final WalletLocks walletLocks;
    private final int maxSubmissionAttempts;

    public WithdrawalService(ChainAdapterRouter router, OrderValidator validator, GasReservePolicy reserves,
                             CustodialWallet custodialWallet, AttemptService attemptService,
                             TransactionBroadcaster broadcaster, ConfirmationTracker confirmationTracker,
                             WalletLocks walletLocks, SwapDeskProperties properties) {
        this.router = router;
        this.validator = validator;
        this.reserves = reserves;
        this.custodialWallet = custodialWallet;
        this.attemptService = attemptService;
        this.broadcaster = broadcaster;
        this.confirmationTracker = confirmationTracker;
        this.walletLocks = walletLocks;
        this.maxSubmissionAttempts = Math.max(1, properties.getExecution().getMaxSubmissionAttempts());
    }

    public WithdrawalResult withdraw(String clientReference, WithdrawalRequest request) {
        String ref = SwapService.normalizeReference(clientReference);
        ChainAdapter adapter = router.resolve(request.chain());
        validator.validate(request, adapter);
        MDC.put(SwapService.MDC_SWAP_REF_KEY, ref);
        try {
            return walletLocks.withLock(request.chain(), request.walletAddress(), () -> send(ref, request, adapter));
        } catch (RestClientException e) {
            throw new RpcUnavailableException("%s call failed: %s".formatted(request.chain(), e.getMessage()), List.of(), e);
        } finally {
            MDC.remove(SwapService.MDC_SWAP_REF_KEY);
        }
    }

    public MaxWithdrawable maxWithdrawable(Chain chain, String address) {
        ChainAdapter adapter = router.resolve(chain);
        if (address == null || !adapter.validateAddress(address)) {
            throw new InvalidInputException("INVALID_WALLET_ADDRESS: " + address + " is not a " + chain + " address");
        }
        long balance;
        try {
            balance = adapter.getNativeBalance(address);
        } catch (RestClientException e) {
            throw new RpcUnavailableException("%s balance query failed: %s".formatted(chain, e.getMessage()), List.of(), e);
        }
        long reserve = reserves.reserveRaw(chain, Operation.WITHDRAWAL);
        long max = Math.max(0L, balance - reserve);
        return new MaxWithdrawable(chain, address, balance, reserve, max,
                Amounts.toHumanUnit(max, chain.getNativeDecimals()));
    }

    private WithdrawalResult send(String ref, WithdrawalRequest request, ChainAdapter adapter) {
        Chain chain = request.chain();
        String wallet = request.walletAddress();
        long amountRaw = adapter.toSmallestUnit(request.amount());
        long reserveRaw = reserves.reserveRaw(chain, Operation.WITHDRAWAL);
        long before = adapter.getNativeBalance(wallet);
        GasReservePolicy.requireFunds(chain.getNativeSymbol(), Math.addExact(amountRaw, reserveRaw), before);
        log.info("event=withdrawal.balance_checked ref={} chain={} wallet={} amountRaw={} reserveRaw={} balanceRaw={}",
                ref, chain, wallet, amountRaw, reserveRaw, before);

        for (int attemptNo = 1; ; attemptNo++) {
            UnsignedTransaction unsigned = adapter.buildNativeTransfer(wallet, request.destination(), amountRaw,
                    request.comment());
            SignedTransaction signed = custodialWallet.sign(request.wallet(), adapter, unsigned);
            TxAttempt attempt = attemptService.recordIntent(ref, chain, Operation.WITHDRAWAL, wallet,
                    request.destination(), amountRaw, 0L, signed.txId());
            Delivery delivery;
            try {
                delivery = broadcaster.broadcast(adapter, signed, attempt);
            } catch (SubmissionFailedException e) {
                if (attemptNo >= maxSubmissionAttempts) {
                    throw e;
                }
                log.warn("event=withdrawal.submit.rejected ref={} attemptNo={} error={} next=rebuild",
                        ref, attemptNo, e.getMessage());
                continue;
            }
            SwapOutcome outcome = confirmationTracker.track(adapter, attempt, delivery == Delivery.AMBIGUOUS);
            Long gas = outcome == SwapOutcome.CONFIRMED ? gasConsumed(ref, adapter, wallet, before, amountRaw) : null;
            log.info("event=withdrawal.done ref={} txId={} outcome={} gasRaw={}", ref, signed.txId(), outcome, gas);
            return new WithdrawalResult(ref, chain, outcome, signed.txId(), chain.explorerUrl(signed.txId()),
                    amountRaw, gas);
        }
    }

    private static Long gasConsumed(String ref, ChainAdapter adapter, String wallet, long before, long amountRaw) {
        try {
            long gas = before - adapter.getNativeBalance(wallet) - amountRaw;
            return gas >= 0 ? gas : null;
        } catch (SwapException | RestClientException e) {
            log.warn("event=withdrawal.reconcile.failed ref={} error={}", ref, e.getMessage());
            return null;
        }
    }

    public record MaxWithdrawable(
            Chain chain,
            String address,
            long balanceRaw,
            long reserveRaw,
            long maxWithdrawableRaw,
            BigDecimal maxWithdrawable
    ) {
    }
}
