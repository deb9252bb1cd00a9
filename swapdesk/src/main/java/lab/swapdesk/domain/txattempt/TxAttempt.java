package lab.swapdesk.domain.txattempt;

import jakarta.persistence.*;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.Operation;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tx_attempts",
       uniqueConstraints = @UniqueConstraint(name = "uk_attempt_ref_no", columnNames = {"clientReference", "attemptNo"}),
       indexes = {
           @Index(name = "idx_attempt_reference", columnList = "clientReference"),
           @Index(name = "idx_attempt_txid", columnList = "txId")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TxAttempt {

    private static final int DETAIL_LENGTH = 200;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 64)
    private String clientReference;

    @Column(nullable = false)
    private int attemptNo; // 1..N per reference

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Chain chain;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Operation operation;

    @Column(nullable = false, length = 80)
    private String walletAddress;

    // token for swaps, recipient for withdrawals
    @Column(length = 80)
    private String counterparty;

    @Column(nullable = false)
    private long amountRaw;

    @Column(nullable = false)
    private long minOutputRaw;

    @Column(length = 100)
    private String txId; // known before broadcast on both chains

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TxAttemptStatus status;

    @Column(length = DETAIL_LENGTH)
    private String detail;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static TxAttempt intent(String clientReference, int attemptNo, Chain chain, Operation operation,
                                   String walletAddress, String counterparty, long amountRaw, long minOutputRaw,
                                   String txId, Instant now) {
        return TxAttempt.builder()
                .clientReference(clientReference)
                .attemptNo(attemptNo)
                .chain(chain)
                .operation(operation)
                .walletAddress(walletAddress)
                .counterparty(counterparty)
                .amountRaw(amountRaw)
                .minOutputRaw(minOutputRaw)
                .txId(txId)
                .status(TxAttemptStatus.INTENT_RECORDED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    // Cancelled before anything was signed for broadcast; kept so the reference stays queryable.
    public static TxAttempt cancelled(String clientReference, int attemptNo, Chain chain, Operation operation,
                                      String walletAddress, String counterparty, long amountRaw, Instant now) {
        return TxAttempt.builder()
                .clientReference(clientReference)
                .attemptNo(attemptNo)
                .chain(chain)
                .operation(operation)
                .walletAddress(walletAddress)
                .counterparty(counterparty)
                .amountRaw(amountRaw)
                .status(TxAttemptStatus.CANCELLED)
                .detail("cancelled before broadcast")
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void transitionTo(TxAttemptStatus next, String detail, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("attempt %s is already %s".formatted(id, status));
        }
        this.status = next;
        if (detail != null) {
            this.detail = detail.length() > DETAIL_LENGTH ? detail.substring(0, DETAIL_LENGTH) : detail;
        }
        this.updatedAt = now;
    }
}
