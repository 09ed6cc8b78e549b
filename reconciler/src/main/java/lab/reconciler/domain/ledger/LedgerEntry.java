package lab.reconciler.domain.ledger;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger line. Every column is {@code updatable = false}; corrections are new
 * entries that reference the same order.
 */
@Entity
@Table(name = "ledger_entries",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_ledger_entry_idem", columnNames = "idempotencyKey"),
           @UniqueConstraint(name = "uk_ledger_entry_seq", columnNames = {"accountId", "sequence"})
       },
       indexes = @Index(name = "idx_ledger_entry_order", columnList = "orderId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class LedgerEntry {

    public static final String RESERVED_TAG = "reserved";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false)
    private long sequence;

    @Column(nullable = false, updatable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 8)
    private EntryDirection direction;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal balanceBefore;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal balanceAfter;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private EntryKind kind;

    @Column(updatable = false, length = 32)
    private String tag;

    /** Entry this one compensates, if any. */
    @Column(updatable = false)
    private UUID reversesEntryId;

    @Column(updatable = false, length = 256)
    private String memo;

    @Column(nullable = false, updatable = false, length = 160)
    private String idempotencyKey;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static LedgerEntry append(
            LedgerAccount account,
            UUID orderId,
            EntryDirection direction,
            BigDecimal amount,
            BigDecimal balanceBefore,
            EntryKind kind,
            String tag,
            UUID reversesEntryId,
            String memo,
            String idempotencyKey,
            Instant now) {
        return LedgerEntry.builder()
                .accountId(account.getId())
                .sequence(account.nextSequence())
                .orderId(orderId)
                .direction(direction)
                .amount(amount)
                .balanceBefore(balanceBefore)
                .balanceAfter(direction.apply(balanceBefore, amount))
                .kind(kind)
                .tag(tag)
                .reversesEntryId(reversesEntryId)
                .memo(memo)
                .idempotencyKey(idempotencyKey)
                .createdAt(now)
                .build();
    }

    public BigDecimal signedAmount() {
        return direction == EntryDirection.CREDIT ? amount : amount.negate();
    }

    public boolean isReservation() {
        return RESERVED_TAG.equals(tag);
    }
}
