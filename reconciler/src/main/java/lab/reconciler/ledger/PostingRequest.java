package lab.reconciler.ledger;

import lab.reconciler.domain.ledger.EntryDirection;
import lab.reconciler.domain.ledger.EntryKind;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * One requested balance change. The idempotency key makes a repeated request return the
 * entry written the first time instead of posting again.
 */
public record PostingRequest(
        UUID accountId,
        UUID orderId,
        EntryDirection direction,
        BigDecimal amount,
        EntryKind kind,
        String tag,
        UUID reversesEntryId,
        String memo,
        String idempotencyKey
) {

    public PostingRequest {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("posting amount must be positive: " + amount);
        }
    }

    public static PostingRequest credit(UUID accountId, UUID orderId, BigDecimal amount, EntryKind kind, String memo, String idempotencyKey) {
        return new PostingRequest(accountId, orderId, EntryDirection.CREDIT, amount, kind, null, null, memo, idempotencyKey);
    }

    public static PostingRequest debit(UUID accountId, UUID orderId, BigDecimal amount, EntryKind kind, String tag, String memo, String idempotencyKey) {
        return new PostingRequest(accountId, orderId, EntryDirection.DEBIT, amount, kind, tag, null, memo, idempotencyKey);
    }
}
