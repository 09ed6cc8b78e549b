package lab.reconciler.api;

import lab.reconciler.common.Amounts;
import lab.reconciler.domain.ledger.LedgerEntry;

import java.time.Instant;
import java.util.UUID;

public record LedgerEntryResponse(
        UUID id,
        UUID accountId,
        long sequence,
        String direction,
        String kind,
        String tag,
        String amount,
        String balanceBefore,
        String balanceAfter,
        String memo,
        Instant createdAt
) {

    static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(
                entry.getId(),
                entry.getAccountId(),
                entry.getSequence(),
                entry.getDirection().name(),
                entry.getKind().name(),
                entry.getTag(),
                Amounts.format(entry.getAmount()),
                Amounts.format(entry.getBalanceBefore()),
                Amounts.format(entry.getBalanceAfter()),
                entry.getMemo(),
                entry.getCreatedAt()
        );
    }
}
