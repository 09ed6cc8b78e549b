package lab.reconciler.ledger;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of replaying an account's entry chain. {@code firstBrokenSequence} is null when
 * every entry is consistent with its predecessor.
 */
public record LedgerVerification(
        UUID accountId,
        long entryCount,
        BigDecimal balance,
        BigDecimal signedSum,
        boolean consistent,
        Long firstBrokenSequence
) {
}
