package lab.reconciler.domain.ledger;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Anchor row for a merchant's balance in one token. The balance itself lives only in the
 * entry chain; this row is what postings lock and it numbers the entries.
 */
@Entity
@Table(name = "ledger_accounts",
       uniqueConstraints = @UniqueConstraint(name = "uk_ledger_account_owner", columnNames = {"merchantId", "token"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class LedgerAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID merchantId;

    @Column(nullable = false, updatable = false, length = 16)
    private String token;

    @Column(nullable = false)
    private long lastSequence;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static LedgerAccount open(UUID merchantId, String token, Instant now) {
        return LedgerAccount.builder()
                .merchantId(merchantId)
                .token(token)
                .lastSequence(0)
                .createdAt(now)
                .build();
    }

    public long nextSequence() {
        return ++lastSequence;
    }
}
