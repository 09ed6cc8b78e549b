package lab.reconciler.domain.ledger;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey);

    Optional<LedgerEntry> findTopByAccountIdOrderBySequenceDesc(UUID accountId);

    List<LedgerEntry> findByAccountIdOrderBySequenceAsc(UUID accountId);

    List<LedgerEntry> findByOrderIdOrderBySequenceAsc(UUID orderId);

    boolean existsByReversesEntryId(UUID reversesEntryId);
}
