package lab.reconciler.ledger;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lab.reconciler.common.IdempotencyConflictException;
import lab.reconciler.common.KeyedLocks;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.domain.ledger.EntryDirection;
import lab.reconciler.domain.ledger.EntryKind;
import lab.reconciler.domain.ledger.LedgerAccount;
import lab.reconciler.domain.ledger.LedgerAccountRepository;
import lab.reconciler.domain.ledger.LedgerEntry;
import lab.reconciler.domain.ledger.LedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single writer of ledger entries. Postings to one account are serialized by a pessimistic
 * lock on the account row, taken before the balance is read and held until the posting
 * transaction commits. Postings made inside a caller's transaction join it and keep the
 * row locked until the caller commits; standalone postings also queue on an in-JVM lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    public static final String MANUAL_TAG = "manual";

    private final LedgerAccountRepository accountRepository;
    private final LedgerEntryRepository entryRepository;
    private final TransactionTemplate transactionTemplate;
    private final EntityManager entityManager;
    private final Clock clock;
    private final KeyedLocks accountLocks = new KeyedLocks("ledger-account");

    public LedgerAccount openAccount(UUID merchantId, String token) {
        return accountLocks.withLock("open:" + merchantId + ":" + token, () -> {
            Optional<LedgerAccount> existing = accountRepository.findByMerchantIdAndToken(merchantId, token);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                LedgerAccount opened = transactionTemplate.execute(status ->
                        accountRepository.save(LedgerAccount.open(merchantId, token, clock.instant())));
                log.info("event=ledger.account.opened accountId={} merchantId={} token={}", opened.getId(), merchantId, token);
                return opened;
            } catch (DataIntegrityViolationException e) {
                // another node opened it first
                return accountRepository.findByMerchantIdAndToken(merchantId, token).orElseThrow(() -> e);
            }
        });
    }

    public LedgerEntry post(PostingRequest request) {
        return postAll(List.of(request)).get(0);
    }

    /**
     * Posts several entries to one account atomically: either all are written or none.
     * Requests whose idempotency key was already used return the stored entry.
     *
     * @throws InsufficientBalanceException if any debit would take the balance below zero
     */
    public List<LedgerEntry> postAll(List<PostingRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        UUID accountId = requests.get(0).accountId();
        if (requests.stream().anyMatch(r -> !r.accountId().equals(accountId))) {
            throw new IllegalArgumentException("postAll requires a single account");
        }

        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return appendLocked(accountId, requests);
        }
        return accountLocks.withLock(accountId.toString(), () -> {
            List<LedgerEntry> result = transactionTemplate.execute(status -> appendLocked(accountId, requests));
            if (result == null) {
                throw new IllegalStateException("ledger posting returned no result for account " + accountId);
            }
            return result;
        });
    }

    private List<LedgerEntry> appendLocked(UUID accountId, List<PostingRequest> requests) {
        LedgerAccount account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new IllegalArgumentException("ledger account not found: " + accountId));
        // the persistence context may hold this account from before the lock
        entityManager.refresh(account, LockModeType.PESSIMISTIC_WRITE);
        Instant now = clock.instant();
        BigDecimal balance = currentBalance(accountId);

        List<LedgerEntry> pending = new ArrayList<>();
        List<LedgerEntry> result = new ArrayList<>();
        for (PostingRequest request : requests) {
            Optional<LedgerEntry> replay = entryRepository.findByIdempotencyKey(request.idempotencyKey());
            if (replay.isPresent()) {
                log.info("event=ledger.post.idempotent_hit accountId={} orderId={} key={}",
                        accountId, request.orderId(), request.idempotencyKey());
                result.add(replay.get());
                continue;
            }
            BigDecimal after = request.direction().apply(balance, request.amount());
            if (after.signum() < 0) {
                log.warn("event=ledger.post.insufficient_balance accountId={} orderId={} balance={} amount={}",
                        accountId, request.orderId(), balance.toPlainString(), request.amount().toPlainString());
                throw new InsufficientBalanceException(accountId, balance, request.amount());
            }
            LedgerEntry entry = LedgerEntry.append(
                    account,
                    request.orderId(),
                    request.direction(),
                    request.amount(),
                    balance,
                    request.kind(),
                    request.tag(),
                    request.reversesEntryId(),
                    request.memo(),
                    request.idempotencyKey(),
                    now
            );
            balance = entry.getBalanceAfter();
            pending.add(entry);
            result.add(entry);
        }

        if (!pending.isEmpty()) {
            entryRepository.saveAll(pending);
            accountRepository.save(account);
            for (LedgerEntry entry : pending) {
                log.info("event=ledger.post.appended accountId={} orderId={} seq={} direction={} kind={} amount={} balanceAfter={}",
                        accountId, entry.getOrderId(), entry.getSequence(), entry.getDirection(), entry.getKind(),
                        entry.getAmount().toPlainString(), entry.getBalanceAfter().toPlainString());
            }
        }
        return result;
    }

    /**
     * Operator credit (positive amount) or debit (negative amount) of a merchant balance.
     * The entry is tagged {@value #MANUAL_TAG} and its memo names the operator and reason;
     * a repeated {@code requestId} returns the first entry.
     *
     * @throws InsufficientBalanceException if a debit would take the balance below zero
     */
    public LedgerEntry adjust(UUID merchantId, String token, BigDecimal amount, String operator, String reason, String requestId) {
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("adjustment amount must be non-zero");
        }
        if (operator == null || operator.isBlank() || reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("operator and reason are required");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("request_id is required");
        }
        LedgerAccount account = openAccount(merchantId, token);
        String memo = "manual adjustment by " + operator + ": " + reason;
        PostingRequest request = new PostingRequest(
                account.getId(),
                UUID.nameUUIDFromBytes(("adjust:" + requestId).getBytes(StandardCharsets.UTF_8)),
                amount.signum() > 0 ? EntryDirection.CREDIT : EntryDirection.DEBIT,
                amount.abs(),
                EntryKind.ADJUSTMENT,
                MANUAL_TAG,
                null,
                memo.length() <= 256 ? memo : memo.substring(0, 256),
                "adjust:" + requestId
        );
        LedgerEntry entry = post(request);
        if (!entry.getAccountId().equals(account.getId()) || entry.getDirection() != request.direction()
                || entry.getAmount().compareTo(request.amount()) != 0) {
            throw new IdempotencyConflictException("request_id already used for a different adjustment: " + requestId);
        }
        log.warn("event=ledger.adjust.done accountId={} merchantId={} token={} operator={} direction={} amount={} balanceAfter={} requestId={} reason={}",
                account.getId(), merchantId, token, operator, entry.getDirection(), entry.getAmount().toPlainString(),
                entry.getBalanceAfter().toPlainString(), requestId, reason);
        return entry;
    }

    /**
     * Writes a compensating entry for every not-yet-reversed entry of the order. Calling it
     * twice writes nothing the second time.
     */
    public List<LedgerEntry> reverseOrder(UUID orderId, String reason) {
        List<LedgerEntry> originals = entryRepository.findByOrderIdOrderBySequenceAsc(orderId).stream()
                .filter(entry -> entry.getReversesEntryId() == null)
                .filter(entry -> !entryRepository.existsByReversesEntryId(entry.getId()))
                .toList();
        if (originals.isEmpty()) {
            return List.of();
        }

        List<PostingRequest> compensations = originals.stream()
                .map(entry -> new PostingRequest(
                        entry.getAccountId(),
                        orderId,
                        entry.getDirection().opposite(),
                        entry.getAmount(),
                        EntryKind.ADJUSTMENT,
                        null,
                        entry.getId(),
                        "reversal of " + entry.getKind() + ": " + reason,
                        "reversal:" + entry.getId()
                ))
                .toList();
        List<LedgerEntry> written = postAll(compensations);
        log.info("event=ledger.reverse.done orderId={} entries={} reason={}", orderId, written.size(), reason);
        return written;
    }

    @Transactional(readOnly = true)
    public boolean hasOpenReservation(UUID orderId) {
        List<LedgerEntry> entries = entryRepository.findByOrderIdOrderBySequenceAsc(orderId);
        return entries.stream()
                .filter(LedgerEntry::isReservation)
                .anyMatch(entry -> entries.stream().noneMatch(other -> entry.getId().equals(other.getReversesEntryId())));
    }

    @Transactional(readOnly = true)
    public BigDecimal balanceOf(UUID accountId) {
        return currentBalance(accountId);
    }

    @Transactional(readOnly = true)
    public BigDecimal balanceOf(UUID merchantId, String token) {
        return accountRepository.findByMerchantIdAndToken(merchantId, token)
                .map(account -> currentBalance(account.getId()))
                .orElse(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForOrder(UUID orderId) {
        return entryRepository.findByOrderIdOrderBySequenceAsc(orderId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForAccount(UUID accountId) {
        return entryRepository.findByAccountIdOrderBySequenceAsc(accountId);
    }

    /**
     * Replays the entry chain of an account and checks each link.
     */
    @Transactional(readOnly = true)
    public LedgerVerification verify(UUID accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw new NotFoundException("ledger account not found: " + accountId);
        }
        List<LedgerEntry> entries = entryRepository.findByAccountIdOrderBySequenceAsc(accountId);
        BigDecimal running = BigDecimal.ZERO;
        Long broken = null;
        for (LedgerEntry entry : entries) {
            boolean linked = entry.getBalanceBefore().compareTo(running) == 0;
            boolean arithmetic = entry.getDirection().apply(entry.getBalanceBefore(), entry.getAmount())
                    .compareTo(entry.getBalanceAfter()) == 0;
            if (broken == null && (!linked || !arithmetic || entry.getBalanceAfter().signum() < 0)) {
                broken = entry.getSequence();
            }
            running = running.add(entry.signedAmount());
        }
        BigDecimal balance = currentBalance(accountId);
        boolean consistent = broken == null && running.compareTo(balance) == 0;
        return new LedgerVerification(accountId, entries.size(), balance, running, consistent, broken);
    }

    private BigDecimal currentBalance(UUID accountId) {
        return entryRepository.findTopByAccountIdOrderBySequenceDesc(accountId)
                .map(LedgerEntry::getBalanceAfter)
                .orElse(BigDecimal.ZERO);
    }
}
