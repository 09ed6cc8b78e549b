package lab.reconciler.sweep;

import lab.reconciler.adapter.BroadcastRejectedException;
import lab.reconciler.adapter.ChainAdapter;
import lab.reconciler.adapter.ChainAdapter.SignedTransfer;
import lab.reconciler.adapter.ChainAdapter.TransferCommand;
import lab.reconciler.adapter.ChainAdapter.TxObservation;
import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.adapter.RpcUnavailableException;
import lab.reconciler.common.KeyedLocks;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.address.DepositAddress;
import lab.reconciler.domain.address.DepositAddressRepository;
import lab.reconciler.domain.collect.CollectTask;
import lab.reconciler.domain.collect.CollectTaskRepository;
import lab.reconciler.domain.collect.CollectTaskStatus;
import lab.reconciler.domain.collect.CollectTaskType;
import lab.reconciler.orchestration.DepositAddressService;
import lab.reconciler.security.HotWalletDirectory;
import lab.reconciler.security.KeyVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Consolidates deposit address balances into the chain's collection address. Addresses
 * short of gas get a top-up from the hot wallet first, and the collect is planned once the
 * top-up is confirmed. Sweeping moves custody only and never touches the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SweepService {

    private static final EnumSet<CollectTaskStatus> IN_FLIGHT = EnumSet.of(CollectTaskStatus.PENDING, CollectTaskStatus.PROCESSING);

    private final CollectTaskRepository taskRepository;
    private final DepositAddressRepository addressRepository;
    private final DepositAddressService addressService;
    private final ChainAdapterRouter router;
    private final HotWalletDirectory hotWallets;
    private final KeyVault keyVault;
    private final ReconcilerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks chainLocks = new KeyedLocks("sweep");

    public record SweepResult(String chain, int confirmed, int planned, int broadcast, int failed) {}

    /** What one execution attempt achieved. {@code UNKNOWN} waits for reconciliation. */
    enum Attempt {
        BROADCAST,
        UNKNOWN,
        FAILED
    }

    public SweepResult runOnce(String chain) {
        String code = chain.toUpperCase(Locale.ROOT);
        return chainLocks.withLock(code, () -> {
            int[] settled = reconcileInFlight(code);
            int planned = plan(code);
            int[] attempts = executeDue(code);
            SweepResult result = new SweepResult(code, settled[0], planned, attempts[0], settled[1] + attempts[1]);
            if (result.confirmed() > 0 || planned > 0 || result.broadcast() > 0 || result.failed() > 0) {
                log.info("event=sweep.run.done chain={} confirmed={} planned={} broadcast={} failed={}",
                        code, result.confirmed(), planned, result.broadcast(), result.failed());
            }
            return result;
        });
    }

    /**
     * Creates at most {@code batchSize} new tasks: a top-up for addresses lacking gas, a
     * collect task for the rest. Addresses with an in-flight or skipped task are left alone.
     */
    int plan(String chain) {
        ReconcilerProperties.ChainEntry config = properties.chain(chain);
        ReconcilerProperties.Sweep sweep = config.getSweep();
        ChainAdapter adapter = router.resolve(chain);
        int created = 0;

        for (DepositAddress address : addressService.scannable(chain)) {
            if (created >= sweep.getBatchSize()) {
                break;
            }
            if (taskRepository.existsByChainAndSourceAddressAndStatusIn(chain, address.getAddress(), IN_FLIGHT)
                    || taskRepository.existsByChainAndSourceAddressAndStatus(chain, address.getAddress(), CollectTaskStatus.SKIPPED)) {
                continue;
            }
            try {
                Optional<CollectTask> task = planFor(address, config, adapter);
                if (task.isPresent()) {
                    CollectTask saved = transactionTemplate.execute(status -> taskRepository.save(task.get()));
                    created++;
                    log.info("event=sweep.task.planned chain={} type={} address={} token={} amount={} taskId={}",
                            chain, saved.getType(), address.getAddress(), saved.getToken(), saved.getAmount().toPlainString(), saved.getId());
                }
            } catch (RpcUnavailableException e) {
                log.warn("event=sweep.plan.rpc_unavailable chain={} address={} error={}", chain, address.getAddress(), e.getMessage());
                return created;
            }
        }
        return created;
    }

    private Optional<CollectTask> planFor(DepositAddress address, ReconcilerProperties.ChainEntry config, ChainAdapter adapter) {
        ReconcilerProperties.Sweep sweep = config.getSweep();
        BigDecimal balance = adapter.balance(address.getAddress(), address.getToken());
        if (balance.compareTo(sweep.getMinAmount()) < 0) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        BigDecimal gasNeeded = adapter.estimateFee(address.getToken()).multiply(sweep.getGasReserveMultiplier());
        String collection = hotWallets.collectionAddress(address.getChain());

        if (config.isNative(address.getToken())) {
            BigDecimal movable = balance.subtract(gasNeeded);
            if (movable.signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(CollectTask.collect(address.getChain(), address.getToken(), address.getAddress(), collection, movable, now, now));
        }

        BigDecimal nativeBalance = adapter.balance(address.getAddress(), config.getNativeSymbol());
        if (nativeBalance.compareTo(gasNeeded) < 0) {
            BigDecimal topUp = sweep.getGasTopUpAmount().max(gasNeeded.subtract(nativeBalance));
            return Optional.of(CollectTask.gasTopUp(address.getChain(), config.getNativeSymbol(),
                    hotWallets.hotWallet(address.getChain()).address(), address.getAddress(), topUp, now));
        }
        return Optional.of(CollectTask.collect(address.getChain(), address.getToken(), address.getAddress(), collection, balance, now, now));
    }

    // {broadcast, failed}
    private int[] executeDue(String chain) {
        int batchSize = properties.chain(chain).getSweep().getBatchSize();
        List<CollectTask> due = taskRepository.findDue(chain, clock.instant(), PageRequest.of(0, batchSize));
        int broadcast = 0;
        int failed = 0;
        for (CollectTask task : due) {
            Attempt attempt = execute(task.getId());
            if (attempt == Attempt.BROADCAST) {
                broadcast++;
            } else if (attempt == Attempt.FAILED) {
                failed++;
            }
        }
        return new int[] {broadcast, failed};
    }

    /**
     * Signs and broadcasts one pending task. The hash is stored before the broadcast, so a
     * broadcast whose outcome is unknown leaves the task processing until
     * {@link #reconcileInFlight} finds it on chain. Only a definite refusal fails the task,
     * and every failure produces a successor, born skipped once the retry cap is used up.
     */
    Attempt execute(UUID taskId) {
        CollectTask task = transactionTemplate.execute(status -> {
            CollectTask loaded = taskRepository.findById(taskId)
                    .orElseThrow(() -> new NotFoundException("collect task not found: " + taskId));
            loaded.markProcessing(clock.instant());
            return taskRepository.save(loaded);
        });

        ChainAdapter adapter = router.resolve(task.getChain());
        SignedTransfer signed;
        try {
            String encryptedKey = payerKey(task);
            signed = keyVault.withPrivateKey(encryptedKey, key -> adapter.sign(
                    new TransferCommand(task.payerAddress(), task.getDestinationAddress(), task.getToken(), task.getAmount()), key));
        } catch (RuntimeException e) {
            fail(taskId, e.getMessage());
            return Attempt.FAILED;
        }
        transactionTemplate.executeWithoutResult(status -> {
            CollectTask current = taskRepository.findById(taskId).orElseThrow();
            current.recordTxHash(signed.txHash());
            taskRepository.save(current);
        });

        try {
            adapter.broadcast(signed);
        } catch (BroadcastRejectedException e) {
            fail(taskId, e.getChainDetail());
            return Attempt.FAILED;
        } catch (RpcUnavailableException e) {
            log.warn("event=sweep.task.broadcast_unknown taskId={} chain={} txHash={} error={}",
                    taskId, task.getChain(), signed.txHash(), e.getMessage());
            return Attempt.UNKNOWN;
        }
        log.info("event=sweep.task.broadcast taskId={} type={} chain={} from={} to={} amount={} txHash={}",
                taskId, task.getType(), task.getChain(), task.payerAddress(), task.getDestinationAddress(),
                task.getAmount().toPlainString(), signed.txHash());
        return Attempt.BROADCAST;
    }

    /**
     * Settles processing tasks from the chain: confirmed transfers succeed with the fee the
     * receipt reports, reverted ones fail. A task with no hash, or whose transaction is
     * still unknown to the chain after {@code processingTimeout}, is failed and retried.
     *
     * @return {confirmed, failed}
     */
    int[] reconcileInFlight(String chain) {
        ChainAdapter adapter = router.resolve(chain);
        Duration timeout = properties.chain(chain).getSweep().getProcessingTimeout();
        int confirmed = 0;
        int failed = 0;
        for (CollectTask task : taskRepository.findByChainAndStatusOrderByExecutedAtAsc(chain, CollectTaskStatus.PROCESSING)) {
            Instant now = clock.instant();
            boolean overdue = task.getExecutedAt() == null || !task.getExecutedAt().plus(timeout).isAfter(now);
            try {
                if (!task.isBroadcast()) {
                    if (overdue) {
                        fail(task.getId(), "no broadcast recorded within " + timeout);
                        failed++;
                    }
                    continue;
                }
                Optional<TxObservation> observation = adapter.lookupTransaction(task.getTxHash());
                if (observation.isEmpty()) {
                    if (overdue) {
                        fail(task.getId(), "tx " + task.getTxHash() + " not found on chain within " + timeout);
                        failed++;
                    }
                    continue;
                }
                TxObservation tx = observation.get();
                if (!tx.success()) {
                    fail(task.getId(), "transaction reverted at block " + tx.blockHeight());
                    failed++;
                } else if (tx.confirmations() >= adapter.requiredConfirmations()) {
                    BigDecimal fee = tx.fee() != null ? tx.fee() : adapter.estimateFee(task.getToken());
                    confirm(task.getId(), fee, adapter);
                    confirmed++;
                }
            } catch (RpcUnavailableException e) {
                log.warn("event=sweep.reconcile.rpc_unavailable chain={} taskId={} error={}", chain, task.getId(), e.getMessage());
                break;
            }
        }
        return new int[] {confirmed, failed};
    }

    /**
     * Puts every skipped task of an address back to work with a fresh retry budget.
     */
    public List<CollectTask> retrySkipped(String chain, String address) {
        String code = router.resolve(chain).chainCode();
        return chainLocks.withLock(code, () -> transactionTemplate.execute(status -> {
            List<CollectTask> skipped = taskRepository.findByChainAndSourceAddressAndStatus(code, address, CollectTaskStatus.SKIPPED);
            if (skipped.isEmpty()) {
                throw new NotFoundException("no skipped sweep task for " + code + " address " + address);
            }
            Instant now = clock.instant();
            List<CollectTask> released = new ArrayList<>();
            for (CollectTask task : skipped) {
                CollectTask retry = taskRepository.save(task.releaseForRetry(now));
                taskRepository.save(task);
                released.add(retry);
                log.warn("event=sweep.task.released chain={} address={} skippedTaskId={} taskId={}",
                        code, address, task.getId(), retry.getId());
            }
            return released;
        }));
    }

    private void confirm(UUID taskId, BigDecimal fee, ChainAdapter adapter) {
        transactionTemplate.executeWithoutResult(status -> {
            CollectTask current = taskRepository.findById(taskId).orElseThrow();
            Instant now = clock.instant();
            current.markSuccess(fee, now);
            taskRepository.save(current);
            log.info("event=sweep.task.success taskId={} type={} chain={} from={} to={} amount={} txHash={} gasUsed={}",
                    taskId, current.getType(), current.getChain(), current.payerAddress(), current.getDestinationAddress(),
                    current.getAmount().toPlainString(), current.getTxHash(), fee.toPlainString());
            if (current.getType() == CollectTaskType.GAS_TOP_UP) {
                scheduleCollectAfterTopUp(current, adapter, now);
            }
        });
    }

    private void scheduleCollectAfterTopUp(CollectTask topUp, ChainAdapter adapter, Instant now) {
        Optional<DepositAddress> address = addressRepository.findFirstByChainAndAddressIgnoreCase(topUp.getChain(), topUp.getSourceAddress());
        if (address.isEmpty()) {
            log.warn("event=sweep.top_up.orphan taskId={} address={}", topUp.getId(), topUp.getSourceAddress());
            return;
        }
        BigDecimal balance = adapter.balance(address.get().getAddress(), address.get().getToken());
        if (balance.signum() <= 0) {
            return;
        }
        ReconcilerProperties.Sweep sweep = properties.chain(topUp.getChain()).getSweep();
        CollectTask collect = taskRepository.save(CollectTask.collect(topUp.getChain(), address.get().getToken(), address.get().getAddress(),
                hotWallets.collectionAddress(topUp.getChain()), balance, now.plus(sweep.getCollectDelay()), now));
        log.info("event=sweep.task.planned chain={} type={} address={} token={} amount={} taskId={} scheduledAt={}",
                topUp.getChain(), collect.getType(), collect.getSourceAddress(), collect.getToken(),
                balance.toPlainString(), collect.getId(), collect.getScheduledAt());
    }

    private void fail(UUID taskId, String error) {
        transactionTemplate.executeWithoutResult(status -> {
            CollectTask current = taskRepository.findById(taskId).orElseThrow();
            Instant now = clock.instant();
            current.markFailed(error, now);
            taskRepository.save(current);
            int maxRetries = properties.chain(current.getChain()).getSweep().getMaxRetries();
            CollectTask next = taskRepository.save(current.successor(maxRetries, now, now));
            if (next.getStatus() == CollectTaskStatus.SKIPPED) {
                log.error("event=sweep.task.skipped taskId={} chain={} address={} retries={} lastError={}",
                        next.getId(), next.getChain(), next.getSourceAddress(), next.getRetryCount(), error);
            } else {
                log.warn("event=sweep.task.failed taskId={} chain={} address={} retry={} error={}",
                        taskId, current.getChain(), current.getSourceAddress(), next.getRetryCount(), error);
            }
        });
    }

    private String payerKey(CollectTask task) {
        if (task.getType() == CollectTaskType.GAS_TOP_UP) {
            return hotWallets.hotWallet(task.getChain()).encryptedKey();
        }
        return addressRepository.findByChainAndTokenAndAddress(task.getChain(), task.getToken(), task.getSourceAddress())
                .map(DepositAddress::getEncryptedPrivateKey)
                .orElseThrow(() -> new NotFoundException("no key for deposit address " + task.getSourceAddress()));
    }
}
