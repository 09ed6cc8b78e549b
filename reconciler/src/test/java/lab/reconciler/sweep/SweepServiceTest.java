package lab.reconciler.sweep;

import lab.reconciler.common.NotFoundException;
import lab.reconciler.domain.address.DepositAddress;
import lab.reconciler.domain.collect.CollectTask;
import lab.reconciler.domain.collect.CollectTaskRepository;
import lab.reconciler.domain.collect.CollectTaskStatus;
import lab.reconciler.domain.collect.CollectTaskType;
import lab.reconciler.domain.ledger.LedgerEntryRepository;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.orchestration.DepositAddressService;
import lab.reconciler.security.HotWalletDirectory;
import lab.reconciler.sim.fakechain.FakeChain;
import lab.reconciler.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against BSC (batch size 2, two retries, three confirmations, fee 0.001 BNB, gas reserve x1.5).
 */
class SweepServiceTest extends IntegrationTestSupport {

    private static final String CHAIN = "BSC";

    @Autowired
    private SweepService sweepService;

    @Autowired
    private CollectTaskRepository taskRepository;

    @Autowired
    private DepositAddressService addressService;

    @Autowired
    private HotWalletDirectory hotWallets;

    @Autowired
    private LedgerEntryRepository entryRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private FakeChain chain;

    @BeforeEach
    void setUp() {
        chain = fakeChain(CHAIN);
        chain.fund(hotWallets.hotWallet(CHAIN).address(), "BNB", new BigDecimal("10"));
    }

    @Test
    void tokenAddressWithoutGas_isToppedUpThenCollected() {
        DepositAddress address = newAddress("USDT");
        chain.fund(address.getAddress(), "USDT", new BigDecimal("50"));
        long ledgerEntriesBefore = entryRepository.count();

        sweepService.plan(CHAIN);
        CollectTask topUp = single(address, CollectTaskType.GAS_TOP_UP);
        assertThat(topUp.getAmount()).isEqualByComparingTo("0.01");
        assertThat(topUp.payerAddress()).isEqualTo(hotWallets.hotWallet(CHAIN).address());

        assertThat(sweepService.execute(topUp.getId())).isEqualTo(SweepService.Attempt.BROADCAST);
        assertThat(chain.balanceOf(address.getAddress(), "BNB")).isEqualByComparingTo("0.01");
        assertThat(reload(topUp).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);
        assertThat(tasksOf(address)).hasSize(1);

        chain.mine(3);
        sweepService.reconcileInFlight(CHAIN);
        assertThat(reload(topUp).getStatus()).isEqualTo(CollectTaskStatus.SUCCESS);

        CollectTask collect = single(address, CollectTaskType.COLLECT);
        assertThat(collect.getStatus()).isEqualTo(CollectTaskStatus.PENDING);
        assertThat(collect.getAmount()).isEqualByComparingTo("50");
        assertThat(sweepService.execute(collect.getId())).isEqualTo(SweepService.Attempt.BROADCAST);

        String collection = hotWallets.collectionAddress(CHAIN);
        assertThat(chain.balanceOf(address.getAddress(), "USDT")).isEqualByComparingTo("0");
        assertThat(chain.balanceOf(collection, "USDT")).isGreaterThanOrEqualTo(new BigDecimal("50"));
        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);

        chain.mine(3);
        sweepService.reconcileInFlight(CHAIN);
        CollectTask done = reload(collect);
        assertThat(done.getStatus()).isEqualTo(CollectTaskStatus.SUCCESS);
        assertThat(done.getGasUsed()).isEqualByComparingTo("0.001");
        assertThat(entryRepository.count()).isEqualTo(ledgerEntriesBefore);
    }

    @Test
    void broadcastedTask_staysProcessingUntilConfirmed() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("20"));
        sweepService.plan(CHAIN);
        CollectTask collect = single(address, CollectTaskType.COLLECT);

        sweepService.execute(collect.getId());
        chain.mine(1);
        sweepService.reconcileInFlight(CHAIN);

        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);
        assertThat(reload(collect).getGasUsed()).isNull();

        chain.mine(2);
        sweepService.reconcileInFlight(CHAIN);
        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.SUCCESS);
    }

    @Test
    void timedOutTopUp_keepsItsHashAndIsConfirmedFromTheChain() {
        DepositAddress address = newAddress("USDT");
        chain.fund(address.getAddress(), "USDT", new BigDecimal("30"));
        sweepService.plan(CHAIN);
        CollectTask topUp = single(address, CollectTaskType.GAS_TOP_UP);

        chain.enqueueOutcome(FakeChain.NextOutcome.TIMEOUT);
        assertThat(sweepService.execute(topUp.getId())).isEqualTo(SweepService.Attempt.UNKNOWN);

        CollectTask pending = reload(topUp);
        assertThat(pending.getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);
        assertThat(pending.getTxHash()).isNotNull();

        sweepService.reconcileInFlight(CHAIN);
        sweepService.plan(CHAIN);
        assertThat(reload(topUp).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);
        assertThat(tasksOf(address)).hasSize(1);

        chain.mine(3);
        sweepService.reconcileInFlight(CHAIN);

        assertThat(reload(topUp).getStatus()).isEqualTo(CollectTaskStatus.SUCCESS);
        assertThat(tasksOf(address)).filteredOn(task -> task.getType() == CollectTaskType.GAS_TOP_UP).hasSize(1);
        assertThat(chain.balanceOf(address.getAddress(), "BNB")).isEqualByComparingTo("0.01");
        assertThat(single(address, CollectTaskType.COLLECT).getStatus()).isEqualTo(CollectTaskStatus.PENDING);
    }

    @Test
    void processingTaskWithoutBroadcast_isFailedAfterTheTimeout() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("12"));
        sweepService.plan(CHAIN);
        CollectTask collect = single(address, CollectTaskType.COLLECT);
        transactionTemplate.executeWithoutResult(status -> {
            CollectTask loaded = taskRepository.findById(collect.getId()).orElseThrow();
            loaded.markProcessing(clock.instant());
            taskRepository.save(loaded);
        });

        sweepService.reconcileInFlight(CHAIN);
        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);

        clock.advance(Duration.ofMinutes(11));
        sweepService.reconcileInFlight(CHAIN);

        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.FAILED);
        CollectTask retry = latest(address);
        assertThat(retry.getStatus()).isEqualTo(CollectTaskStatus.PENDING);
        assertThat(retry.getRetryCount()).isEqualTo(1);
        assertThat(retry.getPreviousTaskId()).isEqualTo(collect.getId());
    }

    @Test
    void droppedTransaction_isFailedOnceOverdue() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("12"));
        sweepService.plan(CHAIN);
        CollectTask collect = single(address, CollectTaskType.COLLECT);

        chain.enqueueOutcome(FakeChain.NextOutcome.DROP);
        assertThat(sweepService.execute(collect.getId())).isEqualTo(SweepService.Attempt.BROADCAST);
        chain.mine(5);
        sweepService.reconcileInFlight(CHAIN);
        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);

        clock.advance(Duration.ofMinutes(11));
        sweepService.reconcileInFlight(CHAIN);

        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.FAILED);
        assertThat(reload(collect).getErrorMessage()).contains("not found on chain");
        assertThat(latest(address).getStatus()).isEqualTo(CollectTaskStatus.PENDING);
        assertThat(chain.balanceOf(address.getAddress(), "BNB")).isEqualByComparingTo("12");
    }

    @Test
    void revertedTransaction_failsTheTask() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("12"));
        sweepService.plan(CHAIN);
        CollectTask collect = single(address, CollectTaskType.COLLECT);

        chain.enqueueOutcome(FakeChain.NextOutcome.REVERT);
        sweepService.execute(collect.getId());
        chain.mine(1);
        sweepService.reconcileInFlight(CHAIN);

        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.FAILED);
        assertThat(reload(collect).getErrorMessage()).startsWith("transaction reverted");
        assertThat(latest(address).getRetryCount()).isEqualTo(1);
    }

    @Test
    void nativeCoinAddress_keepsTheGasReserve() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("20"));

        sweepService.plan(CHAIN);

        CollectTask collect = single(address, CollectTaskType.COLLECT);
        assertThat(collect.getAmount()).isEqualByComparingTo("19.9985");
        assertThat(sweepService.execute(collect.getId())).isEqualTo(SweepService.Attempt.BROADCAST);
        assertThat(chain.balanceOf(address.getAddress(), "BNB")).isEqualByComparingTo("0.0005");
    }

    @Test
    void smallBalances_areLeftAlone() {
        DepositAddress address = newAddress("USDT");
        chain.fund(address.getAddress(), "USDT", new BigDecimal("9.99"));

        sweepService.plan(CHAIN);

        assertThat(taskRepository.findByChainAndSourceAddressOrderByCreatedAtAsc(CHAIN, address.getAddress())).isEmpty();
    }

    @Test
    void planning_isCappedByTheBatchSize() {
        for (int i = 0; i < 3; i++) {
            DepositAddress address = newAddress("BNB");
            chain.fund(address.getAddress(), "BNB", new BigDecimal("15"));
        }

        assertThat(sweepService.plan(CHAIN)).isEqualTo(2);
        assertThat(sweepService.plan(CHAIN)).isEqualTo(1);
        assertThat(sweepService.plan(CHAIN)).isZero();
    }

    @Test
    void rejectedTask_isRetriedThenSkipped() {
        DepositAddress address = newAddress("USDT");
        chain.fund(address.getAddress(), "USDT", new BigDecimal("40"));
        chain.fund(address.getAddress(), "BNB", new BigDecimal("1"));
        sweepService.plan(CHAIN);
        CollectTask task = single(address, CollectTaskType.COLLECT);

        for (int attempt = 0; attempt < 3; attempt++) {
            chain.enqueueOutcome(FakeChain.NextOutcome.REJECT);
            assertThat(sweepService.execute(task.getId())).isEqualTo(SweepService.Attempt.FAILED);
            task = latest(address);
        }

        List<CollectTask> history = tasksOf(address);
        assertThat(history).extracting(CollectTask::getStatus)
                .containsExactlyInAnyOrder(CollectTaskStatus.FAILED, CollectTaskStatus.FAILED, CollectTaskStatus.FAILED, CollectTaskStatus.SKIPPED);
        assertThat(task.getStatus()).isEqualTo(CollectTaskStatus.SKIPPED);
        assertThat(task.getRetryCount()).isEqualTo(3);
        assertThat(task.getErrorMessage()).startsWith("retry limit reached");

        sweepService.plan(CHAIN);
        assertThat(tasksOf(address)).hasSize(4);
    }

    @Test
    void unreachableNode_leavesTheTaskProcessing() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("12"));
        sweepService.plan(CHAIN);
        CollectTask collect = single(address, CollectTaskType.COLLECT);

        chain.setRpcDown(true);
        try {
            assertThat(sweepService.execute(collect.getId())).isEqualTo(SweepService.Attempt.UNKNOWN);
            sweepService.reconcileInFlight(CHAIN);
        } finally {
            chain.setRpcDown(false);
        }

        assertThat(reload(collect).getStatus()).isEqualTo(CollectTaskStatus.PROCESSING);
        assertThat(tasksOf(address)).hasSize(1);
    }

    @Test
    void skippedAddress_isReleasedByAnOperator() {
        DepositAddress address = newAddress("BNB");
        chain.fund(address.getAddress(), "BNB", new BigDecimal("12"));
        sweepService.plan(CHAIN);
        CollectTask task = single(address, CollectTaskType.COLLECT);
        for (int attempt = 0; attempt < 3; attempt++) {
            chain.enqueueOutcome(FakeChain.NextOutcome.REJECT);
            sweepService.execute(task.getId());
            task = latest(address);
        }
        CollectTask skipped = task;
        assertThat(skipped.getStatus()).isEqualTo(CollectTaskStatus.SKIPPED);

        List<CollectTask> released = sweepService.retrySkipped("bsc", address.getAddress());

        assertThat(released).hasSize(1);
        CollectTask retry = released.get(0);
        assertThat(retry.getStatus()).isEqualTo(CollectTaskStatus.PENDING);
        assertThat(retry.getRetryCount()).isZero();
        assertThat(retry.getPreviousTaskId()).isEqualTo(skipped.getId());
        assertThat(reload(skipped).getStatus()).isEqualTo(CollectTaskStatus.FAILED);

        assertThat(sweepService.plan(CHAIN)).isZero();
        assertThat(sweepService.execute(retry.getId())).isEqualTo(SweepService.Attempt.BROADCAST);
        assertThatThrownBy(() -> sweepService.retrySkipped(CHAIN, address.getAddress()))
                .isInstanceOf(NotFoundException.class);
    }

    private DepositAddress newAddress(String token) {
        Merchant merchant = newMerchant();
        return addressService.allocate(merchant.getId(), CHAIN, token);
    }

    private CollectTask single(DepositAddress address, CollectTaskType type) {
        List<CollectTask> tasks = taskRepository.findByChainAndSourceAddressOrderByCreatedAtAsc(CHAIN, address.getAddress()).stream()
                .filter(task -> task.getType() == type)
                .toList();
        assertThat(tasks).hasSize(1);
        return tasks.get(0);
    }

    private CollectTask latest(DepositAddress address) {
        return tasksOf(address).stream()
                .filter(task -> task.getStatus() != CollectTaskStatus.FAILED)
                .max((a, b) -> Integer.compare(a.getRetryCount(), b.getRetryCount()))
                .orElseThrow();
    }

    private List<CollectTask> tasksOf(DepositAddress address) {
        return taskRepository.findByChainAndSourceAddressOrderByCreatedAtAsc(CHAIN, address.getAddress());
    }

    private CollectTask reload(CollectTask task) {
        return taskRepository.findById(task.getId()).orElseThrow();
    }
}
