package lab.reconciler.orchestration;

import lab.reconciler.adapter.ChainAdapter.IncomingTransfer;
import lab.reconciler.common.IdempotencyConflictException;
import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.domain.address.DepositAddress;
import lab.reconciler.domain.ledger.LedgerAccount;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.FailureReason;
import lab.reconciler.domain.order.OrderAuditLog;
import lab.reconciler.domain.order.OrderStatus;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.scanner.ScanResult;
import lab.reconciler.security.HotWalletDirectory;
import lab.reconciler.sim.fakechain.FakeChain;
import lab.reconciler.support.IntegrationTestSupport;
import lab.reconciler.support.RecordingWebhookTransport;
import lab.reconciler.webhook.CallbackSigner;
import lab.reconciler.webhook.NotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DepositFlowIntegrationTest extends IntegrationTestSupport {

    private static final String CHAIN = "ETH";

    @Autowired
    private DepositOrderService depositService;

    @Autowired
    private DepositAddressService addressService;

    @Autowired
    private OrderQueryService queryService;

    @Autowired
    private NotificationDispatcher notificationDispatcher;

    @Autowired
    private CallbackSigner signer;

    @Autowired
    private WithdrawalOrderService withdrawalService;

    @Autowired
    private HotWalletDirectory hotWallets;

    private Merchant merchant;
    private FakeChain chain;

    @BeforeEach
    void setUp() {
        merchant = newMerchant();
        chain = fakeChain(CHAIN);
    }

    @Test
    void exactAmount_detectsConfirmsAndCreditsOnce() {
        String ref = randomRef();
        PaymentOrder order = createDeposit(ref, "100");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getFee()).isEqualByComparingTo("1");

        FakeChain.SimTransfer transfer = chain.deposit(order.getWalletAddress(), "USDT", new BigDecimal("100"));
        chain.mine(1);
        scan(CHAIN);

        PaymentOrder confirming = reload(order);
        assertThat(confirming.getStatus()).isEqualTo(OrderStatus.CONFIRMING);
        assertThat(confirming.getTxHash()).isEqualTo(transfer.txHash());
        assertThat(confirming.getConfirmations()).isEqualTo(2);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("0");

        chain.mine(1);
        scan(CHAIN);
        chain.mine(1);
        scan(CHAIN);

        PaymentOrder settled = reload(order);
        assertThat(settled.getStatus()).isEqualTo(OrderStatus.SUCCESS);
        assertThat(settled.getSettledAmount()).isEqualByComparingTo("100");
        assertThat(settled.getNetAmount()).isEqualByComparingTo("99");
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("99");
        assertThat(ledgerService.entriesForOrder(order.getId())).hasSize(1);
        assertThat(queryService.history(order.getId()))
                .extracting(OrderAuditLog::getToStatus)
                .containsExactlyInAnyOrder(OrderStatus.PENDING, OrderStatus.DETECTED, OrderStatus.CONFIRMING, OrderStatus.SUCCESS);

        notificationDispatcher.dispatchDue();
        List<RecordingWebhookTransport.Call> calls = webhookTransport.callsTo(callbackUrl(ref));
        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).payload()).contains("\"status\":\"success\"", "\"order_no\":\"" + order.getOrderNo() + "\"");
        assertThat(signer.verifyCallback(merchant.getDepositKey(), calls.get(0).signature(),
                merchant.getMerchantNo(), order.getOrderNo(), "success", "100")).isTrue();
    }

    @Test
    void repeatedObservations_creditOnlyOnce() {
        PaymentOrder order = createDeposit(randomRef(), "25");
        FakeChain.SimTransfer transfer = chain.deposit(order.getWalletAddress(), "USDT", new BigDecimal("25"));
        chain.mine(3);
        scan(CHAIN);
        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.SUCCESS);

        DepositAddress address = addressService.allocate(merchant.getId(), CHAIN, "USDT");
        depositService.onTransferObserved(address, observed(transfer, 10));
        depositService.updateConfirmations(order.getId(), transfer.blockHeight(), 12);

        assertThat(ledgerService.entriesForOrder(order.getId())).hasSize(1);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("24.75");
        assertThat(orderRepository.findLiveDepositsByTransfer(CHAIN, address.getAddress(), transfer.txHash())).hasSize(1);
    }

    @Test
    void concurrentConfirmationUpdates_creditOnce() throws Exception {
        PaymentOrder order = createDeposit(randomRef(), "40");
        FakeChain.SimTransfer transfer = chain.deposit(order.getWalletAddress(), "USDT", new BigDecimal("40"));
        chain.mine(1);
        scan(CHAIN);
        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.CONFIRMING);

        List<PaymentOrder> outcomes = runConcurrently(4, () -> depositService.updateConfirmations(order.getId(), transfer.blockHeight(), 5));

        assertThat(outcomes).extracting(PaymentOrder::getStatus).containsOnly(OrderStatus.SUCCESS);
        assertThat(ledgerService.entriesForOrder(order.getId())).hasSize(1);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("39.6");
        assertThat(queryService.history(order.getId()))
                .filteredOn(entry -> entry.getToStatus() == OrderStatus.SUCCESS)
                .hasSize(1);
    }

    @Test
    void depositCreditAndWithdrawalReserve_onOneAccountBothPost() throws Exception {
        String hotWallet = hotWallets.hotWallet(CHAIN).address();
        chain.fund(hotWallet, "USDT", new BigDecimal("1000"));
        chain.fund(hotWallet, "ETH", new BigDecimal("1"));
        credit(merchant, "USDT", "50");
        String withdrawalRef = randomRef();
        PaymentOrder withdrawal = withdrawalService.createWithdrawal(new CreateWithdrawalCommand(
                merchant.getMerchantNo(), withdrawalRef, CHAIN, "USDT", new BigDecimal("20"),
                "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", callbackUrl(withdrawalRef), null));
        PaymentOrder deposit = createDeposit(randomRef(), "40");
        FakeChain.SimTransfer transfer = chain.deposit(deposit.getWalletAddress(), "USDT", new BigDecimal("40"));
        chain.mine(1);
        scan(CHAIN);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<PaymentOrder> credited = pool.submit(() -> {
                start.await();
                return depositService.updateConfirmations(deposit.getId(), transfer.blockHeight(), 5);
            });
            Future<PaymentOrder> reserved = pool.submit(() -> {
                start.await();
                return withdrawalService.dispatch(withdrawal.getId());
            });
            start.countDown();

            assertThat(credited.get(30, TimeUnit.SECONDS).getStatus()).isEqualTo(OrderStatus.SUCCESS);
            assertThat(reserved.get(30, TimeUnit.SECONDS).getStatus()).isEqualTo(OrderStatus.PROCESSING);
        } finally {
            pool.shutdownNow();
        }

        // 50 + 39.6 net deposit - 21 reserved
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("68.6");
        LedgerAccount account = ledgerService.openAccount(merchant.getId(), "USDT");
        assertThat(ledgerService.verify(account.getId()).consistent()).isTrue();
    }

    @Test
    void underpayment_settlesTheAmountThatArrived() {
        PaymentOrder order = createDeposit(randomRef(), "100");
        chain.deposit(order.getWalletAddress(), "USDT", new BigDecimal("99.5"));
        chain.mine(3);
        scan(CHAIN);

        PaymentOrder settled = reload(order);
        assertThat(settled.getStatus()).isEqualTo(OrderStatus.SUCCESS);
        assertThat(settled.getAmount()).isEqualByComparingTo("100");
        assertThat(settled.getSettledAmount()).isEqualByComparingTo("99.5");
        assertThat(settled.getFee()).isEqualByComparingTo("0.995");
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("98.505");
    }

    @Test
    void concurrentOrdersOnOneAddress_getDistinctAmounts() {
        PaymentOrder first = createDeposit(randomRef(), "100");
        PaymentOrder second = createDeposit(randomRef(), "100");
        PaymentOrder third = createDeposit(randomRef(), "100");

        assertThat(second.getWalletAddress()).isEqualTo(first.getWalletAddress());
        assertThat(first.getAmount()).isEqualByComparingTo("100");
        assertThat(second.getAmount()).isEqualByComparingTo("100.001");
        assertThat(third.getAmount()).isEqualByComparingTo("100.002");

        chain.deposit(first.getWalletAddress(), "USDT", new BigDecimal("100.001"));
        chain.mine(1);
        scan(CHAIN);

        assertThat(reload(first).getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(reload(second).getStatus()).isEqualTo(OrderStatus.CONFIRMING);
        assertThat(reload(third).getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void exhaustedAmountSuffixes_rejectTheOrder() {
        for (int i = 0; i < 10; i++) {
            createDeposit(randomRef(), "7");
        }

        assertThatThrownBy(() -> createDeposit(randomRef(), "7"))
                .isInstanceOf(AddressPoolExhaustedException.class);
    }

    @Test
    void expiry_happensExactlyAtTheDeadline() {
        PaymentOrder order = createDeposit(randomRef(), "40");
        Instant deadline = order.getExpiresAt();

        clock.set(deadline.minusMillis(1));
        depositService.expireDue();
        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.PENDING);

        clock.set(deadline);
        depositService.expireDue();
        PaymentOrder expired = reload(order);
        assertThat(expired.getStatus()).isEqualTo(OrderStatus.EXPIRED);
        assertThat(expired.getFailureReason()).isEqualTo(FailureReason.EXPIRED);
        assertThat(expired.getCompletedAt()).isEqualTo(deadline);
    }

    @Test
    void transferAtTheDeadline_becomesAnUnsolicitedDeposit() {
        PaymentOrder order = createDeposit(randomRef(), "60");
        clock.set(order.getExpiresAt());

        FakeChain.SimTransfer transfer = chain.deposit(order.getWalletAddress(), "USDT", new BigDecimal("60"));
        chain.mine(3);
        scan(CHAIN);
        depositService.expireDue();

        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.EXPIRED);
        List<PaymentOrder> bound = orderRepository.findLiveDepositsByTransfer(CHAIN, order.getWalletAddress(), transfer.txHash());
        assertThat(bound).singleElement().satisfies(unsolicited -> {
            assertThat(unsolicited.getId()).isNotEqualTo(order.getId());
            assertThat(unsolicited.getMerchantRef()).isNull();
            assertThat(unsolicited.getStatus()).isEqualTo(OrderStatus.SUCCESS);
        });
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("59.4");
    }

    @Test
    void transferWithoutOrder_isCreditedToTheAddressOwner() {
        DepositAddress address = addressService.allocate(merchant.getId(), CHAIN, "USDT");

        FakeChain.SimTransfer transfer = chain.deposit(address.getAddress(), "USDT", new BigDecimal("50"));
        chain.mine(2);
        scan(CHAIN);

        List<PaymentOrder> bound = orderRepository.findLiveDepositsByTransfer(CHAIN, address.getAddress(), transfer.txHash());
        assertThat(bound).singleElement().satisfies(order -> {
            assertThat(order.getMerchantId()).isEqualTo(merchant.getId());
            assertThat(order.getStatus()).isEqualTo(OrderStatus.SUCCESS);
            assertThat(order.getNetAmount()).isEqualByComparingTo("49.5");
        });
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("49.5");
    }

    @Test
    void vanishedTransaction_failsTheOrderAndRewindsTheCursor() {
        PaymentOrder order = createDeposit(randomRef(), "80");
        FakeChain.SimTransfer transfer = chain.deposit(order.getWalletAddress(), "USDT", new BigDecimal("80"));
        chain.mine(1);
        scan(CHAIN);
        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.CONFIRMING);

        chain.dropTransaction(transfer.txHash());
        chain.mine(1);
        scan(CHAIN);
        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.CONFIRMING);
        assertThat(reload(order).getMissingSinceHeight()).isNotNull();

        chain.mine(2);
        ScanResult result = scan(CHAIN);

        PaymentOrder failed = reload(order);
        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.REORGED);
        assertThat(result.depositsReorged()).isEqualTo(1);
        assertThat(result.cursorHeight()).isEqualTo(transfer.blockHeight() - 1);
        assertThat(ledgerService.entriesForOrder(order.getId())).isEmpty();
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("0");
    }

    @Test
    void sameMerchantReference_replaysOrConflicts() {
        String ref = randomRef();
        PaymentOrder first = createDeposit(ref, "15");
        PaymentOrder replay = createDeposit(ref, "15");

        assertThat(replay.getId()).isEqualTo(first.getId());
        assertThatThrownBy(() -> createDeposit(ref, "16"))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    @Test
    void fiatAmount_isConvertedWithTheConfiguredRate() {
        PaymentOrder order = depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), randomRef(), "eth", "usdt", new BigDecimal("720"), "CNY", null, null));

        assertThat(order.getRequestedAmount()).isEqualByComparingTo("720");
        assertThat(order.getRequestedCurrency()).isEqualTo("CNY");
        assertThat(order.getExchangeRate()).isEqualByComparingTo("7.2");
        assertThat(order.getAmount()).isEqualByComparingTo("100");
        assertThat(order.getChain()).isEqualTo("ETH");

        assertThatThrownBy(() -> depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), randomRef(), CHAIN, "USDT", new BigDecimal("10"), "EUR", null, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("no exchange rate");
    }

    @Test
    void invalidRequests_areRejected() {
        assertThatThrownBy(() -> depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), randomRef(), "DOGE", "USDT", BigDecimal.TEN, null, null, null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), randomRef(), CHAIN, "USDT", BigDecimal.ZERO, null, null, null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), randomRef(), CHAIN, "USDT", BigDecimal.TEN, null, "ftp://merchant.test/cb", null)))
                .isInstanceOf(InvalidRequestException.class);
    }

    private PaymentOrder createDeposit(String ref, String amount) {
        return depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), ref, CHAIN, "USDT", new BigDecimal(amount), null, callbackUrl(ref), "cart-42"));
    }

    private static <T> List<T> runConcurrently(int threads, Callable<T> action) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return action.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static IncomingTransfer observed(FakeChain.SimTransfer transfer, long confirmations) {
        return new IncomingTransfer(transfer.txHash(), transfer.fromAddress(), transfer.toAddress(), transfer.amount(),
                transfer.blockHeight(), transfer.indexInBlock(), confirmations);
    }
}
