package lab.reconciler.orchestration;

import lab.reconciler.common.IdempotencyConflictException;
import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.common.SignatureVerificationException;
import lab.reconciler.domain.ledger.LedgerAccount;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.FailureReason;
import lab.reconciler.domain.order.OrderAuditLog;
import lab.reconciler.domain.order.OrderStateException;
import lab.reconciler.domain.order.OrderStatus;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.webhook.WebhookDeliveryRepository;
import lab.reconciler.security.HotWalletDirectory;
import lab.reconciler.security.TotpVerifier;
import lab.reconciler.sim.fakechain.FakeChain;
import lab.reconciler.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WithdrawalFlowIntegrationTest extends IntegrationTestSupport {

    private static final String CHAIN = "ETH";
    private static final String DESTINATION = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";

    @Autowired
    private WithdrawalOrderService withdrawalService;

    @Autowired
    private DepositOrderService depositService;

    @Autowired
    private OrderQueryService queryService;

    @Autowired
    private HotWalletDirectory hotWallets;

    @Autowired
    private TotpVerifier totpVerifier;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    private Merchant merchant;
    private FakeChain chain;

    @BeforeEach
    void setUp() {
        merchant = newMerchant();
        chain = fakeChain(CHAIN);
        String hotWallet = hotWallets.hotWallet(CHAIN).address();
        chain.fund(hotWallet, "USDT", new BigDecimal("1000000"));
        chain.fund(hotWallet, "ETH", new BigDecimal("100"));
    }

    @Test
    void confirmedWithdrawal_keepsTheReservedDebit() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "50");
        assertThat(order.getFee()).isEqualByComparingTo("1");
        assertThat(order.getNetAmount()).isEqualByComparingTo("50");

        PaymentOrder processing = withdrawalService.dispatch(order.getId());
        assertThat(processing.getStatus()).isEqualTo(OrderStatus.PROCESSING);
        assertThat(processing.getTxHash()).isNotBlank();
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("49");
        assertThat(ledgerService.hasOpenReservation(order.getId())).isTrue();

        chain.mine(3);
        scan(CHAIN);

        PaymentOrder settled = reload(order);
        assertThat(settled.getStatus()).isEqualTo(OrderStatus.SUCCESS);
        assertThat(settled.getConfirmations()).isGreaterThanOrEqualTo(3);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("49");
        assertThat(ledgerService.entriesForOrder(order.getId())).hasSize(2);
        assertThat(chain.balanceOf(DESTINATION, "USDT")).isGreaterThanOrEqualTo(new BigDecimal("50"));
    }

    @Test
    void insufficientBalance_failsWithoutTouchingTheChain() {
        credit(merchant, "USDT", "20");
        PaymentOrder order = createWithdrawal(randomRef(), "20");
        int broadcastsBefore = chain.broadcastCount();

        PaymentOrder failed = withdrawalService.dispatch(order.getId());

        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.INSUFFICIENT_BALANCE);
        assertThat(ledgerService.entriesForOrder(order.getId())).isEmpty();
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("20");
        assertThat(chain.broadcastCount()).isEqualTo(broadcastsBefore);
        assertThat(deliveryRepository.findByOrderIdAndEventStatus(order.getId(), OrderStatus.FAILED)).isPresent();
    }

    @Test
    void rejectedBroadcast_reversesTheReservation() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "50");
        chain.enqueueOutcome(FakeChain.NextOutcome.REJECT);

        PaymentOrder failed = withdrawalService.dispatch(order.getId());

        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.BROADCAST_REJECTED);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("100");
        assertThat(ledgerService.entriesForOrder(order.getId())).hasSize(4);
        assertThat(ledgerService.hasOpenReservation(order.getId())).isFalse();
        LedgerAccount account = ledgerService.openAccount(merchant.getId(), "USDT");
        assertThat(ledgerService.verify(account.getId()).consistent()).isTrue();
    }

    @Test
    void broadcastTimeout_staysProcessingUntilTheChainConfirms() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "30");
        chain.enqueueOutcome(FakeChain.NextOutcome.TIMEOUT);

        PaymentOrder pending = withdrawalService.dispatch(order.getId());
        assertThat(pending.getStatus()).isEqualTo(OrderStatus.PROCESSING);
        assertThat(pending.getTxHash()).isNotBlank();
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("69");

        chain.mine(3);
        scan(CHAIN);

        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.SUCCESS);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("69");
    }

    @Test
    void neverIncludedTransaction_failsAsStuckAfterTheWaitLimit() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "40");
        chain.enqueueOutcome(FakeChain.NextOutcome.DROP);
        withdrawalService.dispatch(order.getId());

        for (int cycle = 1; cycle < 3; cycle++) {
            chain.mine(1);
            scan(CHAIN);
            assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.PROCESSING);
        }
        chain.mine(1);
        scan(CHAIN);

        PaymentOrder failed = reload(order);
        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.STUCK);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("100");
    }

    @Test
    void revertedTransaction_reversesTheReservation() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "10");
        chain.enqueueOutcome(FakeChain.NextOutcome.REVERT);
        withdrawalService.dispatch(order.getId());

        chain.mine(1);
        scan(CHAIN);

        PaymentOrder failed = reload(order);
        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.REVERTED);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("100");
    }

    @Test
    void repeatedDispatch_reservesAndBroadcastsOnce() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "10");
        int broadcastsBefore = chain.broadcastCount();

        withdrawalService.dispatch(order.getId());
        withdrawalService.dispatch(order.getId());
        withdrawalService.dispatchDue();

        assertThat(chain.broadcastCount()).isEqualTo(broadcastsBefore + 1);
        assertThat(ledgerService.entriesForOrder(order.getId())).hasSize(2);
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("89");
    }

    @Test
    void dispatchDue_picksUpNewWithdrawals() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "10");

        int attempted = withdrawalService.dispatchDue();

        assertThat(attempted).isGreaterThanOrEqualTo(1);
        assertThat(reload(order).getStatus()).isEqualTo(OrderStatus.PROCESSING);
    }

    @Test
    void forceComplete_requiresAValidSecondFactorAndAnOpenReservation() {
        credit(merchant, "USDT", "100");
        PaymentOrder order = createWithdrawal(randomRef(), "50");
        chain.enqueueOutcome(FakeChain.NextOutcome.DROP);
        withdrawalService.dispatch(order.getId());

        String code = totpVerifier.currentCode();
        String wrong = (code.charAt(0) == '9' ? "0" : String.valueOf((char) (code.charAt(0) + 1))) + code.substring(1);
        assertThatThrownBy(() -> withdrawalService.forceComplete(order.getOrderNo(), "ops-alice", wrong))
                .isInstanceOf(SignatureVerificationException.class);
        assertThatThrownBy(() -> withdrawalService.forceComplete(order.getOrderNo(), " ", code))
                .isInstanceOf(InvalidRequestException.class);

        PaymentOrder forced = withdrawalService.forceComplete(order.getOrderNo(), "ops-alice", code);

        assertThat(forced.getStatus()).isEqualTo(OrderStatus.SUCCESS);
        assertThat(forced.isForced()).isTrue();
        assertThat(balance(merchant, "USDT")).isEqualByComparingTo("49");
        assertThat(queryService.history(order.getId()))
                .extracting(OrderAuditLog::getActor)
                .contains("ops-alice");
        assertThatThrownBy(() -> withdrawalService.forceComplete(order.getOrderNo(), "ops-alice", code))
                .isInstanceOf(OrderStateException.class);
    }

    @Test
    void forceComplete_refusesDeposits() {
        PaymentOrder deposit = depositService.createDeposit(new CreateDepositCommand(
                merchant.getMerchantNo(), randomRef(), CHAIN, "USDT", BigDecimal.TEN, null, null, null));

        assertThatThrownBy(() -> withdrawalService.forceComplete(deposit.getOrderNo(), "ops-alice", totpVerifier.currentCode()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void policyRules_rejectBadRequests() {
        assertThatThrownBy(() -> createWithdrawal(randomRef(), "5"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("AMOUNT_BELOW_MINIMUM");
        assertThatThrownBy(() -> withdrawalService.createWithdrawal(new CreateWithdrawalCommand(
                merchant.getMerchantNo(), randomRef(), CHAIN, "USDT", new BigDecimal("100"), "not-an-address", null, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("INVALID_TO_ADDRESS");
        String hotWallet = hotWallets.hotWallet(CHAIN).address();
        assertThatThrownBy(() -> withdrawalService.createWithdrawal(new CreateWithdrawalCommand(
                merchant.getMerchantNo(), randomRef(), CHAIN, "USDT", new BigDecimal("100"), hotWallet, null, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("TO_ADDRESS_IS_HOT_WALLET");
    }

    @Test
    void sameMerchantReference_replaysOrConflicts() {
        String ref = randomRef();
        PaymentOrder first = createWithdrawal(ref, "12");

        assertThat(createWithdrawal(ref, "12").getId()).isEqualTo(first.getId());
        assertThatThrownBy(() -> createWithdrawal(ref, "13"))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    private PaymentOrder createWithdrawal(String ref, String amount) {
        return withdrawalService.createWithdrawal(new CreateWithdrawalCommand(
                merchant.getMerchantNo(), ref, CHAIN, "USDT", new BigDecimal(amount), DESTINATION, callbackUrl(ref), null));
    }
}
