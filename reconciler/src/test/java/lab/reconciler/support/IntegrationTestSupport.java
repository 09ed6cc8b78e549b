package lab.reconciler.support;

import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.domain.ledger.EntryKind;
import lab.reconciler.domain.ledger.LedgerAccount;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.order.PaymentOrderRepository;
import lab.reconciler.ledger.LedgerService;
import lab.reconciler.ledger.PostingRequest;
import lab.reconciler.orchestration.MerchantService;
import lab.reconciler.scanner.ChainScanWorker;
import lab.reconciler.scanner.ScanResult;
import lab.reconciler.sim.fakechain.FakeChain;
import lab.reconciler.sim.fakechain.SimulatedChainAdapter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Full application on the simulated chains and an in-memory database. All subclasses share
 * one context, so every test works with its own merchants and never assumes an empty table.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(ReconcilerTestConfig.class)
public abstract class IntegrationTestSupport {

    @Autowired
    protected MerchantService merchantService;

    @Autowired
    protected LedgerService ledgerService;

    @Autowired
    protected PaymentOrderRepository orderRepository;

    @Autowired
    protected ChainScanWorker scanWorker;

    @Autowired
    protected ChainAdapterRouter router;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected RecordingWebhookTransport webhookTransport;

    protected Merchant newMerchant() {
        String merchantNo = "M" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return merchantService.register(merchantNo, "Merchant " + merchantNo, null, null, null);
    }

    protected FakeChain fakeChain(String chain) {
        return ((SimulatedChainAdapter) router.resolve(chain)).fakeChain();
    }

    protected ScanResult scan(String chain) {
        return scanWorker.tick(chain);
    }

    protected PaymentOrder reload(PaymentOrder order) {
        return orderRepository.findById(order.getId()).orElseThrow();
    }

    protected BigDecimal balance(Merchant merchant, String token) {
        return ledgerService.balanceOf(merchant.getId(), token);
    }

    /** Seeds a merchant balance without going through a deposit. */
    protected void credit(Merchant merchant, String token, String amount) {
        LedgerAccount account = ledgerService.openAccount(merchant.getId(), token);
        UUID seedOrderId = UUID.randomUUID();
        ledgerService.post(PostingRequest.credit(account.getId(), seedOrderId, new BigDecimal(amount),
                EntryKind.ADJUSTMENT, "test seed", "seed:" + seedOrderId));
    }

    protected static String callbackUrl(String merchantRef) {
        return "http://merchant.test/callbacks/" + merchantRef;
    }

    protected static String randomRef() {
        return "ref-" + UUID.randomUUID();
    }
}
