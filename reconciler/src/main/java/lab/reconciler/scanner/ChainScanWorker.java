package lab.reconciler.scanner;

import lab.reconciler.adapter.ChainAdapter;
import lab.reconciler.adapter.ChainAdapter.IncomingTransfer;
import lab.reconciler.adapter.ChainAdapter.TxObservation;
import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.adapter.RpcUnavailableException;
import lab.reconciler.common.KeyedLocks;
import lab.reconciler.common.logging.WorkerCorrelation;
import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.address.DepositAddress;
import lab.reconciler.domain.cursor.ChainCursor;
import lab.reconciler.domain.cursor.ChainCursorRepository;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.orchestration.DepositAddressService;
import lab.reconciler.orchestration.DepositOrderService;
import lab.reconciler.orchestration.WithdrawalOrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One tick of a chain's block scanner. The range {@code (cursor, height - safetyLag]} is
 * scanned for every active deposit address before any transfer is processed, and the
 * cursor moves only after all of them were handled, so a failed tick is simply repeated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChainScanWorker {

    private final ChainAdapterRouter router;
    private final ChainCursorRepository cursorRepository;
    private final DepositAddressService addressService;
    private final DepositOrderService depositService;
    private final WithdrawalOrderService withdrawalService;
    private final ReconcilerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks chainLocks = new KeyedLocks("chain-scan");

    private record Observed(DepositAddress address, IncomingTransfer transfer) {}

    public ScanResult tick(String chain) {
        String code = chain.toUpperCase(Locale.ROOT);
        return WorkerCorrelation.run("scan-" + code, () -> chainLocks.withLock(code, () -> scan(code)));
    }

    private ScanResult scan(String chain) {
        ReconcilerProperties.ChainEntry config = properties.chain(chain);
        ChainAdapter adapter = router.resolve(chain);

        long height;
        try {
            height = adapter.currentHeight();
        } catch (RpcUnavailableException e) {
            long cursorHeight = cursorRepository.findById(chain).map(ChainCursor::getLastScannedHeight).orElse(-1L);
            log.warn("event=scanner.tick.rpc_unavailable chain={} cursor={} error={}", chain, cursorHeight, e.getMessage());
            return ScanResult.unavailable(chain, cursorHeight);
        }

        ChainCursor cursor = loadCursor(chain, config, height);
        long lastScanned = cursor.getLastScannedHeight();
        if (height - lastScanned < 1) {
            markIdle(chain, height);
            log.debug("event=scanner.tick.idle chain={} height={} cursor={}", chain, height, lastScanned);
            return ScanResult.idle(chain, height, lastScanned);
        }

        long from = lastScanned + 1;
        long to = Math.min(height - config.getSafetyLag(), lastScanned + config.getMaxBlocksPerTick());
        int transfersSeen = 0;
        if (to >= from) {
            List<Observed> observed = new ArrayList<>();
            try {
                for (DepositAddress address : addressService.scannable(chain)) {
                    for (IncomingTransfer transfer : adapter.scanAddress(address.getAddress(), address.getToken(), from, to)) {
                        observed.add(new Observed(address, transfer));
                    }
                }
            } catch (RpcUnavailableException e) {
                log.warn("event=scanner.range.rpc_unavailable chain={} from={} to={} error={}", chain, from, to, e.getMessage());
                return ScanResult.unavailable(chain, lastScanned);
            }

            for (Observed item : observed) {
                depositService.onTransferObserved(item.address(), item.transfer());
            }
            transfersSeen = observed.size();
            advanceCursor(chain, to, height);
            log.info("event=scanner.range.done chain={} from={} to={} height={} transfers={}", chain, from, to, height, transfersSeen);
        } else {
            markIdle(chain, height);
        }

        int reorged;
        try {
            reorged = refreshOpenDeposits(chain, adapter, config, height);
            withdrawalService.confirmWithdrawals(chain);
        } catch (RpcUnavailableException e) {
            log.warn("event=scanner.refresh.rpc_unavailable chain={} error={}", chain, e.getMessage());
            long cursorHeight = cursorRepository.findById(chain).map(ChainCursor::getLastScannedHeight).orElse(lastScanned);
            return ScanResult.unavailable(chain, cursorHeight);
        }

        long cursorHeight = cursorRepository.findById(chain).map(ChainCursor::getLastScannedHeight).orElse(lastScanned);
        ScanResult.Outcome outcome = to >= from ? ScanResult.Outcome.SCANNED : ScanResult.Outcome.CAUGHT_UP;
        return new ScanResult(chain, outcome, height, to >= from ? from : 0, to >= from ? to : 0, cursorHeight, transfersSeen, reorged);
    }

    /**
     * Re-queries every detected deposit. A transaction that stays absent for the chain's
     * reorg tolerance fails the order and pulls the cursor back below its old block.
     */
    private int refreshOpenDeposits(String chain, ChainAdapter adapter, ReconcilerProperties.ChainEntry config, long height) {
        int reorged = 0;
        for (PaymentOrder order : depositService.openDeposits(chain)) {
            Optional<TxObservation> observation = adapter.lookupTransaction(order.getTxHash());
            if (observation.isPresent()) {
                TxObservation tx = observation.get();
                if (!tx.success()) {
                    depositService.markReverted(order.getId(), "transaction failed at block " + tx.blockHeight());
                } else {
                    depositService.updateConfirmations(order.getId(), tx.blockHeight(), tx.confirmations());
                }
                continue;
            }

            long missingSince = depositService.markMissing(order.getId(), height);
            if (height - missingSince >= config.getReorgToleranceBlocks()) {
                depositService.markReorged(order.getId(),
                        "tx " + order.getTxHash() + " missing since height " + missingSince + " (recorded at " + order.getBlockHeight() + ")");
                rollbackCursor(chain, order.getBlockHeight() == null ? 0 : order.getBlockHeight() - 1);
                reorged++;
            } else {
                log.info("event=scanner.deposit.missing chain={} orderNo={} txHash={} missingSince={} height={}",
                        chain, order.getOrderNo(), order.getTxHash(), missingSince, height);
            }
        }
        return reorged;
    }

    private ChainCursor loadCursor(String chain, ReconcilerProperties.ChainEntry config, long height) {
        return cursorRepository.findById(chain).orElseGet(() -> transactionTemplate.execute(status -> {
            long start = config.getStartHeight() != null
                    ? config.getStartHeight()
                    : Math.max(0, height - config.getSafetyLag());
            ChainCursor created = cursorRepository.save(ChainCursor.startingAt(chain, start));
            log.info("event=scanner.cursor.initialized chain={} height={}", chain, start);
            return created;
        }));
    }

    private void advanceCursor(String chain, long to, long height) {
        transactionTemplate.executeWithoutResult(status -> {
            ChainCursor cursor = cursorRepository.findById(chain).orElseThrow();
            cursor.advanceTo(to, height, clock.instant());
            cursorRepository.save(cursor);
        });
    }

    private void markIdle(String chain, long height) {
        transactionTemplate.executeWithoutResult(status -> {
            ChainCursor cursor = cursorRepository.findById(chain).orElseThrow();
            cursor.markIdle(height, clock.instant());
            cursorRepository.save(cursor);
        });
    }

    private void rollbackCursor(String chain, long height) {
        transactionTemplate.executeWithoutResult(status -> {
            ChainCursor cursor = cursorRepository.findById(chain).orElseThrow();
            long before = cursor.getLastScannedHeight();
            if (cursor.rollbackTo(height)) {
                cursorRepository.save(cursor);
                log.warn("event=scanner.cursor.rolled_back chain={} from={} to={}", chain, before, cursor.getLastScannedHeight());
            }
        });
    }
}
