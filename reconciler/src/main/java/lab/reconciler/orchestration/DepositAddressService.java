package lab.reconciler.orchestration;

import lab.reconciler.adapter.ChainAdapter;
import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.common.KeyedLocks;
import lab.reconciler.domain.address.AddressStatus;
import lab.reconciler.domain.address.DepositAddress;
import lab.reconciler.domain.address.DepositAddressRepository;
import lab.reconciler.security.KeyVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lazily creates the single deposit address of a (merchant, chain, token). Addresses are
 * never reassigned or deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositAddressService {

    private final DepositAddressRepository addressRepository;
    private final ChainAdapterRouter router;
    private final KeyVault keyVault;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks allocationLocks = new KeyedLocks("deposit-address");

    public DepositAddress allocate(UUID merchantId, String chain, String token) {
        return allocationLocks.withLock(merchantId + ":" + chain + ":" + token, () -> {
            Optional<DepositAddress> existing = addressRepository.findByMerchantIdAndChainAndToken(merchantId, chain, token);
            if (existing.isPresent()) {
                return existing.get();
            }
            ChainAdapter.GeneratedAddress generated = router.resolve(chain).generateAddress();
            String encrypted;
            try {
                encrypted = keyVault.encrypt(generated.privateKey());
            } finally {
                Arrays.fill(generated.privateKey(), (byte) 0);
            }
            try {
                DepositAddress saved = transactionTemplate.execute(status -> addressRepository.save(
                        DepositAddress.assigned(merchantId, chain, token, generated.address(), encrypted, clock.instant())));
                log.info("event=deposit_address.allocated merchantId={} chain={} token={} address={}",
                        merchantId, chain, token, generated.address());
                return saved;
            } catch (DataIntegrityViolationException e) {
                // allocated concurrently by another node
                return addressRepository.findByMerchantIdAndChainAndToken(merchantId, chain, token).orElseThrow(() -> e);
            }
        });
    }

    public List<DepositAddress> scannable(String chain) {
        return addressRepository.findByChainAndStatusIn(chain, EnumSet.of(AddressStatus.ASSIGNED, AddressStatus.LOCKED));
    }
}
