package lab.reconciler.security;

import lab.reconciler.adapter.ChainAdapter;
import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custody wallets per chain: the hot wallet that pays withdrawals and gas top-ups, and the
 * collection address sweeps move funds to. In mock mode, chains without configured wallets
 * get generated ones for the lifetime of the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HotWalletDirectory {

    public record Wallet(String address, String encryptedKey) {}

    private final ReconcilerProperties properties;
    private final ChainAdapterRouter router;
    private final KeyVault keyVault;
    private final Map<String, Wallet> generatedHotWallets = new ConcurrentHashMap<>();
    private final Map<String, String> generatedCollectionAddresses = new ConcurrentHashMap<>();

    public Wallet hotWallet(String chain) {
        ReconcilerProperties.HotWallet configured = properties.chain(chain).getHotWallet();
        if (configured.getAddress() != null && !configured.getAddress().isBlank()) {
            return new Wallet(configured.getAddress(), configured.getEncryptedKey());
        }
        requireMockMode(chain, "hot-wallet.address");
        return generatedHotWallets.computeIfAbsent(chain.toUpperCase(Locale.ROOT), this::generate);
    }

    public String collectionAddress(String chain) {
        String configured = properties.chain(chain).getCollectionAddress();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        requireMockMode(chain, "collection-address");
        return generatedCollectionAddresses.computeIfAbsent(chain.toUpperCase(Locale.ROOT), code -> generate(code).address());
    }

    private Wallet generate(String chain) {
        ChainAdapter.GeneratedAddress generated = router.resolve(chain).generateAddress();
        try {
            log.info("event=hot_wallet.generated chain={} address={}", chain, generated.address());
            return new Wallet(generated.address(), keyVault.encrypt(generated.privateKey()));
        } finally {
            Arrays.fill(generated.privateKey(), (byte) 0);
        }
    }

    private void requireMockMode(String chain, String property) {
        if (!"mock".equalsIgnoreCase(properties.getMode())) {
            throw new IllegalStateException("reconciler.chains." + chain + "." + property + " must be configured");
        }
    }
}
