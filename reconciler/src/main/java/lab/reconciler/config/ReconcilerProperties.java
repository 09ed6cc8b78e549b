package lab.reconciler.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Root configuration of the reconciler. Chains are keyed by their upper-case chain code
 * (e.g. TRON, ETH, SOL); every scanner, adapter and sweep loop reads its limits from the
 * matching {@link ChainEntry}.
 */
@ConfigurationProperties(prefix = "reconciler")
@NoArgsConstructor
@Getter
@Setter
public class ReconcilerProperties {

    /** {@code mock} wires simulated chains, {@code rpc} wires JSON-RPC adapters. */
    private String mode = "mock";

    private Map<String, ChainEntry> chains = new LinkedHashMap<>();

    private Fees fees = new Fees();

    private Deposit deposit = new Deposit();

    private Webhook webhook = new Webhook();

    private Workers workers = new Workers();

    private Security security = new Security();

    /** Static token/currency rates: exchangeRates.USDT.CNY = 7.2 means 1 USDT = 7.2 CNY. */
    private Map<String, Map<String, BigDecimal>> exchangeRates = new HashMap<>();

    public void setChains(Map<String, ChainEntry> chains) {
        Map<String, ChainEntry> normalized = new LinkedHashMap<>();
        if (chains != null) {
            chains.forEach((code, entry) -> normalized.put(code.toUpperCase(Locale.ROOT), entry));
        }
        this.chains = normalized;
    }

    public ChainEntry chain(String chainCode) {
        ChainEntry entry = chains.get(chainCode.toUpperCase(Locale.ROOT));
        if (entry == null) {
            throw new IllegalArgumentException("unsupported chain: " + chainCode);
        }
        return entry;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private String rpcUrl;
        private long chainId;
        private String nativeSymbol;
        private int nativeDecimals = 18;
        private int requiredConfirmations = 12;
        /** Blocks below the tip that are never scanned. */
        private int safetyLag = 2;
        /** Blocks a previously seen transaction may stay absent before it is treated as reorged. */
        private int reorgToleranceBlocks = 6;
        private int maxBlocksPerTick = 500;
        private int batchBlockSize = 100;
        private Duration scanInterval = Duration.ofSeconds(10);
        private Duration rpcTimeout = Duration.ofSeconds(10);
        private int maxConfirmationWaitCycles = 120;
        /** Height the cursor starts from on first run; unset means the current safe height. */
        private Long startHeight;
        /** Fee charged by the simulated chain for every transfer. */
        private BigDecimal simulatedFee = new BigDecimal("0.001");
        private Map<String, TokenEntry> tokens = new LinkedHashMap<>();
        private HotWallet hotWallet = new HotWallet();
        private String collectionAddress;
        private Sweep sweep = new Sweep();
        private Proxy proxy = new Proxy();

        public void setTokens(Map<String, TokenEntry> tokens) {
            Map<String, TokenEntry> normalized = new LinkedHashMap<>();
            if (tokens != null) {
                tokens.forEach((symbol, entry) -> normalized.put(symbol.toUpperCase(Locale.ROOT), entry));
            }
            this.tokens = normalized;
        }

        public boolean isNative(String token) {
            return nativeSymbol != null && nativeSymbol.equalsIgnoreCase(token);
        }

        public TokenEntry token(String symbol) {
            TokenEntry entry = tokens.get(symbol.toUpperCase(Locale.ROOT));
            if (entry == null && !isNative(symbol)) {
                throw new IllegalArgumentException("unsupported token " + symbol);
            }
            return entry;
        }

        public boolean supportsToken(String symbol) {
            return isNative(symbol) || tokens.containsKey(symbol.toUpperCase(Locale.ROOT));
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class TokenEntry {
        private String contract;
        private int decimals = 6;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class HotWallet {
        private String address;
        /** base64(nonce || ciphertext || tag), decrypted only for the duration of a signature. */
        private String encryptedKey;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Sweep {
        private BigDecimal minAmount = new BigDecimal("10");
        private BigDecimal gasTopUpAmount = new BigDecimal("0.005");
        private BigDecimal gasReserveMultiplier = new BigDecimal("1.5");
        private int batchSize = 10;
        private int maxRetries = 3;
        private Duration collectDelay = Duration.ofSeconds(30);
        /** A broadcast task not seen on chain within this window is failed and retried. */
        private Duration processingTimeout = Duration.ofMinutes(10);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Proxy {
        private boolean enabled;
        private String host;
        private int port = 8080;
        private String username;
        private String password;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Fees {
        private FeeRule deposit = new FeeRule(new BigDecimal("0.01"), BigDecimal.ZERO, BigDecimal.ZERO);
        private FeeRule withdrawal = new FeeRule(new BigDecimal("0.01"), BigDecimal.ONE, new BigDecimal("10"));
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class FeeRule {
        private BigDecimal percent = BigDecimal.ZERO;
        private BigDecimal fixed = BigDecimal.ZERO;
        private BigDecimal minAmount = BigDecimal.ZERO;

        public FeeRule(BigDecimal percent, BigDecimal fixed, BigDecimal minAmount) {
            this.percent = percent;
            this.fixed = fixed;
            this.minAmount = minAmount;
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Deposit {
        private Duration expiry = Duration.ofMinutes(30);
        private boolean uniqueAmount = true;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Webhook {
        private List<Duration> backoff = new ArrayList<>(List.of(
                Duration.ofMinutes(1),
                Duration.ofMinutes(5),
                Duration.ofMinutes(15),
                Duration.ofHours(1),
                Duration.ofHours(6)
        ));
        private boolean requireHttps = true;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        private int batchSize = 50;

        public void setBackoff(List<Duration> backoff) {
            this.backoff = backoff != null ? backoff : new ArrayList<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Workers {
        private boolean enabled = true;
        /** Threads shared by the @Scheduled workers. */
        private int schedulerPoolSize = 4;
        private int withdrawalBatchSize = 20;
        private Duration withdrawalResumeAfter = Duration.ofMinutes(2);
        private Duration withdrawalInterval = Duration.ofSeconds(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private Duration webhookInterval = Duration.ofSeconds(15);
        private Duration expiryInterval = Duration.ofSeconds(30);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Security {
        /** Base64 of a 32-byte AES key, supplied from the environment. */
        private String encryptionKey;
        /** Base32 TOTP secret for privileged operators. */
        private String adminTotpSecret;
        private Duration signatureWindow = Duration.ofMinutes(5);
    }
}
