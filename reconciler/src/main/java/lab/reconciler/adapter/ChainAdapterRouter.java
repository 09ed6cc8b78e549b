package lab.reconciler.adapter;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Chain code to adapter lookup. Adding a chain means registering another adapter here;
 * nothing that consumes the router changes.
 */
@Slf4j
public class ChainAdapterRouter implements AutoCloseable {

    private final Map<String, ChainAdapter> adaptersByChain;

    // Build an immutable routing table once at startup and fail fast if two adapters claim the same chain.
    public ChainAdapterRouter(List<? extends ChainAdapter> adapters) {
        this.adaptersByChain = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(
                        adapter -> adapter.chainCode().toUpperCase(Locale.ROOT),
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple adapters found for chain: " + left.chainCode());
                        }
                ));
    }

    public ChainAdapter resolve(String chain) {
        return Optional.ofNullable(chain)
                .map(code -> adaptersByChain.get(code.toUpperCase(Locale.ROOT)))
                .orElseThrow(() -> new IllegalArgumentException("No adapter for chain: " + chain));
    }

    public boolean supports(String chain) {
        return chain != null && adaptersByChain.containsKey(chain.toUpperCase(Locale.ROOT));
    }

    public Collection<ChainAdapter> all() {
        return adaptersByChain.values();
    }

    @Override
    public void close() {
        for (ChainAdapter adapter : adaptersByChain.values()) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("event=adapter.close.failed chain={} error={}", adapter.chainCode(), e.getMessage());
            }
        }
    }
}
