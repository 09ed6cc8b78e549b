package lab.reconciler.orchestration;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolved price of one token unit in a foreign currency. Rate acquisition is somebody
 * else's job; this only answers with what is currently known.
 */
public interface ExchangeRateProvider {

    Optional<BigDecimal> rate(String token, String currency);
}
