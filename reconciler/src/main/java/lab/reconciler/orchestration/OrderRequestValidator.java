package lab.reconciler.orchestration;

import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Field checks shared by deposit and withdrawal creation. Business limits live in the
 * withdrawal policy rules instead.
 */
@Component
@RequiredArgsConstructor
class OrderRequestValidator {

    private final ReconcilerProperties properties;
    private final ChainAdapterRouter router;

    String requireChain(String chain) {
        if (chain == null || chain.isBlank()) {
            throw new InvalidRequestException("chain is required");
        }
        String code = chain.trim().toUpperCase(Locale.ROOT);
        if (!properties.getChains().containsKey(code) || !router.supports(code)) {
            throw new InvalidRequestException("unsupported chain: " + chain);
        }
        return code;
    }

    String requireToken(String chain, String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidRequestException("token is required");
        }
        String symbol = token.trim().toUpperCase(Locale.ROOT);
        if (!properties.chain(chain).supportsToken(symbol)) {
            throw new InvalidRequestException("unsupported token " + token + " on " + chain);
        }
        return symbol;
    }

    void requireMerchantRef(String merchantRef) {
        if (merchantRef == null || merchantRef.isBlank()) {
            throw new InvalidRequestException("out_trade_no is required");
        }
        if (merchantRef.length() > 64) {
            throw new InvalidRequestException("out_trade_no is longer than 64 characters");
        }
    }

    void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException("amount must be positive");
        }
    }

    void requireCallbackUrl(String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            return;
        }
        URI uri;
        try {
            uri = new URI(callbackUrl);
        } catch (URISyntaxException e) {
            throw new InvalidRequestException("callback_url is not a valid URL");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean https = scheme.equals("https");
        if (!https && !(scheme.equals("http") && !properties.getWebhook().isRequireHttps())) {
            throw new InvalidRequestException("callback_url must use https");
        }
        if (uri.getHost() == null) {
            throw new InvalidRequestException("callback_url has no host");
        }
    }
}
