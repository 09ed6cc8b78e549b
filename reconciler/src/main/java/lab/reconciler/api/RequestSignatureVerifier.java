package lab.reconciler.api;

import lab.reconciler.common.NotFoundException;
import lab.reconciler.common.SignatureVerificationException;
import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.orchestration.MerchantService;
import lab.reconciler.webhook.CallbackSigner;
import lab.reconciler.webhook.CallbackSigner.RequestLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Authenticates merchant API calls: the timestamp must be within the configured window of
 * server time and {@code sign} must match the HMAC of the request fields, concatenated in the
 * operation's layout order, under the key of the operation's kind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestSignatureVerifier {

    private final MerchantService merchantService;
    private final CallbackSigner signer;
    private final ReconcilerProperties properties;
    private final Clock clock;

    public Merchant verify(String merchantNo, Long timestamp, String sign, OrderKind kind,
                           RequestLayout layout, Map<String, String> fields) {
        if (merchantNo == null || merchantNo.isBlank() || sign == null || sign.isBlank()) {
            throw new SignatureVerificationException("merchant_no and sign are required");
        }
        if (timestamp == null) {
            throw new SignatureVerificationException("timestamp is required");
        }
        Duration window = properties.getSecurity().getSignatureWindow();
        long skewMillis = Math.abs(clock.millis() - timestamp);
        if (skewMillis > window.toMillis()) {
            log.warn("event=api.signature.rejected merchantNo={} reason=timestamp_out_of_window skewMs={}", merchantNo, skewMillis);
            throw new SignatureVerificationException("timestamp outside of the allowed window");
        }

        Merchant merchant;
        try {
            merchant = merchantService.requireActive(merchantNo);
        } catch (NotFoundException e) {
            log.warn("event=api.signature.rejected merchantNo={} reason=unknown_merchant", merchantNo);
            throw new SignatureVerificationException("invalid signature");
        }
        if (!signer.verifyRequest(MerchantService.secretFor(merchant, kind), sign, layout, fields)) {
            log.warn("event=api.signature.rejected merchantNo={} kind={} reason=mismatch", merchantNo, kind);
            throw new SignatureVerificationException("invalid signature");
        }
        return merchant;
    }
}
