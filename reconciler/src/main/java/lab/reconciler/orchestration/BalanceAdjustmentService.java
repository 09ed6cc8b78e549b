package lab.reconciler.orchestration;

import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.common.SignatureVerificationException;
import lab.reconciler.domain.ledger.LedgerEntry;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.ledger.LedgerService;
import lab.reconciler.security.TotpVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Operator corrections of a merchant balance, gated by the same second factor as
 * force-completion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAdjustmentService {

    private final MerchantService merchantService;
    private final LedgerService ledgerService;
    private final TotpVerifier totpVerifier;

    public LedgerEntry adjust(String merchantNo, String token, BigDecimal amount, String operator,
                              String reason, String requestId, String totpCode) {
        if (operator == null || operator.isBlank()) {
            throw new InvalidRequestException("operator is required");
        }
        if (token == null || token.isBlank()) {
            throw new InvalidRequestException("token is required");
        }
        if (!totpVerifier.verify(totpCode)) {
            log.warn("event=ledger.adjust.denied merchantNo={} operator={} reason=bad_totp", merchantNo, operator);
            throw new SignatureVerificationException("invalid second factor");
        }
        Merchant merchant = merchantService.requireActive(merchantNo);
        return ledgerService.adjust(merchant.getId(), token.toUpperCase(Locale.ROOT), amount, operator, reason, requestId);
    }
}
