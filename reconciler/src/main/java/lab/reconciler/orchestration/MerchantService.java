package lab.reconciler.orchestration;

import lab.reconciler.common.IdempotencyConflictException;
import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.merchant.MerchantRepository;
import lab.reconciler.domain.order.OrderKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;

@Service
@RequiredArgsConstructor
@Slf4j
public class MerchantService {

    private final MerchantRepository merchantRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Transactional
    public Merchant register(String merchantNo, String name, BigDecimal depositFeePercent,
                             BigDecimal withdrawalFeePercent, BigDecimal withdrawalFixedFee) {
        if (merchantNo == null || merchantNo.isBlank()) {
            throw new InvalidRequestException("merchant_no is required");
        }
        if (merchantRepository.findByMerchantNo(merchantNo).isPresent()) {
            throw new IdempotencyConflictException("merchant already registered: " + merchantNo);
        }
        Merchant merchant = Merchant.register(merchantNo, name == null ? merchantNo : name, newKey(), newKey(), clock.instant());
        merchant.overrideFees(depositFeePercent, withdrawalFeePercent, withdrawalFixedFee);
        Merchant saved = merchantRepository.save(merchant);
        log.info("event=merchant.registered merchantId={} merchantNo={}", saved.getId(), merchantNo);
        return saved;
    }

    @Transactional(readOnly = true)
    public Merchant requireActive(String merchantNo) {
        Merchant merchant = merchantRepository.findByMerchantNo(merchantNo)
                .orElseThrow(() -> new NotFoundException("merchant not found: " + merchantNo));
        if (!merchant.isActive()) {
            throw new InvalidRequestException("merchant is disabled: " + merchantNo);
        }
        return merchant;
    }

    public static String secretFor(Merchant merchant, OrderKind kind) {
        return kind == OrderKind.DEPOSIT ? merchant.getDepositKey() : merchant.getWithdrawKey();
    }

    private String newKey() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
