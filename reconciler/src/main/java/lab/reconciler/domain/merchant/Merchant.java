package lab.reconciler.domain.merchant;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "merchants",
       uniqueConstraints = @UniqueConstraint(name = "uk_merchant_no", columnNames = "merchantNo"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Merchant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 32)
    private String merchantNo;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 128)
    private String depositKey;

    @Column(nullable = false, length = 128)
    private String withdrawKey;

    /** Per-merchant overrides; null falls back to the configured defaults. */
    @Column(precision = 10, scale = 6)
    private BigDecimal depositFeePercent;

    @Column(precision = 10, scale = 6)
    private BigDecimal withdrawalFeePercent;

    @Column(precision = 38, scale = 18)
    private BigDecimal withdrawalFixedFee;

    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static Merchant register(String merchantNo, String name, String depositKey, String withdrawKey, Instant now) {
        return Merchant.builder()
                .merchantNo(merchantNo)
                .name(name)
                .depositKey(depositKey)
                .withdrawKey(withdrawKey)
                .active(true)
                .createdAt(now)
                .build();
    }

    public void overrideFees(BigDecimal depositFeePercent, BigDecimal withdrawalFeePercent, BigDecimal withdrawalFixedFee) {
        this.depositFeePercent = depositFeePercent;
        this.withdrawalFeePercent = withdrawalFeePercent;
        this.withdrawalFixedFee = withdrawalFixedFee;
    }

    public void deactivate() {
        this.active = false;
    }
}
