package lab.reconciler.domain.address;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A deposit address is bound to one (merchant, chain, token) for its whole life and is
 * never deleted, so a transfer to it always has exactly one owner.
 */
@Entity
@Table(name = "deposit_addresses",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_deposit_address_owner", columnNames = {"merchantId", "chain", "token"}),
           @UniqueConstraint(name = "uk_deposit_address_value", columnNames = {"chain", "token", "address"})
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class DepositAddress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID merchantId;

    @Column(nullable = false, updatable = false, length = 16)
    private String chain;

    @Column(nullable = false, updatable = false, length = 16)
    private String token;

    @Column(nullable = false, updatable = false, length = 128)
    private String address;

    @Column(nullable = false, updatable = false, length = 512)
    private String encryptedPrivateKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AddressStatus status;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal totalReceived;

    private Instant lastActivityAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static DepositAddress assigned(UUID merchantId, String chain, String token, String address, String encryptedPrivateKey, Instant now) {
        return DepositAddress.builder()
                .merchantId(merchantId)
                .chain(chain)
                .token(token)
                .address(address)
                .encryptedPrivateKey(encryptedPrivateKey)
                .status(AddressStatus.ASSIGNED)
                .totalReceived(BigDecimal.ZERO)
                .createdAt(now)
                .build();
    }

    public void recordReceived(BigDecimal amount, Instant now) {
        this.totalReceived = totalReceived.add(amount);
        this.lastActivityAt = now;
    }

    public void changeStatus(AddressStatus next) {
        this.status = next;
    }

    /** Locked addresses still receive funds and are still scanned; only disabled ones drop out. */
    public boolean isScannable() {
        return status == AddressStatus.ASSIGNED || status == AddressStatus.LOCKED;
    }
}
