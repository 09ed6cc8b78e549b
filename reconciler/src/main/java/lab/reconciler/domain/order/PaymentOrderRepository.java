package lab.reconciler.domain.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PaymentOrderRepository extends JpaRepository<PaymentOrder, UUID> {

    Optional<PaymentOrder> findByOrderNo(String orderNo);

    Optional<PaymentOrder> findByMerchantIdAndKindAndMerchantRef(UUID merchantId, OrderKind kind, String merchantRef);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from PaymentOrder o where o.id = :id")
    Optional<PaymentOrder> findByIdForUpdate(@Param("id") UUID id);

    /** Orders already bound to a transfer, excluding ones that were invalidated by a reorg. */
    @Query("""
            select o from PaymentOrder o
            where o.chain = :chain and o.walletAddress = :address and o.txHash = :txHash
              and o.kind = lab.reconciler.domain.order.OrderKind.DEPOSIT
              and (o.failureReason is null or o.failureReason <> lab.reconciler.domain.order.FailureReason.REORGED)
            """)
    List<PaymentOrder> findLiveDepositsByTransfer(@Param("chain") String chain,
                                                  @Param("address") String address,
                                                  @Param("txHash") String txHash);

    List<PaymentOrder> findByKindAndChainAndWalletAddressAndStatusOrderByCreatedAtAsc(
            OrderKind kind, String chain, String walletAddress, OrderStatus status);

    List<PaymentOrder> findByKindAndChainAndStatusIn(OrderKind kind, String chain, Collection<OrderStatus> statuses);

    @Query("""
            select o.id from PaymentOrder o
            where o.kind = lab.reconciler.domain.order.OrderKind.DEPOSIT
              and o.status = lab.reconciler.domain.order.OrderStatus.PENDING
              and o.expiresAt <= :now
            """)
    List<UUID> findExpiredPendingDepositIds(@Param("now") Instant now);

    @Query("""
            select o.id from PaymentOrder o
            where o.kind = lab.reconciler.domain.order.OrderKind.WITHDRAWAL
              and (o.status = lab.reconciler.domain.order.OrderStatus.PENDING
                   or (o.status = lab.reconciler.domain.order.OrderStatus.PROCESSING
                       and o.txHash is null and o.updatedAt <= :staleBefore))
            order by o.createdAt asc
            """)
    List<UUID> findDispatchableWithdrawalIds(@Param("staleBefore") Instant staleBefore, Pageable page);
}
