package lab.reconciler.domain.address;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DepositAddressRepository extends JpaRepository<DepositAddress, UUID> {

    Optional<DepositAddress> findByMerchantIdAndChainAndToken(UUID merchantId, String chain, String token);

    Optional<DepositAddress> findByChainAndTokenAndAddress(String chain, String token, String address);

    Optional<DepositAddress> findFirstByChainAndAddressIgnoreCase(String chain, String address);

    List<DepositAddress> findByChainAndStatusIn(String chain, Collection<AddressStatus> statuses);
}
