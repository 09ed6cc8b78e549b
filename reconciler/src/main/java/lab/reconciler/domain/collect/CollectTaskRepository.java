package lab.reconciler.domain.collect;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface CollectTaskRepository extends JpaRepository<CollectTask, UUID> {

    boolean existsByChainAndSourceAddressAndStatusIn(String chain, String sourceAddress, Collection<CollectTaskStatus> statuses);

    @Query("""
            select t from CollectTask t
            where t.chain = :chain
              and t.status = lab.reconciler.domain.collect.CollectTaskStatus.PENDING
              and t.scheduledAt <= :now
            order by t.scheduledAt asc
            """)
    List<CollectTask> findDue(@Param("chain") String chain, @Param("now") Instant now, Pageable page);

    boolean existsByChainAndSourceAddressAndStatus(String chain, String sourceAddress, CollectTaskStatus status);

    List<CollectTask> findByChainAndSourceAddressAndStatus(String chain, String sourceAddress, CollectTaskStatus status);

    List<CollectTask> findByChainAndStatusOrderByExecutedAtAsc(String chain, CollectTaskStatus status);

    List<CollectTask> findByChainAndSourceAddressOrderByCreatedAtAsc(String chain, String sourceAddress);
}
