package com.flagship.savings_circle.contribution;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContributionRepository extends JpaRepository<ContributionEntity, UUID> {

    List<ContributionEntity> findByPoolId(UUID poolId);

    List<ContributionEntity> findByPoolIdAndRound(UUID poolId, int round);

    /**
     * Confirmed contributions for a round, used by monitoring.
     */
    @Query("""
        SELECT COUNT(c) FROM ContributionEntity c
        WHERE c.poolId = :poolId AND c.round = :round
        AND c.status = com.flagship.savings_circle.contribution.ContributionStatus.CONFIRMED
        """)
    long countConfirmed(@Param("poolId") UUID poolId, @Param("round") int round);
}
