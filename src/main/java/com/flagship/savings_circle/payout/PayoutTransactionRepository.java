package com.flagship.savings_circle.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PayoutTransactionRepository extends JpaRepository<PayoutTransactionEntity, UUID> {

    List<PayoutTransactionEntity> findByPoolIdOrderByRoundAsc(UUID poolId);

    boolean existsByPoolIdAndRound(UUID poolId, int round);
}
