package com.flagship.savings_circle.engine;

import com.flagship.savings_circle.contribution.Contribution;
import com.flagship.savings_circle.contribution.ContributionEntity;
import com.flagship.savings_circle.contribution.ContributionRepository;
import com.flagship.savings_circle.engine.exception.NotFoundException;
import com.flagship.savings_circle.payout.PayoutTransaction;
import com.flagship.savings_circle.payout.PayoutTransactionEntity;
import com.flagship.savings_circle.payout.PayoutTransactionRepository;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.pool.PoolEntity;
import com.flagship.savings_circle.pool.PoolRepository;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberEntity;
import com.flagship.savings_circle.roster.MemberRepository;
import com.flagship.savings_circle.roster.Roster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Loads and saves pool aggregates.
 *
 * This service bridges the domain components and the JPA entities. Write
 * methods use MANDATORY propagation: they only make sense inside the unit
 * of work opened by {@link OptimisticRetryExecutor}, which is also where a
 * version conflict surfaces at commit time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolAggregateStore {

    private final PoolRepository poolRepository;
    private final MemberRepository memberRepository;
    private final ContributionRepository contributionRepository;
    private final PayoutTransactionRepository payoutRepository;

    /**
     * Loads a pool without taking any lock. For status views.
     *
     * @throws NotFoundException if the pool does not exist
     */
    @Transactional(readOnly = true)
    public PoolAggregate load(UUID poolId) {
        PoolEntity entity = poolRepository.findById(poolId)
            .orElseThrow(() -> NotFoundException.pool(poolId));
        return assemble(entity.toDomain());
    }

    /**
     * Loads a pool for modification. The pool version is force-incremented
     * at commit, so any concurrent writer holding the same version fails.
     *
     * @throws NotFoundException if the pool does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PoolAggregate loadForWrite(UUID poolId) {
        PoolEntity entity = poolRepository.findByIdForWrite(poolId)
            .orElseThrow(() -> NotFoundException.pool(poolId));
        log.debug("Loaded pool for write: version={}", entity.getVersion());
        return assemble(entity.toDomain());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Pool insertPool(Pool pool) {
        PoolEntity saved = poolRepository.save(PoolEntity.fromDomain(pool));
        log.debug("Inserted pool {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void savePool(Pool pool) {
        PoolEntity entity = poolRepository.findById(pool.getId())
            .orElseThrow(() -> NotFoundException.pool(pool.getId()));
        entity.updateFromDomain(pool);
    }

    /**
     * Inserts new members and updates position/status of existing ones.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void saveMembers(Collection<Member> members) {
        for (Member member : members) {
            memberRepository.findById(member.getId()).ifPresentOrElse(
                entity -> entity.updateFromDomain(member),
                () -> memberRepository.save(MemberEntity.fromDomain(member))
            );
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void saveContributions(Collection<Contribution> contributions) {
        for (Contribution contribution : contributions) {
            contributionRepository.findById(contribution.getId()).ifPresentOrElse(
                entity -> entity.updateFromDomain(contribution),
                () -> contributionRepository.save(ContributionEntity.fromDomain(contribution))
            );
        }
        if (!contributions.isEmpty()) {
            log.debug("Saved {} contribution record(s)", contributions.size());
        }
    }

    /**
     * Inserts a payout. A second payout for the same round violates the
     * (pool_id, round) unique constraint.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void savePayout(PayoutTransaction transaction) {
        payoutRepository.save(PayoutTransactionEntity.fromDomain(transaction));
        // Flush now so a duplicate round fails inside this unit of work, not at commit.
        payoutRepository.flush();
    }

    @Transactional(readOnly = true)
    public List<PayoutTransaction> findPayouts(UUID poolId) {
        if (!poolRepository.existsById(poolId)) {
            throw NotFoundException.pool(poolId);
        }
        return payoutRepository.findByPoolIdOrderByRoundAsc(poolId).stream()
            .map(PayoutTransactionEntity::toDomain)
            .toList();
    }

    private PoolAggregate assemble(Pool pool) {
        List<Member> members = memberRepository.findByPoolIdOrderByPositionAsc(pool.getId()).stream()
            .map(MemberEntity::toDomain)
            .toList();
        List<Contribution> contributions = contributionRepository.findByPoolId(pool.getId()).stream()
            .map(ContributionEntity::toDomain)
            .toList();
        List<PayoutTransaction> payouts = payoutRepository.findByPoolIdOrderByRoundAsc(pool.getId()).stream()
            .map(PayoutTransactionEntity::toDomain)
            .toList();
        return new PoolAggregate(pool, Roster.of(pool.getMaxMembers(), members), contributions, payouts);
    }
}
