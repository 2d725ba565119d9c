package com.flagship.savings_circle.pool;

import com.flagship.savings_circle.activity.ActivityPublisher;
import com.flagship.savings_circle.activity.PoolActivityEvent;
import com.flagship.savings_circle.contribution.ContributionStatusCache;
import com.flagship.savings_circle.engine.OptimisticRetryExecutor;
import com.flagship.savings_circle.engine.PoolAggregate;
import com.flagship.savings_circle.engine.PoolAggregateStore;
import com.flagship.savings_circle.engine.exception.NotFoundException;
import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.engine.exception.ValidationException;
import com.flagship.savings_circle.payout.PayoutTransaction;
import com.flagship.savings_circle.pool.dto.CreatePoolRequest;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberRole;
import com.flagship.savings_circle.roster.Roster;
import com.flagship.savings_circle.round.RoundTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Pool administration: creation, roster changes and cancellation.
 *
 * Roster changes go through the same versioned unit of work as the
 * engine operations, so a reorder cannot interleave with a payout.
 * Failures are thrown as {@link com.flagship.savings_circle.engine.exception.PoolEngineException}
 * and mapped by the exception handler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolService {

    private final PoolAggregateStore store;
    private final OptimisticRetryExecutor retryExecutor;
    private final ActivityPublisher activityPublisher;
    private final ContributionStatusCache statusCache;

    public PoolAggregate createPool(CreatePoolRequest request) {
        int capacity = request.getMaxMembers() == null ? Pool.DEFAULT_MAX_MEMBERS : request.getMaxMembers();
        int totalRounds = request.getTotalRounds() == null ? capacity : request.getTotalRounds();
        LocalDate startDate = request.getStartDate() == null ? LocalDate.now() : request.getStartDate();
        int amount = request.getContributionAmount() == null ? 0 : request.getContributionAmount();

        Pool pool = Pool.create(UUID.randomUUID(), request.getName(), amount, request.getFrequency(),
                totalRounds, capacity, startDate);
        requireName(request.getAdminName());

        PoolAggregate created = retryExecutor.execute("createPool", pool.getId(), () -> {
            Pool saved = store.insertPool(pool);
            Member admin = Member.create(saved.getId(), request.getAdminUserId(),
                    request.getAdminName(), request.getAdminEmail(), MemberRole.ADMIN);

            Roster roster = Roster.empty(capacity).add(admin);
            roster = roster.markCurrent(admin.getId());
            store.saveMembers(roster.allMembers());

            activityPublisher.publish(PoolActivityEvent.memberJoined(saved.getId(), roster.memberAt(1)));
            return new PoolAggregate(saved, roster, List.of(), List.of());
        });

        log.info("Pool created: poolId={}, amount={}, frequency={}, totalRounds={}, maxMembers={}",
                pool.getId(), amount, pool.getFrequency(), totalRounds, capacity);
        return created;
    }

    public PoolAggregate getPool(UUID poolId) {
        return store.load(poolId);
    }

    public List<PayoutTransaction> getPayouts(UUID poolId) {
        return store.findPayouts(poolId);
    }

    /**
     * Adds a member at the next free position. When the second member joins
     * the pool starts and round 1 opens.
     */
    public PoolAggregate addMember(UUID poolId, String name, String email, UUID userId) {
        requireName(name);
        PoolAggregate updated = retryExecutor.execute("addMember", poolId, () -> {
            PoolAggregate aggregate = store.loadForWrite(poolId);
            aggregate.pool().requireActive();
            boolean wasInProgress = aggregate.tracker().isInProgress();

            Member candidate = Member.create(poolId, userId, name, email, MemberRole.MEMBER);
            PoolAggregate next = applyRosterChange(aggregate, aggregate.roster().add(candidate));

            Member joined = next.roster().findById(candidate.getId())
                    .orElseThrow(() -> new IllegalStateException("Added member missing from roster"));
            activityPublisher.publish(PoolActivityEvent.memberJoined(poolId, joined));

            RoundTracker tracker = next.tracker();
            if (!wasInProgress && tracker.isInProgress()) {
                int round = tracker.currentRound();
                activityPublisher.publish(PoolActivityEvent.roundStarted(poolId, round, tracker.recipient(round),
                        next.payoutEngine().computePayoutAmount(), tracker.scheduledDate(round)));
                log.info("Pool started: round {} is open", round);
            }
            return next;
        });

        statusCache.evict(poolId);
        log.info("Member joined pool {}: memberCount={}", poolId, updated.roster().memberCount());
        return updated;
    }

    /**
     * Sets a new payout order. Rounds already paid keep their recipient.
     */
    public PoolAggregate reorderMembers(UUID poolId, List<UUID> memberIds) {
        PoolAggregate updated = retryExecutor.execute("reorderMembers", poolId, () -> {
            PoolAggregate aggregate = store.loadForWrite(poolId);
            aggregate.pool().requireActive();
            return applyRosterChange(aggregate, aggregate.roster().reorder(memberIds));
        });

        statusCache.evict(poolId);
        log.info("Roster reordered for pool {}", poolId);
        return updated;
    }

    /**
     * Removes a member who has not been paid yet.
     *
     * @throws StateException if the member already received a payout
     */
    public PoolAggregate removeMember(UUID poolId, UUID memberId) {
        PoolAggregate updated = retryExecutor.execute("removeMember", poolId, () -> {
            PoolAggregate aggregate = store.loadForWrite(poolId);
            aggregate.pool().requireActive();

            Member target = aggregate.roster().findById(memberId)
                    .orElseThrow(() -> NotFoundException.member(memberId.toString()));
            boolean paid = aggregate.payouts().stream()
                    .anyMatch(tx -> tx.getRecipientMemberId().equals(memberId));
            if (paid) {
                throw new StateException(String.format(
                        "%s has already received a payout and cannot be removed", target.getName()));
            }
            return applyRosterChange(aggregate, aggregate.roster().remove(memberId));
        });

        statusCache.evict(poolId);
        log.info("Member {} removed from pool {}", memberId, poolId);
        return updated;
    }

    public PoolAggregate cancelPool(UUID poolId) {
        PoolAggregate updated = retryExecutor.execute("cancelPool", poolId, () -> {
            PoolAggregate aggregate = store.loadForWrite(poolId);
            Pool cancelled = aggregate.pool().cancel();
            store.savePool(cancelled);
            return new PoolAggregate(cancelled, aggregate.roster(), aggregate.ledger().all(), aggregate.payouts());
        });

        statusCache.evict(poolId);
        log.info("Pool {} cancelled at round {}", poolId, updated.pool().getCurrentRound());
        return updated;
    }

    /**
     * Marks the current round's recipient, opens pending contributions for
     * anyone who now owes one, and saves the changed rows.
     */
    private PoolAggregate applyRosterChange(PoolAggregate aggregate, Roster changed) {
        Roster roster = changed;
        RoundTracker tracker = new RoundTracker(aggregate.pool(), roster);
        if (!roster.isEmpty() && !aggregate.pool().isFinished()) {
            roster = roster.markCurrent(tracker.recipient(tracker.currentRound()).getId());
        }

        PoolAggregate next = aggregate.withRoster(roster);
        next.ledger().openRound(next.tracker().currentRound());

        store.saveMembers(roster.allMembers());
        store.saveContributions(next.ledger().changes());
        return next;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Member name is required");
        }
    }
}
