package com.flagship.savings_circle.contribution;

import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.engine.exception.ValidationException;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.round.RoundState;
import com.flagship.savings_circle.round.RoundTracker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-(member, round) contribution records of one pool.
 *
 * Works on an in-memory copy of the pool's contributions for the duration
 * of one unit of work. Every record that changes is collected in
 * {@link #changes()} so the caller can persist exactly those rows.
 *
 * A round is closed once its payout transaction exists; closed rounds
 * are read-only.
 */
public final class ContributionLedger {

    private final Map<Key, Contribution> contributions = new HashMap<>();
    private final Set<Integer> closedRounds;
    private final Map<UUID, Contribution> changes = new LinkedHashMap<>();
    private RoundTracker tracker;

    public ContributionLedger(RoundTracker tracker, Collection<Contribution> existing, Set<Integer> closedRounds) {
        this.tracker = tracker;
        this.closedRounds = new HashSet<>(closedRounds);
        existing.forEach(c -> contributions.put(new Key(c.getMemberId(), c.getRound()), c));
    }

    /**
     * Records a confirmed contribution.
     *
     * @param memberRef member id or email
     * @throws com.flagship.savings_circle.engine.exception.NotFoundException if the member is not on the roster
     * @throws StateException if the round is closed, not open yet, or the pool is not active
     * @throws ValidationException if the member is the round's recipient
     * @throws com.flagship.savings_circle.engine.exception.DuplicateActionException if already confirmed
     */
    public Contribution record(String memberRef, int round, String method, String transactionId) {
        Member member = tracker.roster().lookup(memberRef);
        requireOpen(round);

        if (tracker.recipient(round).getId().equals(member.getId())) {
            throw new ValidationException("You are the recipient for this round and do not need to contribute");
        }

        Contribution current = find(member.getId(), round)
            .orElseGet(() -> Contribution.pending(tracker.pool().getId(), member.getId(), round));
        return store(current.confirm(method, transactionId, Instant.now()));
    }

    /**
     * Reverts a confirmed contribution to pending.
     *
     * @throws StateException if the round is closed or the contribution is not confirmed
     */
    public Contribution undo(String memberRef, int round) {
        Member member = tracker.roster().lookup(memberRef);
        requireOpen(round);

        Contribution current = find(member.getId(), round)
            .orElseThrow(() -> new StateException(
                "No confirmed contribution to undo for round " + round));
        return store(current.undo());
    }

    /**
     * Marks an attestation as failed, for example when the admin could not
     * find the reported payment. The member can confirm again afterwards.
     *
     * @throws StateException if the round is closed or the contribution already failed
     */
    public Contribution reject(String memberRef, int round, String reason) {
        Member member = tracker.roster().lookup(memberRef);
        requireOpen(round);

        Contribution current = find(member.getId(), round)
            .orElseGet(() -> Contribution.pending(tracker.pool().getId(), member.getId(), round));
        String effectiveReason = reason == null || reason.isBlank() ? "Rejected by pool admin" : reason.trim();
        return store(current.reject(effectiveReason));
    }

    /**
     * True iff every active member other than the round's recipient has a
     * confirmed contribution for the round.
     */
    public boolean isComplete(int round) {
        if (tracker.state() == RoundState.NOT_STARTED) {
            return false;
        }
        return missing(round).isEmpty();
    }

    /**
     * Active members, other than the recipient, whose contribution for the
     * round is not confirmed. Ordered by position.
     */
    public List<Member> missing(int round) {
        if (tracker.roster().isEmpty()) {
            return List.of();
        }
        UUID recipientId = tracker.recipient(round).getId();
        return tracker.roster().activeMembers().stream()
            .filter(m -> !m.getId().equals(recipientId))
            .filter(m -> find(m.getId(), round).map(c -> !c.isConfirmed()).orElse(true))
            .toList();
    }

    /**
     * Creates pending records for the round where none exist yet. The
     * recipient gets no record. Safe to call repeatedly.
     *
     * @return the records created by this call
     */
    public List<Contribution> openRound(int round) {
        if (!tracker.isInProgress()) {
            return List.of();
        }
        UUID recipientId = tracker.recipient(round).getId();
        List<Contribution> created = new ArrayList<>();
        for (Member member : tracker.roster().activeMembers()) {
            if (member.getId().equals(recipientId) || find(member.getId(), round).isPresent()) {
                continue;
            }
            created.add(store(Contribution.pending(tracker.pool().getId(), member.getId(), round)));
        }
        return created;
    }

    public Optional<Contribution> find(UUID memberId, int round) {
        return Optional.ofNullable(contributions.get(new Key(memberId, round)));
    }

    /**
     * Records of the round, in no particular order.
     */
    public List<Contribution> contributionsFor(int round) {
        return contributions.values().stream()
            .filter(c -> c.getRound() == round)
            .toList();
    }

    /**
     * Every record of the pool, in no particular order.
     */
    public List<Contribution> all() {
        return List.copyOf(contributions.values());
    }

    public boolean isClosed(int round) {
        return closedRounds.contains(round);
    }

    /**
     * Called by the payout engine once the round's transaction exists.
     */
    public void closeRound(int round, RoundTracker advanced) {
        closedRounds.add(round);
        this.tracker = advanced;
    }

    /**
     * Records created or modified since this ledger was loaded.
     */
    public List<Contribution> changes() {
        return List.copyOf(changes.values());
    }

    private Contribution store(Contribution contribution) {
        contributions.put(new Key(contribution.getMemberId(), contribution.getRound()), contribution);
        changes.put(contribution.getId(), contribution);
        return contribution;
    }

    private void requireOpen(int round) {
        tracker.pool().requireActive();
        if (round < 1 || round > tracker.totalRounds()) {
            throw new ValidationException(String.format(
                "Round %d is outside 1..%d", round, tracker.totalRounds()));
        }
        if (closedRounds.contains(round) || round < tracker.currentRound()) {
            throw new StateException(String.format(
                "Round %d is closed: the payout has already been issued", round));
        }
        if (tracker.state() == RoundState.NOT_STARTED) {
            throw new StateException(String.format(
                "Pool has not started: at least %d members are required", RoundTracker.MIN_MEMBERS_TO_START));
        }
        if (round > tracker.currentRound()) {
            throw new StateException(String.format(
                "Round %d has not started yet; the current round is %d", round, tracker.currentRound()));
        }
    }

    private record Key(UUID memberId, int round) {}
}
