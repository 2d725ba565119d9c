package com.flagship.savings_circle.roster;

import com.flagship.savings_circle.engine.exception.DuplicateActionException;
import com.flagship.savings_circle.engine.exception.NotFoundException;
import com.flagship.savings_circle.engine.exception.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of a pool's members and their payout positions.
 *
 * Immutable: join, reorder and removal return a new roster. Every instance
 * satisfies the position invariant: the positions of active members are
 * exactly 1..memberCount, with no gaps and no duplicates. Removed members
 * stay in the snapshot (payout history refers to them) but hold no position.
 */
public final class Roster {

    private final int capacity;
    private final List<Member> members;
    private final List<Member> active;

    private Roster(int capacity, List<Member> members) {
        this.capacity = capacity;
        this.members = List.copyOf(members);
        this.active = members.stream()
            .filter(Member::isActive)
            .sorted(Comparator.comparingInt(Member::getPosition))
            .toList();
        verifyPositions();
    }

    /**
     * Builds a roster from persisted members.
     *
     * @param capacity maximum number of active members
     * @param members all members of the pool, removed ones included
     * @throws IllegalStateException if the active positions are not a permutation of 1..n
     */
    public static Roster of(int capacity, List<Member> members) {
        return new Roster(capacity, members);
    }

    public static Roster empty(int capacity) {
        return new Roster(capacity, List.of());
    }

    public int capacity() {
        return capacity;
    }

    public int memberCount() {
        return active.size();
    }

    public boolean isEmpty() {
        return active.isEmpty();
    }

    /**
     * Active members ordered by position.
     */
    public List<Member> activeMembers() {
        return active;
    }

    /**
     * Every member ever placed on this roster, including removed ones.
     */
    public List<Member> allMembers() {
        return members;
    }

    /**
     * Returns the position a new member with the given role would receive.
     * The admin always takes position 1; everyone else takes the next free slot.
     *
     * @throws ValidationException if the roster is full or position 1 is already taken by an admin
     */
    public int assignPosition(MemberRole role) {
        if (active.size() >= capacity) {
            throw new ValidationException(String.format(
                "Pool is full: maximum of %d members reached", capacity));
        }
        Set<Integer> taken = new HashSet<>();
        active.forEach(m -> taken.add(m.getPosition()));

        if (role == MemberRole.ADMIN) {
            if (taken.contains(1)) {
                throw new ValidationException("Position 1 is already assigned; a pool has a single admin");
            }
            return 1;
        }

        for (int position = 1; position <= capacity; position++) {
            if (!taken.contains(position)) {
                return position;
            }
        }
        throw new ValidationException("No free position available on the roster");
    }

    /**
     * Places a new member at the next free position.
     *
     * @throws DuplicateActionException if the email already belongs to an active member
     * @throws ValidationException if the roster is full
     */
    public Roster add(Member candidate) {
        if (candidate.getEmail() != null && active.stream().anyMatch(m -> m.hasEmail(candidate.getEmail()))) {
            throw new DuplicateActionException(
                "A member with email " + candidate.getEmail() + " already belongs to this pool");
        }
        if (active.stream().anyMatch(m -> m.getId().equals(candidate.getId()))) {
            throw new DuplicateActionException("Member " + candidate.getId() + " is already on the roster");
        }
        int position = assignPosition(candidate.getRole());

        List<Member> next = new ArrayList<>(members);
        next.add(candidate.withPosition(position));
        return new Roster(capacity, next);
    }

    /**
     * Renumbers positions 1..n in the given order.
     *
     * Issued payouts are not touched: they store their recipient, so only
     * rounds that are not yet paid see the new order.
     *
     * @param newOrder ids of every active member, each exactly once
     * @throws ValidationException if the list is not a permutation of the active members
     */
    public Roster reorder(List<UUID> newOrder) {
        if (newOrder == null || newOrder.size() != active.size()) {
            throw new ValidationException(String.format(
                "Reorder must list all %d active members exactly once", active.size()));
        }
        Set<UUID> seen = new HashSet<>();
        for (UUID id : newOrder) {
            if (!seen.add(id)) {
                throw new ValidationException("Duplicate member in new order: " + id);
            }
            if (findById(id).isEmpty()) {
                throw new ValidationException("Member " + id + " is not an active member of this pool");
            }
        }

        List<Member> next = new ArrayList<>();
        for (Member member : members) {
            if (member.isActive()) {
                next.add(member.withPosition(newOrder.indexOf(member.getId()) + 1));
            } else {
                next.add(member);
            }
        }
        return new Roster(capacity, next);
    }

    /**
     * Removes a member and closes the gap, keeping everyone else's relative order.
     *
     * @throws NotFoundException if the member is not active on this roster
     * @throws ValidationException if the member is the pool admin
     */
    public Roster remove(UUID memberId) {
        Member target = findById(memberId)
            .orElseThrow(() -> NotFoundException.member(memberId.toString()));
        if (target.isAdmin()) {
            throw new ValidationException("The pool admin cannot be removed from the roster");
        }

        List<Member> next = new ArrayList<>();
        for (Member member : members) {
            if (member.getId().equals(memberId)) {
                next.add(member.withStatus(MemberStatus.REMOVED).withPosition(0));
            } else if (member.isActive() && member.getPosition() > target.getPosition()) {
                next.add(member.withPosition(member.getPosition() - 1));
            } else {
                next.add(member);
            }
        }
        return new Roster(capacity, next);
    }

    /**
     * Returns a roster where the given member has a new rotation status.
     * Removed members cannot be brought back this way.
     */
    public Roster withStatus(UUID memberId, MemberStatus status) {
        List<Member> next = new ArrayList<>();
        for (Member member : members) {
            if (member.getId().equals(memberId) && member.isActive() && status != MemberStatus.REMOVED) {
                next.add(member.withStatus(status));
            } else {
                next.add(member);
            }
        }
        return new Roster(capacity, next);
    }

    /**
     * Marks the given member as the current recipient. Any other member that
     * was CURRENT goes back to UPCOMING; COMPLETED members keep their status.
     */
    public Roster markCurrent(UUID recipientId) {
        List<Member> next = new ArrayList<>();
        for (Member member : members) {
            if (!member.isActive()) {
                next.add(member);
            } else if (member.getId().equals(recipientId)) {
                next.add(member.withStatus(MemberStatus.CURRENT));
            } else if (member.getStatus() == MemberStatus.CURRENT) {
                next.add(member.withStatus(MemberStatus.UPCOMING));
            } else {
                next.add(member);
            }
        }
        return new Roster(capacity, next);
    }

    /**
     * Resolves an active member by id or by email (case-insensitive).
     *
     * @throws NotFoundException if no active member matches
     */
    public Member lookup(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new NotFoundException("Member identifier is required");
        }
        String trimmed = identifier.trim();
        Optional<UUID> asId = parseId(trimmed);
        if (asId.isPresent()) {
            Optional<Member> byId = findById(asId.get());
            if (byId.isPresent()) {
                return byId.get();
            }
        }
        return active.stream()
            .filter(m -> m.hasEmail(trimmed))
            .findFirst()
            .orElseThrow(() -> NotFoundException.member(trimmed));
    }

    public Optional<Member> findById(UUID memberId) {
        return active.stream()
            .filter(m -> m.getId().equals(memberId))
            .findFirst();
    }

    /**
     * Finds a member by id including removed ones (used for history views).
     */
    public Optional<Member> findAnyById(UUID memberId) {
        return members.stream()
            .filter(m -> m.getId().equals(memberId))
            .findFirst();
    }

    /**
     * @throws ValidationException if the position is outside 1..memberCount
     */
    public Member memberAt(int position) {
        if (position < 1 || position > active.size()) {
            throw new ValidationException(String.format(
                "Position %d is outside 1..%d", position, active.size()));
        }
        return active.get(position - 1);
    }

    private void verifyPositions() {
        for (int i = 0; i < active.size(); i++) {
            if (active.get(i).getPosition() != i + 1) {
                throw new IllegalStateException(String.format(
                    "Roster positions are not contiguous: expected %d but found %d for member %s",
                    i + 1, active.get(i).getPosition(), active.get(i).getId()));
            }
        }
    }

    private static Optional<UUID> parseId(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
