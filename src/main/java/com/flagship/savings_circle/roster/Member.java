package com.flagship.savings_circle.roster;

import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Member of a pool.
 *
 * Position is the fixed payout slot. It only changes through a roster
 * reorder or when another member is removed.
 */
@Value
public class Member {
    UUID id;
    UUID poolId;
    UUID userId;
    String name;
    String email;
    MemberRole role;
    int position;
    MemberStatus status;
    Instant joinedAt;

    /**
     * Creates a member that has not been placed on the roster yet (position 0).
     */
    public static Member create(UUID poolId, UUID userId, String name, String email, MemberRole role) {
        return new Member(
            UUID.randomUUID(),
            poolId,
            userId,
            name == null ? null : name.trim(),
            normalizeEmail(email),
            role,
            0,
            MemberStatus.UPCOMING,
            Instant.now()
        );
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isActive() {
        return status != MemberStatus.REMOVED;
    }

    public boolean isAdmin() {
        return role == MemberRole.ADMIN;
    }

    public boolean hasEmail(String candidate) {
        return email != null && candidate != null && email.equals(normalizeEmail(candidate));
    }

    public Member withPosition(int newPosition) {
        return new Member(id, poolId, userId, name, email, role, newPosition, status, joinedAt);
    }

    public Member withStatus(MemberStatus newStatus) {
        return new Member(id, poolId, userId, name, email, role, position, newStatus, joinedAt);
    }
}
