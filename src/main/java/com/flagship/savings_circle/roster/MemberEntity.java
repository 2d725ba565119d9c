package com.flagship.savings_circle.roster;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a pool member.
 *
 * Positions are not unique at the database level: a reorder rewrites
 * several rows in one flush and would trip a unique index mid-way. The
 * permutation is enforced by {@link Roster} instead.
 */
@Entity
@Table(
    name = "pool_members",
    indexes = {
        @Index(name = "idx_pool_members_pool", columnList = "pool_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MemberEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "pool_id", nullable = false, updatable = false)
    private UUID poolId;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MemberRole role;

    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MemberStatus status;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    public static MemberEntity fromDomain(Member member) {
        return new MemberEntity(
            member.getId(),
            member.getPoolId(),
            member.getUserId(),
            member.getName(),
            member.getEmail(),
            member.getRole(),
            member.getPosition(),
            member.getStatus(),
            member.getJoinedAt()
        );
    }

    public Member toDomain() {
        return new Member(id, poolId, userId, name, email, role, position, status, joinedAt);
    }

    /**
     * Position and status are the only fields that move after joining.
     */
    public void updateFromDomain(Member member) {
        this.position = member.getPosition();
        this.status = member.getStatus();
    }
}
