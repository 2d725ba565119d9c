package com.flagship.savings_circle.identity;

import com.flagship.savings_circle.engine.PoolAggregateStore;
import com.flagship.savings_circle.engine.exception.NotFoundException;
import com.flagship.savings_circle.engine.exception.PermissionDeniedException;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.Roster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves the caller named in the X-Caller-Identity header against a
 * pool's roster.
 *
 * Authentication happens upstream; the header carries the already
 * authenticated member's id or email.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallerIdentityResolver {

    public static final String CALLER_IDENTITY_HEADER = "X-Caller-Identity";

    private final PoolAggregateStore store;

    /**
     * @throws NotFoundException if the pool does not exist
     * @throws PermissionDeniedException if the caller is not an active member of the pool
     */
    public Member resolve(UUID poolId, String callerIdentity) {
        Roster roster = store.load(poolId).roster();
        return resolve(roster, callerIdentity);
    }

    /**
     * @throws PermissionDeniedException if the caller is not the pool admin
     */
    public Member requireAdmin(UUID poolId, String callerIdentity) {
        Member caller = resolve(poolId, callerIdentity);
        if (!caller.isAdmin()) {
            log.info("Denied admin operation on pool {} to member {}", poolId, caller.getId());
            throw new PermissionDeniedException("Only the pool admin can perform this action");
        }
        return caller;
    }

    /**
     * Allows members to act on their own records and the admin to act on anyone's.
     *
     * @param memberRef the member being acted on, id or email; null means the caller
     * @return the reference to pass to the engine
     */
    public String requireSelfOrAdmin(UUID poolId, String callerIdentity, String memberRef) {
        Roster roster = store.load(poolId).roster();
        Member caller = resolve(roster, callerIdentity);
        if (memberRef == null || memberRef.isBlank()) {
            return caller.getId().toString();
        }
        Member target = roster.lookup(memberRef);
        if (!target.getId().equals(caller.getId()) && !caller.isAdmin()) {
            throw new PermissionDeniedException("Only the pool admin can act on behalf of another member");
        }
        return target.getId().toString();
    }

    private Member resolve(Roster roster, String callerIdentity) {
        if (callerIdentity == null || callerIdentity.isBlank()) {
            throw new PermissionDeniedException("Caller identity is required");
        }
        try {
            return roster.lookup(callerIdentity);
        } catch (NotFoundException e) {
            throw new PermissionDeniedException("You are not a member of this pool");
        }
    }
}
