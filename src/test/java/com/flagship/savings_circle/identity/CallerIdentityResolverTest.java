package com.flagship.savings_circle.identity;

import com.flagship.savings_circle.PoolFixtures;
import com.flagship.savings_circle.engine.PoolAggregate;
import com.flagship.savings_circle.engine.PoolAggregateStore;
import com.flagship.savings_circle.engine.exception.NotFoundException;
import com.flagship.savings_circle.engine.exception.PermissionDeniedException;
import com.flagship.savings_circle.roster.Member;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CallerIdentityResolverTest {

    private PoolAggregate aggregate;
    private UUID poolId;
    private CallerIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        aggregate = PoolFixtures.aggregate(10, 3, "Alice", "Bob", "Carol");
        poolId = aggregate.pool().getId();
        PoolAggregateStore store = mock(PoolAggregateStore.class);
        when(store.load(poolId)).thenReturn(aggregate);
        resolver = new CallerIdentityResolver(store);
    }

    private Member member(String name) {
        return aggregate.roster().lookup(PoolFixtures.emailOf(name));
    }

    @Test
    @DisplayName("Caller resolves by email or member id")
    void resolvesCaller() {
        assertEquals("Bob", resolver.resolve(poolId, "bob@example.com").getName());
        assertEquals("Bob", resolver.resolve(poolId, member("Bob").getId().toString()).getName());
    }

    @Test
    @DisplayName("Strangers and missing identities are denied")
    void strangersDenied() {
        PermissionDeniedException stranger = assertThrows(PermissionDeniedException.class,
                () -> resolver.resolve(poolId, "eve@example.com"));
        assertEquals("You are not a member of this pool", stranger.getMessage());

        PermissionDeniedException blank = assertThrows(PermissionDeniedException.class,
                () -> resolver.resolve(poolId, " "));
        assertEquals("Caller identity is required", blank.getMessage());
    }

    @Test
    @DisplayName("Only the admin passes the admin check")
    void adminOnly() {
        assertTrue(resolver.requireAdmin(poolId, "alice@example.com").isAdmin());
        assertThrows(PermissionDeniedException.class, () -> resolver.requireAdmin(poolId, "carol@example.com"));
    }

    @Test
    @DisplayName("Members act for themselves; the admin may act for anyone")
    void selfOrAdmin() {
        String bobId = member("Bob").getId().toString();
        String carolId = member("Carol").getId().toString();

        assertEquals(bobId, resolver.requireSelfOrAdmin(poolId, "bob@example.com", null));
        assertEquals(bobId, resolver.requireSelfOrAdmin(poolId, "bob@example.com", "BOB@example.com"));
        assertEquals(carolId, resolver.requireSelfOrAdmin(poolId, "alice@example.com", "carol@example.com"));

        PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                () -> resolver.requireSelfOrAdmin(poolId, "bob@example.com", "carol@example.com"));
        assertEquals("Only the pool admin can act on behalf of another member", ex.getMessage());
    }

    @Test
    @DisplayName("Acting on an unknown member is NotFound, not a permission error")
    void unknownTarget() {
        assertThrows(NotFoundException.class,
                () -> resolver.requireSelfOrAdmin(poolId, "alice@example.com", "zed@example.com"));
    }
}
