package com.flagship.savings_circle.round;

import com.flagship.savings_circle.PoolFixtures;
import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.engine.exception.ValidationException;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.pool.PoolStatus;
import com.flagship.savings_circle.roster.Roster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RoundTrackerTest {

    @Test
    @DisplayName("Round r goes to the member at position r")
    void recipientFollowsPosition() {
        Pool pool = PoolFixtures.pool(10, 3);
        RoundTracker tracker = new RoundTracker(pool, PoolFixtures.roster(pool, "Alice", "Bob", "Carol"));

        assertEquals("Alice", tracker.recipient(1).getName());
        assertEquals("Bob", tracker.recipient(2).getName());
        assertEquals("Carol", tracker.recipient(3).getName());
        assertEquals("Alice", tracker.currentRecipient().getName());
    }

    @Test
    @DisplayName("Rounds past the roster size wrap around")
    void recipientWrapsAround() {
        Pool pool = PoolFixtures.pool(10, 5);
        RoundTracker tracker = new RoundTracker(pool, PoolFixtures.roster(pool, "Alice", "Bob", "Carol"));

        assertEquals("Alice", tracker.recipient(4).getName());
        assertEquals("Bob", tracker.recipient(5).getName());
    }

    @Test
    @DisplayName("Rounds outside 1..totalRounds are invalid")
    void roundOutOfRange() {
        Pool pool = PoolFixtures.pool(10, 3);
        RoundTracker tracker = new RoundTracker(pool, PoolFixtures.roster(pool, "Alice", "Bob", "Carol"));

        assertThrows(ValidationException.class, () -> tracker.recipient(0));
        assertThrows(ValidationException.class, () -> tracker.recipient(4));
    }

    @Test
    @DisplayName("A pool with one member has not started")
    void notStartedWithSingleMember() {
        Pool pool = PoolFixtures.pool(10, 3);
        RoundTracker tracker = new RoundTracker(pool, PoolFixtures.roster(pool, "Alice"));

        assertEquals(RoundState.NOT_STARTED, tracker.state());
        assertThrows(StateException.class, tracker::currentRecipient);
        assertThrows(StateException.class, tracker::advance);
    }

    @Test
    @DisplayName("Empty roster has no recipient")
    void emptyRoster() {
        Pool pool = PoolFixtures.pool(10, 3);
        RoundTracker tracker = new RoundTracker(pool, Roster.empty(10));

        assertThrows(StateException.class, () -> tracker.recipient(1));
    }

    @Test
    @DisplayName("Advancing past the last round completes the pool")
    void advanceCompletesPool() {
        Pool pool = PoolFixtures.pool(10, 2);
        Roster roster = PoolFixtures.roster(pool, "Alice", "Bob");

        Pool second = new RoundTracker(pool, roster).advance();
        assertEquals(2, second.getCurrentRound());
        assertEquals(PoolStatus.ACTIVE, second.getStatus());

        RoundTracker last = new RoundTracker(second, roster);
        assertTrue(last.isFinalRound(2));
        Pool done = last.advance();

        assertEquals(3, done.getCurrentRound());
        assertEquals(PoolStatus.COMPLETED, done.getStatus());
        assertEquals(RoundState.COMPLETED, new RoundTracker(done, roster).state());
    }

    @Test
    @DisplayName("Scheduled dates step by the payout frequency from the start date")
    void scheduledDates() {
        Pool pool = PoolFixtures.pool(10, 3);
        RoundTracker tracker = new RoundTracker(pool, PoolFixtures.roster(pool, "Alice", "Bob", "Carol"));

        assertEquals(PoolFixtures.START_DATE, tracker.scheduledDate(1));
        assertEquals(LocalDate.of(2026, 3, 1), tracker.scheduledDate(3));
    }
}
