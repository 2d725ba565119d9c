package com.flagship.savings_circle.engine;

import com.flagship.savings_circle.activity.ActivityType;
import com.flagship.savings_circle.activity.PoolActivityEvent;
import com.flagship.savings_circle.contribution.ContributionStatus;
import com.flagship.savings_circle.contribution.dto.ContributionReceipt;
import com.flagship.savings_circle.contribution.dto.ContributionStatusView;
import com.flagship.savings_circle.engine.exception.ErrorCode;
import com.flagship.savings_circle.notification.PayoutIssuedEvent;
import com.flagship.savings_circle.notification.PoolNotification;
import com.flagship.savings_circle.notification.RoundAdvancedEvent;
import com.flagship.savings_circle.outbox.OutboxEvent;
import com.flagship.savings_circle.outbox.OutboxService;
import com.flagship.savings_circle.payout.EarlyPayoutStatus;
import com.flagship.savings_circle.payout.dto.PayoutReceipt;
import com.flagship.savings_circle.pool.PayoutFrequency;
import com.flagship.savings_circle.pool.PoolService;
import com.flagship.savings_circle.pool.dto.CreatePoolRequest;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberSummary;
import com.flagship.savings_circle.round.RoundState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rotation engine operations against a real database: contribution
 * confirmation, undo, early payout and the events each one leaves in
 * the outbox.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PoolEngineServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("savings_circle_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No Kafka or Redis for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("pool.status-cache.enabled", () -> "false");
    }

    @Autowired
    private PoolEngineService engineService;

    @Autowired
    private PoolService poolService;

    @Autowired
    private OutboxService outboxService;

    private UUID poolId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedFailure(OperationResult<?> result) {
        System.out.println("⚠ EXPECTED FAILURE: " + result.errorCode());
        System.out.println("  Message: " + result.getError().getMessage());
    }

    /**
     * Alice (admin), Bob, Carol and Dave; $10 monthly over 4 rounds.
     */
    @BeforeEach
    void setUp() {
        CreatePoolRequest request = new CreatePoolRequest("Block party circle", 10, PayoutFrequency.MONTHLY,
                4, 4, LocalDate.of(2026, 1, 1), "Alice", "alice@example.com", null);
        poolId = poolService.createPool(request).pool().getId();
        poolService.addMember(poolId, "Bob", "bob@example.com", null);
        poolService.addMember(poolId, "Carol", "carol@example.com", null);
        poolService.addMember(poolId, "Dave", "dave@example.com", null);
    }

    private void confirm(String email) {
        OperationResult<ContributionReceipt> result = engineService.confirmContribution(poolId, email, "zelle", null);
        assertTrue(result.isSuccess(), () -> "confirm failed: " + result.getError());
    }

    @Nested
    @DisplayName("Contribution status")
    class ContributionStatusTests {

        @Test
        @DisplayName("New pool lists every member with the recipient exempt")
        void testInitialStatus() {
            printTestHeader("Initial Contribution Status");

            OperationResult<ContributionStatusView> result = engineService.getContributionStatus(poolId);

            assertTrue(result.isSuccess());
            ContributionStatusView view = result.getData();
            printOutput("Round", view.getCurrentRound());
            printOutput("Recipient", view.getRecipient().getName());

            assertEquals(RoundState.IN_PROGRESS, view.getRoundState());
            assertEquals(1, view.getCurrentRound());
            assertEquals("Alice", view.getRecipient().getName());
            assertEquals(4, view.getContributions().size());
            assertEquals(0, view.getConfirmedCount());
            assertEquals(3, view.getExpectedCount());
            assertFalse(view.isAllContributionsReceived());
            assertTrue(view.getContributions().get(0).isRecipient());
            assertNull(view.getContributions().get(0).getHasContributed());
            printSuccess("Status lists recipient and three pending contributors");
        }

        @Test
        @DisplayName("Unknown pool is NOT_FOUND")
        void testUnknownPool() {
            printTestHeader("Unknown Pool");

            OperationResult<ContributionStatusView> result = engineService.getContributionStatus(UUID.randomUUID());

            printExpectedFailure(result);
            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.NOT_FOUND, result.errorCode());
            assertNull(result.getData());
        }
    }

    @Nested
    @DisplayName("Confirming contributions")
    class ConfirmTests {

        @Test
        @DisplayName("Confirmation is recorded and reports the waiting message")
        void testConfirmRecorded() {
            printTestHeader("Confirm Contribution");
            printInput("Member", "bob@example.com");

            OperationResult<ContributionReceipt> result =
                    engineService.confirmContribution(poolId, "bob@example.com", "zelle", "zx-1001");

            printOutput("Message", result.getMessage());
            assertTrue(result.isSuccess());
            assertEquals("Contribution recorded. Waiting for other members to contribute.", result.getMessage());
            assertEquals(ContributionStatus.CONFIRMED, result.getData().getContribution().getStatus());
            assertEquals("zx-1001", result.getData().getContribution().getTransactionId());
            assertFalse(result.getData().isAllContributionsReceived());

            List<OutboxEvent> activity = outboxService.getEventsForPool(PoolActivityEvent.AGGREGATE_TYPE, poolId);
            assertTrue(activity.stream().anyMatch(e -> e.getEventType().equals(ActivityType.PAYMENT_RECEIVED.name())));
            printSuccess("Contribution confirmed and activity event queued");
        }

        @Test
        @DisplayName("Last confirmation says the recipient can be paid")
        void testLastConfirmation() {
            printTestHeader("Last Confirmation");

            confirm("bob@example.com");
            confirm("carol@example.com");
            OperationResult<ContributionReceipt> last =
                    engineService.confirmContribution(poolId, "dave@example.com", "cash", null);

            printOutput("Message", last.getMessage());
            assertTrue(last.getData().isAllContributionsReceived());
            assertEquals("Contribution recorded. All contributions received. Alice can now receive the payout.",
                    last.getMessage());
        }

        @Test
        @DisplayName("Second confirmation is DUPLICATE_ACTION")
        void testDuplicateConfirm() {
            printTestHeader("Duplicate Confirmation");

            confirm("bob@example.com");
            OperationResult<ContributionReceipt> again =
                    engineService.confirmContribution(poolId, "bob@example.com", "zelle", null);

            printExpectedFailure(again);
            assertEquals(ErrorCode.DUPLICATE_ACTION, again.errorCode());
            assertEquals("You have already contributed for this round", again.getError().getMessage());
        }

        @Test
        @DisplayName("Recipient confirming is a VALIDATION_ERROR")
        void testRecipientConfirm() {
            printTestHeader("Recipient Confirms");

            OperationResult<ContributionReceipt> result =
                    engineService.confirmContribution(poolId, "alice@example.com", "zelle", null);

            printExpectedFailure(result);
            assertEquals(ErrorCode.VALIDATION_ERROR, result.errorCode());
        }

        @Test
        @DisplayName("Blank method and unknown member are rejected")
        void testInvalidInput() {
            printTestHeader("Invalid Confirmation Input");

            assertEquals(ErrorCode.VALIDATION_ERROR,
                    engineService.confirmContribution(poolId, "bob@example.com", " ", null).errorCode());
            assertEquals(ErrorCode.NOT_FOUND,
                    engineService.confirmContribution(poolId, "zed@example.com", "zelle", null).errorCode());
            assertEquals(ErrorCode.VALIDATION_ERROR,
                    engineService.confirmContribution(null, "bob@example.com", "zelle", null).errorCode());
        }
    }

    @Nested
    @DisplayName("Undo")
    class UndoTests {

        @Test
        @DisplayName("Undo returns the contribution to pending")
        void testUndo() {
            printTestHeader("Undo Contribution");

            confirm("bob@example.com");
            OperationResult<ContributionReceipt> undone = engineService.undoContribution(poolId, "bob@example.com", null);

            printOutput("Message", undone.getMessage());
            assertTrue(undone.isSuccess());
            assertEquals("Contribution for round 1 has been undone", undone.getMessage());
            assertEquals(ContributionStatus.PENDING, undone.getData().getContribution().getStatus());

            ContributionStatusView view = engineService.getContributionStatus(poolId).getData();
            assertEquals(0, view.getConfirmedCount());
        }

        @Test
        @DisplayName("Undo without a confirmation is INVALID_STATE")
        void testUndoPending() {
            printTestHeader("Undo Pending Contribution");

            OperationResult<ContributionReceipt> result = engineService.undoContribution(poolId, "carol@example.com", 1);

            printExpectedFailure(result);
            assertEquals(ErrorCode.INVALID_STATE, result.errorCode());
        }
    }

    @Nested
    @DisplayName("Early payout")
    class EarlyPayoutTests {

        @Test
        @DisplayName("Two of three in: not allowed, Dave listed as missing")
        void testStatusWithMissing() {
            printTestHeader("Early Payout Status With Missing Contributions");

            confirm("bob@example.com");
            confirm("carol@example.com");
            EarlyPayoutStatus status = engineService.getEarlyPayoutStatus(poolId).getData();

            printOutput("Allowed", status.isAllowed());
            printOutput("Reason", status.getReason());
            assertFalse(status.isAllowed());
            assertEquals("Not all contributions have been received", status.getReason());
            assertEquals(List.of("dave@example.com"),
                    status.getMissingContributions().stream().map(MemberSummary::getEmail).toList());
        }

        @Test
        @DisplayName("Fully confirmed round pays early and opens round 2")
        void testInitiateEarlyPayout() {
            printTestHeader("Initiate Early Payout");

            confirm("bob@example.com");
            confirm("carol@example.com");
            confirm("dave@example.com");
            assertTrue(engineService.getEarlyPayoutStatus(poolId).getData().isAllowed());

            OperationResult<PayoutReceipt> result = engineService.initiateEarlyPayout(poolId, "Rent due");

            printOutput("Message", result.getMessage());
            assertTrue(result.isSuccess());
            assertEquals("Early payout of $40 processed for round 1", result.getMessage());
            PayoutReceipt receipt = result.getData();
            assertEquals(2, receipt.getNextRound());
            assertFalse(receipt.isComplete());
            assertTrue(receipt.getTransaction().isWasEarlyPayout());
            assertEquals("Rent due", receipt.getTransaction().getReason());
            assertEquals(0, new BigDecimal("40").compareTo(receipt.getTransaction().getAmount()));

            ContributionStatusView round2 = engineService.getContributionStatus(poolId).getData();
            assertEquals(2, round2.getCurrentRound());
            assertEquals("Bob", round2.getRecipient().getName());
            assertEquals(LocalDate.of(2026, 2, 1), round2.getScheduledDate());

            List<String> notifications = outboxService.getEventsForPool(PoolNotification.AGGREGATE_TYPE, poolId)
                    .stream().map(OutboxEvent::getEventType).toList();
            assertEquals(List.of(PayoutIssuedEvent.EVENT_TYPE, RoundAdvancedEvent.EVENT_TYPE), notifications);
            printSuccess("Early payout issued, round advanced and notifications queued");
        }

        @Test
        @DisplayName("Second early payout for the same round is rejected")
        void testSecondEarlyPayout() {
            printTestHeader("Repeated Early Payout");

            confirm("bob@example.com");
            confirm("carol@example.com");
            confirm("dave@example.com");
            assertTrue(engineService.initiateEarlyPayout(poolId, null).isSuccess());

            OperationResult<PayoutReceipt> again = engineService.initiateEarlyPayout(poolId, null);

            printExpectedFailure(again);
            assertFalse(again.isSuccess());
            assertEquals(ErrorCode.INVALID_STATE, again.errorCode());
            assertEquals(1, poolService.getPayouts(poolId).size());
        }

        @Test
        @DisplayName("Incomplete round cannot pay early")
        void testInitiateWhenIncomplete() {
            printTestHeader("Early Payout Not Allowed");

            confirm("bob@example.com");
            OperationResult<PayoutReceipt> result = engineService.initiateEarlyPayout(poolId, null);

            printExpectedFailure(result);
            assertEquals(ErrorCode.INVALID_STATE, result.errorCode());
            assertEquals("Not all contributions have been received", result.getError().getMessage());
            assertTrue(poolService.getPayouts(poolId).isEmpty());
        }
    }

    @Test
    @DisplayName("Reorder after a payout leaves the issued transaction alone")
    void testReorderAfterPayout() {
        printTestHeader("Reorder After Payout");

        confirm("bob@example.com");
        confirm("carol@example.com");
        confirm("dave@example.com");
        assertTrue(engineService.issuePayout(poolId, 1).isSuccess());

        List<Member> members = poolService.getPool(poolId).roster().activeMembers();
        UUID alice = members.get(0).getId();
        UUID bob = members.get(1).getId();
        UUID carol = members.get(2).getId();
        UUID dave = members.get(3).getId();

        poolService.reorderMembers(poolId, List.of(alice, dave, carol, bob));

        ContributionStatusView round2 = engineService.getContributionStatus(poolId).getData();
        printOutput("Round 2 recipient", round2.getRecipient().getName());
        assertEquals("Dave", round2.getRecipient().getName());
        assertEquals(alice, poolService.getPayouts(poolId).get(0).getRecipientMemberId());
        assertEquals("Alice", poolService.getPayouts(poolId).get(0).getRecipientName());
        printSuccess("Future recipients follow the new order; history is unchanged");
    }
}
