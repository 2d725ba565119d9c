package com.flagship.savings_circle.contribution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.contribution.dto.ContributionStatusView;
import com.flagship.savings_circle.engine.PoolAggregate;
import com.flagship.savings_circle.engine.PoolEngineService;
import com.flagship.savings_circle.identity.CallerIdentityResolver;
import com.flagship.savings_circle.pool.PoolService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Contribution endpoints: caller identity, status codes per error code,
 * and the Redis-backed status cache.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ContributionControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("savings_circle_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("pool.status-cache.enabled", () -> "true");
    }

    private static final String CALLER = CallerIdentityResolver.CALLER_IDENTITY_HEADER;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @Autowired
    private ContributionStatusCache statusCache;

    @Autowired
    private PoolService poolService;

    @Autowired
    private PoolEngineService engineService;

    private UUID poolId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() throws Exception {
        Map<String, Object> create = Map.of(
                "name", "Office circle",
                "contribution_amount", 15,
                "frequency", "BIWEEKLY",
                "max_members", 3,
                "start_date", "2026-05-01",
                "admin_name", "Alice",
                "admin_email", "alice@example.com");

        MvcResult created = mockMvc.perform(post("/api/pools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(create)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.total_rounds").value(3))
                .andReturn();
        JsonNode pool = objectMapper.readTree(created.getResponse().getContentAsString());
        poolId = UUID.fromString(pool.get("id").asText());

        join("Bob", "bob@example.com");
        join("Carol", "carol@example.com");
    }

    private void join(String name, String email) throws Exception {
        mockMvc.perform(post("/api/pools/{poolId}/members", poolId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", name, "email", email))))
                .andExpect(status().isCreated());
    }

    private String confirmBody(String method) throws Exception {
        return objectMapper.writeValueAsString(Map.of("method", method));
    }

    @Test
    @DisplayName("Member confirms their own contribution")
    void testConfirmOwnContribution() throws Exception {
        printTestHeader("Confirm Own Contribution");

        MvcResult result = mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmBody("venmo")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.round").value(1))
                .andExpect(jsonPath("$.data.contribution.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.data.contribution.method").value("venmo"))
                .andExpect(jsonPath("$.data.all_contributions_received").value(false))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
        printSuccess("Contribution confirmed through the API");
    }

    @Test
    @DisplayName("Duplicate confirmation returns 409 DUPLICATE_ACTION")
    void testDuplicateConfirmation() throws Exception {
        printTestHeader("Duplicate Confirmation");

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "carol@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmBody("cash")))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "carol@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmBody("cash")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("DUPLICATE_ACTION"))
                .andExpect(jsonPath("$.error.message").value("You have already contributed for this round"));
    }

    @Test
    @DisplayName("Recipient confirming returns 400")
    void testRecipientConfirmation() throws Exception {
        printTestHeader("Recipient Confirms");

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "alice@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmBody("cash")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Member cannot confirm for someone else; admin can")
    void testActingOnBehalf() throws Exception {
        printTestHeader("Acting On Behalf Of Another Member");

        Map<String, String> forCarol = Map.of("member_id", "carol@example.com", "method", "cash");

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(forCarol)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("PERMISSION_DENIED"));

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "alice@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(forCarol)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.contribution.email").value("carol@example.com"));
    }

    @Test
    @DisplayName("Caller outside the pool is refused; missing header is 400")
    void testIdentityRequired() throws Exception {
        printTestHeader("Identity Checks");

        mockMvc.perform(get("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "mallory@example.com"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("You are not a member of this pool"));

        mockMvc.perform(get("/api/pools/{poolId}/contributions", poolId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Missing method fails bean validation")
    void testMissingMethod() throws Exception {
        printTestHeader("Missing Payment Method");

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.method").exists());
    }

    @Test
    @DisplayName("Status is cached and evicted on change")
    void testStatusCache() throws Exception {
        printTestHeader("Status Cache");
        String key = statusCache.currentKey(poolId).orElseThrow();

        mockMvc.perform(get("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.recipient.name").value("Alice"))
                .andExpect(jsonPath("$.data.confirmed_count").value(0))
                .andExpect(jsonPath("$.data.expected_count").value(2));
        assertTrue(Boolean.TRUE.equals(redisTemplate.hasKey(key)), "Status should be cached");

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmBody("zelle")))
                .andExpect(status().isOk());
        assertFalse(Boolean.TRUE.equals(redisTemplate.hasKey(key)), "Confirmation should evict the cache");
        assertNotEquals(key, statusCache.currentKey(poolId).orElseThrow());

        mockMvc.perform(get("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com"))
                .andExpect(jsonPath("$.data.confirmed_count").value(1));
        printSuccess("Cache filled on read, evicted on write");
    }

    @Test
    @DisplayName("A status loaded before a confirmation is never served after it")
    void testStatusLoadedBeforeWriteNotServed() throws Exception {
        printTestHeader("Status Read Racing a Confirmation");

        ContributionStatusView loadedEarly = statusCache.getOrLoad(poolId, () -> {
            PoolAggregate before = poolService.getPool(poolId);
            ContributionStatusView view = ContributionStatusView.of(before.tracker(), before.ledger());
            // Bob confirms after the read but before the reader caches its view
            assertTrue(engineService.confirmContribution(poolId, "bob@example.com", "zelle", null).isSuccess());
            return view;
        });
        printOutput("Confirmed count seen by the early reader", loadedEarly.getConfirmedCount());
        assertEquals(0, loadedEarly.getConfirmedCount());

        mockMvc.perform(get("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "carol@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.confirmed_count").value(1));
        printSuccess("The early view stayed under the old generation");
    }

    @Test
    @DisplayName("Undo, reject and early payout through the API")
    void testUndoRejectAndEarlyPayout() throws Exception {
        printTestHeader("Undo, Reject, Early Payout");

        mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                        .header(CALLER, "bob@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmBody("zelle")))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/pools/{poolId}/contributions/{memberId}", poolId, "bob@example.com")
                        .header(CALLER, "bob@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Contribution for round 1 has been undone"))
                .andExpect(jsonPath("$.data.contribution.status").value("PENDING"));

        mockMvc.perform(post("/api/pools/{poolId}/contributions/{memberId}/reject", poolId, "carol@example.com")
                        .header(CALLER, "bob@example.com"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/pools/{poolId}/contributions/{memberId}/reject", poolId, "carol@example.com")
                        .header(CALLER, "alice@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("reason", "No transfer received"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.contribution.status").value("FAILED"))
                .andExpect(jsonPath("$.data.contribution.failure_reason").value("No transfer received"));

        mockMvc.perform(get("/api/pools/{poolId}/early-payout", poolId)
                        .header(CALLER, "alice@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.allowed").value(false))
                .andExpect(jsonPath("$.data.missing_contributions.length()").value(2));

        for (String member : new String[] {"bob@example.com", "carol@example.com"}) {
            mockMvc.perform(post("/api/pools/{poolId}/contributions", poolId)
                            .header(CALLER, member)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(confirmBody("cash")))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/api/pools/{poolId}/early-payout", poolId)
                        .header(CALLER, "alice@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("reason", "Car repair"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Early payout of $45 processed for round 1"))
                .andExpect(jsonPath("$.data.next_round").value(2))
                .andExpect(jsonPath("$.data.is_complete").value(false))
                .andExpect(jsonPath("$.data.transaction.recipient_name").value("Alice"));

        mockMvc.perform(get("/api/pools/{poolId}/payouts", poolId)
                        .header(CALLER, "carol@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].was_early_payout").value(true));
        printSuccess("Full round handled through the API");
    }
}
