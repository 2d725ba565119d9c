package com.flagship.savings_circle.activity;

import com.flagship.savings_circle.payout.PayoutTransaction;
import com.flagship.savings_circle.roster.Member;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Activity entry for the discussion feed of a pool.
 *
 * The feed renders these as system posts. Metadata keys follow what the
 * feed expects: memberId, memberName, amount, round, plus paymentMethod
 * and transactionId for payments.
 */
@Value
public class PoolActivityEvent {

    public static final String AGGREGATE_TYPE = "PoolActivity";

    UUID eventId;
    UUID poolId;
    ActivityType type;
    Map<String, Object> metadata;
    Instant occurredAt;

    public String getEventType() {
        return type.name();
    }

    public static PoolActivityEvent paymentReceived(UUID poolId, Member member, int amount, int round,
                                                    String method, String transactionId) {
        Map<String, Object> metadata = memberMetadata(member);
        metadata.put("amount", amount);
        metadata.put("round", round);
        metadata.put("paymentMethod", method);
        if (transactionId != null) {
            metadata.put("transactionId", transactionId);
        }
        return of(poolId, ActivityType.PAYMENT_RECEIVED, metadata);
    }

    public static PoolActivityEvent payoutSent(UUID poolId, PayoutTransaction transaction) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("memberId", transaction.getRecipientMemberId());
        metadata.put("memberName", transaction.getRecipientName());
        metadata.put("amount", transaction.getAmount());
        metadata.put("round", transaction.getRound());
        metadata.put("transactionId", transaction.getId());
        metadata.put("early", transaction.isWasEarlyPayout());
        return of(poolId, ActivityType.PAYOUT_SENT, metadata);
    }

    public static PoolActivityEvent memberJoined(UUID poolId, Member member) {
        Map<String, Object> metadata = memberMetadata(member);
        metadata.put("position", member.getPosition());
        return of(poolId, ActivityType.MEMBER_JOINED, metadata);
    }

    public static PoolActivityEvent roundStarted(UUID poolId, int round, Member recipient,
                                                 BigDecimal payoutAmount, LocalDate scheduledDate) {
        Map<String, Object> metadata = memberMetadata(recipient);
        metadata.put("round", round);
        metadata.put("amount", payoutAmount);
        if (scheduledDate != null) {
            metadata.put("scheduledDate", scheduledDate.toString());
        }
        return of(poolId, ActivityType.ROUND_STARTED, metadata);
    }

    private static Map<String, Object> memberMetadata(Member member) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("memberId", member.getId());
        metadata.put("memberName", member.getName());
        return metadata;
    }

    private static PoolActivityEvent of(UUID poolId, ActivityType type, Map<String, Object> metadata) {
        return new PoolActivityEvent(UUID.randomUUID(), poolId, type, metadata, Instant.now());
    }
}
