package com.flagship.savings_circle.engine;

import com.flagship.savings_circle.activity.ActivityPublisher;
import com.flagship.savings_circle.activity.PoolActivityEvent;
import com.flagship.savings_circle.contribution.Contribution;
import com.flagship.savings_circle.contribution.ContributionStatusCache;
import com.flagship.savings_circle.contribution.dto.ContributionLine;
import com.flagship.savings_circle.contribution.dto.ContributionReceipt;
import com.flagship.savings_circle.contribution.dto.ContributionStatusView;
import com.flagship.savings_circle.engine.exception.ErrorCode;
import com.flagship.savings_circle.engine.exception.PoolEngineException;
import com.flagship.savings_circle.engine.exception.ValidationException;
import com.flagship.savings_circle.notification.NotificationPublisher;
import com.flagship.savings_circle.notification.PayoutIssuedEvent;
import com.flagship.savings_circle.notification.RoundAdvancedEvent;
import com.flagship.savings_circle.observability.CorrelationContext;
import com.flagship.savings_circle.observability.PoolMetrics;
import com.flagship.savings_circle.payout.EarlyPayoutStatus;
import com.flagship.savings_circle.payout.PayoutResult;
import com.flagship.savings_circle.payout.PayoutTransaction;
import com.flagship.savings_circle.payout.dto.PayoutReceipt;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.round.RoundTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the rotation engine.
 *
 * Every mutating operation is one read-modify-write unit of work on a
 * single pool, run through {@link OptimisticRetryExecutor}: the aggregate
 * is loaded with a version lock, changed by the domain components, and
 * saved together with its outbox events. Domain failures come back as a
 * failed {@link OperationResult}, never as an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolEngineService {

    private final PoolAggregateStore store;
    private final OptimisticRetryExecutor retryExecutor;
    private final ActivityPublisher activityPublisher;
    private final NotificationPublisher notificationPublisher;
    private final ContributionStatusCache statusCache;
    private final PoolMetrics poolMetrics;

    /**
     * Contribution status of the current round.
     */
    public OperationResult<ContributionStatusView> getContributionStatus(UUID poolId) {
        return run("getContributionStatus", poolId, null, () -> {
            ContributionStatusView view = statusCache.getOrLoad(poolId, () -> {
                PoolAggregate aggregate = store.load(poolId);
                return ContributionStatusView.of(aggregate.tracker(), aggregate.ledger());
            });
            return OperationResult.success(null, view);
        });
    }

    /**
     * Records that a member has paid for the current round.
     *
     * @param memberRef member id or email
     * @param method payment method reported by the member
     * @param transactionId external payment reference, optional
     */
    public OperationResult<ContributionReceipt> confirmContribution(UUID poolId, String memberRef,
                                                                    String method, String transactionId) {
        return run("confirmContribution", poolId, memberRef, () -> {
            if (method == null || method.isBlank()) {
                throw new ValidationException("Payment method is required");
            }
            String paymentMethod = method.trim();
            String externalId = transactionId == null || transactionId.isBlank() ? null : transactionId.trim();

            ConfirmOutcome outcome = retryExecutor.execute("confirmContribution", poolId, () -> {
                PoolAggregate aggregate = store.loadForWrite(poolId);
                RoundTracker tracker = aggregate.tracker();
                int round = tracker.currentRound();

                Contribution contribution = aggregate.ledger().record(memberRef, round, paymentMethod, externalId);
                store.saveContributions(aggregate.ledger().changes());

                Member member = aggregate.roster().lookup(memberRef);
                int amount = aggregate.pool().getContributionAmount();
                activityPublisher.publish(PoolActivityEvent.paymentReceived(
                        poolId, member, amount, round, paymentMethod, externalId));

                ContributionReceipt receipt = new ContributionReceipt(round,
                        ContributionLine.forContributor(member, contribution, amount),
                        aggregate.ledger().isComplete(round));
                return new ConfirmOutcome(receipt, tracker.recipient(round).getName());
            });

            statusCache.evict(poolId);
            poolMetrics.recordContribution("confirm", "success");
            log.info("Contribution confirmed: round={}, complete={}",
                    outcome.receipt().getRound(), outcome.receipt().isAllContributionsReceived());

            String message = outcome.receipt().isAllContributionsReceived()
                    ? String.format("Contribution recorded. All contributions received. %s can now receive the payout.",
                            outcome.recipientName())
                    : "Contribution recorded. Waiting for other members to contribute.";
            return OperationResult.success(message, outcome.receipt());
        });
    }

    /**
     * Reverts a confirmed contribution to pending.
     *
     * @param round round to undo, the current round when null
     */
    public OperationResult<ContributionReceipt> undoContribution(UUID poolId, String memberRef, Integer round) {
        return run("undoContribution", poolId, memberRef, () -> {
            ContributionReceipt receipt = retryExecutor.execute("undoContribution", poolId, () -> {
                PoolAggregate aggregate = store.loadForWrite(poolId);
                int target = round == null ? aggregate.tracker().currentRound() : round;

                Contribution contribution = aggregate.ledger().undo(memberRef, target);
                store.saveContributions(aggregate.ledger().changes());

                Member member = aggregate.roster().lookup(memberRef);
                return new ContributionReceipt(target,
                        ContributionLine.forContributor(member, contribution, aggregate.pool().getContributionAmount()),
                        false);
            });

            statusCache.evict(poolId);
            poolMetrics.recordContribution("undo", "success");
            log.info("Contribution undone: round={}", receipt.getRound());
            return OperationResult.success(
                    String.format("Contribution for round %d has been undone", receipt.getRound()), receipt);
        });
    }

    /**
     * Marks a member's attestation for the current round as failed.
     */
    public OperationResult<ContributionReceipt> rejectContribution(UUID poolId, String memberRef, String reason) {
        return run("rejectContribution", poolId, memberRef, () -> {
            ContributionReceipt receipt = retryExecutor.execute("rejectContribution", poolId, () -> {
                PoolAggregate aggregate = store.loadForWrite(poolId);
                int round = aggregate.tracker().currentRound();

                Contribution contribution = aggregate.ledger().reject(memberRef, round, reason);
                store.saveContributions(aggregate.ledger().changes());

                Member member = aggregate.roster().lookup(memberRef);
                return new ContributionReceipt(round,
                        ContributionLine.forContributor(member, contribution, aggregate.pool().getContributionAmount()),
                        false);
            });

            statusCache.evict(poolId);
            poolMetrics.recordContribution("reject", "success");
            log.info("Contribution rejected: round={}", receipt.getRound());
            return OperationResult.success(
                    String.format("Contribution for round %d marked as failed", receipt.getRound()), receipt);
        });
    }

    public OperationResult<EarlyPayoutStatus> getEarlyPayoutStatus(UUID poolId) {
        return run("getEarlyPayoutStatus", poolId, null, () ->
                OperationResult.success(null, store.load(poolId).earlyPayoutEvaluator().checkStatus()));
    }

    /**
     * Pays out the current round ahead of its scheduled date.
     *
     * @param reason optional audit reason stored on the transaction
     */
    public OperationResult<PayoutReceipt> initiateEarlyPayout(UUID poolId, String reason) {
        return run("initiateEarlyPayout", poolId, null, () -> {
            PayoutResult result = retryExecutor.execute("initiateEarlyPayout", poolId, () -> {
                PoolAggregate aggregate = store.loadForWrite(poolId);
                PayoutResult issued = aggregate.earlyPayoutEvaluator().initiateEarlyPayout(reason);
                persistPayout(aggregate, issued);
                return issued;
            });

            afterPayout(result);
            PayoutTransaction tx = result.getTransaction();
            return OperationResult.success(
                    String.format("Early payout of $%s processed for round %d", tx.getAmount().toPlainString(), tx.getRound()),
                    PayoutReceipt.from(result));
        });
    }

    /**
     * Issues the regular payout of a round.
     */
    public OperationResult<PayoutReceipt> issuePayout(UUID poolId, int round) {
        return run("issuePayout", poolId, null, () -> {
            PayoutResult result = retryExecutor.execute("issuePayout", poolId, () -> {
                PoolAggregate aggregate = store.loadForWrite(poolId);
                PayoutResult issued = aggregate.payoutEngine().issuePayout(round);
                persistPayout(aggregate, issued);
                return issued;
            });

            afterPayout(result);
            PayoutTransaction tx = result.getTransaction();
            return OperationResult.success(
                    String.format("Payout of $%s issued to %s for round %d",
                            tx.getAmount().toPlainString(), tx.getRecipientName(), tx.getRound()),
                    PayoutReceipt.from(result));
        });
    }

    private void persistPayout(PoolAggregate aggregate, PayoutResult result) {
        UUID poolId = result.getPool().getId();
        PayoutTransaction tx = result.getTransaction();

        store.savePayout(tx);
        store.savePool(result.getPool());
        store.saveMembers(result.getRoster().allMembers());
        store.saveContributions(aggregate.ledger().changes());

        activityPublisher.publish(PoolActivityEvent.payoutSent(poolId, tx));
        notificationPublisher.publish(PayoutIssuedEvent.from(tx));

        RoundTracker next = aggregate.payoutEngine().tracker();
        if (next.isInProgress()) {
            Member nextRecipient = next.currentRecipient();
            LocalDate date = next.scheduledDate(result.getNextRound());
            BigDecimal nextAmount = aggregate.payoutEngine().computePayoutAmount();
            activityPublisher.publish(PoolActivityEvent.roundStarted(
                    poolId, result.getNextRound(), nextRecipient, nextAmount, date));
            notificationPublisher.publish(RoundAdvancedEvent.from(
                    result, nextRecipient.getId(), nextRecipient.getName(), date));
        } else {
            notificationPublisher.publish(RoundAdvancedEvent.from(result, null, null, null));
        }
    }

    private void afterPayout(PayoutResult result) {
        PayoutTransaction tx = result.getTransaction();
        statusCache.evict(tx.getPoolId());
        poolMetrics.recordPayoutIssued(tx.isWasEarlyPayout());
        log.info("Payout issued: round={}, recipient={}, amount={}, early={}, nextRound={}, complete={}",
                tx.getRound(), tx.getRecipientMemberId(), tx.getAmount(), tx.isWasEarlyPayout(),
                result.getNextRound(), result.isComplete());
    }

    private <T> OperationResult<T> run(String operation, UUID poolId, String memberRef,
                                       Supplier<OperationResult<T>> body) {
        long start = System.nanoTime();
        MDC.put(CorrelationContext.POOL_ID_MDC_KEY, String.valueOf(poolId));
        if (memberRef != null) {
            MDC.put(CorrelationContext.MEMBER_ID_MDC_KEY, memberRef);
        }
        try {
            if (poolId == null) {
                throw new ValidationException("Pool id is required");
            }
            OperationResult<T> result = body.get();
            recordOperation(operation, "success", start);
            return result;

        } catch (PoolEngineException e) {
            log.info("{} rejected: {} {}", operation, e.getErrorCode(), e.getMessage());
            recordOperation(operation, e.getErrorCode().name(), start);
            return OperationResult.failure(e);

        } catch (RuntimeException e) {
            log.error("Unexpected error during {} for pool {} (member {})", operation, poolId, memberRef, e);
            recordOperation(operation, ErrorCode.INTERNAL_ERROR.name(), start);
            return OperationResult.failure(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred");

        } finally {
            MDC.remove(CorrelationContext.POOL_ID_MDC_KEY);
            MDC.remove(CorrelationContext.MEMBER_ID_MDC_KEY);
        }
    }

    private void recordOperation(String operation, String result, long startNanos) {
        poolMetrics.recordOperation(operation, result, (System.nanoTime() - startNanos) / 1_000_000);
    }

    private record ConfirmOutcome(ContributionReceipt receipt, String recipientName) {}
}
