package com.flagship.savings_circle.payout;

import com.flagship.savings_circle.engine.OperationResponses;
import com.flagship.savings_circle.engine.OperationResult;
import com.flagship.savings_circle.engine.PoolEngineService;
import com.flagship.savings_circle.identity.CallerIdentityResolver;
import com.flagship.savings_circle.payout.dto.EarlyPayoutRequest;
import com.flagship.savings_circle.payout.dto.PayoutReceipt;
import com.flagship.savings_circle.payout.dto.PayoutTransactionView;
import com.flagship.savings_circle.pool.PoolService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Payout endpoints. Issuing payouts, early or not, is reserved to the pool admin.
 */
@RestController
@RequestMapping("/api/pools/{poolId}")
@RequiredArgsConstructor
public class PayoutController {

    private final PoolEngineService engineService;
    private final PoolService poolService;
    private final CallerIdentityResolver identityResolver;

    @GetMapping("/early-payout")
    public ResponseEntity<OperationResult<EarlyPayoutStatus>> getEarlyPayoutStatus(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.requireAdmin(poolId, caller);
        return OperationResponses.of(engineService.getEarlyPayoutStatus(poolId));
    }

    @PostMapping("/early-payout")
    public ResponseEntity<OperationResult<PayoutReceipt>> initiateEarlyPayout(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller,
            @Valid @RequestBody(required = false) EarlyPayoutRequest request) {
        identityResolver.requireAdmin(poolId, caller);
        String reason = request == null ? null : request.getReason();
        return OperationResponses.of(engineService.initiateEarlyPayout(poolId, reason));
    }

    @PostMapping("/payouts/{round}")
    public ResponseEntity<OperationResult<PayoutReceipt>> issuePayout(
            @PathVariable("poolId") UUID poolId,
            @PathVariable("round") int round,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.requireAdmin(poolId, caller);
        return OperationResponses.of(engineService.issuePayout(poolId, round));
    }

    @GetMapping("/payouts")
    public ResponseEntity<List<PayoutTransactionView>> getPayouts(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.resolve(poolId, caller);
        return ResponseEntity.ok(poolService.getPayouts(poolId).stream()
                .map(PayoutTransactionView::from)
                .toList());
    }
}
