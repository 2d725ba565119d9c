package com.flagship.savings_circle.contribution;

import com.flagship.savings_circle.contribution.dto.ConfirmContributionRequest;
import com.flagship.savings_circle.contribution.dto.ContributionReceipt;
import com.flagship.savings_circle.contribution.dto.ContributionStatusView;
import com.flagship.savings_circle.contribution.dto.RejectContributionRequest;
import com.flagship.savings_circle.engine.OperationResponses;
import com.flagship.savings_circle.engine.OperationResult;
import com.flagship.savings_circle.engine.PoolEngineService;
import com.flagship.savings_circle.identity.CallerIdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Contribution attestations for a pool's current round.
 *
 * Members confirm and undo their own contributions; the admin may act on
 * anyone's and is the only one who can reject an attestation.
 */
@RestController
@RequestMapping("/api/pools/{poolId}/contributions")
@RequiredArgsConstructor
public class ContributionController {

    private final PoolEngineService engineService;
    private final CallerIdentityResolver identityResolver;

    @GetMapping
    public ResponseEntity<OperationResult<ContributionStatusView>> getContributionStatus(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.resolve(poolId, caller);
        return OperationResponses.of(engineService.getContributionStatus(poolId));
    }

    @PostMapping
    public ResponseEntity<OperationResult<ContributionReceipt>> confirmContribution(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller,
            @Valid @RequestBody ConfirmContributionRequest request) {
        String memberRef = identityResolver.requireSelfOrAdmin(poolId, caller, request.getMemberId());
        return OperationResponses.of(engineService.confirmContribution(
                poolId, memberRef, request.getMethod(), request.getTransactionId()));
    }

    @DeleteMapping("/{memberId}")
    public ResponseEntity<OperationResult<ContributionReceipt>> undoContribution(
            @PathVariable("poolId") UUID poolId,
            @PathVariable("memberId") String memberId,
            @RequestParam(name = "round", required = false) Integer round,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        String memberRef = identityResolver.requireSelfOrAdmin(poolId, caller, memberId);
        return OperationResponses.of(engineService.undoContribution(poolId, memberRef, round));
    }

    @PostMapping("/{memberId}/reject")
    public ResponseEntity<OperationResult<ContributionReceipt>> rejectContribution(
            @PathVariable("poolId") UUID poolId,
            @PathVariable("memberId") String memberId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller,
            @Valid @RequestBody(required = false) RejectContributionRequest request) {
        identityResolver.requireAdmin(poolId, caller);
        String reason = request == null ? null : request.getReason();
        return OperationResponses.of(engineService.rejectContribution(poolId, memberId, reason));
    }
}
