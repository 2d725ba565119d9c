package com.flagship.savings_circle.pool;

import com.flagship.savings_circle.identity.CallerIdentityResolver;
import com.flagship.savings_circle.pool.dto.AddMemberRequest;
import com.flagship.savings_circle.pool.dto.CreatePoolRequest;
import com.flagship.savings_circle.pool.dto.PoolResponse;
import com.flagship.savings_circle.pool.dto.ReorderMembersRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Pool administration endpoints.
 *
 * The caller is named by the X-Caller-Identity header; roster changes other
 * than joining and cancellation are reserved to the pool admin.
 */
@RestController
@RequestMapping("/api/pools")
@RequiredArgsConstructor
@Slf4j
public class PoolController {

    private final PoolService poolService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<PoolResponse> createPool(@Valid @RequestBody CreatePoolRequest request) {
        log.info("Received pool creation request: amount={}, frequency={}",
                request.getContributionAmount(), request.getFrequency());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(PoolResponse.from(poolService.createPool(request)));
    }

    @GetMapping("/{poolId}")
    public ResponseEntity<PoolResponse> getPool(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.resolve(poolId, caller);
        return ResponseEntity.ok(PoolResponse.from(poolService.getPool(poolId)));
    }

    @PostMapping("/{poolId}/members")
    public ResponseEntity<PoolResponse> addMember(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody AddMemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(PoolResponse.from(poolService.addMember(poolId, request.getName(), request.getEmail(),
                    request.getUserId())));
    }

    @PutMapping("/{poolId}/members/order")
    public ResponseEntity<PoolResponse> reorderMembers(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller,
            @Valid @RequestBody ReorderMembersRequest request) {
        identityResolver.requireAdmin(poolId, caller);
        return ResponseEntity.ok(PoolResponse.from(poolService.reorderMembers(poolId, request.getMemberIds())));
    }

    @DeleteMapping("/{poolId}/members/{memberId}")
    public ResponseEntity<PoolResponse> removeMember(
            @PathVariable("poolId") UUID poolId,
            @PathVariable("memberId") UUID memberId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.requireAdmin(poolId, caller);
        return ResponseEntity.ok(PoolResponse.from(poolService.removeMember(poolId, memberId)));
    }

    @PostMapping("/{poolId}/cancel")
    public ResponseEntity<PoolResponse> cancelPool(
            @PathVariable("poolId") UUID poolId,
            @RequestHeader(CallerIdentityResolver.CALLER_IDENTITY_HEADER) String caller) {
        identityResolver.requireAdmin(poolId, caller);
        return ResponseEntity.ok(PoolResponse.from(poolService.cancelPool(poolId)));
    }
}
