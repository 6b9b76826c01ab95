package com.chamapool.chama.controller;

import com.chamapool.chama.dto.ContributionStatusResponse;
import com.chamapool.chama.dto.CreateGroupRequest;
import com.chamapool.chama.dto.CreateProposalRequest;
import com.chamapool.chama.dto.GroupOperationResponse;
import com.chamapool.chama.dto.GroupResponse;
import com.chamapool.chama.dto.JoinResponse;
import com.chamapool.chama.dto.MemberRequest;
import com.chamapool.chama.dto.MemberResponse;
import com.chamapool.chama.dto.PaymentRequest;
import com.chamapool.chama.dto.PayoutQueueRequest;
import com.chamapool.chama.dto.PayoutResponse;
import com.chamapool.chama.dto.ProposalResponse;
import com.chamapool.chama.dto.PunishMemberRequest;
import com.chamapool.chama.dto.PunishmentResponse;
import com.chamapool.chama.dto.VoteRequest;
import com.chamapool.chama.dto.VoteStatusResponse;
import com.chamapool.chama.service.ChamaGroupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for savings group operations. The caller is always the JWT subject.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chama/groups")
@RequiredArgsConstructor
@Validated
@Tag(name = "Chama Groups", description = "Rotating savings group APIs")
@SecurityRequirement(name = "bearer-jwt")
public class ChamaGroupController {

    private final ChamaGroupService chamaGroupService;

    // ============== Groups ==============

    @PostMapping
    @Operation(summary = "Create a savings group")
    public ResponseEntity<GroupResponse> createGroup(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody CreateGroupRequest request) {

        String userId = jwt.getSubject();
        log.info("Creating group for user: {}", userId);

        GroupResponse group = chamaGroupService.createGroup(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(group);
    }

    @GetMapping("/{groupId}")
    @Operation(summary = "Get group summary")
    public ResponseEntity<GroupResponse> getGroup(@PathVariable String groupId) {
        return ResponseEntity.ok(chamaGroupService.getGroup(groupId));
    }

    @GetMapping
    @Operation(summary = "List groups created by a user, the caller by default")
    public ResponseEntity<List<GroupResponse>> getGroupsByCreator(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) String creator) {

        String owner = creator != null ? creator : jwt.getSubject();
        return ResponseEntity.ok(chamaGroupService.getGroupsByCreator(owner));
    }

    // ============== Membership & admin ==============

    @PostMapping("/{groupId}/join")
    @Operation(summary = "Join a group or request to join")
    public ResponseEntity<JoinResponse> join(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {

        String userId = jwt.getSubject();
        log.info("User {} joining group {}", userId, groupId);
        return ResponseEntity.ok(chamaGroupService.join(groupId, userId));
    }

    @PostMapping("/{groupId}/join-requests/approve")
    @Operation(summary = "Approve a pending join request")
    public ResponseEntity<MemberResponse> approveJoin(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody MemberRequest request) {

        chamaGroupService.approveJoin(groupId, jwt.getSubject(), request.getMember());
        return ResponseEntity.ok(chamaGroupService.getMember(groupId, request.getMember()));
    }

    @PostMapping("/{groupId}/join-requests/reject")
    @Operation(summary = "Reject a pending join request")
    public ResponseEntity<Void> rejectJoin(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody MemberRequest request) {

        chamaGroupService.rejectJoin(groupId, jwt.getSubject(), request.getMember());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{groupId}/leave")
    @Operation(summary = "Leave a group and receive the refund")
    public ResponseEntity<GroupOperationResponse> leave(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {

        String userId = jwt.getSubject();
        log.info("User {} leaving group {}", userId, groupId);
        return ResponseEntity.ok(chamaGroupService.leave(groupId, userId));
    }

    @PostMapping("/{groupId}/admins")
    @Operation(summary = "Grant admin rights (creator only)")
    public ResponseEntity<Void> addAdmin(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody MemberRequest request) {

        chamaGroupService.addAdmin(groupId, jwt.getSubject(), request.getMember());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{groupId}/admins/{member}")
    @Operation(summary = "Revoke admin rights (creator only)")
    public ResponseEntity<Void> removeAdmin(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @PathVariable String member) {

        chamaGroupService.removeAdmin(groupId, jwt.getSubject(), member);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{groupId}/creator")
    @Operation(summary = "Hand the creator role to another user")
    public ResponseEntity<GroupResponse> transferCreator(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody MemberRequest request) {

        chamaGroupService.transferCreator(groupId, jwt.getSubject(), request.getMember());
        return ResponseEntity.ok(chamaGroupService.getGroup(groupId));
    }

    @PostMapping("/{groupId}/pause")
    @Operation(summary = "Pause all mutating operations on a group")
    public ResponseEntity<GroupResponse> pause(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {

        chamaGroupService.pause(groupId, jwt.getSubject());
        return ResponseEntity.ok(chamaGroupService.getGroup(groupId));
    }

    @PostMapping("/{groupId}/unpause")
    @Operation(summary = "Resume a paused group")
    public ResponseEntity<GroupResponse> unpause(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {

        chamaGroupService.unpause(groupId, jwt.getSubject());
        return ResponseEntity.ok(chamaGroupService.getGroup(groupId));
    }

    @GetMapping("/{groupId}/members")
    @Operation(summary = "List group members")
    public ResponseEntity<List<MemberResponse>> getMembers(@PathVariable String groupId) {
        return ResponseEntity.ok(chamaGroupService.getMembers(groupId));
    }

    @GetMapping("/{groupId}/members/{member}")
    @Operation(summary = "Get member details")
    public ResponseEntity<MemberResponse> getMember(
            @PathVariable String groupId,
            @PathVariable String member) {
        return ResponseEntity.ok(chamaGroupService.getMember(groupId, member));
    }

    // ============== Contributions ==============

    @PostMapping("/{groupId}/contributions")
    @Operation(summary = "Contribute for the current period")
    public ResponseEntity<ContributionStatusResponse> contribute(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody PaymentRequest request) {

        String userId = jwt.getSubject();
        log.info("User {} contributing {} to group {}", userId, request.getAmount(), groupId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(chamaGroupService.contribute(groupId, userId, request));
    }

    @GetMapping("/{groupId}/contributions/{member}")
    @Operation(summary = "Get a member's contribution for a period, the current one by default")
    public ResponseEntity<ContributionStatusResponse> getContribution(
            @PathVariable String groupId,
            @PathVariable String member,
            @RequestParam(required = false) Long period) {
        return ResponseEntity.ok(chamaGroupService.getContributionStatus(groupId, member, period));
    }

    @PostMapping("/{groupId}/missed-contributions/check")
    @Operation(summary = "Detect missed contributions for every member")
    public ResponseEntity<GroupOperationResponse> checkAllMissedContributions(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {
        return ResponseEntity.ok(chamaGroupService.checkAllMissedContributions(groupId, jwt.getSubject()));
    }

    @PostMapping("/{groupId}/missed-contributions/check/{member}")
    @Operation(summary = "Detect missed contributions for one member")
    public ResponseEntity<GroupOperationResponse> checkMissedContributions(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @PathVariable String member) {
        return ResponseEntity.ok(chamaGroupService.checkMissedContributions(groupId, jwt.getSubject(), member));
    }

    // ============== Punishments ==============

    @PostMapping("/{groupId}/punishments")
    @Operation(summary = "Punish a member (admin only)")
    public ResponseEntity<PunishmentResponse> punishMember(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody PunishMemberRequest request) {

        log.info("Admin {} punishing {} in group {} with {}", jwt.getSubject(), request.getMember(),
                groupId, request.getAction());
        return ResponseEntity.ok(chamaGroupService.punishMember(groupId, jwt.getSubject(), request));
    }

    @PostMapping("/{groupId}/punishments/fine")
    @Operation(summary = "Pay the caller's outstanding fine")
    public ResponseEntity<PunishmentResponse> payFine(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(chamaGroupService.payFine(groupId, jwt.getSubject(), request));
    }

    @GetMapping("/{groupId}/punishments/{member}")
    @Operation(summary = "Get a member's punishment record")
    public ResponseEntity<PunishmentResponse> getPunishment(
            @PathVariable String groupId,
            @PathVariable String member) {
        return ResponseEntity.ok(chamaGroupService.getPunishment(groupId, member));
    }

    @DeleteMapping("/{groupId}/punishments/{member}")
    @Operation(summary = "Cancel a member's active punishment (admin only)")
    public ResponseEntity<PunishmentResponse> cancelPunishment(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @PathVariable String member) {
        return ResponseEntity.ok(chamaGroupService.cancelPunishment(groupId, jwt.getSubject(), member));
    }

    // ============== Governance ==============

    @PostMapping("/{groupId}/proposals")
    @Operation(summary = "Create a governance proposal")
    public ResponseEntity<ProposalResponse> createProposal(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody CreateProposalRequest request) {

        log.info("User {} proposing {} on {} in group {}", jwt.getSubject(), request.getProposalType(),
                request.getTarget(), groupId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(chamaGroupService.createProposal(groupId, jwt.getSubject(), request));
    }

    @GetMapping("/{groupId}/proposals")
    @Operation(summary = "List proposals")
    public ResponseEntity<List<ProposalResponse>> getProposals(@PathVariable String groupId) {
        return ResponseEntity.ok(chamaGroupService.getProposals(groupId));
    }

    @GetMapping("/{groupId}/proposals/{proposalId}")
    @Operation(summary = "Get proposal details")
    public ResponseEntity<ProposalResponse> getProposal(
            @PathVariable String groupId,
            @PathVariable long proposalId) {
        return ResponseEntity.ok(chamaGroupService.getProposal(groupId, proposalId));
    }

    @PostMapping("/{groupId}/proposals/{proposalId}/votes")
    @Operation(summary = "Vote on a proposal")
    public ResponseEntity<ProposalResponse> vote(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @PathVariable long proposalId,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(chamaGroupService.vote(groupId, jwt.getSubject(), proposalId, request.getSupport()));
    }

    @GetMapping("/{groupId}/proposals/{proposalId}/votes/{voter}")
    @Operation(summary = "Check whether a user has voted on a proposal")
    public ResponseEntity<VoteStatusResponse> hasVoted(
            @PathVariable String groupId,
            @PathVariable long proposalId,
            @PathVariable String voter) {
        return ResponseEntity.ok(chamaGroupService.hasVoted(groupId, proposalId, voter));
    }

    @PostMapping("/{groupId}/proposals/{proposalId}/execute")
    @Operation(summary = "Execute a proposal after voting closes (admin only)")
    public ResponseEntity<ProposalResponse> executeProposal(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @PathVariable long proposalId) {

        log.info("Admin {} executing proposal {} in group {}", jwt.getSubject(), proposalId, groupId);
        return ResponseEntity.ok(chamaGroupService.executeProposal(groupId, jwt.getSubject(), proposalId));
    }

    // ============== Payouts ==============

    @PutMapping("/{groupId}/payout-queue")
    @Operation(summary = "Set the payout rotation (creator only, once)")
    public ResponseEntity<GroupResponse> setPayoutQueue(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId,
            @Valid @RequestBody PayoutQueueRequest request) {
        return ResponseEntity.ok(chamaGroupService.setPayoutQueue(groupId, jwt.getSubject(), request.getQueue()));
    }

    @PostMapping("/{groupId}/payouts")
    @Operation(summary = "Process the current period's rotation payout (admin only)")
    public ResponseEntity<PayoutResponse> processRotationPayout(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {

        log.info("Admin {} processing payout for group {}", jwt.getSubject(), groupId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(chamaGroupService.processRotationPayout(groupId, jwt.getSubject()));
    }

    @GetMapping("/{groupId}/payouts/{period}")
    @Operation(summary = "Get the payout of a period")
    public ResponseEntity<PayoutResponse> getPayout(
            @PathVariable String groupId,
            @PathVariable long period) {
        return ResponseEntity.ok(chamaGroupService.getPayout(groupId, period));
    }

    @GetMapping("/{groupId}/members/{member}/payouts")
    @Operation(summary = "Get a member's payout history")
    public ResponseEntity<List<PayoutResponse>> getPayoutHistory(
            @PathVariable String groupId,
            @PathVariable String member) {
        return ResponseEntity.ok(chamaGroupService.getPayoutHistory(groupId, member));
    }

    @PostMapping("/{groupId}/emergency-withdraw")
    @Operation(summary = "Withdraw the whole pool to the creator and close the group (admin only)")
    public ResponseEntity<GroupOperationResponse> triggerEmergencyWithdraw(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String groupId) {

        log.warn("Admin {} triggering emergency withdrawal on group {}", jwt.getSubject(), groupId);
        return ResponseEntity.ok(chamaGroupService.triggerEmergencyWithdraw(groupId, jwt.getSubject()));
    }
}
