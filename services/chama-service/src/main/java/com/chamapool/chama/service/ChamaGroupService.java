package com.chamapool.chama.service;

import com.chamapool.chama.domain.ContributionAsset;
import com.chamapool.chama.domain.JoinOutcome;
import com.chamapool.chama.domain.PayoutRecord;
import com.chamapool.chama.dto.ContributionStatusResponse;
import com.chamapool.chama.dto.CreateGroupRequest;
import com.chamapool.chama.dto.CreateProposalRequest;
import com.chamapool.chama.dto.GroupOperationResponse;
import com.chamapool.chama.dto.GroupResponse;
import com.chamapool.chama.dto.JoinResponse;
import com.chamapool.chama.dto.MemberResponse;
import com.chamapool.chama.dto.PaymentRequest;
import com.chamapool.chama.dto.PayoutResponse;
import com.chamapool.chama.dto.ProposalResponse;
import com.chamapool.chama.dto.PunishMemberRequest;
import com.chamapool.chama.dto.PunishmentResponse;
import com.chamapool.chama.dto.RegistryStatusResponse;
import com.chamapool.chama.dto.VoteStatusResponse;
import com.chamapool.chama.engine.ChamaGroupEngine;
import com.chamapool.chama.exception.ChamaException;
import com.chamapool.chama.exception.GroupIntegrityException;
import com.chamapool.chama.mapper.ChamaGroupMapper;
import com.chamapool.chama.metrics.ChamaMetricsService;
import com.chamapool.chama.registry.ChamaGroupRegistry;
import com.chamapool.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for group operations coming from the REST layer. Resolves the group, runs the
 * operation as the given caller and maps the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChamaGroupService {

    private final ChamaGroupRegistry registry;
    private final ChamaGroupMapper mapper;
    private final ChamaMetricsService metricsService;

    // ============== Registry ==============

    public GroupResponse createGroup(String caller, CreateGroupRequest request) {
        log.info("Creating group '{}' for creator {}", request.getName(), caller);
        ChamaGroupEngine engine = execute("createGroup", null, caller,
                () -> registry.createGroup(caller, mapper.toRules(request)));
        return mapper.toGroupResponse(engine.snapshot());
    }

    public GroupResponse getGroup(String groupId) {
        return mapper.toGroupResponse(registry.getGroup(groupId).snapshot());
    }

    public List<GroupResponse> getGroupsByCreator(String creator) {
        return registry.getGroupsByCreator(creator).stream()
                .map(this::getGroup)
                .collect(Collectors.toList());
    }

    public RegistryStatusResponse pauseRegistry(String caller) {
        execute("pauseRegistry", null, caller, () -> {
            registry.pause(caller);
            return null;
        });
        return getRegistryStatus();
    }

    public RegistryStatusResponse unpauseRegistry(String caller) {
        execute("unpauseRegistry", null, caller, () -> {
            registry.unpause(caller);
            return null;
        });
        return getRegistryStatus();
    }

    public RegistryStatusResponse getRegistryStatus() {
        return RegistryStatusResponse.builder()
                .paused(registry.isPaused())
                .owner(registry.getOwner())
                .groupCount(registry.getGroupCount())
                .build();
    }

    // ============== Membership & admin ==============

    public JoinResponse join(String groupId, String caller) {
        JoinOutcome outcome = execute("join", groupId, caller, () -> group(groupId).join(caller));
        return JoinResponse.builder()
                .groupId(groupId)
                .member(caller)
                .outcome(outcome.name())
                .build();
    }

    public void approveJoin(String groupId, String caller, String member) {
        run("approveJoin", groupId, caller, () -> group(groupId).approveJoin(caller, member));
    }

    public void rejectJoin(String groupId, String caller, String member) {
        run("rejectJoin", groupId, caller, () -> group(groupId).rejectJoin(caller, member));
    }

    public GroupOperationResponse leave(String groupId, String caller) {
        BigDecimal refund = execute("leave", groupId, caller, () -> group(groupId).leave(caller));
        return GroupOperationResponse.builder()
                .groupId(groupId)
                .operation("leave")
                .member(caller)
                .amount(refund)
                .build();
    }

    public void addAdmin(String groupId, String caller, String member) {
        run("addAdmin", groupId, caller, () -> group(groupId).addAdmin(caller, member));
    }

    public void removeAdmin(String groupId, String caller, String member) {
        run("removeAdmin", groupId, caller, () -> group(groupId).removeAdmin(caller, member));
    }

    public void transferCreator(String groupId, String caller, String newCreator) {
        run("transferCreator", groupId, caller, () -> group(groupId).transferCreator(caller, newCreator));
    }

    public void pause(String groupId, String caller) {
        run("pause", groupId, caller, () -> group(groupId).pause(caller));
    }

    public void unpause(String groupId, String caller) {
        run("unpause", groupId, caller, () -> group(groupId).unpause(caller));
    }

    // ============== Contributions & punishment ==============

    public ContributionStatusResponse contribute(String groupId, String caller, PaymentRequest payment) {
        ChamaGroupEngine engine = group(groupId);
        run("contribute", groupId, caller,
                () -> engine.contribute(caller, assetOf(payment), payment.getAmount()));
        return getContributionStatus(groupId, caller, engine.getCurrentPeriod());
    }

    public GroupOperationResponse checkMissedContributions(String groupId, String caller, String member) {
        int detected = execute("checkMissedContributions", groupId, caller,
                () -> group(groupId).checkMissedContributions(caller, member));
        return GroupOperationResponse.builder()
                .groupId(groupId)
                .operation("checkMissedContributions")
                .member(member)
                .count(detected)
                .build();
    }

    public GroupOperationResponse checkAllMissedContributions(String groupId, String caller) {
        int detected = execute("checkAllMissedContributions", groupId, caller,
                () -> group(groupId).checkAllMissedContributions(caller));
        return GroupOperationResponse.builder()
                .groupId(groupId)
                .operation("checkAllMissedContributions")
                .count(detected)
                .build();
    }

    public PunishmentResponse punishMember(String groupId, String caller, PunishMemberRequest request) {
        ChamaGroupEngine engine = group(groupId);
        run("punishMember", groupId, caller,
                () -> engine.punishMember(caller, request.getMember(), request.getAction(), request.getReason()));
        return getPunishment(groupId, request.getMember());
    }

    public PunishmentResponse payFine(String groupId, String caller, PaymentRequest payment) {
        ChamaGroupEngine engine = group(groupId);
        run("payFine", groupId, caller, () -> engine.payFine(caller, assetOf(payment), payment.getAmount()));
        return getPunishment(groupId, caller);
    }

    public PunishmentResponse cancelPunishment(String groupId, String caller, String member) {
        run("cancelPunishment", groupId, caller, () -> group(groupId).cancelPunishment(caller, member));
        return getPunishment(groupId, member);
    }

    // ============== Governance ==============

    public ProposalResponse createProposal(String groupId, String caller, CreateProposalRequest request) {
        ChamaGroupEngine engine = group(groupId);
        long id = execute("createProposal", groupId, caller, () -> engine.createProposal(caller,
                request.getProposalType(), request.getTarget(), request.getValue(), request.getDescription()));
        return getProposal(groupId, id);
    }

    public ProposalResponse vote(String groupId, String caller, long proposalId, boolean support) {
        run("voteOnProposal", groupId, caller, () -> group(groupId).voteOnProposal(caller, proposalId, support));
        return getProposal(groupId, proposalId);
    }

    public ProposalResponse executeProposal(String groupId, String caller, long proposalId) {
        run("executeProposal", groupId, caller, () -> group(groupId).executeProposal(caller, proposalId));
        return getProposal(groupId, proposalId);
    }

    // ============== Payouts ==============

    public GroupResponse setPayoutQueue(String groupId, String caller, List<String> queue) {
        ChamaGroupEngine engine = group(groupId);
        run("setPayoutQueue", groupId, caller, () -> engine.setPayoutQueue(caller, queue));
        return mapper.toGroupResponse(engine.snapshot());
    }

    public PayoutResponse processRotationPayout(String groupId, String caller) {
        PayoutRecord record = execute("processRotationPayout", groupId, caller,
                () -> group(groupId).processRotationPayout(caller));
        return mapper.toPayoutResponse(record.getPeriod(), record);
    }

    public GroupOperationResponse triggerEmergencyWithdraw(String groupId, String caller) {
        BigDecimal amount = execute("triggerEmergencyWithdraw", groupId, caller,
                () -> group(groupId).triggerEmergencyWithdraw(caller));
        return GroupOperationResponse.builder()
                .groupId(groupId)
                .operation("triggerEmergencyWithdraw")
                .member(caller)
                .amount(amount)
                .build();
    }

    // ============== Queries ==============

    public MemberResponse getMember(String groupId, String member) {
        ChamaGroupEngine engine = group(groupId);
        return mapper.toMemberResponse(member, engine.getMemberDetails(member).orElse(null),
                engine.getPayoutHistory(member));
    }

    public List<MemberResponse> getMembers(String groupId) {
        ChamaGroupEngine engine = group(groupId);
        return engine.getMembers().stream()
                .map(m -> mapper.toMemberResponse(m.getMemberId(), m, engine.getPayoutHistory(m.getMemberId())))
                .collect(Collectors.toList());
    }

    public PunishmentResponse getPunishment(String groupId, String member) {
        return mapper.toPunishmentResponse(member, group(groupId).getPunishmentDetails(member).orElse(null));
    }

    public ContributionStatusResponse getContributionStatus(String groupId, String member, Long period) {
        ChamaGroupEngine engine = group(groupId);
        long effectivePeriod = period != null ? period : engine.getCurrentPeriod();
        Instant contributedAt = engine.getContributionTimestamp(member, effectivePeriod);
        return ContributionStatusResponse.builder()
                .member(member)
                .period(effectivePeriod)
                .contributed(!Instant.EPOCH.equals(contributedAt))
                .contributedAt(contributedAt)
                .windowOpen(engine.isContributionWindowOpen())
                .build();
    }

    public ProposalResponse getProposal(String groupId, long proposalId) {
        return group(groupId).getProposal(proposalId)
                .map(mapper::toProposalResponse)
                .orElseThrow(() -> new GroupIntegrityException(ErrorCode.GROUP_PROPOSAL_NOT_FOUND,
                        "Proposal does not exist: " + proposalId));
    }

    public List<ProposalResponse> getProposals(String groupId) {
        return group(groupId).getProposals().stream()
                .map(mapper::toProposalResponse)
                .collect(Collectors.toList());
    }

    public VoteStatusResponse hasVoted(String groupId, long proposalId, String voter) {
        return VoteStatusResponse.builder()
                .proposalId(proposalId)
                .voter(voter)
                .hasVoted(group(groupId).hasVoted(proposalId, voter))
                .build();
    }

    public PayoutResponse getPayout(String groupId, long period) {
        return mapper.toPayoutResponse(period, group(groupId).getPayoutInfo(period).orElse(null));
    }

    public List<PayoutResponse> getPayoutHistory(String groupId, String member) {
        ChamaGroupEngine engine = group(groupId);
        return engine.getPayoutHistory(member).stream()
                .map(period -> mapper.toPayoutResponse(period, engine.getPayoutInfo(period).orElse(null)))
                .collect(Collectors.toList());
    }

    private ChamaGroupEngine group(String groupId) {
        return registry.getGroup(groupId);
    }

    private static ContributionAsset assetOf(PaymentRequest payment) {
        return ContributionAsset.of(payment.getToken());
    }

    private void run(String operation, String groupId, String caller, Runnable action) {
        execute(operation, groupId, caller, () -> {
            action.run();
            return null;
        });
    }

    private <T> T execute(String operation, String groupId, String caller, Supplier<T> action) {
        try {
            return action.get();
        } catch (ChamaException e) {
            log.warn("Rejected {} on group {} by {}: {}", operation, groupId, caller, e.getMessage());
            metricsService.recordRejectedOperation(operation, e.getErrorCode().getCode());
            throw e;
        }
    }
}
