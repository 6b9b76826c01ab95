package com.chamapool.chama.mapper;

import com.chamapool.chama.domain.ContributionAsset;
import com.chamapool.chama.domain.GroupRules;
import com.chamapool.chama.domain.Member;
import com.chamapool.chama.domain.PayoutRecord;
import com.chamapool.chama.domain.Proposal;
import com.chamapool.chama.domain.Punishment;
import com.chamapool.chama.dto.CreateGroupRequest;
import com.chamapool.chama.dto.GroupResponse;
import com.chamapool.chama.dto.MemberResponse;
import com.chamapool.chama.dto.PayoutResponse;
import com.chamapool.chama.dto.ProposalResponse;
import com.chamapool.chama.dto.PunishmentResponse;
import com.chamapool.chama.engine.GroupSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps between REST DTOs and the group domain.
 */
@Component
public class ChamaGroupMapper {

    public GroupRules toRules(CreateGroupRequest request) {
        return GroupRules.builder()
                .name(request.getName())
                .contributionAmount(request.getContributionAmount())
                .contributionFrequency(request.getContributionFrequency())
                .maxMembers(request.getMaxMembers() != null ? request.getMaxMembers() : 0)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .punishmentMode(request.getPunishmentMode())
                .approvalRequired(request.isApprovalRequired())
                .emergencyWithdrawAllowed(request.isEmergencyWithdrawAllowed())
                .contributionAsset(ContributionAsset.of(request.getContributionToken()))
                .contributionWindow(request.getContributionWindow())
                .gracePeriod(request.getGracePeriod())
                .fineAmount(request.getFineAmount())
                .build();
    }

    public GroupResponse toGroupResponse(GroupSnapshot snapshot) {
        GroupRules rules = snapshot.getRules();
        return GroupResponse.builder()
                .groupId(snapshot.getGroupId())
                .name(rules.getName())
                .contributionAmount(rules.getContributionAmount())
                .contributionAsset(rules.getContributionAsset().code())
                .contributionFrequency(rules.getContributionFrequency())
                .maxMembers(rules.getMaxMembers())
                .startDate(rules.getStartDate())
                .endDate(rules.getEndDate())
                .punishmentMode(rules.getPunishmentMode().name())
                .approvalRequired(rules.isApprovalRequired())
                .emergencyWithdrawAllowed(rules.isEmergencyWithdrawAllowed())
                .contributionWindow(rules.getContributionWindow())
                .gracePeriod(rules.getGracePeriod())
                .fineAmount(snapshot.getFineAmount())
                .creator(snapshot.getCreator())
                .admins(snapshot.getAdmins())
                .active(snapshot.isActive())
                .paused(snapshot.isPaused())
                .totalFunds(snapshot.getTotalFunds())
                .memberCount(snapshot.getMemberCount())
                .activeMemberCount(snapshot.getActiveMemberCount())
                .skippedPayouts(snapshot.getSkippedPayouts())
                .currentPeriod(snapshot.getCurrentPeriod())
                .contributionWindowOpen(snapshot.isContributionWindowOpen())
                .payoutQueue(snapshot.getPayoutQueue())
                .pendingJoinRequests(snapshot.getPendingJoinRequests())
                .proposalCount(snapshot.getProposalCount())
                .build();
    }

    public MemberResponse toMemberResponse(String memberId, Member member, List<Long> payoutPeriods) {
        if (member == null) {
            return MemberResponse.builder()
                    .memberId(memberId)
                    .exists(false)
                    .totalContributed(BigDecimal.ZERO)
                    .payoutPeriods(List.of())
                    .build();
        }
        return MemberResponse.builder()
                .memberId(member.getMemberId())
                .exists(true)
                .active(member.isActive())
                .joinedAt(member.getJoinedAt())
                .totalContributed(member.getTotalContributed())
                .missedContributions(member.getMissedContributions())
                .consecutiveFines(member.getConsecutiveFines())
                .receivedPayout(member.isReceivedPayout())
                .payoutPeriods(payoutPeriods)
                .build();
    }

    public PunishmentResponse toPunishmentResponse(String member, Punishment punishment) {
        if (punishment == null) {
            return PunishmentResponse.builder()
                    .member(member)
                    .action("NONE")
                    .active(false)
                    .fineAmount(BigDecimal.ZERO)
                    .build();
        }
        return PunishmentResponse.builder()
                .member(member)
                .action(punishment.getAction().name())
                .reason(punishment.getReason())
                .active(punishment.isActive())
                .issuedAt(punishment.getIssuedAt())
                .fineAmount(punishment.getFineAmount())
                .build();
    }

    public ProposalResponse toProposalResponse(Proposal proposal) {
        return ProposalResponse.builder()
                .id(proposal.getId())
                .proposalType(proposal.getProposalType().name())
                .target(proposal.getTarget())
                .value(proposal.getValue())
                .description(proposal.getDescription())
                .proposer(proposal.getProposer())
                .votesFor(proposal.getVotesFor())
                .votesAgainst(proposal.getVotesAgainst())
                .createdAt(proposal.getCreatedAt())
                .votingEndsAt(proposal.getVotingEndsAt())
                .executed(proposal.isExecuted())
                .executedAt(proposal.getExecutedAt())
                .build();
    }

    public PayoutResponse toPayoutResponse(long period, PayoutRecord record) {
        if (record == null) {
            return PayoutResponse.builder().period(period).paid(false).build();
        }
        return PayoutResponse.builder()
                .period(record.getPeriod())
                .paid(true)
                .recipient(record.getRecipient())
                .amount(record.getAmount())
                .paidAt(record.getPaidAt())
                .wasSkipped(record.isWasSkipped())
                .build();
    }
}
