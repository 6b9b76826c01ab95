package com.chamapool.chama.engine;

import com.chamapool.chama.domain.ContributionAsset;
import com.chamapool.chama.domain.GroupRules;
import com.chamapool.chama.domain.JoinOutcome;
import com.chamapool.chama.domain.Member;
import com.chamapool.chama.domain.PayoutRecord;
import com.chamapool.chama.domain.Proposal;
import com.chamapool.chama.domain.ProposalType;
import com.chamapool.chama.domain.Punishment;
import com.chamapool.chama.domain.PunishmentAction;
import com.chamapool.chama.exception.ChamaAuthorizationException;
import com.chamapool.chama.exception.GroupCapacityException;
import com.chamapool.chama.exception.GroupIntegrityException;
import com.chamapool.chama.exception.GroupPreconditionException;
import com.chamapool.chama.exception.PaymentMismatchException;
import com.chamapool.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State machine of a single savings group: membership, periodic contributions, punishments,
 * governance proposals and the payout rotation.
 *
 * Every operation runs under one lock per group. A mutating operation works on the live
 * ledger after taking a snapshot of it; if anything throws, the snapshot is restored, so a
 * rejected operation leaves no trace. Events raised during an operation are handed to the
 * {@link GroupEventListener} only once the operation has committed and the lock is released.
 *
 * Outbound value always leaves through {@link #transferOut}: the state that marks the action
 * as done is written first, and any call back into this engine while the transfer runs is
 * rejected.
 */
@Slf4j
public class ChamaGroupEngine {

    private final String groupId;
    private final GroupRules rules;
    private final EngineSettings settings;
    private final ContributionSchedule schedule;
    private final BigDecimal fineAmount;
    private final Clock clock;
    private final ValueTransferGateway transferGateway;
    private final GroupEventListener eventListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ChamaEvent> pendingEvents = new ArrayList<>();
    private GroupLedger ledger;
    private boolean transferInProgress;

    public ChamaGroupEngine(String groupId,
                            String creator,
                            GroupRules rules,
                            EngineSettings settings,
                            Clock clock,
                            ValueTransferGateway transferGateway,
                            GroupEventListener eventListener) {
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.transferGateway = Objects.requireNonNull(transferGateway, "transferGateway");
        this.eventListener = eventListener != null ? eventListener : GroupEventListener.NO_OP;
        requireIdentity(creator);

        Duration window = rules.getContributionWindow() != null
                ? rules.getContributionWindow() : settings.getDefaultContributionWindow();
        Duration grace = rules.getGracePeriod() != null
                ? rules.getGracePeriod() : settings.getDefaultGracePeriod();
        this.schedule = new ContributionSchedule(rules.getStartDate(), settings.getPeriodDuration(), window, grace);
        this.fineAmount = rules.getFineAmount() != null
                ? rules.getFineAmount()
                : rules.getContributionAmount()
                        .multiply(BigDecimal.valueOf(settings.getDefaultFinePercent()))
                        .divide(BigDecimal.valueOf(100), rules.getContributionAmount().scale() + 2, RoundingMode.HALF_UP);

        this.ledger = new GroupLedger();
        this.ledger.creator = creator;
        this.ledger.admins.add(creator);
    }

    // ===== Membership & admin =====

    public JoinOutcome join(String caller) {
        return mutate("join", true, () -> {
            requireIdentity(caller);
            Instant now = clock.instant();
            if (ledger.members.containsKey(caller)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_ALREADY_MEMBER);
            }
            requireRunning(now);
            if (ledger.hasActivePunishment(caller)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_MEMBER_PUNISHED);
            }
            requireRoom();

            if (rules.isApprovalRequired()) {
                if (ledger.pendingJoinRequests.containsKey(caller)) {
                    throw new GroupPreconditionException(ErrorCode.GROUP_JOIN_ALREADY_REQUESTED);
                }
                ledger.pendingJoinRequests.put(caller, now);
                emit(event(ChamaEventType.JOIN_REQUESTED, now).member(caller));
                log.info("Join request recorded: group={}, member={}", groupId, caller);
                return JoinOutcome.REQUESTED;
            }

            admit(caller, now);
            return JoinOutcome.ADMITTED;
        });
    }

    public void approveJoin(String caller, String user) {
        mutate("approveJoin", true, () -> {
            requireAdmin(caller);
            requireGroupActive();
            if (!ledger.pendingJoinRequests.containsKey(user)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_NO_JOIN_REQUEST);
            }
            if (ledger.members.containsKey(user)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_ALREADY_MEMBER);
            }
            requireRoom();

            Instant now = clock.instant();
            ledger.pendingJoinRequests.remove(user);
            emit(event(ChamaEventType.JOIN_APPROVED, now).member(user).counterparty(caller));
            admit(user, now);
            return null;
        });
    }

    public void rejectJoin(String caller, String user) {
        mutate("rejectJoin", true, () -> {
            requireAdmin(caller);
            if (ledger.pendingJoinRequests.remove(user) == null) {
                throw new GroupPreconditionException(ErrorCode.GROUP_NO_JOIN_REQUEST);
            }
            emit(event(ChamaEventType.JOIN_REJECTED, clock.instant()).member(user).counterparty(caller));
            log.info("Join request rejected: group={}, member={}, by={}", groupId, user, caller);
            return null;
        });
    }

    /**
     * Deactivates the caller and refunds what they paid in, less a fine per missed period.
     * Members who have already received a payout get nothing back.
     *
     * @return the refunded amount
     */
    public BigDecimal leave(String caller) {
        return mutate("leave", true, () -> {
            Member member = requireActiveMember(caller);
            if (ledger.hasActivePunishment(caller)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_ACTIVE_PUNISHMENT);
            }

            BigDecimal refund = computeRefund(member);
            deactivate(member);

            if (refund.signum() > 0) {
                if (refund.compareTo(ledger.totalFunds) > 0) {
                    throw new GroupPreconditionException(ErrorCode.GROUP_INSUFFICIENT_POOL,
                            "Refund of " + refund + " exceeds pool balance " + ledger.totalFunds);
                }
                ledger.totalFunds = ledger.totalFunds.subtract(refund);
                transferOut(caller, refund, reference("refund", caller));
            }

            emit(event(ChamaEventType.MEMBER_LEFT, clock.instant()).member(caller).amount(refund));
            log.info("Member left: group={}, member={}, refund={}", groupId, caller, refund);
            return refund;
        });
    }

    public void addAdmin(String caller, String user) {
        mutate("addAdmin", true, () -> {
            requireCreator(caller);
            requireIdentity(user);
            grantAdmin(user, caller);
            return null;
        });
    }

    public void removeAdmin(String caller, String user) {
        mutate("removeAdmin", true, () -> {
            requireCreator(caller);
            revokeAdmin(user, caller);
            return null;
        });
    }

    public void transferCreator(String caller, String newCreator) {
        mutate("transferCreator", true, () -> {
            requireCreator(caller);
            requireIdentity(newCreator);
            if (newCreator.equals(ledger.creator)) {
                throw new GroupIntegrityException(ErrorCode.GROUP_ALREADY_CREATOR);
            }
            String previous = ledger.creator;
            ledger.creator = newCreator;
            ledger.admins.add(newCreator);
            emit(event(ChamaEventType.CREATOR_TRANSFERRED, clock.instant()).member(newCreator).counterparty(previous));
            log.info("Creator transferred: group={}, from={}, to={}", groupId, previous, newCreator);
            return null;
        });
    }

    public void pause(String caller) {
        mutate("pause", true, () -> {
            requireAdmin(caller);
            ledger.paused = true;
            emit(event(ChamaEventType.GROUP_PAUSED, clock.instant()).member(caller));
            log.info("Group paused: group={}, by={}", groupId, caller);
            return null;
        });
    }

    public void unpause(String caller) {
        mutate("unpause", false, () -> {
            requireAdmin(caller);
            if (!ledger.paused) {
                throw new GroupPreconditionException(ErrorCode.GROUP_NOT_PAUSED);
            }
            ledger.paused = false;
            emit(event(ChamaEventType.GROUP_UNPAUSED, clock.instant()).member(caller));
            log.info("Group unpaused: group={}, by={}", groupId, caller);
            return null;
        });
    }

    // ===== Contributions =====

    /**
     * Pays the caller's contribution for the current period. Earlier periods the caller let
     * lapse are detected first and may punish them. A fine still lets the contribution through;
     * a ban is kept but nothing is collected and the call is rejected.
     */
    public void contribute(String caller, ContributionAsset asset, BigDecimal amount) {
        Boolean accepted = mutate("contribute", true, () -> {
            Member member = requireActiveMember(caller);
            Instant now = clock.instant();
            requireRunning(now);

            long period = schedule.periodAt(now);
            if (ledger.hasContributed(caller, period)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_ALREADY_CONTRIBUTED);
            }
            requireAsset(asset);
            if (amount == null || amount.compareTo(rules.getContributionAmount()) != 0) {
                throw new PaymentMismatchException(ErrorCode.GROUP_INCORRECT_CONTRIBUTION,
                        rules.getContributionAmount(), amount);
            }
            if (!schedule.isWindowOpen(now)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_WINDOW_CLOSED);
            }

            detectMissedContributions(member, now);
            if (!member.isActive()) {
                log.warn("Contribution refused after ban: group={}, member={}, period={}", groupId, caller, period);
                return Boolean.FALSE;
            }

            transferIn(caller, amount, reference("contribution", caller + ":" + period));
            ledger.contributions.computeIfAbsent(caller, k -> new HashMap<>()).put(period, now);
            member.setTotalContributed(member.getTotalContributed().add(amount));
            ledger.totalFunds = ledger.totalFunds.add(amount);

            emit(event(ChamaEventType.CONTRIBUTION_MADE, now).member(caller).amount(amount).period(period));
            log.info("Contribution recorded: group={}, member={}, period={}, amount={}",
                    groupId, caller, period, amount);
            return Boolean.TRUE;
        });
        if (!accepted) {
            throw new GroupPreconditionException(ErrorCode.GROUP_MEMBER_INACTIVE,
                    "Member was banned for missed contributions; contribution not collected");
        }
    }

    /**
     * Walks the member's unchecked periods whose deadline has passed and records every miss.
     *
     * @return number of newly detected missed periods
     */
    public int checkMissedContributions(String caller, String user) {
        return mutate("checkMissedContributions", true, () -> {
            requireAdmin(caller);
            Member member = requireKnownMember(user);
            return detectMissedContributions(member, clock.instant());
        });
    }

    public int checkAllMissedContributions(String caller) {
        return mutate("checkAllMissedContributions", true, () -> {
            requireAdmin(caller);
            Instant now = clock.instant();
            int detected = 0;
            for (Member member : new ArrayList<>(ledger.members.values())) {
                detected += detectMissedContributions(member, now);
            }
            return detected;
        });
    }

    // ===== Punishment =====

    public void punishMember(String caller, String user, PunishmentAction action, String reason) {
        mutate("punishMember", true, () -> {
            requireAdmin(caller);
            if (action == null || action == PunishmentAction.NONE) {
                throw new GroupIntegrityException(ErrorCode.GROUP_INVALID_PUNISHMENT);
            }
            Member member = requireKnownMember(user);
            if (!member.isActive()) {
                throw new GroupPreconditionException(ErrorCode.GROUP_MEMBER_INACTIVE);
            }
            applyPunishment(member, action, reason, clock.instant());
            return null;
        });
    }

    public void payFine(String caller, ContributionAsset asset, BigDecimal amount) {
        mutate("payFine", true, () -> {
            Punishment punishment = ledger.punishments.get(caller);
            Member member = ledger.member(caller);
            if (member == null || punishment == null || !punishment.isActiveFine()) {
                throw new GroupPreconditionException(ErrorCode.GROUP_NO_ACTIVE_FINE);
            }
            requireAsset(asset);
            if (amount == null || amount.compareTo(punishment.getFineAmount()) != 0) {
                throw new PaymentMismatchException(ErrorCode.GROUP_INCORRECT_FINE, punishment.getFineAmount(), amount);
            }

            Instant now = clock.instant();
            transferIn(caller, amount, reference("fine", caller + ":" + now.toEpochMilli()));
            punishment.setActive(false);
            member.setConsecutiveFines(0);
            ledger.totalFunds = ledger.totalFunds.add(amount);

            emit(event(ChamaEventType.FINE_COLLECTED, now).member(caller).amount(amount));
            log.info("Fine collected: group={}, member={}, amount={}", groupId, caller, amount);
            return null;
        });
    }

    public void cancelPunishment(String caller, String user) {
        mutate("cancelPunishment", true, () -> {
            requireAdmin(caller);
            clearPunishment(user, clock.instant());
            return null;
        });
    }

    // ===== Governance =====

    public long createProposal(String caller, ProposalType type, String target, BigDecimal value, String description) {
        return mutate("createProposal", true, () -> {
            requireActiveMember(caller);
            Objects.requireNonNull(type, "proposalType");
            requireIdentity(target);

            Instant now = clock.instant();
            long id = ++ledger.proposalCounter;
            Proposal proposal = Proposal.builder()
                    .id(id)
                    .proposalType(type)
                    .target(target)
                    .value(value)
                    .description(description)
                    .proposer(caller)
                    .createdAt(now)
                    .votingEndsAt(now.plus(settings.getProposalDuration()))
                    .build();
            ledger.proposals.put(id, proposal);
            ledger.voters.put(id, new LinkedHashSet<>());

            emit(event(ChamaEventType.PROPOSAL_CREATED, now).member(caller).counterparty(target)
                    .proposalId(id).reason(type.name()));
            log.info("Proposal created: group={}, id={}, type={}, target={}", groupId, id, type, target);
            return id;
        });
    }

    public void voteOnProposal(String caller, long proposalId, boolean support) {
        mutate("voteOnProposal", true, () -> {
            requireActiveMember(caller);
            Proposal proposal = requireProposal(proposalId);
            if (proposal.isExecuted()) {
                throw new GroupIntegrityException(ErrorCode.GROUP_PROPOSAL_EXECUTED);
            }
            Instant now = clock.instant();
            if (now.isAfter(proposal.getVotingEndsAt())) {
                throw new GroupPreconditionException(ErrorCode.GROUP_VOTING_CLOSED);
            }
            if (!ledger.voters.get(proposalId).add(caller)) {
                throw new GroupPreconditionException(ErrorCode.GROUP_ALREADY_VOTED);
            }
            if (support) {
                proposal.setVotesFor(proposal.getVotesFor() + 1);
            } else {
                proposal.setVotesAgainst(proposal.getVotesAgainst() + 1);
            }
            emit(event(ChamaEventType.VOTE_CAST, now).member(caller).proposalId(proposalId).support(support));
            return null;
        });
    }

    public void executeProposal(String caller, long proposalId) {
        mutate("executeProposal", true, () -> {
            requireAdmin(caller);
            Proposal proposal = requireProposal(proposalId);
            if (proposal.isExecuted()) {
                throw new GroupIntegrityException(ErrorCode.GROUP_PROPOSAL_EXECUTED);
            }
            Instant now = clock.instant();
            if (!now.isAfter(proposal.getVotingEndsAt())) {
                throw new GroupPreconditionException(ErrorCode.GROUP_VOTING_ACTIVE);
            }
            int required = requiredVotes(ledger.activeMemberCount, settings.getQuorumPercent());
            if (proposal.totalVotes() < required) {
                throw new GroupPreconditionException(ErrorCode.GROUP_INSUFFICIENT_PARTICIPATION,
                        "Insufficient participation: " + proposal.totalVotes() + " of " + required + " required votes");
            }
            if (proposal.getVotesFor() <= proposal.getVotesAgainst()) {
                throw new GroupPreconditionException(ErrorCode.GROUP_PROPOSAL_REJECTED);
            }

            String target = proposal.getTarget();
            switch (proposal.getProposalType()) {
                case CANCEL_PUNISHMENT:
                    clearPunishment(target, now);
                    break;
                case ADD_ADMIN:
                    grantAdmin(target, caller);
                    break;
                case REMOVE_ADMIN:
                    revokeAdmin(target, caller);
                    break;
                case KICK_MEMBER:
                    kick(target, proposalId, now);
                    break;
                default:
                    throw new IllegalStateException("Unhandled proposal type " + proposal.getProposalType());
            }

            proposal.setExecuted(true);
            proposal.setExecutedAt(now);
            emit(event(ChamaEventType.PROPOSAL_EXECUTED, now).member(caller).counterparty(target)
                    .proposalId(proposalId).reason(proposal.getProposalType().name()));
            log.info("Proposal executed: group={}, id={}, type={}, votesFor={}, votesAgainst={}",
                    groupId, proposalId, proposal.getProposalType(), proposal.getVotesFor(), proposal.getVotesAgainst());
            return null;
        });
    }

    // ===== Payout rotation =====

    public void setPayoutQueue(String caller, List<String> queue) {
        mutate("setPayoutQueue", true, () -> {
            requireCreator(caller);
            if (!ledger.payoutQueue.isEmpty()) {
                throw new GroupCapacityException(ErrorCode.GROUP_QUEUE_ALREADY_SET);
            }
            if (queue == null || queue.isEmpty() || queue.size() != ledger.memberCount) {
                throw new GroupCapacityException(ErrorCode.GROUP_QUEUE_LENGTH_MISMATCH,
                        "Queue length " + (queue == null ? 0 : queue.size())
                                + " must equal member count " + ledger.memberCount);
            }
            Set<String> seen = new HashSet<>();
            for (String entry : queue) {
                if (entry == null || !ledger.members.containsKey(entry)) {
                    throw new GroupCapacityException(ErrorCode.GROUP_QUEUE_INVALID_ENTRY,
                            "Queue entry is not a member: " + entry);
                }
                if (!seen.add(entry)) {
                    throw new GroupCapacityException(ErrorCode.GROUP_QUEUE_DUPLICATE,
                            "Queue contains duplicate member: " + entry);
                }
            }
            ledger.payoutQueue = new ArrayList<>(queue);
            log.info("Payout queue set: group={}, queue={}", groupId, queue);
            return null;
        });
    }

    /**
     * Pays the pooled contributions of the current period to the next member in the rotation.
     * An ineligible nominal recipient shifts the rotation permanently by one.
     *
     * @return the payout written for the current period
     */
    public PayoutRecord processRotationPayout(String caller) {
        return mutate("processRotationPayout", true, () -> {
            requireAdmin(caller);
            requireGroupActive();

            Instant now = clock.instant();
            long period = schedule.periodAt(now);
            if (ledger.payouts.containsKey(period)) {
                throw new GroupIntegrityException(ErrorCode.GROUP_PAYOUT_PROCESSED);
            }
            List<String> queue = ledger.payoutQueue;
            if (queue.isEmpty()) {
                throw new GroupCapacityException(ErrorCode.GROUP_QUEUE_NOT_SET);
            }
            for (String queued : queue) {
                if (ledger.isPayoutEligible(queued) && !ledger.hasContributed(queued, period)) {
                    throw new GroupPreconditionException(ErrorCode.GROUP_MEMBER_NOT_CONTRIBUTED,
                            "Member has not contributed yet: " + queued);
                }
            }

            int nominal = (int) Math.floorMod(period - ledger.skippedPayouts, (long) queue.size());
            String recipient = queue.get(nominal);
            boolean wasSkipped = false;
            if (!ledger.isPayoutEligible(recipient)) {
                wasSkipped = true;
                ledger.skippedPayouts++;
                recipient = nextEligible(queue, nominal)
                        .orElseThrow(() -> new GroupPreconditionException(ErrorCode.GROUP_NO_ELIGIBLE_RECIPIENTS));
                log.info("Rotation skipped ineligible member: group={}, period={}, skipped={}, recipient={}",
                        groupId, period, queue.get(nominal), recipient);
            }

            BigDecimal amount = rules.getContributionAmount().multiply(BigDecimal.valueOf(ledger.activeMemberCount));
            if (amount.compareTo(ledger.totalFunds) > 0) {
                throw new GroupPreconditionException(ErrorCode.GROUP_INSUFFICIENT_POOL,
                        "Payout of " + amount + " exceeds pool balance " + ledger.totalFunds);
            }

            PayoutRecord record = PayoutRecord.builder()
                    .period(period)
                    .recipient(recipient)
                    .amount(amount)
                    .paidAt(now)
                    .wasSkipped(wasSkipped)
                    .build();
            ledger.totalFunds = ledger.totalFunds.subtract(amount);
            ledger.payouts.put(period, record);
            ledger.payoutHistory.computeIfAbsent(recipient, k -> new ArrayList<>()).add(period);
            ledger.member(recipient).setReceivedPayout(true);
            transferOut(recipient, amount, reference("payout", String.valueOf(period)));

            emit(event(ChamaEventType.PAYOUT_PROCESSED, now).member(recipient).amount(amount)
                    .period(period).wasSkipped(wasSkipped));
            log.info("Payout processed: group={}, period={}, recipient={}, amount={}, skipped={}",
                    groupId, period, recipient, amount, wasSkipped);
            return record;
        });
    }

    /**
     * Sends the whole pool to the creator and closes the group for good.
     *
     * @return the withdrawn amount
     */
    public BigDecimal triggerEmergencyWithdraw(String caller) {
        return mutate("triggerEmergencyWithdraw", true, () -> {
            requireAdmin(caller);
            if (!rules.isEmergencyWithdrawAllowed()) {
                throw new GroupPreconditionException(ErrorCode.GROUP_EMERGENCY_WITHDRAW_DISABLED);
            }
            requireGroupActive();

            BigDecimal amount = ledger.totalFunds;
            ledger.totalFunds = BigDecimal.ZERO;
            ledger.active = false;
            if (amount.signum() > 0) {
                transferOut(ledger.creator, amount, reference("emergency", ledger.creator));
            }

            emit(event(ChamaEventType.EMERGENCY_WITHDRAWAL, clock.instant()).member(caller)
                    .counterparty(ledger.creator).amount(amount));
            log.warn("Emergency withdrawal: group={}, by={}, amount={}", groupId, caller, amount);
            return amount;
        });
    }

    // ===== Queries =====

    public String getGroupId() {
        return groupId;
    }

    public GroupRules getRules() {
        return rules;
    }

    public BigDecimal getFineAmount() {
        return fineAmount;
    }

    public long getCurrentPeriod() {
        return schedule.periodAt(clock.instant());
    }

    public boolean isContributionWindowOpen() {
        return schedule.isWindowOpen(clock.instant());
    }

    /**
     * @return when the member contributed for the period, or {@link Instant#EPOCH} if they did not
     */
    public Instant getContributionTimestamp(String member, long period) {
        return read(() -> {
            Map<Long, Instant> byPeriod = ledger.contributions.get(member);
            Instant at = byPeriod != null ? byPeriod.get(period) : null;
            return at != null ? at : Instant.EPOCH;
        });
    }

    public Optional<Member> getMemberDetails(String member) {
        return read(() -> Optional.ofNullable(ledger.member(member)).map(m -> m.toBuilder().build()));
    }

    public List<Member> getMembers() {
        return read(() -> {
            List<Member> copies = new ArrayList<>();
            ledger.members.values().forEach(m -> copies.add(m.toBuilder().build()));
            return copies;
        });
    }

    public Optional<Punishment> getPunishmentDetails(String member) {
        return read(() -> Optional.ofNullable(ledger.punishments.get(member)).map(p -> p.toBuilder().build()));
    }

    public Optional<Proposal> getProposal(long proposalId) {
        return read(() -> Optional.ofNullable(ledger.proposals.get(proposalId)).map(p -> p.toBuilder().build()));
    }

    public List<Proposal> getProposals() {
        return read(() -> {
            List<Proposal> copies = new ArrayList<>();
            ledger.proposals.values().forEach(p -> copies.add(p.toBuilder().build()));
            return copies;
        });
    }

    public boolean hasVoted(long proposalId, String voter) {
        return read(() -> {
            Set<String> voted = ledger.voters.get(proposalId);
            return voted != null && voted.contains(voter);
        });
    }

    public Optional<PayoutRecord> getPayoutInfo(long period) {
        return read(() -> Optional.ofNullable(ledger.payouts.get(period)));
    }

    public List<Long> getPayoutHistory(String member) {
        return read(() -> List.copyOf(ledger.payoutHistory.getOrDefault(member, Collections.emptyList())));
    }

    public boolean hasReceivedPayout(String member) {
        return read(() -> {
            Member m = ledger.member(member);
            return m != null && m.isReceivedPayout();
        });
    }

    public int getMemberCount() {
        return read(() -> ledger.memberCount);
    }

    public int getActiveMemberCount() {
        return read(() -> ledger.activeMemberCount);
    }

    public BigDecimal getTotalFunds() {
        return read(() -> ledger.totalFunds);
    }

    public String getCreator() {
        return read(() -> ledger.creator);
    }

    public boolean isAdmin(String user) {
        return read(() -> ledger.admins.contains(user));
    }

    public boolean isPaused() {
        return read(() -> ledger.paused);
    }

    public boolean isActive() {
        return read(() -> ledger.active);
    }

    public long getSkippedPayouts() {
        return read(() -> ledger.skippedPayouts);
    }

    public List<String> getPayoutQueue() {
        return read(() -> List.copyOf(ledger.payoutQueue));
    }

    public boolean hasPendingJoinRequest(String user) {
        return read(() -> ledger.pendingJoinRequests.containsKey(user));
    }

    public GroupSnapshot snapshot() {
        return read(() -> {
            Instant now = clock.instant();
            return GroupSnapshot.builder()
                    .groupId(groupId)
                    .rules(rules)
                    .fineAmount(fineAmount)
                    .creator(ledger.creator)
                    .admins(List.copyOf(ledger.admins))
                    .active(ledger.active)
                    .paused(ledger.paused)
                    .totalFunds(ledger.totalFunds)
                    .memberCount(ledger.memberCount)
                    .activeMemberCount(ledger.activeMemberCount)
                    .skippedPayouts(ledger.skippedPayouts)
                    .currentPeriod(schedule.periodAt(now))
                    .contributionWindowOpen(schedule.isWindowOpen(now))
                    .payoutQueue(List.copyOf(ledger.payoutQueue))
                    .pendingJoinRequests(List.copyOf(ledger.pendingJoinRequests.keySet()))
                    .proposalCount(ledger.proposalCounter)
                    .build();
        });
    }

    static int requiredVotes(int activeMembers, int quorumPercent) {
        return (activeMembers * quorumPercent + 99) / 100;
    }

    // ===== Internals =====

    private <T> T mutate(String operation, boolean requiresUnpaused, Supplier<T> action) {
        List<ChamaEvent> committed;
        T result;
        lock.lock();
        try {
            if (transferInProgress) {
                throw new GroupPreconditionException(ErrorCode.GROUP_REENTRANT_CALL,
                        "Reentrant call to " + operation + " during value transfer");
            }
            if (requiresUnpaused && ledger.paused) {
                throw new GroupPreconditionException(ErrorCode.GROUP_PAUSED);
            }

            GroupLedger snapshot = ledger.copy();
            try {
                result = action.get();
            } catch (RuntimeException e) {
                ledger = snapshot;
                pendingEvents.clear();
                log.debug("Rolled back {} on group {}: {}", operation, groupId, e.getMessage());
                throw e;
            }

            committed = new ArrayList<>(pendingEvents);
            pendingEvents.clear();
        } finally {
            lock.unlock();
        }
        dispatch(committed);
        return result;
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(List<ChamaEvent> events) {
        for (ChamaEvent event : events) {
            try {
                eventListener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Failed to dispatch {} event for group {}", event.getType(), groupId, e);
            }
        }
    }

    private void transferIn(String from, BigDecimal amount, String reference) {
        transferInProgress = true;
        try {
            transferGateway.collect(from, rules.getContributionAsset(), amount, reference);
        } finally {
            transferInProgress = false;
        }
    }

    private void transferOut(String to, BigDecimal amount, String reference) {
        transferInProgress = true;
        try {
            transferGateway.disburse(to, rules.getContributionAsset(), amount, reference);
        } finally {
            transferInProgress = false;
        }
    }

    private int detectMissedContributions(Member member, Instant now) {
        long current = schedule.periodAt(now);
        long period = member.getNextPeriodToCheck();
        int detected = 0;
        while (member.isActive() && period < current && schedule.isDeadlinePassed(period, now)) {
            boolean closedBeforeJoin = schedule.deadline(period).isBefore(member.getJoinedAt());
            if (!closedBeforeJoin && !ledger.hasContributed(member.getMemberId(), period)) {
                member.setMissedContributions(member.getMissedContributions() + 1);
                detected++;
                emit(event(ChamaEventType.MISSED_CONTRIBUTION_DETECTED, now)
                        .member(member.getMemberId()).period(period));
                log.info("Missed contribution detected: group={}, member={}, period={}, missed={}",
                        groupId, member.getMemberId(), period, member.getMissedContributions());

                if (member.getMissedContributions() > settings.getMaxMissedContributions()
                        && rules.getPunishmentMode() != PunishmentAction.NONE) {
                    applyPunishment(member, rules.getPunishmentMode(),
                            "Missed " + member.getMissedContributions() + " contributions", now);
                }
            }
            period++;
        }
        member.setNextPeriodToCheck(Math.max(member.getNextPeriodToCheck(), period));
        return detected;
    }

    private void applyPunishment(Member member, PunishmentAction requested, String reason, Instant now) {
        PunishmentAction applied = requested;
        if (requested == PunishmentAction.FINE && rules.getPunishmentMode() == PunishmentAction.FINE) {
            member.setConsecutiveFines(member.getConsecutiveFines() + 1);
            if (member.getConsecutiveFines() >= settings.getFineEscalationThreshold()) {
                applied = PunishmentAction.BAN;
                log.warn("Fine escalated to ban: group={}, member={}, consecutiveFines={}",
                        groupId, member.getMemberId(), member.getConsecutiveFines());
            }
        } else {
            member.setConsecutiveFines(0);
        }

        BigDecimal fine = applied == PunishmentAction.FINE ? fineAmount : BigDecimal.ZERO;
        ledger.punishments.put(member.getMemberId(), Punishment.builder()
                .action(applied)
                .reason(reason)
                .active(true)
                .issuedAt(now)
                .fineAmount(fine)
                .deactivatedMember(applied == PunishmentAction.BAN && member.isActive())
                .build());
        if (applied == PunishmentAction.BAN) {
            deactivate(member);
        }

        emit(event(ChamaEventType.MEMBER_PUNISHED, now).member(member.getMemberId())
                .action(applied).reason(reason).amount(fine));
        log.info("Member punished: group={}, member={}, action={}, reason={}",
                groupId, member.getMemberId(), applied, reason);
    }

    private void clearPunishment(String user, Instant now) {
        Punishment punishment = ledger.punishments.get(user);
        if (punishment == null || !punishment.isActive()) {
            throw new GroupPreconditionException(ErrorCode.GROUP_NO_ACTIVE_PUNISHMENT);
        }
        punishment.setActive(false);

        if (punishment.getAction() == PunishmentAction.BAN) {
            Member member = ledger.member(user);
            if (punishment.isDeactivatedMember() && !member.isActive()) {
                member.setActive(true);
                ledger.activeMemberCount++;
            }
            member.setMissedContributions(0);
            member.setConsecutiveFines(0);
            member.setNextPeriodToCheck(Math.max(member.getNextPeriodToCheck(), schedule.periodAt(now)));
        }

        emit(event(ChamaEventType.PUNISHMENT_CANCELLED, now).member(user).action(punishment.getAction()));
        log.info("Punishment cancelled: group={}, member={}, action={}", groupId, user, punishment.getAction());
    }

    private void grantAdmin(String user, String by) {
        requireIdentity(user);
        ledger.admins.add(user);
        emit(event(ChamaEventType.ADMIN_ADDED, clock.instant()).member(user).counterparty(by));
        log.info("Admin added: group={}, admin={}, by={}", groupId, user, by);
    }

    private void revokeAdmin(String user, String by) {
        if (user != null && user.equals(ledger.creator)) {
            throw new GroupIntegrityException(ErrorCode.GROUP_CANNOT_REMOVE_CREATOR);
        }
        ledger.admins.remove(user);
        emit(event(ChamaEventType.ADMIN_REMOVED, clock.instant()).member(user).counterparty(by));
        log.info("Admin removed: group={}, admin={}, by={}", groupId, user, by);
    }

    private void kick(String user, long proposalId, Instant now) {
        Member member = requireKnownMember(user);
        deactivate(member);
        // a cancelled ban must not reinstate a kicked member
        Punishment punishment = ledger.punishments.get(user);
        if (punishment != null) {
            punishment.setDeactivatedMember(false);
        }
        emit(event(ChamaEventType.MEMBER_LEFT, now).member(user).proposalId(proposalId)
                .reason("Kicked by proposal " + proposalId).amount(BigDecimal.ZERO));
        log.info("Member kicked: group={}, member={}, proposal={}", groupId, user, proposalId);
    }

    private void admit(String user, Instant now) {
        Member member = Member.builder()
                .memberId(user)
                .active(true)
                .joinedAt(now)
                .nextPeriodToCheck(schedule.periodAt(now))
                .build();
        ledger.members.put(user, member);
        ledger.memberCount++;
        ledger.activeMemberCount++;
        emit(event(ChamaEventType.MEMBER_JOINED, now).member(user));
        log.info("Member joined: group={}, member={}, members={}/{}",
                groupId, user, ledger.memberCount, rules.getMaxMembers());
    }

    private void deactivate(Member member) {
        if (member.isActive()) {
            member.setActive(false);
            ledger.activeMemberCount--;
        }
    }

    private BigDecimal computeRefund(Member member) {
        boolean paidOut = member.isReceivedPayout()
                || !ledger.payoutHistory.getOrDefault(member.getMemberId(), Collections.emptyList()).isEmpty();
        if (paidOut) {
            return BigDecimal.ZERO;
        }
        BigDecimal penalty = fineAmount.multiply(BigDecimal.valueOf(member.getMissedContributions()));
        return member.getTotalContributed().subtract(penalty).max(BigDecimal.ZERO);
    }

    private Optional<String> nextEligible(List<String> queue, int from) {
        for (int step = 1; step < queue.size(); step++) {
            String candidate = queue.get((from + step) % queue.size());
            if (ledger.isPayoutEligible(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private void requireRunning(Instant now) {
        requireGroupActive();
        if (now.isBefore(rules.getStartDate())) {
            throw new GroupPreconditionException(ErrorCode.GROUP_NOT_STARTED);
        }
        if (now.isAfter(rules.getEndDate())) {
            throw new GroupPreconditionException(ErrorCode.GROUP_ENDED);
        }
    }

    private void requireGroupActive() {
        if (!ledger.active) {
            throw new GroupPreconditionException(ErrorCode.GROUP_INACTIVE);
        }
    }

    private void requireRoom() {
        if (ledger.memberCount >= rules.getMaxMembers()) {
            throw new GroupCapacityException(ErrorCode.GROUP_FULL);
        }
    }

    private void requireAsset(ContributionAsset asset) {
        ContributionAsset paid = asset != null ? asset : ContributionAsset.NATIVE;
        if (!paid.equals(rules.getContributionAsset())) {
            throw new PaymentMismatchException(ErrorCode.GROUP_WRONG_ASSET);
        }
    }

    private void requireAdmin(String caller) {
        if (caller == null || !ledger.admins.contains(caller)) {
            throw new ChamaAuthorizationException(ErrorCode.GROUP_NOT_ADMIN);
        }
    }

    private void requireCreator(String caller) {
        if (caller == null || !caller.equals(ledger.creator)) {
            throw new ChamaAuthorizationException(ErrorCode.GROUP_NOT_CREATOR);
        }
    }

    private Member requireActiveMember(String caller) {
        Member member = ledger.member(caller);
        if (member == null || !member.isActive()) {
            throw new ChamaAuthorizationException(ErrorCode.GROUP_NOT_ACTIVE_MEMBER);
        }
        return member;
    }

    private Member requireKnownMember(String user) {
        Member member = ledger.member(user);
        if (member == null) {
            throw new GroupIntegrityException(ErrorCode.GROUP_UNKNOWN_MEMBER, "Not a member: " + user);
        }
        return member;
    }

    private Proposal requireProposal(long proposalId) {
        Proposal proposal = ledger.proposals.get(proposalId);
        if (proposal == null) {
            throw new GroupIntegrityException(ErrorCode.GROUP_PROPOSAL_NOT_FOUND,
                    "Proposal does not exist: " + proposalId);
        }
        return proposal;
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new GroupIntegrityException(ErrorCode.GROUP_INVALID_ADDRESS);
        }
    }

    private ChamaEvent.ChamaEventBuilder event(ChamaEventType type, Instant at) {
        return ChamaEvent.builder().type(type).groupId(groupId).occurredAt(at);
    }

    private void emit(ChamaEvent.ChamaEventBuilder builder) {
        pendingEvents.add(builder.build());
    }

    private String reference(String kind, String detail) {
        return groupId + ":" + kind + ":" + detail;
    }
}
