package com.chamapool.chama.engine;

import com.chamapool.chama.domain.Member;
import com.chamapool.chama.domain.PayoutRecord;
import com.chamapool.chama.domain.Proposal;
import com.chamapool.chama.domain.Punishment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable state of one group. Only touched by {@link ChamaGroupEngine} while it holds the
 * group lock; {@link #copy()} produces the snapshot an operation rolls back to.
 */
final class GroupLedger {

    String creator;
    Set<String> admins = new LinkedHashSet<>();
    boolean active = true;
    boolean paused;
    BigDecimal totalFunds = BigDecimal.ZERO;
    int memberCount;
    int activeMemberCount;
    long skippedPayouts;
    long proposalCounter;

    Map<String, Member> members = new LinkedHashMap<>();
    Map<String, Punishment> punishments = new HashMap<>();
    Map<String, Map<Long, Instant>> contributions = new HashMap<>();
    Map<String, Instant> pendingJoinRequests = new LinkedHashMap<>();
    Map<Long, Proposal> proposals = new LinkedHashMap<>();
    Map<Long, Set<String>> voters = new HashMap<>();
    Map<Long, PayoutRecord> payouts = new TreeMap<>();
    Map<String, List<Long>> payoutHistory = new HashMap<>();
    List<String> payoutQueue = new ArrayList<>();

    Member member(String memberId) {
        return members.get(memberId);
    }

    boolean isActiveMember(String memberId) {
        Member member = members.get(memberId);
        return member != null && member.isActive();
    }

    boolean hasActivePunishment(String memberId) {
        Punishment punishment = punishments.get(memberId);
        return punishment != null && punishment.isActive();
    }

    boolean isPayoutEligible(String memberId) {
        return isActiveMember(memberId) && !hasActivePunishment(memberId);
    }

    boolean hasContributed(String memberId, long period) {
        Map<Long, Instant> byPeriod = contributions.get(memberId);
        return byPeriod != null && byPeriod.containsKey(period);
    }

    GroupLedger copy() {
        GroupLedger copy = new GroupLedger();
        copy.creator = creator;
        copy.admins = new LinkedHashSet<>(admins);
        copy.active = active;
        copy.paused = paused;
        copy.totalFunds = totalFunds;
        copy.memberCount = memberCount;
        copy.activeMemberCount = activeMemberCount;
        copy.skippedPayouts = skippedPayouts;
        copy.proposalCounter = proposalCounter;

        members.forEach((id, member) -> copy.members.put(id, member.toBuilder().build()));
        punishments.forEach((id, punishment) -> copy.punishments.put(id, punishment.toBuilder().build()));
        contributions.forEach((id, byPeriod) -> copy.contributions.put(id, new HashMap<>(byPeriod)));
        copy.pendingJoinRequests = new LinkedHashMap<>(pendingJoinRequests);
        proposals.forEach((id, proposal) -> copy.proposals.put(id, proposal.toBuilder().build()));
        voters.forEach((id, set) -> copy.voters.put(id, new LinkedHashSet<>(set)));
        copy.payouts = new TreeMap<>(payouts);
        payoutHistory.forEach((id, periods) -> copy.payoutHistory.put(id, new ArrayList<>(periods)));
        copy.payoutQueue = new ArrayList<>(payoutQueue);
        return copy;
    }
}
