package com.chamapool.chama.engine;

import com.chamapool.chama.domain.GroupRules;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Consistent point-in-time view of a group's top-level state.
 */
@Value
@Builder
public class GroupSnapshot {

    String groupId;
    GroupRules rules;
    BigDecimal fineAmount;
    String creator;
    List<String> admins;
    boolean active;
    boolean paused;
    BigDecimal totalFunds;
    int memberCount;
    int activeMemberCount;
    long skippedPayouts;
    long currentPeriod;
    boolean contributionWindowOpen;
    List<String> payoutQueue;
    List<String> pendingJoinRequests;
    long proposalCount;
}
