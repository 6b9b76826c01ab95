package com.chamapool.chama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Group summary: rules plus current top-level state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroupResponse {

    private String groupId;
    private String name;
    private BigDecimal contributionAmount;
    private String contributionAsset;
    private String contributionFrequency;
    private int maxMembers;
    private Instant startDate;
    private Instant endDate;
    private String punishmentMode;
    private boolean approvalRequired;
    private boolean emergencyWithdrawAllowed;
    private Duration contributionWindow;
    private Duration gracePeriod;
    private BigDecimal fineAmount;

    private String creator;
    private List<String> admins;
    private boolean active;
    private boolean paused;
    private BigDecimal totalFunds;
    private int memberCount;
    private int activeMemberCount;
    private long skippedPayouts;
    private long currentPeriod;
    private boolean contributionWindowOpen;
    private List<String> payoutQueue;
    private List<String> pendingJoinRequests;
    private long proposalCount;
}
