package com.chamapool.chama.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Rules a group is created with. Validated by the registry and never changed afterwards.
 */
@Value
@Builder(toBuilder = true)
public class GroupRules {

    String name;
    BigDecimal contributionAmount;
    String contributionFrequency;
    int maxMembers;
    Instant startDate;
    Instant endDate;
    PunishmentAction punishmentMode;
    boolean approvalRequired;
    boolean emergencyWithdrawAllowed;

    @Builder.Default
    ContributionAsset contributionAsset = ContributionAsset.NATIVE;

    Duration contributionWindow;
    Duration gracePeriod;
    BigDecimal fineAmount;
}
