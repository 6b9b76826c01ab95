package com.chamapool.chama.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Constants shared by every group engine. Per-group overrides (window, grace, fine) live
 * in {@link com.chamapool.chama.domain.GroupRules}.
 */
@Value
@Builder
public class EngineSettings {

    @Builder.Default
    Duration periodDuration = Duration.ofDays(7);

    @Builder.Default
    Duration defaultContributionWindow = Duration.ofDays(5);

    @Builder.Default
    Duration defaultGracePeriod = Duration.ofDays(2);

    /**
     * Fine charged when a group is created without an explicit fine amount, as a percentage
     * of the contribution amount.
     */
    @Builder.Default
    int defaultFinePercent = 10;

    @Builder.Default
    int maxMissedContributions = 3;

    @Builder.Default
    int fineEscalationThreshold = 3;

    @Builder.Default
    int quorumPercent = 50;

    @Builder.Default
    Duration proposalDuration = Duration.ofDays(3);

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
