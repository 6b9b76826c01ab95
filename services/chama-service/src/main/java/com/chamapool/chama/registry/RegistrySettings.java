package com.chamapool.chama.registry;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Bounds enforced when a group is created, plus the identity allowed to pause the registry.
 */
@Value
@Builder
public class RegistrySettings {

    String owner;

    @Builder.Default
    int minNameLength = 1;

    @Builder.Default
    int maxNameLength = 50;

    @Builder.Default
    BigDecimal minContribution = new BigDecimal("0.001");

    @Builder.Default
    BigDecimal maxContribution = new BigDecimal("100");

    @Builder.Default
    int minMembers = 3;

    @Builder.Default
    int maxMembers = 100;

    @Builder.Default
    Duration maxGroupDuration = Duration.ofDays(365);

    @Builder.Default
    int maxGroupsPerCreator = 10;
}
