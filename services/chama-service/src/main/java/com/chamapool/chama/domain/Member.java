package com.chamapool.chama.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A group member. Members are never removed; leaving, bans and kicks only clear {@code active}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Member {

    private String memberId;
    private boolean active;
    private Instant joinedAt;

    @Builder.Default
    private BigDecimal totalContributed = BigDecimal.ZERO;

    private int missedContributions;
    private int consecutiveFines;
    private boolean receivedPayout;

    /**
     * First period not yet inspected by missed-contribution detection.
     */
    private long nextPeriodToCheck;
}
