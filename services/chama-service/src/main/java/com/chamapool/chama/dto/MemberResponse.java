package com.chamapool.chama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Member details. Unknown identities come back with {@code exists=false} and zero values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemberResponse {

    private String memberId;
    private boolean exists;
    private boolean active;
    private Instant joinedAt;
    private BigDecimal totalContributed;
    private int missedContributions;
    private int consecutiveFines;
    private boolean receivedPayout;
    private List<Long> payoutPeriods;
}
