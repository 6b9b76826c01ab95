package com.chamapool.chama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProposalResponse {

    private long id;
    private String proposalType;
    private String target;
    private BigDecimal value;
    private String description;
    private String proposer;
    private int votesFor;
    private int votesAgainst;
    private Instant createdAt;
    private Instant votingEndsAt;
    private boolean executed;
    private Instant executedAt;
}
