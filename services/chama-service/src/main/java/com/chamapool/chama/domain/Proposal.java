package com.chamapool.chama.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Governance proposal. Ids are assigned incrementally from 1 and proposals are never deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Proposal {

    private long id;
    private ProposalType proposalType;
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

    public int totalVotes() {
        return votesFor + votesAgainst;
    }
}
