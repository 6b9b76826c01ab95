package com.chamapool.chama.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Chama Group Event - wire model published to the group events topic
 *
 * event_type is one of the engine event types, e.g. MEMBER_JOINED, CONTRIBUTION_MADE,
 * MISSED_CONTRIBUTION_DETECTED, PAYOUT_PROCESSED, PROPOSAL_EXECUTED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChamaGroupEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("group_id")
    private String groupId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("version")
    private String version;

    @JsonProperty("member")
    private String member;

    @JsonProperty("counterparty")
    private String counterparty;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("period")
    private Long period;

    @JsonProperty("proposal_id")
    private Long proposalId;

    @JsonProperty("punishment_action")
    private String punishmentAction;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("was_skipped")
    private Boolean wasSkipped;

    @JsonProperty("support")
    private Boolean support;
}
