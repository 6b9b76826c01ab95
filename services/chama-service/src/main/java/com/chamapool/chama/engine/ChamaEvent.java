package com.chamapool.chama.engine;

import com.chamapool.chama.domain.PunishmentAction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Something observable that happened to a group. Only the fields relevant to the
 * event type are set.
 */
@Value
@Builder
public class ChamaEvent {

    ChamaEventType type;
    String groupId;
    String member;

    /**
     * Second party, such as the approving admin or the previous creator.
     */
    String counterparty;

    BigDecimal amount;
    Long period;
    Long proposalId;
    PunishmentAction action;
    String reason;
    Boolean wasSkipped;
    Boolean support;
    Instant occurredAt;
}
