package com.chamapool.chama.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Punishment {

    private PunishmentAction action;
    private String reason;
    private boolean active;
    private Instant issuedAt;
    private BigDecimal fineAmount;

    /**
     * True when this ban is what took the member out of the active set. Only then does
     * cancelling it reinstate the member.
     */
    private boolean deactivatedMember;

    public boolean isActiveFine() {
        return active && action == PunishmentAction.FINE;
    }

    public boolean isActiveBan() {
        return active && action == PunishmentAction.BAN;
    }
}
