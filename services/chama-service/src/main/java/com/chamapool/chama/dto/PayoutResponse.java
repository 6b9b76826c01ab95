package com.chamapool.chama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payout for one period; {@code paid=false} when the period has not been paid yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayoutResponse {

    private long period;
    private boolean paid;
    private String recipient;
    private BigDecimal amount;
    private Instant paidAt;
    private boolean wasSkipped;
}
