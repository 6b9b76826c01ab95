package com.chamapool.chama.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payout made for one period. Written once; a period with a record is paid.
 */
@Value
@Builder
public class PayoutRecord {

    long period;
    String recipient;
    BigDecimal amount;
    Instant paidAt;
    boolean wasSkipped;
}
