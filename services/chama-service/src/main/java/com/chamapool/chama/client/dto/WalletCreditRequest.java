package com.chamapool.chama.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletCreditRequest {

    private String userId;
    private BigDecimal amount;
    private String currency;

    /**
     * Idempotency reference, unique per group operation
     */
    private String reference;

    private String description;
}
