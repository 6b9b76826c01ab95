package com.chamapool.chama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Result of a group operation that returns a value: refunds, withdrawals, proposal ids and
 * missed-contribution counts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroupOperationResponse {

    private String groupId;
    private String operation;
    private String member;
    private BigDecimal amount;
    private Integer count;
    private Long proposalId;
}
