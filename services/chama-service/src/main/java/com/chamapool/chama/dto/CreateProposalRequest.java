package com.chamapool.chama.dto;

import com.chamapool.chama.domain.ProposalType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProposalRequest {

    @NotNull(message = "Proposal type is required")
    private ProposalType proposalType;

    @NotBlank(message = "Target is required")
    private String target;

    private BigDecimal value;

    @Size(max = 1000)
    private String description;
}
