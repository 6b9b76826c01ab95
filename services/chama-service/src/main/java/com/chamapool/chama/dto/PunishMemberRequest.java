package com.chamapool.chama.dto;

import com.chamapool.chama.domain.PunishmentAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PunishMemberRequest {

    @NotBlank(message = "Member is required")
    private String member;

    @NotNull(message = "Action is required")
    private PunishmentAction action;

    @Size(max = 500)
    private String reason;
}
