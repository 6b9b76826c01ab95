package com.chamapool.chama.dto;

import com.chamapool.chama.domain.PunishmentAction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Parameters for a new group. Range checks are applied by the registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateGroupRequest {

    @NotBlank(message = "Group name is required")
    private String name;

    @NotNull(message = "Contribution amount is required")
    @Positive(message = "Contribution amount must be positive")
    private BigDecimal contributionAmount;

    @Schema(description = "Free-text label such as WEEKLY", example = "WEEKLY")
    private String contributionFrequency;

    @NotNull(message = "Max members is required")
    private Integer maxMembers;

    @NotNull(message = "Start date is required")
    private Instant startDate;

    @NotNull(message = "End date is required")
    private Instant endDate;

    private PunishmentAction punishmentMode;

    private boolean approvalRequired;

    private boolean emergencyWithdrawAllowed;

    @Schema(description = "Token code; omit for the native currency", example = "USDC")
    private String contributionToken;

    @Schema(description = "ISO-8601 duration, defaults to the service setting", example = "P5D")
    private Duration contributionWindow;

    @Schema(description = "ISO-8601 duration, defaults to the service setting", example = "P2D")
    private Duration gracePeriod;

    @Schema(description = "Fine per missed contribution, defaults to a percentage of the contribution")
    private BigDecimal fineAmount;
}
