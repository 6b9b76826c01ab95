package com.chamapool.chama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * {@code contributedAt} is the epoch when the member has not contributed for the period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContributionStatusResponse {

    private String member;
    private long period;
    private boolean contributed;
    private Instant contributedAt;
    private boolean windowOpen;
}
