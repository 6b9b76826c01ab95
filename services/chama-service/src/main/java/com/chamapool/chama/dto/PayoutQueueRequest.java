package com.chamapool.chama.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutQueueRequest {

    @NotEmpty(message = "Queue must not be empty")
    private List<String> queue;
}
