package com.alphaguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the human approval of a DRAFT hypothesis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivateHypothesisRequest {

    /** Person approving the activation. Recorded with the transition. */
    @NotBlank
    private String approver;
}
