package com.rozet.api;

import jakarta.validation.constraints.NotBlank;

public record PlanRequest(
        @NotBlank String request,
        String contextSummary
) {
}
