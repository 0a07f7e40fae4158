package com.rozet.api;

import jakarta.validation.constraints.NotBlank;

public record RunRequest(
        @NotBlank String request,
        String contextSummary,
        String workingDir
) {
}
