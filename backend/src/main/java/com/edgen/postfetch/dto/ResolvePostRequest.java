package com.edgen.postfetch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record ResolvePostRequest(
        @NotBlank String url,
        boolean requireMembership,
        @Positive Long timeoutMs) {
}
