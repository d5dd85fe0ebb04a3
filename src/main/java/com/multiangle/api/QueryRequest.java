package com.multiangle.api;

import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
        @NotBlank String query,
        String provider,
        String model
) {
}
