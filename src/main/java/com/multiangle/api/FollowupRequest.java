package com.multiangle.api;

import jakarta.validation.constraints.NotBlank;

public record FollowupRequest(@NotBlank String message) {
}
