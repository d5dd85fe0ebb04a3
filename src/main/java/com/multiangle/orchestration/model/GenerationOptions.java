package com.multiangle.orchestration.model;

import org.springframework.lang.Nullable;

/**
 * Per-call options for the text-generation capability. Blank provider/model fall back to configuration.
 */
public record GenerationOptions(
        String purpose,
        @Nullable String provider,
        @Nullable String model
) {

    public static GenerationOptions defaults(String purpose) {
        return new GenerationOptions(purpose, null, null);
    }

    public GenerationOptions forPurpose(String otherPurpose) {
        return new GenerationOptions(otherPurpose, provider, model);
    }
}
