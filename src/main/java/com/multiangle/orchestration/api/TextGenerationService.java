package com.multiangle.orchestration.api;

import com.multiangle.exception.TextGenerationException;
import com.multiangle.orchestration.model.GenerationOptions;

/**
 * Single-shot text generation used by the angle, contradiction and synthesis stages.
 */
public interface TextGenerationService {

    /**
     * Sends one prompt and returns the generated text.
     *
     * @param prompt The full user prompt.
     * @param options Purpose of the call and optional provider/model overrides.
     * @return The generated text, never {@code null}.
     * @throws TextGenerationException if the provider call fails or returns nothing.
     */
    String complete(String prompt, GenerationOptions options);
}
