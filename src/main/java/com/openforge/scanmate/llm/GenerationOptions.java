package com.openforge.scanmate.llm;

/**
 * Sampling settings for one generation request.
 */
public record GenerationOptions(double temperature, int maxTokens) {

    /** Conversational replies: looser sampling, longer output. */
    public static final GenerationOptions CHAT = new GenerationOptions(0.7, 1024);

    /** Threat reports: near-deterministic, short fixed-format output. */
    public static final GenerationOptions SCAN = new GenerationOptions(0.1, 512);
}
