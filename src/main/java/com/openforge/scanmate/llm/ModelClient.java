package com.openforge.scanmate.llm;

import com.openforge.scanmate.llm.model.Message;

import java.util.List;

/**
 * Narrow adapter over the external text-generation service.
 *
 * Implementations block until the reply is complete and fail with an
 * unchecked exception; they should stop promptly when the calling thread
 * is interrupted.
 */
public interface ModelClient {

    /** Sends a role-tagged message sequence and returns the generated text. */
    String generate(List<Message> messages, GenerationOptions options);

    /** The model identifier requests are sent to. */
    String modelName();
}
