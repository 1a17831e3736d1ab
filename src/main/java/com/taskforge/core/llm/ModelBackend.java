package com.taskforge.core.llm;

/**
 * Language-model backend used by intent classification and the ReAct loop.
 * <p>
 * Callers treat every failure as recoverable and fall back to local logic.
 */
public interface ModelBackend {

    /**
     * Returns the raw text completion for a system + user prompt pair.
     */
    String complete(String systemPrompt, String userPrompt);

    /**
     * Returns the completion deserialized into {@code outputType}.
     */
    <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType);
}
