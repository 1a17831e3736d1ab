package com.taskforge.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link ModelBackend} on top of Spring AI's {@link ChatClient}.
 * <p>
 * Structured calls append the JSON schema generated by {@link BeanOutputConverter}
 * to the user prompt. When the converter rejects the answer, a lenient Jackson
 * mapper gets a second try after stripping markdown code fences.
 */
@Service
public class LlmService implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.chat.options.model:default}") String model) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized (model: {})", model);
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        log.debug("Model completion returned in {} ms", System.currentTimeMillis() - start);
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model returned empty content");
        }
        return response;
    }

    @Override
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.debug("Structured model call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Structured model call complete -> {} ({}s)", outputType.getSimpleName(),
                String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Schema conversion to {} failed: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw model response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    private <T> T parseLeniently(String json, Class<T> outputType) {
        String cleaned = stripCodeFence(json);
        try {
            return lenientMapper.readValue(cleaned, outputType);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse model response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
