package com.supplyguard.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper over Spring AI's {@link ChatClient}.
 * <p>
 * {@link #complete(AiRequest)} returns the raw model text so callers can keep it
 * when it is not valid JSON; {@link #parse(String, Class)} attempts the
 * structured conversion separately.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized, provider base-url: {}", baseUrl);
    }

    /**
     * Sends the request and returns the model's text.
     *
     * @throws LlmEmptyResponseException when the model returns blank content
     */
    public String complete(AiRequest request) {
        long start = System.currentTimeMillis();
        var options = ChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .build();
        String response = chatClient.prompt()
                .system(request.systemPrompt())
                .user(request.userPrompt())
                .options(options)
                .call()
                .content();
        log.debug("LLM call complete in {} ms", System.currentTimeMillis() - start);
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for model " + request.model());
        }
        return response;
    }

    /** JSON format instructions for {@code type}, to append to a user prompt. */
    public String formatInstructions(Class<?> type) {
        return new BeanOutputConverter<>(type).getFormat();
    }

    /**
     * Converts model text into {@code type}: first through {@link BeanOutputConverter},
     * then through a lenient Jackson pass that strips code fences and surrounding prose.
     *
     * @throws LlmParseException when neither pass yields an instance
     */
    public <T> T parse(String response, Class<T> type) {
        try {
            return new BeanOutputConverter<>(type).convert(response);
        } catch (RuntimeException e) {
            log.debug("BeanOutputConverter rejected response for {}: {}", type.getSimpleName(), e.getMessage());
            return parseWithJackson(response, type);
        }
    }

    private <T> T parseWithJackson(String response, Class<T> type) {
        String cleaned = extractJson(response);
        try {
            return lenientMapper.readValue(cleaned, type);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse LLM response to " + type.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String extractJson(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        return cleaned.trim();
    }
}
