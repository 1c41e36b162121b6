package com.scoutmind.core.llm;

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
 * Wraps Spring AI's {@link ChatClient} for the two kinds of calls the research
 * pipeline makes: structured output deserialized into a record, and free-form
 * markdown text.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to append a JSON schema to
 * the user prompt. When the converter cannot read the answer, a lenient Jackson
 * pass that strips markdown code fences is tried before giving up.
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
        log.info("LlmService initialized, OpenAI-compatible base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt and deserializes the answer into {@code outputType},
     * using the model defaults.
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        return structuredCall(systemPrompt, userPrompt, outputType, null);
    }

    /**
     * Sends a system + user prompt and deserializes the answer into {@code outputType}.
     *
     * @param systemPrompt instructions for the model's role
     * @param userPrompt   the request text; schema instructions are appended to it
     * @param outputType   record or POJO to deserialize into
     * @param options      per-call model/temperature overrides, or {@code null} for defaults
     * @param <T>          target type
     * @return an instance of {@code T} populated from the JSON answer
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when the content cannot be read as {@code T}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType, ChatOptions options) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat());
        if (options != null) {
            request = request.options(options);
        }
        String response = request.call().content();
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), seconds(start));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Sends a system + user prompt and returns the answer text unchanged.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     */
    public String call(String systemPrompt, String userPrompt, ChatOptions options) {
        long start = System.currentTimeMillis();
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt);
        if (options != null) {
            request = request.options(options);
        }
        String response = request.call().content();
        log.info("LLM text call complete ({}s)", seconds(start));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content");
        }
        return response.trim();
    }

    private <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = stripCodeFence(json);
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Lenient parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Lenient parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException(outputType, json, e);
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

    private static String seconds(long start) {
        return String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0);
    }
}
