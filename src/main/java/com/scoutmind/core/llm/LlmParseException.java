package com.scoutmind.core.llm;

/**
 * Thrown when a model answer cannot be read as the requested type, even after
 * code fences are stripped and unknown fields are ignored.
 * <p>
 * Keeps a short single-line excerpt of the answer for logging.
 */
public class LlmParseException extends RuntimeException {

    static final int EXCERPT_CHARS = 200;

    private final Class<?> targetType;
    private final String excerpt;

    public LlmParseException(Class<?> targetType, String rawResponse, Throwable cause) {
        super("Failed to parse LLM response to " + targetType.getSimpleName()
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.targetType = targetType;
        this.excerpt = excerptOf(rawResponse);
    }

    public Class<?> getTargetType() {
        return targetType;
    }

    public String getExcerpt() {
        return excerpt;
    }

    static String excerptOf(String rawResponse) {
        if (rawResponse == null) {
            return "";
        }
        String flat = rawResponse.replaceAll("\\s+", " ").trim();
        return flat.length() <= EXCERPT_CHARS ? flat : flat.substring(0, EXCERPT_CHARS) + "...";
    }
}
