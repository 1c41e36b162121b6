package com.scoutmind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable output record of one task attempt.
 * <p>
 * Backed by an insertion-ordered map keyed by {@link ResultKeys}. Values may be
 * {@code null} (a handler may report {@code "summary": null} next to an error),
 * so "present" below always means present and non-null. Instances are never
 * mutated after construction; later tasks read them through the typed
 * accessors.
 */
public final class TaskResult implements Serializable {

    private static final TaskResult EMPTY = new TaskResult(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private TaskResult(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TaskResult empty() {
        return EMPTY;
    }

    public static TaskResult error(String message) {
        return builder().put(ResultKeys.ERROR, message).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Generic access ───────────────────────────────────────────────

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Optional<String> string(String key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    // ── Typed access ─────────────────────────────────────────────────

    public Optional<String> error() {
        return string(ResultKeys.ERROR);
    }

    public boolean isError() {
        return has(ResultKeys.ERROR);
    }

    public Optional<ProductData> productData() {
        return values.get(ResultKeys.PRODUCT_DATA) instanceof ProductData data
                ? Optional.of(data)
                : Optional.empty();
    }

    public List<String> productUrls() {
        if (values.get(ResultKeys.PRODUCT_URLS) instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        return List.of();
    }

    public List<SearchHit> searchResults() {
        if (values.get(ResultKeys.SEARCH_RESULTS) instanceof List<?> list) {
            return list.stream()
                    .filter(SearchHit.class::isInstance)
                    .map(SearchHit.class::cast)
                    .toList();
        }
        return List.of();
    }

    public Optional<String> primaryUrl() {
        return string(ResultKeys.PRIMARY_URL).filter(s -> !s.isBlank());
    }

    public Optional<String> url() {
        return string(ResultKeys.URL).filter(s -> !s.isBlank());
    }

    public Optional<String> summary() {
        return string(ResultKeys.SUMMARY);
    }

    public Optional<SentimentAnalysis> sentiment() {
        return values.get(ResultKeys.SENTIMENT) instanceof SentimentAnalysis analysis
                ? Optional.of(analysis)
                : Optional.empty();
    }

    public Optional<String> comparison() {
        return string(ResultKeys.COMPARISON);
    }

    public Optional<String> finalReport() {
        return string(ResultKeys.FINAL_REPORT);
    }

    // ── Object ───────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskResult other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TaskResult" + values;
    }

    /**
     * Accumulates entries for a new result. Keys keep insertion order.
     */
    public static final class Builder {

        private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Result key must not be blank");
            }
            values.put(key, value);
            return this;
        }

        public Builder putAll(TaskResult other) {
            other.values.forEach(this::put);
            return this;
        }

        public TaskResult build() {
            return new TaskResult(new LinkedHashMap<>(values));
        }
    }
}
