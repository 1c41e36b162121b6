package com.scoutmind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Customer sentiment derived from a product's reviews and rating.
 *
 * @param overall            positive, negative, neutral or mixed
 * @param score              overall score from -1.0 (very negative) to 1.0 (very positive)
 * @param positivePercentage share of positive opinion, 0-100
 * @param neutralPercentage  share of neutral opinion, 0-100
 * @param negativePercentage share of negative opinion, 0-100
 * @param keyPositiveThemes  recurring praise
 * @param keyNegativeThemes  recurring complaints
 * @param confidence         model confidence, 0-1
 * @param analysisSummary    two or three sentence summary
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentimentAnalysis(
    String overall,
    Double score,
    @JsonProperty("positive_percentage") Double positivePercentage,
    @JsonProperty("neutral_percentage") Double neutralPercentage,
    @JsonProperty("negative_percentage") Double negativePercentage,
    @JsonProperty("key_positive_themes") List<String> keyPositiveThemes,
    @JsonProperty("key_negative_themes") List<String> keyNegativeThemes,
    Double confidence,
    @JsonProperty("analysis_summary") String analysisSummary
) implements Serializable {

    public SentimentAnalysis {
        keyPositiveThemes = keyPositiveThemes == null
                ? List.of() : keyPositiveThemes.stream().filter(Objects::nonNull).toList();
        keyNegativeThemes = keyNegativeThemes == null
                ? List.of() : keyNegativeThemes.stream().filter(Objects::nonNull).toList();
    }
}
