package com.scoutmind.core.model;

import java.io.Serializable;

/**
 * One web search result.
 */
public record SearchHit(
    String title,
    String url,
    String content,
    Double score
) implements Serializable {}
