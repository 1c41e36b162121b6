package com.scoutmind.core.progress;

import java.io.Serializable;

/**
 * Progress annotation attached to a step event.
 *
 * @param percent        completion percentage, 0-100
 * @param completedSteps steps finished so far (planning and finalizing count as one each)
 * @param totalSteps     number of tasks plus two
 * @param description    human-readable description of the step
 */
public record Progress(
    int percent,
    int completedSteps,
    int totalSteps,
    String description
) implements Serializable {}
