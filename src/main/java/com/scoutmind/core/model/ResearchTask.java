package com.scoutmind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Optional;

/**
 * One step of a research plan.
 *
 * @param action      action name as emitted by the planner; resolved through {@link ActionType#fromName}
 * @param query       free-text input for the action, required when the task does not follow another task
 * @param fromTask    reference expression such as {@code task:0} or {@code task:1,task:3}
 * @param urlIndex    which element of a referenced task's URL list to use (defaults to 0)
 * @param description optional label used for progress display only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchTask(
    String action,
    String query,
    @JsonProperty("from_task") String fromTask,
    @JsonProperty("url_index") Integer urlIndex,
    String description
) implements Serializable {

    public static ResearchTask of(ActionType action, String query) {
        return new ResearchTask(action.wireName(), query, null, null, null);
    }

    public static ResearchTask following(ActionType action, String fromTask) {
        return new ResearchTask(action.wireName(), null, fromTask, null, null);
    }

    public Optional<ActionType> actionType() {
        return ActionType.fromName(action);
    }

    public int urlIndexOrDefault() {
        return urlIndex != null ? urlIndex : 0;
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public boolean hasReference() {
        return fromTask != null && !fromTask.isBlank();
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
