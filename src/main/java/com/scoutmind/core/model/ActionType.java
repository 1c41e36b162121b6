package com.scoutmind.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of actions a research task can request.
 * <p>
 * Each constant carries the wire name the planner emits and the minimum number
 * of upstream references the action needs in order to produce data. The set is
 * closed at compile time but new constants can be added together with a
 * {@link com.scoutmind.core.tasks.TaskHandler} implementation.
 */
public enum ActionType {

    SEARCH("search", 0),
    SCRAPE("scrape", 0),
    SUMMARIZE("summarize", 1),
    SENTIMENT("sentiment", 1),
    COMPARE("compare", 2),
    FINAL_REPORT("final_report", 0);

    private final String wireName;
    private final int minimumReferences;

    ActionType(String wireName, int minimumReferences) {
        this.wireName = wireName;
        this.minimumReferences = minimumReferences;
    }

    public String wireName() {
        return wireName;
    }

    public int minimumReferences() {
        return minimumReferences;
    }

    /**
     * Maps a planner-supplied action name onto a constant. Matching ignores case
     * and surrounding whitespace; {@code finalize} is accepted for
     * {@link #FINAL_REPORT}.
     *
     * @return the matching action, or empty for names no handler is bound to
     */
    public static Optional<ActionType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("finalize".equals(normalized)) {
            return Optional.of(FINAL_REPORT);
        }
        for (ActionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
