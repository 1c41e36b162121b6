package com.scoutmind.core.resolve;

import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.TaskResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns a task's {@code from_task} expression into values taken from earlier
 * task results.
 * <p>
 * An expression is a comma-separated list of references such as
 * {@code task:1,task:3}. Each reference is split on its first colon and the
 * remainder is read as a task index. A reference that is malformed (no colon,
 * non-numeric index) or points at an index with no result resolves to an empty
 * result. Nothing here throws on bad input; deciding whether missing data is
 * fatal is left to the handler.
 */
public final class ReferenceResolver {

    private ReferenceResolver() {}

    /**
     * Parses one reference, e.g. {@code task:2}.
     *
     * @return the index, or empty when the reference is malformed
     */
    public static OptionalInt parseReference(String reference) {
        if (reference == null) {
            return OptionalInt.empty();
        }
        int colon = reference.indexOf(':');
        if (colon < 0) {
            return OptionalInt.empty();
        }
        String key = reference.substring(colon + 1).trim();
        try {
            return OptionalInt.of(Integer.parseInt(key));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Splits an expression into its trimmed, non-blank reference strings.
     */
    public static List<String> split(String fromTask) {
        if (fromTask == null || fromTask.isBlank()) {
            return List.of();
        }
        List<String> references = new ArrayList<>();
        for (String part : fromTask.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                references.add(trimmed);
            }
        }
        return references;
    }

    /**
     * Resolves every reference of an expression, one result per reference in
     * reference order. Malformed or unanswered references yield
     * {@link TaskResult#empty()}.
     */
    public static List<TaskResult> resolve(String fromTask, Map<Integer, TaskResult> results) {
        List<TaskResult> resolved = new ArrayList<>();
        for (String reference : split(fromTask)) {
            OptionalInt index = parseReference(reference);
            TaskResult result = index.isPresent() ? results.get(index.getAsInt()) : null;
            resolved.add(result != null ? result : TaskResult.empty());
        }
        return resolved;
    }

    /**
     * Result of the first reference of an expression.
     */
    public static TaskResult resolveFirst(String fromTask, Map<Integer, TaskResult> results) {
        List<TaskResult> resolved = resolve(fromTask, results);
        return resolved.isEmpty() ? TaskResult.empty() : resolved.get(0);
    }

    /**
     * Picks a single URL for a task from its first reference.
     * <p>
     * When the referenced result carries a URL list, {@code url_index} selects
     * from it; an out-of-range index falls back to the first element. An empty
     * list falls back to the result's {@code primary_url}, then its {@code url}.
     */
    public static Optional<String> resolveUrl(ResearchTask task, Map<Integer, TaskResult> results) {
        TaskResult prior = resolveFirst(task.fromTask(), results);
        List<String> urls = prior.productUrls();
        if (!urls.isEmpty()) {
            int index = task.urlIndexOrDefault();
            return Optional.of(index >= 0 && index < urls.size() ? urls.get(index) : urls.get(0));
        }
        return prior.primaryUrl().or(prior::url);
    }

    /**
     * Product data from the first reference.
     */
    public static Optional<ProductData> resolveProductData(ResearchTask task, Map<Integer, TaskResult> results) {
        return resolveFirst(task.fromTask(), results).productData();
    }

    /**
     * Product data from every reference that yields some, in reference order.
     * References that resolve to nothing usable are skipped.
     */
    public static List<ProductData> resolveAllProductData(ResearchTask task, Map<Integer, TaskResult> results) {
        return resolve(task.fromTask(), results).stream()
                .map(TaskResult::productData)
                .flatMap(Optional::stream)
                .toList();
    }
}
