package com.scoutmind.core.planner;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.resolve.ReferenceResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lists structural problems in a plan. Findings are advisory: plans are
 * executed as written and every problem listed here also surfaces at run time
 * as the affected task's error.
 */
public final class PlanValidator {

    private PlanValidator() {}

    public static List<String> warnings(ResearchPlan plan) {
        List<String> warnings = new ArrayList<>();
        if (plan == null) {
            return warnings;
        }
        List<ResearchTask> tasks = plan.tasks();
        for (int i = 0; i < tasks.size(); i++) {
            ResearchTask task = tasks.get(i);
            Optional<ActionType> type = task.actionType();
            if (type.isEmpty()) {
                warnings.add("task " + i + ": unknown action '" + task.action() + "'");
                continue;
            }

            int wellFormed = 0;
            for (String reference : ReferenceResolver.split(task.fromTask())) {
                OptionalInt index = ReferenceResolver.parseReference(reference);
                if (index.isEmpty()) {
                    warnings.add("task " + i + ": malformed reference '" + reference + "'");
                } else if (index.getAsInt() >= i) {
                    warnings.add("task " + i + ": reference '" + reference + "' does not point at an earlier task");
                } else {
                    wellFormed++;
                }
            }

            int required = type.get().minimumReferences();
            if (wellFormed < required) {
                warnings.add("task " + i + ": " + type.get().wireName() + " needs " + required
                        + " reference(s), found " + wellFormed);
            }
        }
        return warnings;
    }
}
