package com.scoutmind.core.tasks;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.TaskResult;

/**
 * Executes one kind of research task.
 * <p>
 * Implementations report failure by returning a result that carries
 * {@code error}. An exception that escapes is caught by {@link TaskRegistry}
 * and turned into such a result.
 */
public interface TaskHandler {

    ActionType action();

    TaskResult execute(TaskInvocation invocation);
}
