package com.purchasingpower.specflow.service.impl;

import com.purchasingpower.specflow.configuration.SpecflowProperties;
import com.purchasingpower.specflow.exception.TaskNotFoundException;
import com.purchasingpower.specflow.exception.TaskStatusException;
import com.purchasingpower.specflow.exception.TaskUpdateException;
import com.purchasingpower.specflow.model.tasks.BatchUpdateResult;
import com.purchasingpower.specflow.model.tasks.ParseResult;
import com.purchasingpower.specflow.model.tasks.ParsedTask;
import com.purchasingpower.specflow.model.tasks.ResolvedTask;
import com.purchasingpower.specflow.model.tasks.UpdateResult;
import com.purchasingpower.specflow.resolver.LegacyIdResolver;
import com.purchasingpower.specflow.service.TaskStatusService;
import com.purchasingpower.specflow.service.TasksParserService;
import com.purchasingpower.specflow.util.MarkdownUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStatusServiceImpl implements TaskStatusService {

    static final Pattern CHECKBOX_LINE = Pattern.compile("^(\\s*-\\s+\\[)([ xX])(\\].*)$");

    private final TasksParserService tasksParserService;
    private final SpecflowProperties properties;

    @Override
    public UpdateResult setTaskStatus(String content, String taskId, boolean completed) {
        ResolvedTask resolved = resolve(content, taskId);
        ParsedTask task = resolved.task();

        // Plain split: the parser's line numbers index straight into it
        List<String> lines = new ArrayList<>(MarkdownUtils.splitLines(content));
        int lineIndex = task.getLineNumber() - 1;

        if (lineIndex < 0 || lineIndex >= lines.size()) {
            throw new TaskUpdateException("Invalid line number: " + task.getLineNumber(), taskId, task.getLineNumber());
        }

        String line = lines.get(lineIndex);
        Matcher matcher = CHECKBOX_LINE.matcher(line);
        if (!matcher.find()) {
            throw new TaskUpdateException(
                    "Failed to update task at line " + task.getLineNumber() + ": no checkbox found",
                    taskId, task.getLineNumber());
        }

        lines.set(lineIndex, matcher.replaceFirst("$1" + (completed ? "x" : " ") + "$3"));
        log.debug("Set task {} ({}) at line {} to {}",
                taskId, task.getDisplayId(), task.getLineNumber(), completed ? "completed" : "pending");

        return UpdateResult.builder()
                .newContent(String.join("\n", lines))
                .task(TasksParserServiceImpl.toLegacyTask(task, completed))
                .build();
    }

    @Override
    public UpdateResult toggleTaskStatus(String content, String taskId) {
        ResolvedTask resolved = resolve(content, taskId);
        return setTaskStatus(content, taskId, !resolved.task().isCompleted());
    }

    @Override
    public BatchUpdateResult markTasksComplete(String content, List<String> taskIds) {
        return applyAll(content, taskIds, true);
    }

    @Override
    public BatchUpdateResult markTasksIncomplete(String content, List<String> taskIds) {
        return applyAll(content, taskIds, false);
    }

    private BatchUpdateResult applyAll(String content, List<String> taskIds, boolean completed) {
        String currentContent = content;
        int updated = 0;

        for (String taskId : taskIds) {
            try {
                currentContent = setTaskStatus(currentContent, taskId, completed).getNewContent();
                updated++;
            } catch (TaskStatusException e) {
                log.warn("Could not mark task {}: {} ({})",
                        completed ? "complete" : "incomplete", taskId, e.getMessage());
            }
        }

        return BatchUpdateResult.builder()
                .newContent(currentContent)
                .updated(updated)
                .build();
    }

    private ResolvedTask resolve(String content, String taskId) {
        ParseResult result = tasksParserService.parse(properties.getStatus().getScratchChangeId(), content);
        LegacyIdResolver resolver = new LegacyIdResolver(result);

        if (properties.getStatus().isWarnLegacyIds()) {
            LegacyIdResolver.warnLegacyId(taskId);
        }

        return resolver.resolveWithFallback(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
