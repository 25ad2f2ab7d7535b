package com.purchasingpower.specflow.resolver;

import com.purchasingpower.specflow.model.tasks.ParseResult;
import com.purchasingpower.specflow.model.tasks.ParsedGroup;
import com.purchasingpower.specflow.model.tasks.ParsedPhase;
import com.purchasingpower.specflow.model.tasks.ParsedTask;
import com.purchasingpower.specflow.model.tasks.ResolvedTask;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;

/**
 * Resolves any supported task id dialect to a task with its group and phase.
 *
 * <p>Bound to one {@link ParseResult}: the content-hash and display-id indexes are
 * built in the constructor and never updated. Build a new resolver after every
 * re-parse.
 *
 * <p>When two tasks share a content hash (same title in same-titled groups) the
 * hash index keeps the later one.
 *
 * @see IdType
 * @since 1.0.0
 */
@Slf4j
public class LegacyIdResolver {

    private final ParseResult parseResult;
    private final Map<String, TaskEntry> taskByHash = new HashMap<>();
    private final Map<String, TaskEntry> taskByDisplayId = new HashMap<>();

    public LegacyIdResolver(ParseResult parseResult) {
        this.parseResult = parseResult;

        for (ParsedGroup group : parseResult.getGroups()) {
            for (ParsedTask task : group.getTasks()) {
                TaskEntry entry = new TaskEntry(task, group);
                taskByHash.put(task.getContentHash(), entry);
                taskByDisplayId.put(task.getDisplayId(), entry);
            }
        }
    }

    /**
     * Resolve using only the dialect {@link IdType#detect(String)} picks.
     */
    public Optional<ResolvedTask> resolve(String taskId) {
        return switch (IdType.detect(taskId)) {
            case INTERNAL -> resolveByInternalId(taskId);
            case DISPLAY_ID -> resolveByDisplayId(taskId);
            case PHASE_TASK -> resolveByPhaseTask(taskId);
            case GROUP_TASK -> resolveByGroupTask(taskId);
            case CONTENT_HASH -> resolveByContentHash(taskId);
            case TITLE -> resolveByTitle(taskId);
        };
    }

    /**
     * Resolve directly, then retry as display id, content hash, internal id and
     * title substring, in that order.
     */
    public Optional<ResolvedTask> resolveWithFallback(String taskId) {
        List<Function<String, Optional<ResolvedTask>>> chain = List.of(
                this::resolve,
                this::resolveByDisplayId,
                this::resolveByContentHash,
                this::resolveByInternalId,
                this::resolveByTitle
        );

        for (Function<String, Optional<ResolvedTask>> strategy : chain) {
            Optional<ResolvedTask> resolved = strategy.apply(taskId);
            if (resolved.isPresent()) {
                return resolved;
            }
        }
        return Optional.empty();
    }

    public Optional<ResolvedTask> resolveByInternalId(String id) {
        for (ParsedGroup group : parseResult.getGroups()) {
            for (ParsedTask task : group.getTasks()) {
                if (task.getId().equals(id)) {
                    return withPhase(task, group);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<ResolvedTask> resolveByDisplayId(String displayId) {
        return Optional.ofNullable(taskByDisplayId.get(displayId))
                .flatMap(entry -> withPhase(entry.task(), entry.group()));
    }

    public Optional<ResolvedTask> resolveByContentHash(String hash) {
        return Optional.ofNullable(taskByHash.get(hash))
                .flatMap(entry -> withPhase(entry.task(), entry.group()));
    }

    /**
     * {@code task-P-T}: the T-th task of phase P with the phase's groups flattened
     * in document order.
     */
    public Optional<ResolvedTask> resolveByPhaseTask(String id) {
        Matcher matcher = IdType.PHASE_TASK_PATTERN.matcher(id);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        int phaseNum = parseOrdinal(matcher.group(1));
        int taskNum = parseOrdinal(matcher.group(2));
        if (phaseNum < 1 || phaseNum > parseResult.getPhases().size()) {
            return Optional.empty();
        }

        ParsedPhase phase = parseResult.getPhases().get(phaseNum - 1);
        int taskIndex = 0;
        for (ParsedGroup group : phase.getGroups()) {
            for (ParsedTask task : group.getTasks()) {
                taskIndex++;
                if (taskIndex == taskNum) {
                    return Optional.of(new ResolvedTask(task, group, phase));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * {@code task-group-G-T}: positional lookup in the flat group list, ignoring phases.
     */
    public Optional<ResolvedTask> resolveByGroupTask(String id) {
        Matcher matcher = IdType.GROUP_TASK_PATTERN.matcher(id);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        int groupNum = parseOrdinal(matcher.group(1));
        int taskNum = parseOrdinal(matcher.group(2));
        List<ParsedGroup> groups = parseResult.getGroups();
        if (groupNum < 1 || groupNum > groups.size()) {
            return Optional.empty();
        }

        ParsedGroup group = groups.get(groupNum - 1);
        if (taskNum < 1 || taskNum > group.getTasks().size()) {
            return Optional.empty();
        }
        return withPhase(group.getTasks().get(taskNum - 1), group);
    }

    /**
     * First task, in document order, whose title contains the pattern ignoring case.
     */
    public Optional<ResolvedTask> resolveByTitle(String titlePattern) {
        String pattern = titlePattern.toLowerCase(Locale.ROOT);

        for (ParsedGroup group : parseResult.getGroups()) {
            for (ParsedTask task : group.getTasks()) {
                if (task.getTitle().toLowerCase(Locale.ROOT).contains(pattern)) {
                    return withPhase(task, group);
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isLegacyFormat(String id) {
        return IdType.detect(id).isLegacy();
    }

    /**
     * Log a deprecation warning for phase-task and group-task ids. Never blocks.
     */
    public static void warnLegacyId(String id) {
        if (isLegacyFormat(id)) {
            log.warn("[DEPRECATED] Legacy task ID format: {}. Use displayId format instead: X.X.X", id);
        }
    }

    // a group opened by a section before the first phase has no owning phase
    private Optional<ResolvedTask> withPhase(ParsedTask task, ParsedGroup group) {
        List<ParsedPhase> phases = parseResult.getPhases();
        int phaseIndex = group.getPhaseIndex();
        if (phaseIndex < 0 || phaseIndex >= phases.size()) {
            return Optional.empty();
        }

        ParsedPhase phase = phases.get(phaseIndex);
        boolean owned = phase.getGroups().stream().anyMatch(candidate -> candidate == group);
        return owned ? Optional.of(new ResolvedTask(task, group, phase)) : Optional.empty();
    }

    private static int parseOrdinal(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private record TaskEntry(ParsedTask task, ParsedGroup group) {
    }
}
