package com.purchasingpower.specflow.service.impl;

import com.purchasingpower.specflow.model.tasks.GroupLevel;
import com.purchasingpower.specflow.model.tasks.LegacyTask;
import com.purchasingpower.specflow.model.tasks.LegacyTaskGroup;
import com.purchasingpower.specflow.model.tasks.LegacyTasksFile;
import com.purchasingpower.specflow.model.tasks.ParseFormat;
import com.purchasingpower.specflow.model.tasks.ParseMetadata;
import com.purchasingpower.specflow.model.tasks.ParseResult;
import com.purchasingpower.specflow.model.tasks.ParseWarning;
import com.purchasingpower.specflow.model.tasks.ParsedGroup;
import com.purchasingpower.specflow.model.tasks.ParsedPhase;
import com.purchasingpower.specflow.model.tasks.ParsedTask;
import com.purchasingpower.specflow.model.tasks.SyncTask;
import com.purchasingpower.specflow.model.tasks.WarningType;
import com.purchasingpower.specflow.parser.ClassifiedLine;
import com.purchasingpower.specflow.parser.ContentHasher;
import com.purchasingpower.specflow.parser.LineClassifier;
import com.purchasingpower.specflow.parser.LineKind;
import com.purchasingpower.specflow.service.TasksParserService;
import com.purchasingpower.specflow.util.MarkdownUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Single-pass assembler for tasks.md.
 *
 * <p>Walks the document once with two cursors (current phase, current group):
 * <ul>
 *   <li>a phase header flushes the open group and phase, then opens a new phase</li>
 *   <li>a section header flushes the open group and opens a new one in the current phase</li>
 *   <li>any other line under a phase with no open group opens an implicit group
 *       titled after the phase</li>
 *   <li>task lines before the first header have no group and are dropped</li>
 * </ul>
 *
 * <p>Empty groups and phases are discarded at flush time. Ordinals are taken from
 * the number of already emitted phases/groups, so ids stay contiguous even when an
 * empty group or phase is discarded. All cursor state lives in a per-call
 * {@link AssemblyState}; the service itself holds no mutable state.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TasksParserServiceImpl implements TasksParserService {

    private final LineClassifier lineClassifier;
    private final ContentHasher contentHasher;

    @Override
    public ParseResult parse(String changeId, String content) {
        long startNanos = System.nanoTime();
        AssemblyState state = new AssemblyState();

        List<String> lines = MarkdownUtils.splitLines(content);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;

            if (line.isBlank() || line.startsWith("# ")) {
                continue;
            }

            Optional<ClassifiedLine> classified = lineClassifier.classify(line);
            LineKind kind = classified.map(ClassifiedLine::kind).orElse(null);

            if (kind == LineKind.PHASE_HEADER) {
                state.flushGroup();
                state.flushPhase();
                state.openPhase(classified.get().title(), lineNumber);
                continue;
            }

            if (kind == LineKind.SECTION_HEADER) {
                state.flushGroup();
                state.openSection(classified.get().title(), lineNumber);
                continue;
            }

            if (state.currentPhase != null && state.currentGroup == null) {
                state.openImplicitGroup();
            }

            if (classified.get().isTask()) {
                if (state.currentGroup == null) {
                    log.debug("Dropping task at line {}: no enclosing header", lineNumber);
                    continue;
                }
                addTask(state, classified.get(), line, lineNumber);
            }
        }

        state.flushGroup();
        state.flushPhase();

        ParseMetadata metadata = calculateMetadata(state, startNanos);
        log.debug("Parsed change {}: {} tasks in {} groups, {} warnings",
                changeId, metadata.getTotalTasks(), metadata.getTotalGroups(), metadata.getWarnings().size());

        return ParseResult.builder()
                .changeId(changeId)
                .phases(List.copyOf(state.phases))
                .groups(List.copyOf(state.groups))
                .metadata(metadata)
                .build();
    }

    @Override
    public LegacyTasksFile parseLegacy(String changeId, String content) {
        return toLegacy(parse(changeId, content));
    }

    @Override
    public List<SyncTask> toSyncTasks(ParseResult result) {
        List<SyncTask> syncTasks = new ArrayList<>();

        for (ParsedGroup group : result.getGroups()) {
            List<ParsedTask> tasks = group.getTasks();
            for (int i = 0; i < tasks.size(); i++) {
                ParsedTask task = tasks.get(i);
                syncTasks.add(SyncTask.builder()
                        .displayId(task.getDisplayId())
                        .title(task.getTitle())
                        .completed(task.isCompleted())
                        .lineNumber(task.getLineNumber())
                        .groupTitle(group.getTitle())
                        .groupOrder(group.getGlobalIndex() + 1)
                        .taskOrder(i + 1)
                        .majorTitle(group.getPhaseTitle() != null ? group.getPhaseTitle() : group.getTitle())
                        .majorOrder(group.getPhaseIndex() + 1)
                        .subOrder(group.getSectionIndex() + 1)
                        .build());
            }
        }

        return syncTasks;
    }

    @Override
    public LegacyTasksFile toLegacy(ParseResult result) {
        List<LegacyTaskGroup> groups = result.getGroups().stream()
                .map(group -> LegacyTaskGroup.builder()
                        .id(group.getId())
                        .title(group.getTitle())
                        .displayId(group.getDisplayId())
                        .phaseIndex(group.getPhaseIndex())
                        .groupIndex(group.getSectionIndex())
                        .majorOrder(group.getPhaseIndex() + 1)
                        .majorTitle(group.getPhaseTitle())
                        .subOrder(group.getSectionIndex() + 1)
                        .groupTitle(group.getTitle())
                        .groupOrder(group.getGlobalIndex() + 1)
                        .tasks(group.getTasks().stream()
                                .map(task -> toLegacyTask(task, task.isCompleted()))
                                .toList())
                        .build())
                .toList();

        return LegacyTasksFile.builder()
                .changeId(result.getChangeId())
                .groups(groups)
                .build();
    }

    /**
     * Legacy view of a task with an overridden completion flag.
     */
    static LegacyTask toLegacyTask(ParsedTask task, boolean completed) {
        return LegacyTask.builder()
                .id(task.getId())
                .title(task.getTitle())
                .completed(completed)
                .groupId(task.getGroupId())
                .lineNumber(task.getLineNumber())
                .indent(task.getIndent())
                .displayId(task.getDisplayId())
                .build();
    }

    private void addTask(AssemblyState state, ClassifiedLine match, String rawLine, int lineNumber) {
        GroupDraft group = state.currentGroup;
        int ordinal = group.tasks.size() + 1;
        String contentHash = contentHasher.hash(group.title, match.title());

        Integer parentTaskIndex = null;
        if (match.indent() >= 2) {
            parentTaskIndex = findParentTaskIndex(group.tasks, match.indent());
            if (parentTaskIndex == null) {
                state.warn(WarningType.ORPHAN_SUBTASK, "Subtask without parent: " + match.title(), lineNumber);
            }
        }

        if (!state.seenHashes.add(contentHash)) {
            state.warn(WarningType.DUPLICATE_ID,
                    "Duplicate content hash " + contentHash + " for task: " + match.title(), lineNumber);
        }

        group.tasks.add(ParsedTask.builder()
                .id("task-" + (group.globalIndex + 1) + "-" + ordinal)
                .displayId(group.displayId + "." + ordinal)
                .contentHash(contentHash)
                .title(match.title())
                .completed(match.completed())
                .indent(match.indent())
                .parentTaskIndex(parentTaskIndex)
                .lineNumber(lineNumber)
                .rawLine(rawLine)
                .groupId(group.id)
                .build());
    }

    private static Integer findParentTaskIndex(List<ParsedTask> tasks, int childIndent) {
        for (int i = tasks.size() - 1; i >= 0; i--) {
            if (tasks.get(i).getIndent() < childIndent) {
                return i;
            }
        }
        return null;
    }

    private static ParseMetadata calculateMetadata(AssemblyState state, long startNanos) {
        int totalTasks = 0;
        int completedTasks = 0;

        for (ParsedGroup group : state.groups) {
            totalTasks += group.getTasks().size();
            completedTasks += (int) group.getTasks().stream().filter(ParsedTask::isCompleted).count();
        }

        return ParseMetadata.builder()
                .totalTasks(totalTasks)
                .completedTasks(completedTasks)
                .totalGroups(state.groups.size())
                .format(ParseFormat.OPENSPEC_1_0)
                .parseTime((System.nanoTime() - startNanos) / 1_000_000.0)
                .warnings(List.copyOf(state.warnings))
                .build();
    }

    /**
     * Mutable cursors and accumulators for one parse call.
     */
    private static final class AssemblyState {
        final List<ParsedPhase> phases = new ArrayList<>();
        final List<ParsedGroup> groups = new ArrayList<>();
        final List<ParseWarning> warnings = new ArrayList<>();
        final Set<String> seenHashes = new HashSet<>();

        PhaseDraft currentPhase;
        GroupDraft currentGroup;

        // sections seen before any phase header
        int looseSections;

        void openPhase(String title, int lineNumber) {
            currentPhase = new PhaseDraft(phases.size(), title, lineNumber);
            currentGroup = null;
        }

        void openSection(String title, int lineNumber) {
            if (currentPhase == null) {
                warn(WarningType.UNKNOWN_FORMAT, "Section outside of any phase: " + title, lineNumber);
                currentGroup = new GroupDraft(groups.size(), title, GroupLevel.SECTION, 0, looseSections++, null);
                return;
            }
            currentGroup = new GroupDraft(groups.size(), title, GroupLevel.SECTION,
                    currentPhase.index, currentPhase.groups.size(), currentPhase.title);
        }

        void openImplicitGroup() {
            currentGroup = new GroupDraft(groups.size(), currentPhase.title, GroupLevel.PHASE,
                    currentPhase.index, currentPhase.groups.size(), currentPhase.title);
        }

        void flushGroup() {
            if (currentGroup != null && !currentGroup.tasks.isEmpty()) {
                ParsedGroup group = currentGroup.build();
                groups.add(group);
                if (currentPhase != null) {
                    currentPhase.groups.add(group);
                }
            }
            currentGroup = null;
        }

        void flushPhase() {
            if (currentPhase != null && !currentPhase.groups.isEmpty()) {
                phases.add(currentPhase.build());
            }
            currentPhase = null;
        }

        void warn(WarningType type, String message, int lineNumber) {
            warnings.add(ParseWarning.builder()
                    .type(type)
                    .message(message)
                    .lineNumber(lineNumber)
                    .build());
        }
    }

    private static final class PhaseDraft {
        final int index;
        final String title;
        final int lineNumber;
        final List<ParsedGroup> groups = new ArrayList<>();

        PhaseDraft(int index, String title, int lineNumber) {
            this.index = index;
            this.title = title;
            this.lineNumber = lineNumber;
        }

        ParsedPhase build() {
            return ParsedPhase.builder()
                    .index(index)
                    .title(title)
                    .lineNumber(lineNumber)
                    .groups(List.copyOf(groups))
                    .build();
        }
    }

    private static final class GroupDraft {
        final int globalIndex;
        final String id;
        final String displayId;
        final String title;
        final GroupLevel level;
        final int phaseIndex;
        final int sectionIndex;
        final String phaseTitle;
        final List<ParsedTask> tasks = new ArrayList<>();

        GroupDraft(int globalIndex, String title, GroupLevel level, int phaseIndex, int sectionIndex, String phaseTitle) {
            this.globalIndex = globalIndex;
            this.id = "group-" + (globalIndex + 1);
            this.displayId = (phaseIndex + 1) + "." + (sectionIndex + 1);
            this.title = title;
            this.level = level;
            this.phaseIndex = phaseIndex;
            this.sectionIndex = sectionIndex;
            this.phaseTitle = phaseTitle;
        }

        ParsedGroup build() {
            return ParsedGroup.builder()
                    .id(id)
                    .displayId(displayId)
                    .title(title)
                    .level(level)
                    .phaseIndex(phaseIndex)
                    .sectionIndex(sectionIndex)
                    .globalIndex(globalIndex)
                    .phaseTitle(phaseTitle)
                    .tasks(List.copyOf(tasks))
                    .build();
        }
    }
}
