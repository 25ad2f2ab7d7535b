package com.purchasingpower.specflow.service.impl;

import com.purchasingpower.specflow.model.tasks.GroupLevel;
import com.purchasingpower.specflow.model.tasks.LegacyTaskGroup;
import com.purchasingpower.specflow.model.tasks.LegacyTasksFile;
import com.purchasingpower.specflow.model.tasks.ParseFormat;
import com.purchasingpower.specflow.model.tasks.ParseResult;
import com.purchasingpower.specflow.model.tasks.ParsedGroup;
import com.purchasingpower.specflow.model.tasks.ParsedTask;
import com.purchasingpower.specflow.model.tasks.SyncTask;
import com.purchasingpower.specflow.model.tasks.WarningType;
import com.purchasingpower.specflow.parser.ContentHasher;
import com.purchasingpower.specflow.parser.LineClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing of tasks.md into the phase / group / task tree.
 */
@DisplayName("Tasks Parser Service Tests")
class TasksParserServiceImplTest {

    private static final String THREE_LEVEL = """
            # Tasks

            ## Phase 1: Setup

            ### 1.1 Database
            - [ ] Create schema
            - [x] Add indexes

            ### 1.2 API
            - [ ] Define endpoints
              - [ ] GET /items

            ## Phase 2: Build
            - [x] Implement service
            - [ ] Write tests
            """;

    private TasksParserServiceImpl parser;

    @BeforeEach
    void setUp() {
        parser = new TasksParserServiceImpl(new LineClassifier(), new ContentHasher());
    }

    @Nested
    @DisplayName("Hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("Should build phases, sections and implicit groups")
        void testThreeLevelHierarchy() {
            // Given/When
            ParseResult result = parser.parse("change-1", THREE_LEVEL);

            // Then
            assertEquals("change-1", result.getChangeId());
            assertEquals(2, result.getPhases().size());
            assertThat(result.getGroups())
                    .extracting(ParsedGroup::getId, ParsedGroup::getDisplayId, ParsedGroup::getTitle, ParsedGroup::getLevel)
                    .containsExactly(
                            tuple("group-1", "1.1", "Database", GroupLevel.SECTION),
                            tuple("group-2", "1.2", "API", GroupLevel.SECTION),
                            tuple("group-3", "2.1", "Build", GroupLevel.PHASE));

            assertEquals("Setup", result.getPhases().get(0).getTitle());
            assertEquals(3, result.getPhases().get(0).getLineNumber());
            assertSame(result.getGroups().get(2), result.getPhases().get(1).getGroups().get(0));
        }

        @Test
        @DisplayName("Should assign ids, display ids and line numbers to tasks")
        void testTaskIdentity() {
            ParseResult result = parser.parse("change-1", THREE_LEVEL);

            ParsedTask first = result.getGroups().get(0).getTasks().get(0);
            assertEquals("task-1-1", first.getId());
            assertEquals("1.1.1", first.getDisplayId());
            assertEquals("Create schema", first.getTitle());
            assertEquals(6, first.getLineNumber());
            assertEquals("- [ ] Create schema", first.getRawLine());
            assertEquals("group-1", first.getGroupId());

            ParsedTask phaseTask = result.getGroups().get(2).getTasks().get(1);
            assertEquals("task-3-2", phaseTask.getId());
            assertEquals("2.1.2", phaseTask.getDisplayId());
            assertEquals(15, phaseTask.getLineNumber());
        }

        @Test
        @DisplayName("Should link indented tasks to the nearest shallower task")
        void testSubtaskParent() {
            ParseResult result = parser.parse("change-1", THREE_LEVEL);

            ParsedTask subtask = result.getGroups().get(1).getTasks().get(1);
            assertEquals("GET /items", subtask.getTitle());
            assertEquals(2, subtask.getIndent());
            assertEquals(0, subtask.getParentTaskIndex());
            assertTrue(subtask.isSubtask());
            assertFalse(result.getGroups().get(1).getTasks().get(0).isSubtask());
        }

        @Test
        @DisplayName("Should put tasks directly under a phase into a group titled after the phase")
        void testImplicitGroup() {
            String content = """
                    ## Phase 1: Setup

                    - [ ] Create project
                    """;

            ParseResult result = parser.parse("implicit", content);

            assertEquals(1, result.getGroups().size());
            ParsedGroup group = result.getGroups().get(0);
            assertEquals("Setup", group.getTitle());
            assertEquals(GroupLevel.PHASE, group.getLevel());
            assertEquals("1.1", group.getDisplayId());
            assertEquals("Setup", group.getPhaseTitle());
        }

        @Test
        @DisplayName("Should keep section numbering when prose precedes the first section")
        void testProseBeforeSection() {
            String content = """
                    ## Phase 1: Setup
                    Some introduction text.
                    ### 1.1 Real work
                    - [ ] Do it
                    """;

            ParseResult result = parser.parse("prose", content);

            assertEquals(1, result.getGroups().size());
            assertEquals("1.1", result.getGroups().get(0).getDisplayId());
            assertEquals("Real work", result.getGroups().get(0).getTitle());
        }
    }

    @Nested
    @DisplayName("Filtering and edge cases")
    class EdgeCases {

        @Test
        @DisplayName("Should return an empty result for empty content")
        void testEmptyContent() {
            ParseResult result = parser.parse("empty", "");

            assertTrue(result.getPhases().isEmpty());
            assertTrue(result.getGroups().isEmpty());
            assertEquals(0, result.getMetadata().getTotalTasks());
            assertEquals(0, result.getMetadata().getProgress());
            assertTrue(result.getMetadata().getWarnings().isEmpty());
        }

        @Test
        @DisplayName("Should drop headers without tasks")
        void testHeadersOnly() {
            String content = """
                    # Title
                    ## Phase 1: Nothing here
                    ### 1.1 Empty
                    """;

            ParseResult result = parser.parse("headers", content);

            assertTrue(result.getPhases().isEmpty());
            assertTrue(result.getGroups().isEmpty());
        }

        @Test
        @DisplayName("Should keep ordinals contiguous when empty groups and phases are dropped")
        void testContiguousOrdinals() {
            String content = """
                    ## Phase 1: Empty phase
                    ## Phase 2: Real
                    ### 2.1 Empty section
                    ### 2.2 Work
                    - [ ] First
                    ### 2.3 More work
                    - [ ] Second
                    """;

            ParseResult result = parser.parse("gaps", content);

            assertEquals(1, result.getPhases().size());
            assertEquals(0, result.getPhases().get(0).getIndex());
            assertThat(result.getGroups())
                    .extracting(ParsedGroup::getId, ParsedGroup::getDisplayId, ParsedGroup::getGlobalIndex)
                    .containsExactly(tuple("group-1", "1.1", 0), tuple("group-2", "1.2", 1));
        }

        @Test
        @DisplayName("Should ignore tasks before the first header")
        void testTasksBeforeHeader() {
            String content = """
                    - [ ] Lost task
                    ## Phase 1: Setup
                    - [ ] Kept task
                    """;

            ParseResult result = parser.parse("lost", content);

            assertEquals(1, result.getMetadata().getTotalTasks());
            assertEquals("Kept task", result.getGroups().get(0).getTasks().get(0).getTitle());
        }

        @Test
        @DisplayName("Should silently skip malformed checkboxes")
        void testMalformedTasks() {
            String content = """
                    ## Tasks
                    - [ ] Valid
                    - [~] In progress marker
                    - [] No space
                    -[ ] No space after dash
                    """;

            ParseResult result = parser.parse("malformed", content);

            assertEquals(1, result.getMetadata().getTotalTasks());
            assertTrue(result.getMetadata().getWarnings().isEmpty());
        }

        @Test
        @DisplayName("Should warn about a subtask with no parent")
        void testOrphanSubtask() {
            String content = """
                    ## Phase 1: Setup
                      - [ ] Indented first
                    """;

            ParseResult result = parser.parse("orphan", content);

            ParsedTask task = result.getGroups().get(0).getTasks().get(0);
            assertNull(task.getParentTaskIndex());
            assertThat(result.getMetadata().getWarnings())
                    .singleElement()
                    .satisfies(warning -> {
                        assertEquals(WarningType.ORPHAN_SUBTASK, warning.getType());
                        assertEquals(2, warning.getLineNumber());
                    });
        }

        @Test
        @DisplayName("Should warn about duplicate titles and share their content hash")
        void testDuplicateTitles() {
            String content = """
                    ## Phase 1: Setup
                    - [ ] Same title
                    - [ ] Same title
                    """;

            ParseResult result = parser.parse("dupes", content);

            List<ParsedTask> tasks = result.getGroups().get(0).getTasks();
            assertEquals(tasks.get(0).getContentHash(), tasks.get(1).getContentHash());
            assertNotEquals(tasks.get(0).getDisplayId(), tasks.get(1).getDisplayId());
            assertThat(result.getMetadata().getWarnings())
                    .extracting(warning -> warning.getType())
                    .containsExactly(WarningType.DUPLICATE_ID);
        }

        @Test
        @DisplayName("Should keep a section before any phase with an unknown-format warning")
        void testSectionBeforePhase() {
            String content = """
                    ### Loose
                    - [ ] Early
                    ## Phase 1: Setup
                    - [ ] Later
                    """;

            ParseResult result = parser.parse("loose", content);

            assertEquals(2, result.getGroups().size());
            assertEquals(1, result.getPhases().size());
            assertNull(result.getGroups().get(0).getPhaseTitle());
            assertThat(result.getMetadata().getWarnings())
                    .extracting(warning -> warning.getType())
                    .contains(WarningType.UNKNOWN_FORMAT);
        }

        @Test
        @DisplayName("Should handle CRLF line endings")
        void testCrlf() {
            String content = "## Phase 1: Setup\r\n- [x] Done\r\n- [ ] Pending\r\n";

            ParseResult result = parser.parse("crlf", content);

            assertEquals("Setup", result.getGroups().get(0).getTitle());
            assertThat(result.getGroups().get(0).getTasks())
                    .extracting(ParsedTask::getTitle)
                    .containsExactly("Done", "Pending");
        }
    }

    @Nested
    @DisplayName("Content hash")
    class ContentHash {

        @Test
        @DisplayName("Should derive the hash from group title and task title")
        void testKnownHash() {
            ParseResult result = parser.parse("hash", THREE_LEVEL);

            ParsedTask task = result.getGroups().get(0).getTasks().get(0);
            assertEquals("5dd7f9de", task.getContentHash());
        }

        @Test
        @DisplayName("Should survive reordering and differ between tasks")
        void testHashStability() {
            String reordered = """
                    ## Phase 1: Setup
                    ### 1.1 Database
                    - [x] Add indexes
                    - [ ] Create schema
                    """;

            ParsedTask original = parser.parse("a", THREE_LEVEL).getGroups().get(0).getTasks().get(0);
            ParsedTask moved = parser.parse("b", reordered).getGroups().get(0).getTasks().get(1);
            ParsedTask neighbour = parser.parse("b", reordered).getGroups().get(0).getTasks().get(0);

            assertEquals(original.getContentHash(), moved.getContentHash());
            assertNotEquals(original.getDisplayId(), moved.getDisplayId());
            assertNotEquals(moved.getContentHash(), neighbour.getContentHash());
            assertThat(moved.getContentHash()).matches("^[0-9a-f]{8}$");
        }
    }

    @Nested
    @DisplayName("Metadata and projections")
    class Projections {

        @Test
        @DisplayName("Should count tasks and report progress")
        void testMetadata() {
            ParseResult result = parser.parse("meta", THREE_LEVEL);

            assertEquals(6, result.getMetadata().getTotalTasks());
            assertEquals(2, result.getMetadata().getCompletedTasks());
            assertEquals(3, result.getMetadata().getTotalGroups());
            assertEquals(33, result.getMetadata().getProgress());
            assertEquals(ParseFormat.OPENSPEC_1_0, result.getMetadata().getFormat());
            assertTrue(result.getMetadata().getParseTime() >= 0);
            assertThat(result.pendingTasks())
                    .extracting(ParsedTask::getTitle)
                    .containsExactly("Create schema", "Define endpoints", "GET /items", "Write tests");
        }

        @Test
        @DisplayName("Should produce contiguous sync orders in document order")
        void testSyncTasks() {
            ParseResult result = parser.parse("sync", THREE_LEVEL);

            List<SyncTask> syncTasks = parser.toSyncTasks(result);

            assertEquals(6, syncTasks.size());
            assertThat(syncTasks)
                    .extracting(SyncTask::getDisplayId, SyncTask::getGroupOrder, SyncTask::getTaskOrder,
                            SyncTask::getMajorOrder, SyncTask::getSubOrder, SyncTask::getMajorTitle)
                    .containsExactly(
                            tuple("1.1.1", 1, 1, 1, 1, "Setup"),
                            tuple("1.1.2", 1, 2, 1, 1, "Setup"),
                            tuple("1.2.1", 2, 1, 1, 2, "Setup"),
                            tuple("1.2.2", 2, 2, 1, 2, "Setup"),
                            tuple("2.1.1", 3, 1, 2, 1, "Build"),
                            tuple("2.1.2", 3, 2, 2, 1, "Build"));
            assertEquals("Database", syncTasks.get(0).getGroupTitle());
            assertEquals(7, syncTasks.get(1).getLineNumber());
        }

        @Test
        @DisplayName("Should project the legacy file shape")
        void testLegacyProjection() {
            LegacyTasksFile legacy = parser.parseLegacy("legacy", THREE_LEVEL);

            assertEquals("legacy", legacy.getChangeId());
            assertEquals(3, legacy.getGroups().size());

            LegacyTaskGroup api = legacy.getGroups().get(1);
            assertEquals("group-2", api.getId());
            assertEquals("API", api.getTitle());
            assertEquals("1.2", api.getDisplayId());
            assertEquals(0, api.getPhaseIndex());
            assertEquals(1, api.getGroupIndex());
            assertEquals(1, api.getMajorOrder());
            assertEquals("Setup", api.getMajorTitle());
            assertEquals(2, api.getSubOrder());
            assertEquals(2, api.getGroupOrder());
            assertEquals("task-2-1", api.getTasks().get(0).getId());
            assertEquals("group-2", api.getTasks().get(0).getGroupId());
            assertEquals(legacy, parser.toLegacy(parser.parse("legacy", THREE_LEVEL)));
        }
    }
}
