package com.purchasingpower.specflow.service;

import com.purchasingpower.specflow.model.tasks.LegacyTasksFile;
import com.purchasingpower.specflow.model.tasks.ParseResult;
import com.purchasingpower.specflow.model.tasks.SyncTask;

import java.util.List;

/**
 * Parses tasks.md content into a Phase → Group → Task tree.
 *
 * <p>Parsing never throws: lines that cannot be placed are dropped and, where
 * relevant, reported in {@code metadata.warnings}.
 *
 * @since 1.0.0
 */
public interface TasksParserService {

    /**
     * Parse tasks.md content.
     *
     * @param changeId opaque caller id, echoed in the result
     * @param content  full document text
     * @return immutable parse tree with metadata
     */
    ParseResult parse(String changeId, String content);

    /**
     * Parse and project into the flat legacy shape.
     */
    LegacyTasksFile parseLegacy(String changeId, String content);

    /**
     * Flatten a parse result into rows for the database sync job.
     */
    List<SyncTask> toSyncTasks(ParseResult result);

    /**
     * Project an existing parse result into the flat legacy shape.
     */
    LegacyTasksFile toLegacy(ParseResult result);
}
