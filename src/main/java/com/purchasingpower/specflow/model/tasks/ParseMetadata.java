package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregate counts and diagnostics for one parse.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ParseMetadata {
    int totalTasks;
    int completedTasks;
    int totalGroups;
    ParseFormat format;

    /**
     * Wall-clock parse time in milliseconds.
     */
    double parseTime;

    @Builder.Default
    List<ParseWarning> warnings = List.of();

    /**
     * Completion percentage, rounded. 0 when there are no tasks.
     */
    @JsonIgnore
    public int getProgress() {
        if (totalTasks == 0) {
            return 0;
        }
        return (int) Math.round(completedTasks * 100.0 / totalTasks);
    }
}
