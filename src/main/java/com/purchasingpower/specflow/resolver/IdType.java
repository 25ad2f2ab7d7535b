package com.purchasingpower.specflow.resolver;

import java.util.regex.Pattern;

/**
 * The task id dialects accepted by {@link LegacyIdResolver}.
 *
 * <p>{@link #detect(String)} checks in a fixed priority order; the first rule
 * that applies decides the dialect.
 *
 * @since 1.0.0
 */
public enum IdType {

    /** {@code task-N-M} that is not a phase-task id; matched against {@code task.id}. */
    INTERNAL,

    /** {@code 1.2.3} */
    DISPLAY_ID,

    /** {@code task-P-T}: T-th task of phase P, counted across its groups (deprecated). */
    PHASE_TASK,

    /** {@code task-group-G-T}: T-th task of the G-th group in the flat list (deprecated). */
    GROUP_TASK,

    /** 8 lowercase hex characters. */
    CONTENT_HASH,

    /** Case-insensitive substring of a task title. */
    TITLE;

    static final Pattern PHASE_TASK_PATTERN = Pattern.compile("^task-(\\d+)-(\\d+)$");
    static final Pattern GROUP_TASK_PATTERN = Pattern.compile("^task-group-(\\d+)-(\\d+)$");
    static final Pattern DISPLAY_ID_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");
    static final Pattern CONTENT_HASH_PATTERN = Pattern.compile("^[a-f0-9]{8}$");

    public static IdType detect(String id) {
        if (id.startsWith("task-") && !id.contains("group")) {
            return PHASE_TASK_PATTERN.matcher(id).matches() ? PHASE_TASK : INTERNAL;
        }
        if (id.contains("group")) {
            return GROUP_TASK;
        }
        if (DISPLAY_ID_PATTERN.matcher(id).matches()) {
            return DISPLAY_ID;
        }
        if (CONTENT_HASH_PATTERN.matcher(id).matches()) {
            return CONTENT_HASH;
        }
        return TITLE;
    }

    /**
     * Dialects kept only for old callers.
     */
    public boolean isLegacy() {
        return this == PHASE_TASK || this == GROUP_TASK;
    }
}
