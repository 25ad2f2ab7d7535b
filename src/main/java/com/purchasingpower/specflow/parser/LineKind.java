package com.purchasingpower.specflow.parser;

/**
 * What a single tasks.md line was recognized as.
 */
public enum LineKind {
    PHASE_HEADER,
    SECTION_HEADER,
    TASK
}
