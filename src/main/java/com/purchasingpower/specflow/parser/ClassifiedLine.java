package com.purchasingpower.specflow.parser;

/**
 * Result of classifying one line. {@code completed} and {@code indent} are only
 * meaningful for {@link LineKind#TASK}.
 */
public record ClassifiedLine(LineKind kind, String title, boolean completed, int indent) {

    static ClassifiedLine phase(String title) {
        return new ClassifiedLine(LineKind.PHASE_HEADER, title, false, 0);
    }

    static ClassifiedLine section(String title) {
        return new ClassifiedLine(LineKind.SECTION_HEADER, title, false, 0);
    }

    static ClassifiedLine task(String title, boolean completed, int indent) {
        return new ClassifiedLine(LineKind.TASK, title, completed, indent);
    }

    public boolean isTask() {
        return kind == LineKind.TASK;
    }
}
