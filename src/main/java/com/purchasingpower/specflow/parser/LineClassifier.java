package com.purchasingpower.specflow.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single tasks.md line as phase header, section header or task.
 *
 * <p>Header patterns are tried in a fixed order and the first match wins:
 * <ul>
 *   <li>Phase ({@code ##}): "Phase N: Title", "N. Title", "Title"</li>
 *   <li>Section ({@code ###} / {@code ####}): "N.N Title", "Title"</li>
 * </ul>
 *
 * <p>Task lines are {@code - [ ]}, {@code - [x]} or {@code - [X]} with optional
 * indentation and an optional {@code task-N-N:} prefix, which is stripped.
 * Anything else inside the brackets, an empty title, or a title starting with
 * {@code #} is not a task. Rejected lines produce no output and no warning.
 *
 * @since 1.0.0
 */
@Component
public class LineClassifier {

    private static final List<Pattern> PHASE_PATTERNS = List.of(
            Pattern.compile("^##\\s+Phase\\s+(\\d+)[:.]?\\s*(.*)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^##\\s+(\\d+)\\.\\s*(.+)$"),
            Pattern.compile("^##\\s+([^#\\d].+)$")
    );

    private static final List<Pattern> SECTION_PATTERNS = List.of(
            Pattern.compile("^#{3,4}\\s+([\\d.]+)\\s+(.+)$"),
            Pattern.compile("^#{3,4}\\s+([^#\\d].+)$")
    );

    private static final Pattern TASK_PATTERN =
            Pattern.compile("^(\\s*)-\\s+\\[([ xX])\\]\\s*(?:task-[\\d-]+:\\s*)?(.+)$");

    /**
     * Classify one line (without its trailing newline).
     *
     * @return the classification, or empty when the line is none of the three kinds
     */
    public Optional<ClassifiedLine> classify(String line) {
        Optional<ClassifiedLine> phase = matchPhase(line);
        if (phase.isPresent()) {
            return phase;
        }
        Optional<ClassifiedLine> section = matchSection(line);
        if (section.isPresent()) {
            return section;
        }
        return matchTask(line);
    }

    public Optional<ClassifiedLine> matchPhase(String line) {
        if (!line.startsWith("##") || line.startsWith("###")) {
            return Optional.empty();
        }
        return firstHeaderMatch(PHASE_PATTERNS, line).map(ClassifiedLine::phase);
    }

    public Optional<ClassifiedLine> matchSection(String line) {
        if (!line.startsWith("###")) {
            return Optional.empty();
        }
        return firstHeaderMatch(SECTION_PATTERNS, line).map(ClassifiedLine::section);
    }

    public Optional<ClassifiedLine> matchTask(String line) {
        Matcher matcher = TASK_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }

        int indent = matcher.group(1).length();
        boolean completed = matcher.group(2).equalsIgnoreCase("x");
        String title = matcher.group(3).trim();

        if (title.isEmpty() || title.startsWith("#")) {
            return Optional.empty();
        }
        return Optional.of(ClassifiedLine.task(title, completed, indent));
    }

    private static Optional<String> firstHeaderMatch(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return Optional.of(headerTitle(matcher));
            }
        }
        return Optional.empty();
    }

    // "Phase N: Title" and "N. Title" carry the title in group 2; plain titles in group 1
    private static String headerTitle(Matcher matcher) {
        if (matcher.groupCount() >= 2) {
            String title = matcher.group(2).trim();
            if (!title.isEmpty()) {
                return title;
            }
        }
        return matcher.group(1).trim();
    }
}
