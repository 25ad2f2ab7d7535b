package com.purchasingpower.specflow.util;

import com.purchasingpower.specflow.model.moai.ParsedCondition;
import com.purchasingpower.specflow.model.moai.SpecFrontmatter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Low-level markdown helpers shared by the tasks.md parser and the MoAI SPEC parsers.
 *
 * <p>Only the pieces both families need live here: line splitting, frontmatter
 * extraction and checkbox extraction.
 *
 * @since 1.0.0
 */
public final class MarkdownUtils {

    private static final Pattern FRONTMATTER = Pattern.compile("^---\\r?\\n(.*?)\\r?\\n---", Pattern.DOTALL);
    private static final Pattern FRONTMATTER_BLOCK = Pattern.compile("^---\\r?\\n.*?\\r?\\n---\\r?\\n?", Pattern.DOTALL);
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern CHECKBOX = Pattern.compile("^\\s*-\\s+\\[([ xX])\\]\\s+(.+)$");
    private static final Pattern CHECKBOX_PREFIX = Pattern.compile("^\\s*-\\s+\\[[ xX]\\]");

    private MarkdownUtils() {
    }

    /**
     * Split on {@code \n}, keeping trailing empty lines so that joining the result
     * with {@code \n} reproduces the input exactly.
     */
    public static List<String> splitLines(String content) {
        if (content == null) {
            return List.of("");
        }
        return Arrays.asList(content.split("\n", -1));
    }

    /**
     * Parse the leading {@code ---} block into key/value pairs.
     *
     * <p>{@code [a, b]} becomes a list, an all-digit value becomes a {@code Long},
     * anything else stays a trimmed string. Lines without a colon or with an empty
     * key are ignored. Without a block only the reserved keys are returned.
     */
    public static SpecFrontmatter parseFrontmatter(String content) {
        if (content == null) {
            return SpecFrontmatter.empty();
        }
        Matcher matcher = FRONTMATTER.matcher(content);
        if (!matcher.find()) {
            return SpecFrontmatter.empty();
        }

        Map<String, Object> entries = new LinkedHashMap<>();
        for (String line : matcher.group(1).split("\n")) {
            int colonIdx = line.indexOf(':');
            if (colonIdx == -1) {
                continue;
            }

            String key = line.substring(0, colonIdx).trim();
            String rawValue = line.substring(colonIdx + 1).trim();
            if (key.isEmpty()) {
                continue;
            }

            entries.put(key, frontmatterValue(rawValue));
        }

        return SpecFrontmatter.of(entries);
    }

    /**
     * Content with the leading frontmatter block removed.
     */
    public static String stripFrontmatter(String content) {
        if (content == null) {
            return "";
        }
        return FRONTMATTER_BLOCK.matcher(content).replaceFirst("");
    }

    /**
     * Extract every {@code - [ ] text} / {@code - [x] text} line.
     */
    public static List<ParsedCondition> parseCheckboxes(List<String> lines) {
        List<ParsedCondition> conditions = new ArrayList<>();
        for (String line : lines) {
            Matcher matcher = CHECKBOX.matcher(line);
            if (matcher.find()) {
                conditions.add(new ParsedCondition(matcher.group(2).trim(), matcher.group(1).equalsIgnoreCase("x")));
            }
        }
        return conditions;
    }

    /**
     * True if the line starts with a checkbox marker, indented or not.
     */
    public static boolean isCheckbox(String line) {
        return CHECKBOX_PREFIX.matcher(line).find();
    }

    /**
     * True for a non-blank line that is neither indented nor a checkbox, which
     * closes an indented checklist such as a TAG's completion conditions.
     */
    public static boolean closesIndentedChecklist(String line) {
        return !line.isBlank() && !Character.isWhitespace(line.charAt(0)) && !isCheckbox(line);
    }

    /**
     * True when the list is non-empty and every item is checked.
     */
    public static boolean allChecked(List<ParsedCondition> conditions) {
        return !conditions.isEmpty() && conditions.stream().allMatch(ParsedCondition::checked);
    }

    private static Object frontmatterValue(String rawValue) {
        if (rawValue.startsWith("[") && rawValue.endsWith("]")) {
            String inner = rawValue.substring(1, rawValue.length() - 1).trim();
            if (inner.isEmpty()) {
                return List.of();
            }
            return Arrays.stream(inner.split(",")).map(String::trim).toList();
        }

        if (DIGITS.matcher(rawValue).matches()) {
            try {
                return Long.parseLong(rawValue);
            } catch (NumberFormatException e) {
                return rawValue;
            }
        }

        return rawValue;
    }
}
