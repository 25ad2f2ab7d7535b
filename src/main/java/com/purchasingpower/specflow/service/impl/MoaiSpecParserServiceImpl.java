package com.purchasingpower.specflow.service.impl;

import com.purchasingpower.specflow.model.moai.ParsedAcceptanceCriteria;
import com.purchasingpower.specflow.model.moai.ParsedCondition;
import com.purchasingpower.specflow.model.moai.ParsedMoaiAcceptance;
import com.purchasingpower.specflow.model.moai.ParsedMoaiPlan;
import com.purchasingpower.specflow.model.moai.ParsedMoaiSpec;
import com.purchasingpower.specflow.model.moai.ParsedRequirement;
import com.purchasingpower.specflow.model.moai.ParsedTag;
import com.purchasingpower.specflow.model.moai.RequirementType;
import com.purchasingpower.specflow.model.moai.SpecFrontmatter;
import com.purchasingpower.specflow.service.MoaiSpecParserService;
import com.purchasingpower.specflow.util.MarkdownUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parsers for plan.md, acceptance.md and spec.md.
 *
 * <p>Expected plan.md layout:
 * <pre>
 * ## Strategy
 * ...free text...
 * ## TAG Chain
 * ### TAG-001: Title
 * - **Scope**: ...
 * - **Purpose**: ...
 * - **Dependencies**: None | TAG-001, TAG-002
 * - **Completion Conditions**:
 *   - [ ] condition
 * </pre>
 *
 * <p>Expected acceptance.md layout:
 * <pre>
 * ## AC-1: Title
 * **Given** ...
 * **When** ...
 * **Then** ...
 * - continuation bullet
 * ### Success Metrics
 * - [ ] metric
 * ## Definition of Done
 * - [ ] item
 * </pre>
 *
 * <p>Expected spec.md layout:
 * <pre>
 * ### FR-1: Title
 * **[EARS: Ubiquitous]**
 * The system shall ...
 * </pre>
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class MoaiSpecParserServiceImpl implements MoaiSpecParserService {

    private static final Pattern H2 = Pattern.compile("^##\\s+");
    private static final Pattern STRATEGY = Pattern.compile("^strategy$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG_CHAIN = Pattern.compile("^tag\\s+chain$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG_HEADER = Pattern.compile("^###\\s+(TAG-\\d+):\\s*(.+)$");
    private static final Pattern SCOPE = Pattern.compile("^-\\s+\\*\\*Scope\\*\\*:\\s*(.+)$");
    private static final Pattern PURPOSE = Pattern.compile("^-\\s+\\*\\*Purpose\\*\\*:\\s*(.+)$");
    private static final Pattern DEPENDENCIES = Pattern.compile("^-\\s+\\*\\*Dependencies\\*\\*:\\s*(.+)$");
    private static final Pattern NONE = Pattern.compile("^none$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPLETION_CONDITIONS =
            Pattern.compile("^-\\s+\\*\\*Completion Conditions\\*\\*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern INDENTED_CHECKBOX = Pattern.compile("^\\s+-\\s+\\[[ xX]\\]");

    private static final Pattern AC_HEADER = Pattern.compile("^##\\s+(AC-\\d+):\\s*(.+)$");
    private static final Pattern DEFINITION_OF_DONE = Pattern.compile("^##\\s+Definition of Done", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUCCESS_METRICS = Pattern.compile("^###\\s+Success Metrics", Pattern.CASE_INSENSITIVE);
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^---\\s*$");
    private static final Pattern GIVEN = Pattern.compile("^\\*\\*Given\\*\\*\\s+(.+)$");
    private static final Pattern WHEN = Pattern.compile("^\\*\\*When\\*\\*\\s+(.+)$");
    private static final Pattern THEN = Pattern.compile("^\\*\\*Then\\*\\*\\s+(.+)$");
    private static final Pattern BULLET_PREFIX = Pattern.compile("^-\\s+");

    private static final Pattern REQUIREMENT_SECTION = Pattern.compile("^###\\s+((?:FR|NFR)-\\d+):\\s*(.+)$");
    private static final Pattern ANY_H2_OR_H3 = Pattern.compile("^#{2,3}\\s+");
    private static final Pattern EARS_MARKER = Pattern.compile("^\\*\\*\\[EARS:\\s*(.+?)\\]\\*\\*\\s*$");

    @Override
    public SpecFrontmatter parseFrontmatter(String content) {
        return MarkdownUtils.parseFrontmatter(content);
    }

    // ------------------------------------------------------------------
    // plan.md
    // ------------------------------------------------------------------

    @Override
    public ParsedMoaiPlan parsePlan(String content) {
        SpecFrontmatter frontmatter = MarkdownUtils.parseFrontmatter(content);
        List<String> lines = MarkdownUtils.splitLines(MarkdownUtils.stripFrontmatter(content));

        List<ParsedTag> tags = new ArrayList<>();
        List<String> strategyLines = new ArrayList<>();
        boolean inStrategy = false;
        boolean inTagChain = false;
        boolean inConditions = false;
        TagDraft currentTag = null;

        for (String line : lines) {
            if (isH2(line)) {
                if (currentTag != null) {
                    tags.add(currentTag.build());
                    currentTag = null;
                }
                inConditions = false;

                String h2Title = H2.matcher(line).replaceFirst("").trim();
                inStrategy = STRATEGY.matcher(h2Title).matches();
                inTagChain = TAG_CHAIN.matcher(h2Title).matches();
                continue;
            }

            if (inStrategy) {
                strategyLines.add(line);
                continue;
            }

            if (!inTagChain) {
                continue;
            }

            Matcher tagMatch = TAG_HEADER.matcher(line);
            if (tagMatch.find()) {
                if (currentTag != null) {
                    tags.add(currentTag.build());
                }
                currentTag = new TagDraft(tagMatch.group(1), tagMatch.group(2).trim());
                inConditions = false;
                continue;
            }

            if (currentTag == null) {
                continue;
            }

            Matcher scopeMatch = SCOPE.matcher(line);
            if (scopeMatch.find()) {
                currentTag.scope = scopeMatch.group(1).trim();
                inConditions = false;
                continue;
            }

            Matcher purposeMatch = PURPOSE.matcher(line);
            if (purposeMatch.find()) {
                currentTag.purpose = purposeMatch.group(1).trim();
                inConditions = false;
                continue;
            }

            Matcher depsMatch = DEPENDENCIES.matcher(line);
            if (depsMatch.find()) {
                currentTag.dependencies = parseDependencies(depsMatch.group(1).trim());
                inConditions = false;
                continue;
            }

            if (COMPLETION_CONDITIONS.matcher(line).find()) {
                inConditions = true;
                continue;
            }

            if (inConditions) {
                if (INDENTED_CHECKBOX.matcher(line).find()) {
                    currentTag.conditionLines.add(line);
                } else if (MarkdownUtils.closesIndentedChecklist(line)) {
                    inConditions = false;
                }
            }
        }

        if (currentTag != null) {
            tags.add(currentTag.build());
        }

        String strategy = String.join("\n", strategyLines).trim();
        log.debug("Parsed plan {}: {} TAGs", frontmatter.getSpecId(), tags.size());

        return ParsedMoaiPlan.builder()
                .frontmatter(frontmatter)
                .specId(frontmatter.getSpecId())
                .tags(List.copyOf(tags))
                .strategy(strategy.isEmpty() ? null : strategy)
                .build();
    }

    private static List<String> parseDependencies(String raw) {
        if (NONE.matcher(raw).matches()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(dep -> !dep.isEmpty())
                .toList();
    }

    // ------------------------------------------------------------------
    // acceptance.md
    // ------------------------------------------------------------------

    @Override
    public ParsedMoaiAcceptance parseAcceptance(String content) {
        SpecFrontmatter frontmatter = MarkdownUtils.parseFrontmatter(content);
        List<String> lines = MarkdownUtils.splitLines(MarkdownUtils.stripFrontmatter(content));

        List<ParsedAcceptanceCriteria> criteria = new ArrayList<>();
        List<ParsedCondition> definitionOfDone = new ArrayList<>();

        CriterionDraft currentAc = null;
        boolean inSuccessMetrics = false;
        boolean inDefinitionOfDone = false;
        boolean collectingThen = false;

        for (String line : lines) {
            Matcher acMatch = AC_HEADER.matcher(line);
            if (acMatch.find()) {
                flushCriterion(criteria, currentAc);
                currentAc = new CriterionDraft(acMatch.group(1), acMatch.group(2).trim());
                inSuccessMetrics = false;
                inDefinitionOfDone = false;
                collectingThen = false;
                continue;
            }

            if (DEFINITION_OF_DONE.matcher(line).find()) {
                flushCriterion(criteria, currentAc);
                currentAc = null;
                inDefinitionOfDone = true;
                inSuccessMetrics = false;
                collectingThen = false;
                continue;
            }

            if (isH2(line)) {
                flushCriterion(criteria, currentAc);
                currentAc = null;
                inDefinitionOfDone = false;
                inSuccessMetrics = false;
                collectingThen = false;
                continue;
            }

            if (inDefinitionOfDone) {
                definitionOfDone.addAll(MarkdownUtils.parseCheckboxes(List.of(line)));
                continue;
            }

            if (currentAc == null) {
                continue;
            }

            if (line.startsWith("### ")) {
                collectingThen = false;
                inSuccessMetrics = SUCCESS_METRICS.matcher(line).find();
                continue;
            }

            if (HORIZONTAL_RULE.matcher(line).find()) {
                continue;
            }

            if (inSuccessMetrics) {
                if (MarkdownUtils.isCheckbox(line)) {
                    currentAc.metricLines.add(line);
                }
                continue;
            }

            Matcher givenMatch = GIVEN.matcher(line);
            if (givenMatch.find()) {
                currentAc.given = givenMatch.group(1).trim();
                collectingThen = false;
                continue;
            }

            Matcher whenMatch = WHEN.matcher(line);
            if (whenMatch.find()) {
                currentAc.when = whenMatch.group(1).trim();
                collectingThen = false;
                continue;
            }

            Matcher thenMatch = THEN.matcher(line);
            if (thenMatch.find()) {
                currentAc.thenLines.clear();
                currentAc.thenLines.add(thenMatch.group(1).trim());
                collectingThen = true;
                continue;
            }

            if (collectingThen && line.startsWith("- ") && !MarkdownUtils.isCheckbox(line)) {
                currentAc.thenLines.add(BULLET_PREFIX.matcher(line).replaceFirst("").trim());
                continue;
            }

            if (collectingThen && !line.isBlank()) {
                collectingThen = false;
            }
        }

        flushCriterion(criteria, currentAc);
        log.debug("Parsed acceptance {}: {} criteria, {} DoD items",
                frontmatter.getSpecId(), criteria.size(), definitionOfDone.size());

        return ParsedMoaiAcceptance.builder()
                .frontmatter(frontmatter)
                .specId(frontmatter.getSpecId())
                .criteria(List.copyOf(criteria))
                .definitionOfDone(List.copyOf(definitionOfDone))
                .build();
    }

    private static void flushCriterion(List<ParsedAcceptanceCriteria> criteria, CriterionDraft draft) {
        if (draft != null) {
            criteria.add(draft.build());
        }
    }

    // ------------------------------------------------------------------
    // spec.md
    // ------------------------------------------------------------------

    @Override
    public ParsedMoaiSpec parseSpec(String content) {
        SpecFrontmatter frontmatter = MarkdownUtils.parseFrontmatter(content);
        List<String> lines = MarkdownUtils.splitLines(MarkdownUtils.stripFrontmatter(content));

        List<ParsedRequirement> requirements = new ArrayList<>();
        RequirementCursor cursor = new RequirementCursor();

        for (String line : lines) {
            Matcher sectionMatch = REQUIREMENT_SECTION.matcher(line);
            if (sectionMatch.find()) {
                cursor.flush(requirements);
                cursor.openSection(sectionMatch.group(1), sectionMatch.group(2).trim());
                continue;
            }

            if (ANY_H2_OR_H3.matcher(line).find()) {
                cursor.flush(requirements);
                // an H2 is a parent heading and keeps the section; an H3 replaces it
                if (line.startsWith("### ")) {
                    cursor.openSection("", "");
                } else {
                    cursor.resetRequirement();
                }
                continue;
            }

            if (cursor.sectionId.isEmpty()) {
                continue;
            }

            Matcher earsMatch = EARS_MARKER.matcher(line);
            if (earsMatch.find()) {
                cursor.flush(requirements);
                cursor.startRequirement(earsMatch.group(1).trim());
                continue;
            }

            if (!cursor.earsCategory.isEmpty() && !line.isBlank()) {
                cursor.textLines.add(line.trim());
            }
        }

        cursor.flush(requirements);
        log.debug("Parsed spec {}: {} requirements", frontmatter.getSpecId(), requirements.size());

        return ParsedMoaiSpec.builder()
                .frontmatter(frontmatter)
                .specId(frontmatter.getSpecId())
                .requirements(List.copyOf(requirements))
                .build();
    }

    static RequirementType detectRequirementType(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains(" shall ")) {
            return RequirementType.SHALL;
        }
        if (lower.contains(" should ")) {
            return RequirementType.SHOULD;
        }
        if (lower.contains(" may ")) {
            return RequirementType.MAY;
        }
        if (lower.contains(" will ")) {
            return RequirementType.WILL;
        }
        return RequirementType.SHALL;
    }

    private static boolean isH2(String line) {
        return line.startsWith("## ") && !line.startsWith("### ");
    }

    private static final class TagDraft {
        final String id;
        final String title;
        String scope = "";
        String purpose = "";
        List<String> dependencies = List.of();
        final List<String> conditionLines = new ArrayList<>();

        TagDraft(String id, String title) {
            this.id = id;
            this.title = title;
        }

        ParsedTag build() {
            List<ParsedCondition> conditions = MarkdownUtils.parseCheckboxes(conditionLines);
            return ParsedTag.builder()
                    .id(id)
                    .title(title)
                    .scope(scope)
                    .purpose(purpose)
                    .dependencies(dependencies)
                    .conditions(List.copyOf(conditions))
                    .completed(MarkdownUtils.allChecked(conditions))
                    .build();
        }
    }

    private static final class CriterionDraft {
        final String id;
        final String title;
        String given = "";
        String when = "";
        final List<String> thenLines = new ArrayList<>();
        final List<String> metricLines = new ArrayList<>();

        CriterionDraft(String id, String title) {
            this.id = id;
            this.title = title;
        }

        ParsedAcceptanceCriteria build() {
            List<ParsedCondition> metrics = MarkdownUtils.parseCheckboxes(metricLines);
            return ParsedAcceptanceCriteria.builder()
                    .id(id)
                    .title(title)
                    .given(given)
                    .when(when)
                    .then(String.join("\n", thenLines))
                    .successMetrics(List.copyOf(metrics))
                    .verified(MarkdownUtils.allChecked(metrics))
                    .build();
        }
    }

    /**
     * Current FR/NFR section and the requirement being collected inside it.
     */
    private static final class RequirementCursor {
        String sectionId = "";
        String sectionTitle = "";
        String earsCategory = "";
        int counter;
        final List<String> textLines = new ArrayList<>();

        void openSection(String id, String title) {
            sectionId = id;
            sectionTitle = title;
            resetRequirement();
        }

        void resetRequirement() {
            earsCategory = "";
            counter = 0;
            textLines.clear();
        }

        // the counter advances even when a marker ends up without text
        void startRequirement(String category) {
            earsCategory = category;
            counter++;
            textLines.clear();
        }

        void flush(List<ParsedRequirement> requirements) {
            if (sectionId.isEmpty() || earsCategory.isEmpty() || textLines.isEmpty()) {
                return;
            }

            String text = String.join(" ", textLines);
            requirements.add(ParsedRequirement.builder()
                    .id(counter > 0 ? sectionId + "." + counter : sectionId)
                    .title(sectionTitle)
                    .type(detectRequirementType(text))
                    .text(text)
                    .earsCategory(earsCategory)
                    .build());
            textLines.clear();
        }
    }
}
