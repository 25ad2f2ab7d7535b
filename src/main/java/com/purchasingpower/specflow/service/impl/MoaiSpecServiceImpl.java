package com.purchasingpower.specflow.service.impl;

import com.purchasingpower.specflow.configuration.SpecflowProperties;
import com.purchasingpower.specflow.exception.TagNotFoundException;
import com.purchasingpower.specflow.exception.TaskUpdateException;
import com.purchasingpower.specflow.model.moai.MoaiSpecContext;
import com.purchasingpower.specflow.model.moai.MoaiSpecSummary;
import com.purchasingpower.specflow.model.moai.ParsedMoaiPlan;
import com.purchasingpower.specflow.model.moai.ParsedTag;
import com.purchasingpower.specflow.model.moai.SpecFrontmatter;
import com.purchasingpower.specflow.service.MoaiSpecParserService;
import com.purchasingpower.specflow.service.MoaiSpecService;
import com.purchasingpower.specflow.util.MarkdownUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
public class MoaiSpecServiceImpl implements MoaiSpecService {

    private static final String TITLE_KEY = "title";
    private static final String STATUS_KEY = "status";

    private static final Pattern TAG_ID = Pattern.compile("^TAG-\\d+$");
    private static final Pattern NEXT_TAG_OR_SECTION = Pattern.compile("^(?:###\\s+TAG-|##\\s)");
    private static final Pattern COMPLETION_CONDITIONS =
            Pattern.compile("^-\\s+\\*\\*Completion Conditions\\*\\*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONDITION_CHECKBOX = Pattern.compile("^(\\s+-\\s+\\[)([ xX])(\\].*)$");

    private final MoaiSpecParserService parserService;
    private final SpecflowProperties properties;
    private final Pattern specIdPattern;

    public MoaiSpecServiceImpl(MoaiSpecParserService parserService, SpecflowProperties properties) {
        this.parserService = parserService;
        this.properties = properties;
        this.specIdPattern = Pattern.compile(properties.getMoai().getSpecIdPattern());
    }

    @Override
    public MoaiSpecContext buildContext(String specContent, String planContent, String acceptanceContent) {
        return new MoaiSpecContext(
                parserService.parseSpec(orEmpty(specContent)),
                parserService.parsePlan(orEmpty(planContent)),
                parserService.parseAcceptance(orEmpty(acceptanceContent)));
    }

    @Override
    public MoaiSpecSummary summarize(String specId, String specContent, String planContent) {
        ParsedMoaiPlan plan = parserService.parsePlan(orEmpty(planContent));
        SpecFrontmatter specFrontmatter = parserService.parseFrontmatter(orEmpty(specContent));

        String title = specFrontmatter.getString(TITLE_KEY);
        String status = specFrontmatter.getString(STATUS_KEY);
        String created = plan.getFrontmatter().getCreated();
        if (created.isEmpty()) {
            created = specFrontmatter.getCreated();
        }

        int totalTags = plan.getTags().size();
        int completedTags = (int) plan.getTags().stream().filter(ParsedTag::isCompleted).count();
        int progress = totalTags > 0 ? (int) Math.round(completedTags * 100.0 / totalTags) : 0;

        return MoaiSpecSummary.builder()
                .id(specId)
                .title(title.isEmpty() ? specId : title)
                .description(extractDescription(orEmpty(specContent)))
                .status(status.isEmpty() ? properties.getMoai().getDefaultStatus() : status)
                .created(created)
                .totalTags(totalTags)
                .completedTags(completedTags)
                .progress(progress)
                .build();
    }

    @Override
    public ParsedTag findTag(ParsedMoaiPlan plan, String tagId) {
        return plan.getTags().stream()
                .filter(tag -> tag.getId().equals(tagId))
                .findFirst()
                .orElseThrow(() -> new TagNotFoundException(tagId, "SPEC " + plan.getSpecId()));
    }

    @Override
    public Optional<ParsedTag> nextTag(ParsedMoaiPlan plan) {
        Map<String, Boolean> completedById = plan.getTags().stream()
                .collect(Collectors.toMap(ParsedTag::getId, ParsedTag::isCompleted, (first, second) -> first));

        return plan.getTags().stream()
                .filter(tag -> !tag.isCompleted())
                .filter(tag -> tag.getDependencies().stream()
                        .allMatch(dep -> completedById.getOrDefault(dep, false)))
                .findFirst();
    }

    @Override
    public String setTagStatus(String planContent, String tagId, boolean completed) {
        List<String> lines = new ArrayList<>(MarkdownUtils.splitLines(planContent));
        Pattern header = Pattern.compile("^###\\s+" + Pattern.quote(tagId) + ":");

        int tagLineIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (header.matcher(lines.get(i)).find()) {
                tagLineIndex = i;
                break;
            }
        }
        if (tagLineIndex == -1) {
            throw new TagNotFoundException(tagId, "plan.md");
        }

        int updated = 0;
        for (int i = tagLineIndex + 1; i < lines.size(); i++) {
            if (NEXT_TAG_OR_SECTION.matcher(lines.get(i)).find()) {
                break;
            }
            if (!COMPLETION_CONDITIONS.matcher(lines.get(i)).find()) {
                continue;
            }

            // same window the plan parser reads conditions from
            int j = i + 1;
            while (j < lines.size() && !MarkdownUtils.closesIndentedChecklist(lines.get(j))) {
                Matcher matcher = CONDITION_CHECKBOX.matcher(lines.get(j));
                if (matcher.find()) {
                    lines.set(j, matcher.replaceFirst("$1" + (completed ? "x" : " ") + "$3"));
                    updated++;
                }
                j++;
            }
            i = j - 1;
        }

        if (updated == 0) {
            throw new TaskUpdateException(
                    "Failed to update TAG " + tagId + " status in plan.md: no completion conditions",
                    tagId, tagLineIndex + 1);
        }

        log.debug("Set {} condition(s) of {} to {}", updated, tagId, completed ? "checked" : "unchecked");
        return String.join("\n", lines);
    }

    @Override
    public boolean isMoaiSpec(String changeId) {
        return changeId != null && specIdPattern.matcher(changeId).find();
    }

    @Override
    public boolean isMoaiTag(String taskId) {
        return taskId != null && TAG_ID.matcher(taskId).matches();
    }

    /**
     * First paragraph after the first heading, cut at the configured length.
     */
    String extractDescription(String specContent) {
        int maxLength = properties.getMoai().getDescriptionMaxLength();
        List<String> lines = MarkdownUtils.splitLines(specContent);

        int bodyStart = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith("#")) {
                bodyStart = i;
                break;
            }
        }
        if (bodyStart < 0) {
            return "";
        }

        StringBuilder description = new StringBuilder();
        for (int i = bodyStart + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.startsWith("#")) {
                break;
            }
            if (!line.isBlank()) {
                description.append(line).append(' ');
            }
            if (description.length() > maxLength) {
                break;
            }
        }

        String trimmed = description.toString().trim();
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }

    private static String orEmpty(String content) {
        return content == null || content.isBlank() ? "" : content;
    }
}
