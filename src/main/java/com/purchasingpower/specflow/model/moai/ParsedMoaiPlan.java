package com.purchasingpower.specflow.model.moai;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed plan.md. {@code strategy} is null when the document has no Strategy text.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedMoaiPlan {
    SpecFrontmatter frontmatter;
    String specId;
    List<ParsedTag> tags;
    String strategy;
}
