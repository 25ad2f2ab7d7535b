package com.purchasingpower.specflow.model.moai;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed acceptance.md.
 */
@Value
@Builder
public class ParsedMoaiAcceptance {
    SpecFrontmatter frontmatter;
    String specId;
    List<ParsedAcceptanceCriteria> criteria;
    List<ParsedCondition> definitionOfDone;
}
