package com.purchasingpower.specflow.model.moai;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed spec.md.
 */
@Value
@Builder
public class ParsedMoaiSpec {
    SpecFrontmatter frontmatter;
    String specId;
    List<ParsedRequirement> requirements;
}
