package com.purchasingpower.specflow.service;

import com.purchasingpower.specflow.model.moai.ParsedMoaiAcceptance;
import com.purchasingpower.specflow.model.moai.ParsedMoaiPlan;
import com.purchasingpower.specflow.model.moai.ParsedMoaiSpec;
import com.purchasingpower.specflow.model.moai.SpecFrontmatter;

/**
 * Parsers for the three documents of a MoAI SPEC directory.
 *
 * <p>Each parser is an independent section state machine. None of them throws on
 * malformed or partial input; missing sections simply produce empty lists.
 *
 * @since 1.0.0
 */
public interface MoaiSpecParserService {

    SpecFrontmatter parseFrontmatter(String content);

    /**
     * plan.md: Strategy text and the TAG chain with completion conditions.
     */
    ParsedMoaiPlan parsePlan(String content);

    /**
     * acceptance.md: Given/When/Then criteria, success metrics and Definition of Done.
     */
    ParsedMoaiAcceptance parseAcceptance(String content);

    /**
     * spec.md: EARS requirements from FR/NFR sections.
     */
    ParsedMoaiSpec parseSpec(String content);
}
