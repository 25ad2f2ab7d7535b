package com.purchasingpower.specflow.service;

import com.purchasingpower.specflow.model.moai.MoaiSpecContext;
import com.purchasingpower.specflow.model.moai.MoaiSpecSummary;
import com.purchasingpower.specflow.model.moai.ParsedMoaiPlan;
import com.purchasingpower.specflow.model.moai.ParsedTag;

import java.util.Optional;

/**
 * Operations over a MoAI SPEC directory's documents, given as already-read text.
 *
 * @since 1.0.0
 */
public interface MoaiSpecService {

    /**
     * Parse spec.md, plan.md and acceptance.md together. A null or blank document
     * parses as empty.
     */
    MoaiSpecContext buildContext(String specContent, String planContent, String acceptanceContent);

    /**
     * Listing entry: title, description and status from spec.md, TAG progress from plan.md.
     */
    MoaiSpecSummary summarize(String specId, String specContent, String planContent);

    /**
     * @throws com.purchasingpower.specflow.exception.TagNotFoundException if the plan has no such TAG
     */
    ParsedTag findTag(ParsedMoaiPlan plan, String tagId);

    /**
     * First incomplete TAG, in chain order, whose dependencies are all complete.
     */
    Optional<ParsedTag> nextTag(ParsedMoaiPlan plan);

    /**
     * Check or uncheck every Completion Conditions checkbox of one TAG.
     *
     * @return the rewritten plan.md text
     * @throws com.purchasingpower.specflow.exception.TagNotFoundException if the TAG header is missing
     * @throws com.purchasingpower.specflow.exception.TaskUpdateException  if the TAG has no condition checkbox
     */
    String setTagStatus(String planContent, String tagId, boolean completed);

    boolean isMoaiSpec(String changeId);

    boolean isMoaiTag(String taskId);
}
