package com.purchasingpower.specflow.model.moai;

import lombok.Builder;
import lombok.Value;

/**
 * Listing entry for a SPEC: title and status from spec.md, progress from the
 * plan.md TAG chain.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class MoaiSpecSummary {
    String id;
    String title;
    String description;
    String status;
    String created;
    int totalTags;
    int completedTags;

    /** Rounded percentage of completed TAGs; 0 without TAGs. */
    int progress;
}
