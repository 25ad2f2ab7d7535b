package com.purchasingpower.specflow.model.moai;

import lombok.Builder;
import lombok.Value;

/**
 * EARS requirement from spec.md.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ParsedRequirement {
    /** "{sectionId}.{counter}", e.g. "FR-1.2" */
    String id;
    /** Title of the FR/NFR section. */
    String title;
    RequirementType type;
    String text;
    /** e.g. "Ubiquitous", "Event-Driven" */
    String earsCategory;
}
