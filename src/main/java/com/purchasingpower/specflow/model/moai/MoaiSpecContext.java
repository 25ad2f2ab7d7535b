package com.purchasingpower.specflow.model.moai;

/**
 * The three parsed documents of one SPEC directory.
 */
public record MoaiSpecContext(ParsedMoaiSpec spec, ParsedMoaiPlan plan, ParsedMoaiAcceptance acceptance) {
}
