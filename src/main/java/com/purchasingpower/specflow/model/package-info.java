/**
 * Immutable parse results: {@code tasks} for OpenSpec tasks.md, {@code moai} for
 * MoAI SPEC documents.
 *
 * @since 1.0.0
 */
package com.purchasingpower.specflow.model;
