/**
 * Line-level building blocks for tasks.md parsing.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code LineClassifier} - Ordered phase, section and task patterns, first match wins</li>
 *   <li>{@code ContentHasher} - Stable 8-char task hash over group and task title</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.specflow.parser;
