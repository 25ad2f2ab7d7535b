/**
 * Task id resolution across every id dialect tasks.md tooling has used.
 *
 * <p>Supported dialects, in detection priority:
 * <ul>
 *   <li>{@code task-group-G-T} - group-relative position (legacy)</li>
 *   <li>{@code task-P-T} - phase-relative position (legacy)</li>
 *   <li>{@code 1.2.3} - display id</li>
 *   <li>{@code a1b2c3d4} - content hash</li>
 *   <li>anything else - title substring</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.specflow.resolver;
