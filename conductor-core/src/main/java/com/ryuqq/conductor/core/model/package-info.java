/**
 * Core domain model package containing identifiers and small value records.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.RunId} - Run instance identifier</li>
 *   <li>{@link com.ryuqq.conductor.core.model.StageId} - Stage identifier inside a template</li>
 *   <li>{@link com.ryuqq.conductor.core.model.TemplateId} - Pipeline template identifier</li>
 *   <li>{@link com.ryuqq.conductor.core.model.ScopeId} - Isolation scope (workspace) identifier</li>
 * </ul>
 *
 * <h2>Value Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.TokenUsage} - Prompt/completion token counts</li>
 *   <li>{@link com.ryuqq.conductor.core.model.BranchOrigin} - Parent pointer of a forked run</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.model;
