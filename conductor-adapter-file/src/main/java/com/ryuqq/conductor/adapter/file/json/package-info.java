/**
 * Jackson configuration shared by the file adapters.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.file.json;
