/**
 * Stage execution strategies, one per {@link com.ryuqq.conductor.core.template.StageKind}.
 *
 * <p>Handlers are asynchronous and never write events; the run loop turns their outcome
 * (or failure, through {@link com.ryuqq.conductor.adapter.runner.stage.StageFailures}) into
 * the next event of the run.</p>
 */
package com.ryuqq.conductor.adapter.runner.stage;
