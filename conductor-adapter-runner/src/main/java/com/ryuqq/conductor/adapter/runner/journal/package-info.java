/**
 * Event-sourced run state store.
 *
 * <p>{@link com.ryuqq.conductor.adapter.runner.journal.RunJournal} derives run state from the
 * {@link com.ryuqq.conductor.core.spi.EventSink} log, writes periodic
 * {@link com.ryuqq.conductor.core.event.StateSnapshot}s and resolves branch prefixes
 * against the parent log.</p>
 */
package com.ryuqq.conductor.adapter.runner.journal;
