/**
 * File-system adapters for the orchestrator SPIs.
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.file.FileEventSink}: one JSON Lines log per run,
 *       synced on every append, torn tails truncated on open</li>
 *   <li>{@link com.ryuqq.conductor.adapter.file.FileCacheBackend}: one JSON document per
 *       cache key, replaced by atomic move</li>
 * </ul>
 *
 * <h2>Layout</h2>
 * <pre>
 * events/
 *   run-8f3a.jsonl        {"@type":"RunCreated","runId":"run-8f3a","sequence":1,...}
 * cache/
 *   3b9c...e1.json        {"key":"3b9c...e1","scope":"workspace-a","text":"...",...}
 * </pre>
 *
 * @see com.ryuqq.conductor.adapter.file.json.ConductorJson
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.file;
