package com.ryuqq.conductor.adapter.file.json;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.conductor.core.event.RunCancelled;
import com.ryuqq.conductor.core.event.RunCompleted;
import com.ryuqq.conductor.core.event.RunCreated;
import com.ryuqq.conductor.core.event.RunFailed;
import com.ryuqq.conductor.core.event.RunPaused;
import com.ryuqq.conductor.core.event.RunResumed;
import com.ryuqq.conductor.core.event.RunStarted;
import com.ryuqq.conductor.core.event.StageAwaitingFeedback;
import com.ryuqq.conductor.core.event.StageCompleted;
import com.ryuqq.conductor.core.event.StageFailed;
import com.ryuqq.conductor.core.event.StageRetried;
import com.ryuqq.conductor.core.event.StageSkipped;
import com.ryuqq.conductor.core.event.StageStarted;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.event.UserFeedbackRecorded;

/**
 * Polymorphic type information for {@link com.ryuqq.conductor.core.event.RunEvent}.
 *
 * <p>Kept out of the core module so that core stays free of Jackson. The type
 * names are part of the on-disk format and must not change.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RunCreated.class, name = "RunCreated"),
    @JsonSubTypes.Type(value = RunStarted.class, name = "RunStarted"),
    @JsonSubTypes.Type(value = RunPaused.class, name = "RunPaused"),
    @JsonSubTypes.Type(value = RunResumed.class, name = "RunResumed"),
    @JsonSubTypes.Type(value = StageStarted.class, name = "StageStarted"),
    @JsonSubTypes.Type(value = StageCompleted.class, name = "StageCompleted"),
    @JsonSubTypes.Type(value = StageFailed.class, name = "StageFailed"),
    @JsonSubTypes.Type(value = StageRetried.class, name = "StageRetried"),
    @JsonSubTypes.Type(value = StageSkipped.class, name = "StageSkipped"),
    @JsonSubTypes.Type(value = StageAwaitingFeedback.class, name = "StageAwaitingFeedback"),
    @JsonSubTypes.Type(value = UserFeedbackRecorded.class, name = "UserFeedbackRecorded"),
    @JsonSubTypes.Type(value = RunCompleted.class, name = "RunCompleted"),
    @JsonSubTypes.Type(value = RunFailed.class, name = "RunFailed"),
    @JsonSubTypes.Type(value = RunCancelled.class, name = "RunCancelled"),
    @JsonSubTypes.Type(value = StateSnapshot.class, name = "StateSnapshot")
})
abstract class RunEventMixin {
}
