package com.ryuqq.conductor.adapter.file;

import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.exception.EventSinkException;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.state.RunStateProjector;
import com.ryuqq.conductor.testkit.support.EventFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileEventSink 손상 복구 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FileEventSinkRecoveryTest {

    @TempDir
    Path directory;

    private List<RunEvent> writeLog(EventFixtures events) {
        FileEventSink sink = new FileEventSink(directory);
        List<RunEvent> log = List.of(events.created("a"), events.started(), events.stageStarted("a", 1));
        for (RunEvent event : log) {
            sink.append(events.runId(), event);
        }
        return log;
    }

    @Test
    @DisplayName("끝나지 않은 마지막 줄은 열 때 잘라내고 이어서 기록할 수 있다")
    void tornTail_truncatedOnOpen() throws Exception {
        // given
        EventFixtures events = EventFixtures.forRun("run-torn");
        List<RunEvent> log = writeLog(events);
        Path file = directory.resolve("run-torn.jsonl");
        long intactSize = Files.size(file);
        Files.write(file, "{\"@type\":\"StageCompl".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);

        // when
        FileEventSink reopened = new FileEventSink(directory);
        List<RunEvent> read = reopened.readFrom(events.runId(), 1);
        RunEvent next = events.stageCompleted("a", 1, "A");
        reopened.append(events.runId(), next);

        // then
        assertThat(read).containsExactlyElementsOf(log);
        assertThat(Files.size(file)).isGreaterThan(intactSize);
        assertThat(new FileEventSink(directory).readFrom(events.runId(), 4)).containsExactly(next);
    }

    @Test
    @DisplayName("읽을 수 없는 마지막 줄도 잘린 쓰기로 취급한다")
    void unreadableTerminatedTail_truncatedOnOpen() throws Exception {
        // given
        EventFixtures events = EventFixtures.forRun("run-garbage-tail");
        List<RunEvent> log = writeLog(events);
        Path file = directory.resolve("run-garbage-tail.jsonl");
        Files.write(file, "not json\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);

        // when
        List<RunEvent> read = new FileEventSink(directory).readFrom(events.runId(), 1);

        // then
        assertThat(read).containsExactlyElementsOf(log);
    }

    @Test
    @DisplayName("중간 줄이 손상되면 EventSinkException")
    void corruptMiddleLine_rejected() throws Exception {
        // given
        EventFixtures events = EventFixtures.forRun("run-corrupt");
        writeLog(events);
        Path file = directory.resolve("run-corrupt.jsonl");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        lines.set(1, "{broken");
        Files.write(file, lines, StandardCharsets.UTF_8);

        // when & then
        FileEventSink reopened = new FileEventSink(directory);
        assertThatThrownBy(() -> reopened.readFrom(RunId.of("run-corrupt"), 1))
            .isInstanceOf(EventSinkException.class)
            .hasMessageContaining("Corrupt event");
    }

    // ============================================================
    // 스냅샷 이후 읽기
    // ============================================================

    private List<RunEvent> writeSnapshottedLog(FileEventSink sink, EventFixtures events) {
        List<RunEvent> prefix = List.of(events.created("a", "b"), events.started(),
            events.stageStarted("a", 1), events.stageCompleted("a", 1, "A"));
        List<RunEvent> log = new ArrayList<>(prefix);
        log.add(events.snapshot(new RunStateProjector().replay(prefix)));
        log.add(events.stageStarted("b", 1));
        log.add(events.stageCompleted("b", 1, "B"));
        for (RunEvent event : log) {
            sink.append(events.runId(), event);
        }
        return log;
    }

    @Test
    @DisplayName("스냅샷 이후부터 읽으면 스냅샷 앞의 줄은 다시 해석하지 않는다")
    void readAfterSnapshot_skipsEarlierLines() throws Exception {
        // given
        EventFixtures events = EventFixtures.forRun("run-seek");
        FileEventSink sink = new FileEventSink(directory);
        List<RunEvent> log = writeSnapshottedLog(sink, events);
        Path file = directory.resolve("run-seek.jsonl");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        int width = lines.get(2).getBytes(StandardCharsets.UTF_8).length;
        lines.set(2, "#".repeat(width));
        Files.write(file, lines, StandardCharsets.UTF_8);

        // when
        List<RunEvent> suffix = sink.readFrom(events.runId(), 6);
        List<RunEvent> fromSnapshot = sink.readFrom(events.runId(), 5);

        // then
        assertThat(suffix).containsExactlyElementsOf(log.subList(5, 7));
        assertThat(fromSnapshot).containsExactlyElementsOf(log.subList(4, 7));
        assertThatThrownBy(() -> sink.readFrom(events.runId(), 1))
            .isInstanceOf(EventSinkException.class)
            .hasMessageContaining("Corrupt event");
    }

    @Test
    @DisplayName("다시 연 싱크와 새로 기록한 스냅샷도 스냅샷 위치부터 읽는다")
    void snapshotOffset_restoredOnOpenAndMovedOnAppend() {
        // given
        EventFixtures events = EventFixtures.forRun("run-reopen-seek");
        List<RunEvent> log = writeSnapshottedLog(new FileEventSink(directory), events);
        FileEventSink reopened = new FileEventSink(directory);

        // when
        List<RunEvent> suffix = reopened.readFrom(events.runId(), 6);
        StateSnapshot second = events.snapshot(new RunStateProjector().replay(log));
        reopened.append(events.runId(), second);
        RunEvent last = events.completed();
        reopened.append(events.runId(), last);

        // then
        assertThat(suffix).containsExactlyElementsOf(log.subList(5, 7));
        assertThat(reopened.readLatestSnapshot(events.runId())).contains(second);
        assertThat(reopened.readFrom(events.runId(), 9)).containsExactly(last);
        assertThat(reopened.readFrom(events.runId(), 8)).containsExactly(second, last);
        assertThat(reopened.readFrom(events.runId(), 1)).hasSize(9);
    }

    @Test
    @DisplayName("각 이벤트는 타입 이름과 함께 한 줄로 기록된다")
    void eventsStoredAsTypedLines() throws Exception {
        // given
        EventFixtures events = EventFixtures.forRun("run-lines");
        writeLog(events);

        // when
        List<String> lines = Files.readAllLines(directory.resolve("run-lines.jsonl"), StandardCharsets.UTF_8);

        // then
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("{\"@type\":\"RunCreated\"");
        assertThat(lines.get(0)).contains("\"occurredAt\":\"2026-");
        assertThat(lines.get(2)).contains("\"stageId\":\"a\"");
    }
}
