package com.ryuqq.conductor.adapter.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ryuqq.conductor.adapter.file.json.ConductorJson;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.exception.EventSinkException;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.spi.EventSequencing;
import com.ryuqq.conductor.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File-backed {@link EventSink}: one JSON Lines file per run.
 *
 * <p>Each event is one line of {@code <directory>/<runId>.jsonl}. Appends are written
 * with {@link StandardOpenOption#DSYNC}, so {@link #append} returns only after the
 * bytes reached the device.</p>
 *
 * <p><strong>Recovery:</strong></p>
 * <ul>
 *   <li>A trailing line that is unterminated or unreadable is a torn write; it is
 *       truncated away when the run's file is first opened</li>
 *   <li>An unreadable line followed by readable ones is corruption and fails every
 *       read of that run with {@link EventSinkException}</li>
 * </ul>
 *
 * <p>Each run's file is opened lazily and then cached together with its last sequence,
 * its latest snapshot and that snapshot's byte offset. Reads that start at or after the
 * latest snapshot seek to it and parse only the lines from there on. One
 * {@code FileEventSink} must own a directory; two sinks over the same directory would
 * not see each other's appends.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(FileEventSink.class);
    private static final String SUFFIX = ".jsonl";

    private final Path directory;
    private final ObjectWriter writer;
    private final ObjectReader reader;
    private final ConcurrentHashMap<RunId, RunFile> files = new ConcurrentHashMap<>();

    public FileEventSink(Path directory) {
        this(directory, ConductorJson.createObjectMapper());
    }

    public FileEventSink(Path directory, ObjectMapper objectMapper) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new EventSinkException("Cannot create event directory " + directory, e);
        }
        this.directory = directory;
        this.writer = objectMapper.writerFor(RunEvent.class);
        this.reader = objectMapper.readerFor(RunEvent.class);
    }

    @Override
    public void append(RunId runId, RunEvent event) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunFile file = open(runId);
        synchronized (file) {
            EventSequencing.checkAppend(runId, event, file.lastSequence);
            byte[] line = encode(event);
            try (FileChannel channel = FileChannel.open(file.path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND, StandardOpenOption.DSYNC)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            } catch (IOException e) {
                throw new EventSinkException("Failed to append event " + event.sequence() + " of run " + runId, e);
            }
            file.lastSequence = event.sequence();
            if (event instanceof StateSnapshot) {
                file.latestSnapshot = (StateSnapshot) event;
                file.snapshotOffset = file.size;
                file.suffixOffset = file.size + line.length;
            }
            file.size += line.length;
        }
    }

    @Override
    public List<RunEvent> readFrom(RunId runId, long fromSequence) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunFile file = open(runId);
        synchronized (file) {
            List<RunEvent> result = new ArrayList<>();
            for (RunEvent event : load(file.path, startOffset(file, fromSequence)).events) {
                if (event.sequence() >= fromSequence) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    @Override
    public Optional<StateSnapshot> readLatestSnapshot(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunFile file = open(runId);
        synchronized (file) {
            return Optional.ofNullable(file.latestSnapshot);
        }
    }

    @Override
    public List<RunId> runIds() {
        List<RunId> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path path : stream) {
                if (Files.size(path) > 0) {
                    String name = path.getFileName().toString();
                    result.add(RunId.of(name.substring(0, name.length() - SUFFIX.length())));
                }
            }
        } catch (IOException e) {
            throw new EventSinkException("Failed to list runs in " + directory, e);
        }
        return result;
    }

    private RunFile open(RunId runId) {
        return files.computeIfAbsent(runId, id -> {
            Path path = directory.resolve(id.getValue() + SUFFIX);
            Loaded loaded = load(path, 0);
            if (loaded.torn) {
                truncate(path, loaded.validLength);
            }
            RunFile file = new RunFile(path);
            file.size = loaded.validLength;
            if (!loaded.events.isEmpty()) {
                file.lastSequence = loaded.events.get(loaded.events.size() - 1).sequence();
            }
            if (loaded.latestSnapshot != null) {
                file.latestSnapshot = loaded.latestSnapshot;
                file.snapshotOffset = loaded.snapshotOffset;
                file.suffixOffset = loaded.suffixOffset;
            }
            return file;
        });
    }

    private static long startOffset(RunFile file, long fromSequence) {
        if (file.latestSnapshot == null || fromSequence < file.latestSnapshot.sequence()) {
            return 0;
        }
        return fromSequence == file.latestSnapshot.sequence() ? file.snapshotOffset : file.suffixOffset;
    }

    private Loaded load(Path path, long start) {
        if (!Files.exists(path)) {
            return new Loaded(List.of(), start, false);
        }
        byte[] bytes = readBytes(path, start);

        Loaded loaded = new Loaded(new ArrayList<>(), start, false);
        int offset = 0;
        while (offset < bytes.length) {
            int end = indexOf(bytes, (byte) '\n', offset);
            if (end < 0) {
                log.warn("Truncating unterminated trailing event in {} at byte {}", path, start + offset);
                return loaded.tornAt(start + offset);
            }
            String line = new String(bytes, offset, end - offset, StandardCharsets.UTF_8);
            RunEvent event;
            try {
                event = reader.readValue(line);
            } catch (IOException e) {
                if (end + 1 < bytes.length) {
                    throw new EventSinkException("Corrupt event at byte " + (start + offset) + " of " + path, e);
                }
                log.warn("Truncating unreadable trailing event in {} at byte {}", path, start + offset, e);
                return loaded.tornAt(start + offset);
            }
            loaded.events.add(event);
            if (event instanceof StateSnapshot) {
                loaded.latestSnapshot = (StateSnapshot) event;
                loaded.snapshotOffset = start + offset;
                loaded.suffixOffset = start + end + 1;
            }
            offset = end + 1;
        }
        loaded.validLength = start + bytes.length;
        return loaded;
    }

    private static byte[] readBytes(Path path, long start) {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long remaining = channel.size() - start;
            if (remaining <= 0) {
                return new byte[0];
            }
            if (remaining > Integer.MAX_VALUE) {
                throw new EventSinkException("Event file " + path + " is too large to read from byte " + start);
            }
            ByteBuffer buffer = ByteBuffer.allocate((int) remaining);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, start + buffer.position()) < 0) {
                    break;
                }
            }
            return buffer.array();
        } catch (IOException e) {
            throw new EventSinkException("Failed to read " + path, e);
        }
    }

    private static void truncate(Path path, long length) {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.DSYNC)) {
            channel.truncate(length);
        } catch (IOException e) {
            throw new EventSinkException("Failed to truncate torn tail of " + path, e);
        }
    }

    private byte[] encode(RunEvent event) {
        try {
            return (writer.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new EventSinkException("Cannot serialize " + event.type() + " of run " + event.runId(), e);
        }
    }

    private static int indexOf(byte[] bytes, byte target, int from) {
        for (int i = from; i < bytes.length; i++) {
            if (bytes[i] == target) {
                return i;
            }
        }
        return -1;
    }

    private static final class RunFile {
        private final Path path;
        private long lastSequence;
        private long size;
        private StateSnapshot latestSnapshot;
        private long snapshotOffset;
        private long suffixOffset;

        private RunFile(Path path) {
            this.path = path;
        }
    }

    private static final class Loaded {
        private final List<RunEvent> events;
        private long validLength;
        private boolean torn;
        private StateSnapshot latestSnapshot;
        private long snapshotOffset;
        private long suffixOffset;

        private Loaded(List<RunEvent> events, long validLength, boolean torn) {
            this.events = events;
            this.validLength = validLength;
            this.torn = torn;
        }

        private Loaded tornAt(long offset) {
            this.validLength = offset;
            this.torn = true;
            return this;
        }
    }
}
