package com.codeagent.engine.trajectory;

import com.codeagent.engine.config.JacksonConfig;
import com.codeagent.engine.exception.InvalidTrajectoryFormatException;
import com.codeagent.engine.exception.TrajectoryException;
import com.codeagent.engine.exception.TrajectoryNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only journal of everything an agent did.
 *
 * Appends take the write lock. With a file attached, every append rewrites the
 * whole JSON document before the lock is released, so the file always holds a
 * complete trajectory. One recorder can outlive many task runs.
 */
@Slf4j
public class TrajectoryRecorder {

    public static final String DEFAULT_DIRECTORY = "trajectories";
    public static final String DEFAULT_AGENT_TYPE = "coding_agent";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final ObjectMapper MAPPER = JacksonConfig.newObjectMapper();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<TrajectoryEntry> entries = new ArrayList<>();
    private final String id = UUID.randomUUID().toString();
    private final Path filePath;
    private final boolean autoSave;
    private volatile String agentType = DEFAULT_AGENT_TYPE;

    private TrajectoryRecorder(Path filePath, boolean autoSave) {
        this.filePath = filePath;
        this.autoSave = autoSave;
    }

    /** In-memory recorder; {@link #save()} is a no-op. */
    public static TrajectoryRecorder inMemory() {
        return new TrajectoryRecorder(null, false);
    }

    /** Recorder that rewrites {@code path} after every append. */
    public static TrajectoryRecorder withFile(Path path) {
        return new TrajectoryRecorder(path, true);
    }

    public static TrajectoryRecorder withAutoFilename() {
        return withAutoFilename(Paths.get(DEFAULT_DIRECTORY));
    }

    /** {@code <directory>/trajectory_yyyyMMdd_HHmmss.json} */
    public static TrajectoryRecorder withAutoFilename(Path directory) {
        String filename = "trajectory_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".json";
        return withFile(directory.resolve(filename));
    }

    public void setAgentType(String agentType) {
        this.agentType = agentType;
    }

    /**
     * Append an entry, then persist if auto-save is on.
     *
     * @throws TrajectoryException if the document could not be written
     */
    public void record(TrajectoryEntry entry) {
        lock.writeLock().lock();
        try {
            entries.add(entry);
            if (autoSave) {
                writeFile(buildTrajectory());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<TrajectoryEntry> getEntries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int entryCount() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Write the current document to the attached file, if any. */
    public void save() {
        if (filePath == null) return;
        lock.writeLock().lock();
        try {
            writeFile(buildTrajectory());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Trajectory toTrajectory() {
        lock.readLock().lock();
        try {
            return buildTrajectory();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Path> filePath() {
        return Optional.ofNullable(filePath);
    }

    public boolean isAutoSave() {
        return autoSave;
    }

    /**
     * Read a trajectory document.
     *
     * @throws TrajectoryNotFoundException      if nothing exists at {@code path}
     * @throws InvalidTrajectoryFormatException if the file is not a trajectory document
     */
    public static Trajectory load(Path path) {
        if (!Files.exists(path)) {
            throw new TrajectoryNotFoundException(path.toString());
        }

        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TrajectoryException("Failed to read trajectory: " + path, e);
        }

        Trajectory trajectory;
        try {
            trajectory = MAPPER.readValue(json, Trajectory.class);
        } catch (JsonProcessingException e) {
            throw new InvalidTrajectoryFormatException(path.toString(), e);
        }
        if (trajectory == null || trajectory.getMetadata() == null || trajectory.getEntries() == null) {
            throw new InvalidTrajectoryFormatException(path.toString(), null);
        }
        return trajectory;
    }

    // caller holds a lock
    private Trajectory buildTrajectory() {
        List<TrajectoryEntry> snapshot = List.copyOf(entries);

        Instant startedAt = snapshot.isEmpty() ? Instant.now() : snapshot.get(0).getTimestamp();
        Instant completedAt = snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1).getTimestamp();
        Long durationMs = completedAt != null ? completedAt.toEpochMilli() - startedAt.toEpochMilli() : null;

        String task = null;
        Boolean success = null;
        int totalSteps = 0;
        for (TrajectoryEntry entry : snapshot) {
            if (entry.getEntryType() instanceof EntryType.TaskStart start) {
                task = start.getTask();
            } else if (entry.getEntryType() instanceof EntryType.TaskComplete complete) {
                success = complete.isSuccess();
            }
            totalSteps = Math.max(totalSteps, entry.getStep());
        }

        TrajectoryMetadata metadata = TrajectoryMetadata.builder()
                .id(id)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .version(TrajectoryMetadata.FORMAT_VERSION)
                .agentType(agentType)
                .task(task)
                .success(success)
                .totalSteps(totalSteps)
                .durationMs(durationMs)
                .build();
        return new Trajectory(metadata, snapshot);
    }

    // caller holds the write lock
    private void writeFile(Trajectory trajectory) {
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(filePath, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(trajectory),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TrajectoryException("Failed to save trajectory to " + filePath, e);
        }
    }
}
