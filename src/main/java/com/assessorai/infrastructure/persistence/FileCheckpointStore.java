package com.assessorai.infrastructure.persistence;

import com.assessorai.domain.pipeline.model.PipelineState;
import com.assessorai.domain.pipeline.repository.CheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One JSON file per run under {@code <dir>/<runId>.json}; finalized runs move to
 * {@code <dir>/archive/}. Writes go through a temp file and an atomic rename so a
 * crash never leaves a torn checkpoint.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Path archiveDirectory;
    private final ObjectMapper mapper;

    public FileCheckpointStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.archiveDirectory = directory.resolve("archive");
        this.mapper = mapper;
    }

    @Override
    public synchronized void save(PipelineState state) {
        Path target = active(state.getRunId());
        try {
            byte[] bytes = mapper.writeValueAsBytes(state);
            if (Files.exists(target) && Arrays.equals(Files.readAllBytes(target), bytes)) {
                log.debug("[Checkpoint] {} unchanged at {}", state.getRunId(), state.getCheckpointKey());
                return;
            }
            Files.createDirectories(directory);
            writeAtomically(target, bytes);
            log.debug("[Checkpoint] {} saved at {} status={}", state.getRunId(), state.getCheckpointKey(),
                    state.getStatus());
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot write checkpoint for run " + state.getRunId(), e);
        }
    }

    @Override
    public Optional<PipelineState> load(String runId) {
        Path active = active(runId);
        Path archived = archiveDirectory.resolve(runId + SUFFIX);
        Path source = Files.exists(active) ? active : Files.exists(archived) ? archived : null;
        if (source == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(Files.readAllBytes(source), PipelineState.class));
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot read checkpoint for run " + runId, e);
        }
    }

    @Override
    public synchronized void archive(PipelineState state) {
        try {
            Files.createDirectories(archiveDirectory);
            writeAtomically(archiveDirectory.resolve(state.getRunId() + SUFFIX), mapper.writeValueAsBytes(state));
            Files.deleteIfExists(active(state.getRunId()));
            log.info("[Checkpoint] {} archived", state.getRunId());
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot archive run " + state.getRunId(), e);
        }
    }

    @Override
    public synchronized boolean delete(String runId) {
        try {
            return Files.deleteIfExists(active(runId));
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot delete checkpoint for run " + runId, e);
        }
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) {
        return purge(directory, cutoff) + purge(archiveDirectory, cutoff);
    }

    private int purge(Path dir, Instant cutoff) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(f -> f.toString().endsWith(SUFFIX)).toList()) {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && Files.deleteIfExists(file)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot purge checkpoints in " + dir, e);
        }
        return removed;
    }

    private Path active(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return directory.resolve(runId + SUFFIX);
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
