package com.assessorai.infrastructure.persistence;

import com.assessorai.domain.pipeline.model.DeadLetterRecord;
import com.assessorai.domain.pipeline.repository.DeadLetterQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Dead letters as {@code <dir>/<runId>-<n>.json}. Files are created with CREATE_NEW
 * and never rewritten.
 */
@Slf4j
public class FileDeadLetterQueue implements DeadLetterQueue {

    private static final Pattern FILE_NAME = Pattern.compile("(.+)-(\\d+)\\.json");

    private final Path directory;
    private final ObjectMapper mapper;

    public FileDeadLetterQueue(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public synchronized DeadLetterRecord append(DeadLetterRecord record) {
        String runId = record.runId();
        if (runId == null || !FileCheckpointStore.RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        try {
            Files.createDirectories(directory);
            int sequence = sequences(runId).stream().max(Integer::compare).orElse(0) + 1;
            while (true) {
                DeadLetterRecord numbered = record.withSequence(sequence);
                Path file = directory.resolve(runId + "-" + sequence + ".json");
                try {
                    Files.write(file, mapper.writeValueAsBytes(numbered), StandardOpenOption.CREATE_NEW);
                    log.error("[DeadLetter] run {} dead-lettered as {} ({})", runId, file.getFileName(),
                            record.errorKind());
                    return numbered;
                } catch (FileAlreadyExistsException e) {
                    sequence++;
                }
            }
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot write dead letter for run " + runId, e);
        }
    }

    @Override
    public List<DeadLetterRecord> findByRunId(String runId) {
        List<DeadLetterRecord> records = new ArrayList<>();
        try {
            for (int sequence : sequences(runId)) {
                Path file = directory.resolve(runId + "-" + sequence + ".json");
                records.add(mapper.readValue(Files.readAllBytes(file), DeadLetterRecord.class));
            }
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot read dead letters for run " + runId, e);
        }
        records.sort(Comparator.comparingInt(DeadLetterRecord::sequence));
        return records;
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> FILE_NAME.matcher(f.getFileName().toString()).matches()).toList()) {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && Files.deleteIfExists(file)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new PipelineStorageException("Cannot purge dead letters in " + directory, e);
        }
        return removed;
    }

    private List<Integer> sequences(String runId) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(f -> FILE_NAME.matcher(f.getFileName().toString()))
                    .filter(Matcher::matches)
                    .filter(m -> m.group(1).equals(runId))
                    .map(m -> Integer.parseInt(m.group(2)))
                    .sorted()
                    .toList();
        }
    }
}
