package com.whereq.newscaster.store;

import com.whereq.newscaster.exception.JobStoreException;
import com.whereq.newscaster.model.Job;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per job. Records are replaced atomically so a crash never
 * leaves a half-written record behind.
 */
@Slf4j
public class FileJobRecordStore extends AbstractJobRecordStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final JobRecordCodec codec;

    public FileJobRecordStore(Path directory, JobRecordCodec codec) {
        this.directory = directory;
        this.codec = codec;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new JobStoreException("Cannot create job store directory " + directory, e);
        }
        log.info("Initialized file job store at {}", directory.toAbsolutePath());
    }

    @Override
    protected Optional<Job> read(String id) {
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new JobStoreException("Failed to read job record " + file, e);
        }
    }

    @Override
    protected void write(Job job) {
        Path target = fileFor(job.getId());
        try {
            Path temp = Files.createTempFile(directory, ".job-", ".tmp");
            Files.writeString(temp, codec.encode(job), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to write job record " + target, e);
        }
    }

    @Override
    protected List<Job> readAll() {
        List<Job> jobs = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(f -> f.getFileName().toString().endsWith(SUFFIX))
                .sorted()
                .forEach(f -> {
                    try {
                        jobs.add(codec.decode(Files.readString(f, StandardCharsets.UTF_8)));
                    } catch (IOException | JobStoreException e) {
                        log.warn("Skipping unreadable job record {}: {}", f, e.getMessage());
                    }
                });
        } catch (IOException e) {
            throw new JobStoreException("Failed to list job records in " + directory, e);
        }
        return jobs;
    }

    @Override
    public long count() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            throw new JobStoreException("Failed to count job records in " + directory, e);
        }
    }

    /**
     * Percent-encodes every byte outside [A-Za-z0-9._-], so distinct ids
     * always map to distinct files inside the store directory.
     */
    Path fileFor(String id) {
        StringBuilder name = new StringBuilder(id.length() + SUFFIX.length());
        for (byte b : id.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '.' || c == '_' || c == '-') {
                name.append(c);
            } else {
                name.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return directory.resolve(name.append(SUFFIX).toString());
    }
}
