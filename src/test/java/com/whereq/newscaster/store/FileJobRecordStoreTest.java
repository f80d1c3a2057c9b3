package com.whereq.newscaster.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.newscaster.exception.JobNotFoundException;
import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobError;
import com.whereq.newscaster.model.JobKind;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.model.RenderInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileJobRecordStoreTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path directory;

    private JobRecordCodec codec;
    private FileJobRecordStore store;

    @BeforeEach
    void setUp() {
        codec = new JobRecordCodec(new ObjectMapper());
        store = new FileJobRecordStore(directory, codec);
    }

    private Job submitted(String id) {
        return Job.submitted(id, JobKind.VIDEO_RENDER,
            List.of(RenderInput.video("https://cdn.example.com/avatar.mp4"), RenderInput.audio("https://cdn.example.com/a.mp3")),
            CREATED);
    }

    @Test
    @DisplayName("Saved job is readable after reopening the store")
    void survivesReopen() {
        // given
        store.save(submitted("abc123"));
        store.update("abc123", job -> {
            job.setStatus(JobStatus.COMPLETED);
            job.setRemoteOutputUrl("https://render.example.com/out.mp4");
        });

        // when
        FileJobRecordStore reopened = new FileJobRecordStore(directory, codec);
        Job loaded = reopened.load("abc123");

        // then
        assertThat(loaded.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(loaded.getRemoteOutputUrl()).isEqualTo("https://render.example.com/out.mp4");
        assertThat(loaded.getCreatedAt()).isEqualTo(CREATED);
        assertThat(loaded.getInputs()).hasSize(2);
        assertThat(loaded.getKind()).isEqualTo(JobKind.VIDEO_RENDER);
    }

    @Test
    @DisplayName("Record is written with snake_case fields and ISO timestamps")
    void persistedFormat() throws Exception {
        // given
        store.save(submitted("abc123"));
        store.update("abc123", job -> job.setRehostedUrl("https://bucket.s3.us-west-2.amazonaws.com/videos/x.mp4"));

        // when
        String json = Files.readString(directory.resolve("abc123.json"), StandardCharsets.UTF_8);

        // then
        assertThat(json).contains("\"id\":\"abc123\"");
        assertThat(json).contains("\"rehosted_url\":");
        assertThat(json).contains("\"created_at\":\"2024-05-01T10:00:00Z\"");
        assertThat(json).contains("\"status\":\"SUBMITTED\"");
    }

    @Test
    @DisplayName("Terminal status never reverts, other fields still merge")
    void terminalStatusIsMonotonic() {
        // given
        store.save(submitted("abc123"));
        store.update("abc123", job -> {
            job.setStatus(JobStatus.FAILED);
            job.setError(JobError.of(ErrorKind.REMOTE_JOB_FAILURE, "bad audio"));
        });

        // when
        Job after = store.update("abc123", job -> {
            job.setStatus(JobStatus.PROCESSING);
            job.setError(null);
            job.setAttempts(7);
        });

        // then
        assertThat(after.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(after.getError().getMessage()).isEqualTo("bad audio");
        assertThat(after.getAttempts()).isEqualTo(7);
        assertThat(store.load("abc123").getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    @DisplayName("POLLING_TIMEOUT is never written")
    void pollingTimeoutNotPersisted() {
        // given
        store.save(submitted("abc123"));
        store.update("abc123", job -> job.setStatus(JobStatus.PROCESSING));

        // when
        Job after = store.update("abc123", job -> job.setStatus(JobStatus.POLLING_TIMEOUT));

        // then
        assertThat(after.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(store.load("abc123").getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    @DisplayName("A new record saved as POLLING_TIMEOUT is stored as PROCESSING")
    void newPollingTimeoutRecordStoredAsProcessing() {
        // given
        Job job = submitted("late");
        job.setStatus(JobStatus.POLLING_TIMEOUT);

        // when
        store.save(job);

        // then
        assertThat(store.load("late").getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    @DisplayName("Unknown id is reported as not found")
    void unknownId() {
        assertThat(store.find("missing")).isEmpty();
        assertThatThrownBy(() -> store.load("missing"))
            .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.update("missing", job -> job.setAttempts(1)))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Concurrent updates of the same job are serialized")
    void concurrentUpdates() throws Exception {
        // given
        store.save(submitted("abc123"));
        ExecutorService pool = Executors.newFixedThreadPool(8);

        // when
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            futures.add(pool.submit(() -> store.update("abc123", job -> job.setAttempts(job.getAttempts() + 1))));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        // then
        assertThat(store.load("abc123").getAttempts()).isEqualTo(40);
    }

    @Test
    @DisplayName("Unreadable files are skipped when listing")
    void listSkipsCorruptRecords() throws Exception {
        // given
        store.save(submitted("one"));
        store.save(submitted("two"));
        Files.writeString(directory.resolve("broken.json"), "{not json", StandardCharsets.UTF_8);

        // when
        List<Job> jobs = store.list();

        // then
        assertThat(jobs).extracting(Job::getId).containsExactlyInAnyOrder("one", "two");
    }

    @Test
    @DisplayName("Ids are mapped to safe file names")
    void fileNamesAreSanitized() {
        assertThat(store.fileFor("../etc/passwd").getFileName().toString()).isEqualTo("..%2Fetc%2Fpasswd.json");
        assertThat(store.fileFor("../etc/passwd").getParent()).isEqualTo(directory);
        assertThat(store.fileFor("job_42.v1-a").getFileName().toString()).isEqualTo("job_42.v1-a.json");
        assertThat(store.fileFor("100%").getFileName().toString()).isEqualTo("100%25.json");
    }

    @Test
    @DisplayName("Ids that differ only in unsafe characters keep separate records")
    void similarIdsDoNotCollide() {
        // given
        Job slashed = submitted("a/b");
        slashed.setItemId("first");
        Job underscored = submitted("a_b");
        underscored.setItemId("second");
        Job encodedLookalike = submitted("a%2Fb");
        encodedLookalike.setItemId("third");

        // when
        store.save(slashed);
        store.save(underscored);
        store.save(encodedLookalike);

        // then
        assertThat(store.load("a/b").getItemId()).isEqualTo("first");
        assertThat(store.load("a_b").getItemId()).isEqualTo("second");
        assertThat(store.load("a%2Fb").getItemId()).isEqualTo("third");
        assertThat(store.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Count reports stored records without decoding them")
    void countsRecordFiles() throws Exception {
        // given
        store.save(submitted("one"));
        store.save(submitted("two"));
        Files.writeString(directory.resolve(".job-123.tmp"), "partial", StandardCharsets.UTF_8);

        // when / then
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Returned jobs are copies")
    void returnsCopies() {
        // given
        store.save(submitted("abc123"));

        // when
        Job loaded = store.load("abc123");
        loaded.setStatus(JobStatus.FAILED);

        // then
        assertThat(store.load("abc123").getStatus()).isEqualTo(JobStatus.SUBMITTED);
    }
}
