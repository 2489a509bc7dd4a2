package io.twin4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.twin4j.config.TwinProperties;
import io.twin4j.core.DataRecord;
import io.twin4j.core.Job;
import io.twin4j.core.JobHandlerRegistry;
import io.twin4j.core.JobPayload;
import io.twin4j.core.JobStatus;
import io.twin4j.core.QueueNames;
import io.twin4j.core.TriggerKind;
import io.twin4j.core.UploadKind;
import io.twin4j.core.UploadRequest;
import io.twin4j.core.UploadStatus;
import io.twin4j.core.UploadTicket;
import io.twin4j.core.UploadUpdate;
import io.twin4j.database.InMemoryDatabaseAdapter;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.QueueException;
import io.twin4j.errors.ValidationException;
import io.twin4j.storage.LocalStorageService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class UploadProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String STREAM = "assets";

    @TempDir
    Path tempDir;

    private TwinProperties props;
    private LocalStorageService storage;
    private InMemoryDatabaseAdapter db;
    private InMemoryJobStore jobStore;
    private QueueManager queueManager;
    private UploadProcessor processor;
    private Path scratchDir;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        scratchDir = tempDir.resolve("scratch");

        props = new TwinProperties();
        props.setPollInterval(Duration.ofMillis(20));
        props.setWorkerId("worker-test");
        props.getUpload().setScratchDir(scratchDir);
        props.getUpload().setInMemoryThreshold(64);

        storage = new LocalStorageService(tempDir.resolve("blobs"), "https://cdn.example.com", clock);
        db = new InMemoryDatabaseAdapter(storage);
        jobStore = new InMemoryJobStore();
        queueManager = new QueueManager(
                props,
                jobStore,
                new JobHandlerRegistry(List.of(new UploadJobHandler(db, storage, clock))),
                new ObjectMapper()
        );
        processor = new UploadProcessor(props, db, queueManager, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        queueManager.close(Duration.ofSeconds(2));
    }

    @Test
    void smallUploadShouldCompleteWithPublicUrl() throws Exception {
        queueManager.start();
        byte[] content = "hello twin".getBytes(StandardCharsets.UTF_8);

        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM)
                .content(content)
                .filename("notes.txt")
                .contentType("text/plain")
                .description("site notes")
                .build());

        DataRecord record = awaitStatus(ticket, UploadStatus.COMPLETED);
        assertArrayEquals(content, record.data());
        assertEquals("text/plain", record.contentType());
        assertEquals("notes.txt", record.filename());
        assertEquals("site notes", record.description());
        assertEquals(ticket.jobId(), record.uploadJobId());
        assertThat(record.blobRef()).startsWith(STREAM + "/").endsWith(".txt");
        assertEquals("https://cdn.example.com/" + record.blobRef(), record.publicUrl());
        assertNull(record.uploadError());
    }

    @Test
    void privateUploadShouldHaveNoPublicUrl() throws Exception {
        queueManager.start();

        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM)
                .content(new byte[]{1, 2, 3})
                .isPublic(false)
                .build());

        DataRecord record = awaitStatus(ticket, UploadStatus.COMPLETED);
        assertNull(record.publicUrl());
    }

    @Test
    void largeUploadShouldBeSpilledAndScratchFileRemoved() throws Exception {
        byte[] content = new byte[10_000];
        Arrays.fill(content, (byte) 7);

        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM).content(content).extension("bin").build());

        // not started yet: the content waits in the scratch directory
        assertEquals(1, countFiles(scratchDir));
        assertEquals(UploadStatus.PENDING, record(ticket).uploadStatus());

        queueManager.start();
        DataRecord record = awaitStatus(ticket, UploadStatus.COMPLETED);
        assertArrayEquals(content, record.data());
        assertEquals(0, countFiles(scratchDir));
    }

    @Test
    void archiveShouldBeExtractedWithShallowestRootEntry() throws Exception {
        queueManager.start();
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("city/tiles/tileset.json", "{\"nested\":true}");
        entries.put("city/tileset.json", "{\"root\":true}");
        entries.put("city/tiles/0.b3dm", "tile");

        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM)
                .content(zip(entries))
                .filename("city.zip")
                .archive("tileset.json")
                .build());

        DataRecord record = awaitStatus(ticket, UploadStatus.COMPLETED);
        String basePath = STREAM + "/" + NOW.toEpochMilli();
        assertEquals(basePath, record.blobRef());
        assertEquals("https://cdn.example.com/" + basePath + "/city/tileset.json", record.publicUrl());
        assertEquals("tile", new String(storage.retrieve(basePath + "/city/tiles/0.b3dm"), StandardCharsets.UTF_8));
        assertEquals(3, countFiles(storage.baseDir().resolve(basePath)));
    }

    @Test
    void archiveWithoutRootEntryShouldFailAndRemoveExtractedFiles() throws Exception {
        queueManager.start();

        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM)
                .content(zip(Map.of("city/readme.txt", "no tileset here")))
                .archive("tileset.json")
                .build());

        DataRecord record = awaitStatus(ticket, UploadStatus.FAILED);
        assertThat(record.uploadError()).contains("no tileset.json found");
        assertEquals(0, countFiles(storage.baseDir().resolve(STREAM)));
    }

    @Test
    void archiveEscapingItsPrefixShouldFail() throws Exception {
        queueManager.start();

        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM)
                .content(zip(Map.of("../../evil.sh", "rm -rf")))
                .archive(null)
                .build());

        DataRecord record = awaitStatus(ticket, UploadStatus.FAILED);
        assertThat(record.uploadError()).contains("Invalid archive entry");
        assertEquals(0, countFiles(tempDir.resolve("blobs")));
    }

    @Test
    void resubmittingCompletedUploadShouldReturnExistingTicket() throws Exception {
        queueManager.start();
        UploadTicket first = processor.submit(UploadRequest.builder(STREAM).content(new byte[]{1}).build());
        DataRecord completed = awaitStatus(first, UploadStatus.COMPLETED);

        UploadTicket again = processor.submit(UploadRequest.builder(STREAM)
                .recordId(first.recordId())
                .content(new byte[]{2})
                .build());

        assertEquals(first, again);
        assertEquals(completed.blobRef(), record(first).blobRef());
        assertEquals(1, jobStore.countByStatus(QueueNames.UPLOADS).completed());
    }

    @Test
    void resubmittingFailedUploadShouldRetryTheSameRecord() throws Exception {
        queueManager.start();
        UploadTicket first = processor.submit(UploadRequest.builder(STREAM)
                .content(zip(Map.of("readme.txt", "x")))
                .archive("scene.gltf")
                .build());
        awaitStatus(first, UploadStatus.FAILED);

        UploadTicket retry = processor.submit(UploadRequest.builder(STREAM)
                .recordId(first.recordId())
                .content(zip(Map.of("scene.gltf", "{}")))
                .archive("scene.gltf")
                .build());

        assertEquals(first.recordId(), retry.recordId());
        DataRecord record = awaitStatus(retry, UploadStatus.COMPLETED);
        assertNull(record.uploadError());
        assertEquals(retry.jobId(), record.uploadJobId());
    }

    @Test
    void uploadQueueWithRetriesShouldRefuseToStart() {
        props.getQueues().put(QueueNames.UPLOADS, new TwinProperties.QueueOptions(1, 2, Duration.ofMillis(10)));

        assertThatThrownBy(() -> queueManager.start())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maxAttempts = 1");
        assertFalse(queueManager.isRunning());
    }

    @Test
    void uploadJobForSettledRecordShouldFailTheJob() throws Exception {
        queueManager.start();
        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM).content(new byte[]{1}).build());
        DataRecord completed = awaitStatus(ticket, UploadStatus.COMPLETED);

        // a second delivery of the same upload
        UploadJobData replay = new UploadJobData(ticket.recordId(), STREAM, UploadKind.FILE, null, null, null, null, new byte[]{2});
        Map<String, Object> raw = new ObjectMapper().convertValue(replay, new TypeReference<>() {
        });
        String jobId = queueManager.enqueue(QueueNames.UPLOADS, new JobPayload(STREAM, TriggerKind.UPLOAD, raw));

        waitUntil(3, TimeUnit.SECONDS, () -> jobStatus(jobId) == JobStatus.FAILED);
        assertThat(queueManager.findJob(jobId).orElseThrow().lastError()).contains("is COMPLETED, expected PENDING");
        assertEquals(UploadStatus.COMPLETED, record(ticket).uploadStatus());
        assertEquals(completed.blobRef(), record(ticket).blobRef());
    }

    @Test
    void resubmittingPendingUploadShouldBeRejected() {
        UploadTicket ticket = processor.submit(UploadRequest.builder(STREAM).content(new byte[]{1}).build());

        assertThatThrownBy(() -> processor.submit(UploadRequest.builder(STREAM)
                .recordId(ticket.recordId())
                .content(new byte[]{1})
                .build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("still PENDING");
    }

    @Test
    void recordLeftProcessingByFailedJobShouldAcceptResubmission() throws Exception {
        UploadTicket first = processor.submit(UploadRequest.builder(STREAM).content(new byte[]{1}).build());
        // the process died after the job was force-failed, before the record was updated
        Job claimed = jobStore.claimNext(QueueNames.UPLOADS, Instant.now(), Set.of(), "worker-gone").orElseThrow();
        db.updateUploadState(STREAM, first.recordId(), UploadUpdate.processing(claimed.jobId()));
        jobStore.markFailed(claimed.jobId(), "worker-gone", "Job cancelled: shutdown grace period expired", Instant.now());

        UploadTicket retry = processor.submit(UploadRequest.builder(STREAM)
                .recordId(first.recordId())
                .content(new byte[]{2})
                .build());
        queueManager.start();

        assertEquals(first.recordId(), retry.recordId());
        assertNotEquals(first.jobId(), retry.jobId());
        DataRecord record = awaitStatus(retry, UploadStatus.COMPLETED);
        assertArrayEquals(new byte[]{2}, record.data());
        assertEquals(retry.jobId(), record.uploadJobId());
    }

    @Test
    void resubmittingUnknownRecordShouldBeRejected() {
        db.createTable(STREAM);

        assertThatThrownBy(() -> processor.submit(UploadRequest.builder(STREAM)
                .recordId("404")
                .content(new byte[]{1})
                .build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void enqueueFailureShouldMarkRecordFailed() throws Exception {
        queueManager.close(Duration.ofSeconds(1));
        byte[] content = new byte[1_000];

        assertThatThrownBy(() -> processor.submit(UploadRequest.builder(STREAM).content(content).build()))
                .isInstanceOf(QueueException.class);

        DataRecord record = db.getLatestByName(STREAM).orElseThrow();
        assertEquals(UploadStatus.FAILED, record.uploadStatus());
        assertThat(record.uploadError()).startsWith("Enqueue failed");
        assertEquals(0, countFiles(scratchDir));
    }

    private JobStatus jobStatus(String jobId) {
        return queueManager.findJob(jobId).map(Job::status).orElse(null);
    }

    private DataRecord record(UploadTicket ticket) {
        return db.getById(ticket.streamName(), ticket.recordId()).orElseThrow();
    }

    private DataRecord awaitStatus(UploadTicket ticket, UploadStatus status) throws InterruptedException {
        waitUntil(3, TimeUnit.SECONDS, () -> record(ticket).uploadStatus() == status);
        return record(ticket);
    }

    private static long countFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).count();
        }
    }

    private static byte[] zip(Map<String, String> entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static void waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Condition not met within " + timeout + " " + unit);
    }
}
