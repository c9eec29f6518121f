package com.meetinganalyzer.drive;

import com.meetinganalyzer.RecordingSleeper;
import com.meetinganalyzer.TestProperties;
import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.common.util.BackoffPolicy;
import com.meetinganalyzer.drive.model.ObjectChunk;
import com.meetinganalyzer.drive.model.SourceObject;
import com.meetinganalyzer.drive.service.MediaFetcher;
import com.meetinganalyzer.drive.service.ObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaFetcherTest {

    @TempDir
    Path tempDir;

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final BackoffPolicy backoffPolicy = new BackoffPolicy(
            Duration.ofMillis(800), Duration.ofMillis(300), Duration.ofSeconds(8), sleeper, () -> 0.0);

    @Test
    void downloadsInChunksAndReportsProgress() throws Exception {
        ScriptedStore store = new ScriptedStore(bytes(10_000));
        List<Integer> progress = new ArrayList<>();

        Path path = fetcher(store, 0).retrieve("obj-1", "call one.mp3", (name, percent) -> progress.add(percent));

        assertThat(path.getFileName().toString()).isEqualTo("obj-1_call_one.mp3");
        assertThat(Files.readAllBytes(path)).isEqualTo(store.content);
        assertThat(store.offsets).containsExactly(0L, 4096L, 8192L);
        assertThat(progress).containsExactly(40, 81, 100);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void unknownTotalKeepsReadingUntilTheStoreRunsOut() throws Exception {
        ScriptedStore store = new ScriptedStore(bytes(8192));
        store.hideTotal();
        List<Integer> progress = new ArrayList<>();

        Path path = fetcher(store, 0).retrieve("obj-1", "call.mp3", (name, percent) -> progress.add(percent));

        assertThat(Files.readAllBytes(path)).isEqualTo(store.content);
        assertThat(store.offsets).containsExactly(0L, 4096L, 8192L);
        assertThat(progress).containsExactly(100);
    }

    @Test
    void unknownTotalStopsAtAShortChunk() throws Exception {
        ScriptedStore store = new ScriptedStore(bytes(10_000));
        store.hideTotal();

        Path path = fetcher(store, 0).retrieve("obj-1", "call.mp3");

        assertThat(Files.readAllBytes(path)).isEqualTo(store.content);
        assertThat(store.offsets).containsExactly(0L, 4096L, 8192L);
    }

    @Test
    void transientFailuresRetryTheSameChunkWithGrowingBackoff() throws Exception {
        ScriptedStore store = new ScriptedStore(bytes(10_000));
        store.failAt(4096, transientError(), transientError());

        Path path = fetcher(store, 0).retrieve("obj-1", "call.mp3");

        assertThat(Files.readAllBytes(path)).isEqualTo(store.content);
        assertThat(store.offsets).containsExactly(0L, 4096L, 4096L, 4096L, 8192L);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(800), Duration.ofMillis(1600));
    }

    @Test
    void attemptCounterResetsAfterSuccessfulChunk() {
        ScriptedStore store = new ScriptedStore(bytes(10_000));
        store.failAt(0, transientError());
        store.failAt(4096, transientError());

        fetcher(store, 2).retrieve("obj-1", "call.mp3");

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(800), Duration.ofMillis(800));
    }

    @Test
    void givesUpAfterConfiguredAttemptsAndRemovesPartialFile() {
        ScriptedStore store = new ScriptedStore(bytes(10_000));
        store.failAt(4096, transientError(), transientError(), transientError(), transientError());

        assertThatThrownBy(() -> fetcher(store, 3).retrieve("obj-1", "call.mp3"))
                .isInstanceOf(PipelineException.class)
                .satisfies(error -> assertThat(((PipelineException) error).getKind()).isEqualTo(ErrorKind.RETRIEVAL_FAILED));

        assertThat(sleeper.sleeps()).hasSize(2);
        assertThat(tempDir.resolve("obj-1_call.mp3")).doesNotExist();
    }

    @Test
    void nonTransientFailureAbortsWithoutRetry() {
        ScriptedStore store = new ScriptedStore(bytes(10_000));
        store.failAt(0, new PipelineException(ErrorKind.RETRIEVAL_FAILED, "404 Not Found"));

        assertThatThrownBy(() -> fetcher(store, 0).retrieve("obj-1", "call.mp3"))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("404")
                .satisfies(error -> assertThat(((PipelineException) error).getKind()).isEqualTo(ErrorKind.RETRIEVAL_FAILED));

        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(tempDir.resolve("obj-1_call.mp3")).doesNotExist();
    }

    @Test
    void failingProgressListenerDoesNotBreakTheDownload() throws Exception {
        ScriptedStore store = new ScriptedStore(bytes(5_000));

        Path path = fetcher(store, 0).retrieve("obj-1", "call.mp3", (name, percent) -> {
            throw new IllegalStateException("ui gone");
        });

        assertThat(Files.size(path)).isEqualTo(5_000);
    }

    private MediaFetcher fetcher(ObjectStore store, int maxChunkAttempts) {
        return new MediaFetcher(store, backoffPolicy, TestProperties.builder()
                .tmpDir(tempDir.toString())
                .chunkSize(4096)
                .maxChunkAttempts(maxChunkAttempts)
                .build());
    }

    private static PipelineException transientError() {
        return new PipelineException(ErrorKind.TRANSIENT_TRANSFER, "503 Service Unavailable");
    }

    private static byte[] bytes(int size) {
        byte[] data = new byte[size];
        new Random(42).nextBytes(data);
        return data;
    }

    private static final class ScriptedStore implements ObjectStore {

        private final byte[] content;
        private final List<Long> offsets = new ArrayList<>();
        private final Map<Long, Deque<RuntimeException>> failures = new HashMap<>();
        private boolean totalHidden;

        ScriptedStore(byte[] content) {
            this.content = content;
        }

        void hideTotal() {
            totalHidden = true;
        }

        void failAt(long offset, RuntimeException... errors) {
            failures.computeIfAbsent(offset, key -> new ArrayDeque<>()).addAll(List.of(errors));
        }

        @Override
        public ObjectChunk readChunk(String objectId, long offset, long length) {
            offsets.add(offset);
            Deque<RuntimeException> pending = failures.get(offset);
            if (pending != null && !pending.isEmpty()) {
                throw pending.poll();
            }
            if (offset >= content.length) {
                return new ObjectChunk(new byte[0], offset);
            }
            int end = (int) Math.min(content.length, offset + length);
            long total = totalHidden ? ObjectChunk.UNKNOWN_TOTAL : content.length;
            return new ObjectChunk(Arrays.copyOfRange(content, (int) offset, end), total);
        }

        @Override
        public List<SourceObject> listFolders(String parentId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<SourceObject> listMedia(String folderId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<SourceObject> listChildren(String folderId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<String> getParents(String objectId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void updateParents(String objectId, String addParent, List<String> removeParents) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void annotate(String objectId, String description) {
            throw new UnsupportedOperationException();
        }
    }
}
