package com.meetinganalyzer.drive.service;

import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.common.util.BackoffPolicy;
import com.meetinganalyzer.common.util.FileNames;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.ObjectChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Service
public class MediaFetcher {

    private static final Logger log = LoggerFactory.getLogger(MediaFetcher.class);

    private final ObjectStore objectStore;
    private final BackoffPolicy backoffPolicy;
    private final Path tmpDir;
    private final long chunkSize;
    private final int maxChunkAttempts;

    public MediaFetcher(ObjectStore objectStore, BackoffPolicy backoffPolicy, AppProperties appProperties) {
        this.objectStore = objectStore;
        this.backoffPolicy = backoffPolicy;
        this.tmpDir = Path.of(appProperties.runtime().tmpDir());
        this.chunkSize = appProperties.transfer().chunkSizeBytes();
        this.maxChunkAttempts = appProperties.transfer().maxChunkAttempts();
    }

    public Path retrieve(String objectId, String displayName) {
        return retrieve(objectId, displayName, (name, percent) -> log.info("Downloading {}: {}%", name, percent));
    }

    public Path retrieve(String objectId, String displayName, ProgressListener listener) {
        String safeName = FileNames.sanitize(displayName);
        Path target = tmpDir.resolve(objectId + "_" + safeName);

        try {
            Files.createDirectories(tmpDir);
        } catch (IOException exception) {
            throw new PipelineException(ErrorKind.RETRIEVAL_FAILED, "Cannot create temp directory " + tmpDir, exception);
        }

        try (OutputStream output = Files.newOutputStream(target)) {
            transfer(objectId, safeName, output, listener);
        } catch (IOException exception) {
            deletePartial(target);
            throw new PipelineException(ErrorKind.RETRIEVAL_FAILED,
                    "Writing " + safeName + " failed: " + exception.getMessage(), exception);
        } catch (RuntimeException exception) {
            deletePartial(target);
            throw exception;
        }

        log.info("Downloaded {} to {}", displayName, target);
        return target;
    }

    private void transfer(String objectId, String safeName, OutputStream output, ProgressListener listener) throws IOException {
        long offset = 0;
        int attempt = 0;
        int lastPercent = -1;
        boolean done = false;

        while (!done) {
            ObjectChunk chunk;
            try {
                chunk = objectStore.readChunk(objectId, offset, chunkSize);
            } catch (PipelineException exception) {
                if (!exception.isTransient()) {
                    throw new PipelineException(ErrorKind.RETRIEVAL_FAILED,
                            "Retrieval of " + objectId + " failed: " + exception.getMessage(), exception);
                }
                attempt++;
                if (maxChunkAttempts > 0 && attempt >= maxChunkAttempts) {
                    throw new PipelineException(ErrorKind.RETRIEVAL_FAILED,
                            "Retrieval of " + objectId + " gave up after " + attempt + " attempts at offset " + offset,
                            exception);
                }
                Duration delay = pause(objectId, attempt - 1);
                log.warn("Transient error downloading {} at offset {} (attempt {}), retried after {} ms: {}",
                        safeName, offset, attempt, delay.toMillis(), exception.getMessage());
                continue;
            }

            attempt = 0;
            long total = chunk.totalSize();
            if (chunk.length() == 0) {
                if (chunk.totalKnown() && offset < total) {
                    throw new PipelineException(ErrorKind.RETRIEVAL_FAILED,
                            "Empty chunk for " + objectId + " at offset " + offset + " of " + total);
                }
                done = true;
            } else {
                output.write(chunk.data());
                offset += chunk.length();
                // Without a total, only a short chunk or an empty read marks the end.
                done = chunk.totalKnown() ? offset >= total : chunk.length() < chunkSize;
            }

            int percent = lastPercent;
            if (done) {
                percent = 100;
            } else if (total > 0) {
                percent = (int) Math.min(100, offset * 100 / total);
            }
            if (percent != lastPercent) {
                lastPercent = percent;
                report(listener, safeName, percent);
            }
        }
    }

    private Duration pause(String objectId, int attempt) {
        try {
            return backoffPolicy.pause(attempt);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorKind.RETRIEVAL_FAILED, "Interrupted while retrying " + objectId, exception);
        }
    }

    private void report(ProgressListener listener, String safeName, int percent) {
        if (listener == null) {
            return;
        }
        try {
            listener.onProgress(safeName, percent);
        } catch (RuntimeException exception) {
            log.warn("Progress listener failed for {}", safeName, exception);
        }
    }

    private void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException exception) {
            log.warn("Unable to delete partial download {}", target, exception);
        }
    }
}
