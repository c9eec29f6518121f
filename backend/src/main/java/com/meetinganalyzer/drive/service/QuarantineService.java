package com.meetinganalyzer.drive.service;

import com.meetinganalyzer.common.util.BackoffPolicy;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.SourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class QuarantineService {

    private static final Logger log = LoggerFactory.getLogger(QuarantineService.class);
    static final String DESCRIPTION_PREFIX = "Quarantined: ";
    static final int MAX_REASON_LENGTH = 300;

    private final ObjectStore objectStore;
    private final BackoffPolicy backoffPolicy;
    private final AppProperties appProperties;

    public QuarantineService(ObjectStore objectStore, BackoffPolicy backoffPolicy, AppProperties appProperties) {
        this.objectStore = objectStore;
        this.backoffPolicy = backoffPolicy;
        this.appProperties = appProperties;
    }

    public boolean quarantine(String objectId, String currentFolderId, String reason) {
        String text = reason == null ? "" : reason;
        if (text.length() > MAX_REASON_LENGTH) {
            text = text.substring(0, MAX_REASON_LENGTH);
        }
        try {
            objectStore.annotate(objectId, DESCRIPTION_PREFIX + text);
        } catch (RuntimeException exception) {
            log.warn("Could not annotate {} before quarantine: {}", objectId, exception.getMessage());
        }

        boolean moved = move(objectId, currentFolderId, appProperties.drive().quarantineFolderId());
        if (moved) {
            log.info("Quarantined {}: {}", objectId, text);
        } else {
            log.error("Quarantine of {} failed; object left in {}", objectId, currentFolderId);
        }
        return moved;
    }

    public boolean moveToProcessed(String objectId, String currentFolderId) {
        boolean moved = move(objectId, currentFolderId, appProperties.drive().processedFolderId());
        if (moved) {
            log.info("Moved {} to processed folder", objectId);
        }
        return moved;
    }

    public List<SourceObject> releaseExpired(Instant now) {
        int hours = appProperties.quarantine().autoRetryAfterHours();
        String target = retryTarget();
        Instant cutoff = now.minus(Duration.ofHours(hours));

        List<SourceObject> candidates;
        try {
            candidates = objectStore.listChildren(appProperties.drive().quarantineFolderId());
        } catch (RuntimeException exception) {
            log.error("Unable to list quarantine folder", exception);
            return List.of();
        }

        List<SourceObject> released = new ArrayList<>();
        for (SourceObject candidate : candidates) {
            if (candidate.isFolder() || candidate.createdTime() == null || candidate.createdTime().isAfter(cutoff)) {
                continue;
            }
            if (move(candidate.id(), appProperties.drive().quarantineFolderId(), target)) {
                log.info("Released {} from quarantine after {}h", candidate.name(), hours);
                released.add(candidate);
            } else {
                log.error("Could not release {} from quarantine", candidate.name());
            }
        }
        return released;
    }

    boolean move(String objectId, String currentFolderId, String targetFolderId) {
        int maxAttempts = appProperties.transfer().moveMaxAttempts();
        RuntimeException lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                List<String> parents = new ArrayList<>(objectStore.getParents(objectId));
                if (parents.isEmpty() && currentFolderId != null) {
                    parents.add(currentFolderId);
                }
                parents.remove(targetFolderId);
                objectStore.updateParents(objectId, targetFolderId, parents);
                return true;
            } catch (RuntimeException exception) {
                lastError = exception;
                log.warn("Move attempt {}/{} for {} failed: {}", attempt + 1, maxAttempts, objectId, exception.getMessage());
                if (attempt + 1 < maxAttempts && !pause(attempt)) {
                    break;
                }
            }
        }

        log.error("Moving {} to {} failed after {} attempts", objectId, targetFolderId, maxAttempts, lastError);
        return false;
    }

    private boolean pause(int attempt) {
        try {
            backoffPolicy.pause(attempt);
            return true;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String retryTarget() {
        String configured = appProperties.quarantine().retryTargetFolderId();
        return configured == null || configured.isBlank() ? appProperties.drive().parentFolderId() : configured;
    }
}
