package com.meetinganalyzer.pipeline.service;

import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.SourceObject;
import com.meetinganalyzer.drive.service.FolderDiscoveryService;
import com.meetinganalyzer.drive.service.QuarantineService;
import com.meetinganalyzer.ledger.model.LedgerStatus;
import com.meetinganalyzer.ledger.service.LedgerService;
import com.meetinganalyzer.pipeline.model.RunSummary;
import com.meetinganalyzer.pipeline.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class BatchRunService {

    private static final Logger log = LoggerFactory.getLogger(BatchRunService.class);

    private final FolderDiscoveryService folderDiscoveryService;
    private final LedgerService ledgerService;
    private final QuarantineService quarantineService;
    private final MeetingPipeline meetingPipeline;
    private final AppProperties appProperties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BatchRunService(FolderDiscoveryService folderDiscoveryService,
                           LedgerService ledgerService,
                           QuarantineService quarantineService,
                           MeetingPipeline meetingPipeline,
                           AppProperties appProperties,
                           Clock clock) {
        this.folderDiscoveryService = folderDiscoveryService;
        this.ledgerService = ledgerService;
        this.quarantineService = quarantineService;
        this.meetingPipeline = meetingPipeline;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public RunSummary runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.warn("A run is already in progress; skipping this trigger");
            return RunSummary.notStarted();
        }
        try {
            return execute();
        } finally {
            running.set(false);
        }
    }

    private RunSummary execute() {
        try {
            ledgerService.refresh();
        } catch (RuntimeException exception) {
            log.error("Unable to load the ledger; aborting run", exception);
            return RunSummary.notStarted();
        }

        int released = releaseQuarantined();

        List<WorkItem> items = new ArrayList<>();
        int alreadyProcessed = 0;
        for (Map.Entry<String, String> member : folderDiscoveryService.discoverMemberFolders().entrySet()) {
            for (SourceObject source : folderDiscoveryService.listPending(member.getValue())) {
                if (ledgerService.isProcessed(source.id())) {
                    alreadyProcessed++;
                    continue;
                }
                items.add(new WorkItem(source, member.getKey(), member.getValue()));
            }
        }
        log.info("Run started: {} pending, {} already processed, {} released from quarantine",
                items.size(), alreadyProcessed, released);

        Counters counters = new Counters();
        int workers = Math.max(1, appProperties.run().workers());
        if (workers == 1 || items.size() <= 1) {
            items.forEach(item -> processOne(item, counters));
        } else {
            runParallel(items, workers, counters);
        }

        RunSummary summary = new RunSummary(
                items.size() + alreadyProcessed,
                counters.processed.get(),
                counters.failed.get(),
                counters.skipped.get() + alreadyProcessed,
                released,
                counters.halted.get()
        );
        log.info("Run finished: {}", summary);
        return summary;
    }

    private void processOne(WorkItem item, Counters counters) {
        String objectId = item.source().id();
        if (counters.halted.get()) {
            counters.skipped.incrementAndGet();
            return;
        }

        boolean claimed;
        try {
            claimed = ledgerService.tryClaim(objectId);
        } catch (RuntimeException exception) {
            log.error("Unable to claim {}; skipping", objectId, exception);
            counters.skipped.incrementAndGet();
            return;
        }
        if (!claimed) {
            counters.skipped.incrementAndGet();
            return;
        }

        try {
            meetingPipeline.process(item);
            counters.processed.incrementAndGet();
        } catch (PipelineException exception) {
            counters.failed.incrementAndGet();
            if (exception.getKind().haltsRun()) {
                log.error("Provider quota exhausted; no further objects will be started in this run");
                counters.halted.set(true);
            }
        } catch (RuntimeException exception) {
            counters.failed.incrementAndGet();
            log.error("Unexpected failure processing {}", objectId, exception);
        } finally {
            ledgerService.release(objectId);
        }
    }

    private void runParallel(List<WorkItem> items, int workers, Counters counters) {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (WorkItem item : items) {
                futures.add(executor.submit(() -> processOne(item, counters)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (InterruptedException exception) {
                    Thread.currentThread().interrupt();
                    counters.halted.set(true);
                    log.warn("Interrupted while waiting for workers");
                    return;
                } catch (ExecutionException exception) {
                    log.error("Worker task failed", exception.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private int releaseQuarantined() {
        int hours = appProperties.quarantine().autoRetryAfterHours();
        int released = 0;
        for (SourceObject source : quarantineService.releaseExpired(clock.instant())) {
            try {
                ledgerService.recordOutcome(source.id(), LedgerStatus.RETRY_PENDING, "Auto-retry after " + hours + "h", source.name());
                released++;
            } catch (PipelineException exception) {
                log.error("Could not record release of {} in the ledger", source.id(), exception);
            }
        }
        return released;
    }

    private static final class Counters {
        private final AtomicInteger processed = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicBoolean halted = new AtomicBoolean();
    }
}
