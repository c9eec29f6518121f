package com.meetinganalyzer.pipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "app.run.scheduler-enabled", havingValue = "true")
public class BatchRunWorker {

    private static final Logger log = LoggerFactory.getLogger(BatchRunWorker.class);

    private final BatchRunService batchRunService;

    public BatchRunWorker(BatchRunService batchRunService) {
        this.batchRunService = batchRunService;
    }

    @Scheduled(cron = "${app.run.cron:0 0 * * * *}")
    public void runScheduledBatch() {
        try {
            batchRunService.runOnce();
        } catch (Exception exception) {
            log.error("Scheduled batch run failed", exception);
        }
    }
}
