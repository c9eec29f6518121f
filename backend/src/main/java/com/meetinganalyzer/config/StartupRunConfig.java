package com.meetinganalyzer.config;

import com.meetinganalyzer.pipeline.model.RunSummary;
import com.meetinganalyzer.pipeline.service.BatchRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(value = "app.run.on-startup", havingValue = "true")
public class StartupRunConfig {

    private static final Logger log = LoggerFactory.getLogger(StartupRunConfig.class);

    @Bean
    CommandLineRunner startupBatchRun(BatchRunService batchRunService) {
        return args -> {
            RunSummary summary = batchRunService.runOnce();
            log.info("Startup run complete: {} processed, {} failed, {} skipped",
                    summary.processed(), summary.failed(), summary.skipped());
        };
    }
}
