package com.meetinganalyzer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @Valid @NotNull Drive drive,
        @Valid @NotNull Sheets sheets,
        Google google,
        @Valid @NotNull Transfer transfer,
        @Valid @NotNull Http http,
        @Valid @NotNull Runtime runtime,
        @Valid @NotNull Quarantine quarantine,
        @Valid @NotNull Ledger ledger,
        @Valid @NotNull Run run,
        @Valid @NotNull Analysis analysis,
        Gemini gemini,
        OpenAi openai,
        Ollama ollama,
        @Valid @NotNull Asr asr,
        Map<String, Owner> owners,
        Map<String, String> managerEmails
) {

    public AppProperties {
        owners = owners == null ? Map.of() : Map.copyOf(owners);
        managerEmails = managerEmails == null ? Map.of() : Map.copyOf(managerEmails);
    }

    public record Drive(
            @NotBlank String baseUrl,
            @NotBlank String parentFolderId,
            @NotBlank String processedFolderId,
            @NotBlank String quarantineFolderId
    ) {}

    public record Sheets(
            @NotBlank String baseUrl,
            @NotBlank String sheetId,
            @NotBlank String resultsTab,
            @NotBlank String ledgerTab
    ) {}

    public record Google(
            String credentialsPath
    ) {}

    public record Transfer(
            @Min(1024) long chunkSizeBytes,
            @NotNull Duration baseDelay,
            @NotNull Duration jitter,
            @NotNull Duration maxDelay,
            @Min(0) int maxChunkAttempts,
            @Min(1) int moveMaxAttempts
    ) {}

    public record Http(
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout
    ) {}

    public record Runtime(
            @NotBlank String tmpDir
    ) {}

    public record Quarantine(
            @Min(0) int autoRetryAfterHours,
            String retryTargetFolderId
    ) {}

    public record Ledger(
            boolean redisLockEnabled,
            String lockKeyPrefix,
            Duration lockTtl
    ) {}

    public record Run(
            boolean onStartup,
            boolean schedulerEnabled,
            String cron,
            @Min(1) int workers
    ) {}

    public record Analysis(
            @NotNull List<String> providerOrder,
            String promptPath
    ) {}

    public record Gemini(
            String apiKey,
            String model,
            String baseUrl,
            double temperature
    ) {}

    public record OpenAi(
            String apiKey,
            String model,
            String baseUrl
    ) {}

    public record Ollama(
            String baseUrl,
            String model
    ) {}

    public record Asr(
            @NotBlank String baseUrl,
            String apiKey,
            String model,
            String targetLanguage,
            boolean translateToTarget,
            boolean trimSilence,
            @Min(1) int beamSize
    ) {}

    public record Owner(
            String email,
            String manager,
            String team
    ) {}
}
