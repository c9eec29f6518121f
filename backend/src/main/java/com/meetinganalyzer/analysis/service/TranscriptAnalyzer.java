package com.meetinganalyzer.analysis.service;

import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.config.AppProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class TranscriptAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TranscriptAnalyzer.class);
    static final String TRANSCRIPT_DIVIDER = "\n\n---\nMEETING TRANSCRIPT:\n";

    private final List<AnalysisProvider> providers;
    private final PromptTemplateLoader promptTemplateLoader;
    private final ResponseNormalizer responseNormalizer;
    private final Counter fallbackCounter;

    public TranscriptAnalyzer(List<AnalysisProvider> availableProviders,
                              PromptTemplateLoader promptTemplateLoader,
                              ResponseNormalizer responseNormalizer,
                              AppProperties appProperties,
                              MeterRegistry meterRegistry) {
        this.providers = order(availableProviders, appProperties.analysis().providerOrder());
        this.promptTemplateLoader = promptTemplateLoader;
        this.responseNormalizer = responseNormalizer;
        this.fallbackCounter = meterRegistry.counter("meetings.provider.fallback.total");
    }

    public CanonicalRecord analyze(String transcript, String contextName) {
        if (transcript == null || transcript.isBlank()) {
            log.warn("Blank transcript for {}; nothing to analyze", contextName);
            return CanonicalRecord.empty();
        }

        String prompt = promptTemplateLoader.load() + TRANSCRIPT_DIVIDER + transcript;
        List<String> failures = new ArrayList<>();
        boolean quotaHit = false;

        for (AnalysisProvider provider : providers) {
            if (!provider.isConfigured()) {
                failures.add(provider.name() + ": not configured");
                continue;
            }
            try {
                String answer = provider.generate(prompt);
                if (answer == null || answer.isBlank()) {
                    log.warn("Provider {} returned a blank answer for {}", provider.name(), contextName);
                    failures.add(provider.name() + ": blank answer");
                    fallbackCounter.increment();
                    continue;
                }
                log.info("Provider {} analyzed {}", provider.name(), contextName);
                return responseNormalizer.normalize(answer, contextName);
            } catch (RuntimeException exception) {
                boolean quota = QuotaErrors.isQuotaError(exception);
                quotaHit |= quota;
                log.warn("Provider {} failed for {}{}: {}", provider.name(), contextName,
                        quota ? " (quota)" : "", exception.getMessage());
                failures.add(provider.name() + ": " + exception.getMessage());
                fallbackCounter.increment();
            }
        }

        ErrorKind kind = quotaHit ? ErrorKind.QUOTA_EXCEEDED : ErrorKind.PROVIDER_UNAVAILABLE;
        String detail = failures.isEmpty() ? "no providers configured" : String.join("; ", failures);
        throw new PipelineException(kind, "All analysis providers failed for " + contextName + ": " + detail);
    }

    private static List<AnalysisProvider> order(List<AnalysisProvider> available, List<String> providerOrder) {
        Map<String, AnalysisProvider> byName = available.stream()
                .collect(Collectors.toMap(provider -> provider.name().toLowerCase(Locale.ROOT), Function.identity(),
                        (first, second) -> first));
        List<AnalysisProvider> ordered = new ArrayList<>();
        for (String name : providerOrder) {
            AnalysisProvider provider = byName.get(name.trim().toLowerCase(Locale.ROOT));
            if (provider == null) {
                log.warn("Unknown analysis provider '{}' in provider order", name);
            } else if (!ordered.contains(provider)) {
                ordered.add(provider);
            }
        }
        return List.copyOf(ordered);
    }
}
