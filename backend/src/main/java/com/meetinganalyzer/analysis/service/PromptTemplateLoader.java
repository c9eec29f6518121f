package com.meetinganalyzer.analysis.service;

import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

@Component
public class PromptTemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(PromptTemplateLoader.class);

    static final String BUILT_IN_TEMPLATE = """
            Act as an expert business analyst for society-management ERP and ASP sales meetings.
            Analyze the meeting transcript that follows.
            Return ONLY a single valid JSON object. No introduction, no closing text, no markdown fences.
            Use exactly these keys:
            %s
            If a value cannot be found in the transcript, use "N/A".
            Score fields (%s) are whole numbers from 0 (absent) to 10 (excellent).
            "Total Score" is the sum of the five scores and "%% Score" is Total/50 as a percentage with one decimal.
            """;

    private final String promptPath;

    public PromptTemplateLoader(AppProperties appProperties) {
        this.promptPath = appProperties.analysis().promptPath();
    }

    public String load() {
        if (promptPath != null && !promptPath.isBlank()) {
            Path path = Path.of(promptPath);
            if (Files.isRegularFile(path)) {
                try {
                    String content = Files.readString(path, StandardCharsets.UTF_8).strip();
                    if (!content.isEmpty()) {
                        return content;
                    }
                    log.warn("Prompt file {} is empty; using built-in template", path);
                } catch (IOException exception) {
                    log.warn("Unable to read prompt file {}; using built-in template", path, exception);
                }
            } else {
                log.warn("Prompt file {} not found; using built-in template", path);
            }
        }
        return builtInTemplate();
    }

    static String builtInTemplate() {
        String keys = CanonicalSchema.FIELDS.stream()
                .map(field -> "- \"" + field + "\"")
                .collect(Collectors.joining("\n"));
        String scores = CanonicalSchema.SCORE_FIELDS.stream()
                .map(field -> "\"" + field + "\"")
                .collect(Collectors.joining(", "));
        return BUILT_IN_TEMPLATE.formatted(keys, scores).strip();
    }
}
