package com.meetinganalyzer.transcription.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.transcription.service.TranscriptionAdapter;
import com.meetinganalyzer.transcription.service.TranscriptionOptions;
import com.meetinganalyzer.transcription.service.TranscriptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

@Component
public class WhisperTranscriptionAdapter implements TranscriptionAdapter {

    private static final Logger log = LoggerFactory.getLogger(WhisperTranscriptionAdapter.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.Asr asr;

    public WhisperTranscriptionAdapter(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.asr = appProperties.asr();
    }

    @Override
    public TranscriptionResult transcribe(Path filePath, TranscriptionOptions options) {
        Instant start = Instant.now();
        String model = asr.model() == null || asr.model().isBlank() ? "whisper-1" : asr.model();

        try {
            boolean translate = options.translateToTarget() && isEnglish(options.targetLanguage());
            if (options.translateToTarget() && !translate) {
                log.warn("Translation to '{}' is not supported by the ASR server; transcribing instead",
                        options.targetLanguage());
            }

            MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
            body.add("file", new FileSystemResource(filePath));
            body.add("model", model);
            body.add("response_format", "verbose_json");
            body.add("vad_filter", Boolean.toString(options.trimSilence()));
            body.add("beam_size", Integer.toString(options.beamSize()));

            RestClient.RequestBodySpec request = restClient.post()
                    .uri(asr.baseUrl() + (translate ? "/v1/audio/translations" : "/v1/audio/transcriptions"))
                    .contentType(MediaType.MULTIPART_FORM_DATA);
            if (asr.apiKey() != null && !asr.apiKey().isBlank()) {
                request = request.header("Authorization", "Bearer " + asr.apiKey());
            }
            String rawResponse = request.body(body).retrieve().body(String.class);

            String text;
            String language = "unknown";
            double seconds = 0;
            String trimmed = rawResponse == null ? "" : rawResponse.trim();
            if (trimmed.startsWith("{")) {
                JsonNode root = objectMapper.readTree(trimmed);
                text = root.path("text").asText("");
                language = root.path("language").asText("unknown");
                seconds = root.path("duration").asDouble(0);
            } else {
                text = trimmed;
            }

            long latencyMs = Duration.between(start, Instant.now()).toMillis();
            if (text.isBlank()) {
                log.warn("ASR returned no speech for {}", filePath.getFileName());
                return TranscriptionResult.empty(model, latencyMs);
            }
            int minutes = (int) Math.round(seconds / 60.0);
            log.info("Transcribed {} ({} chars, {} min, language {}) in {} ms",
                    filePath.getFileName(), text.length(), minutes, language, latencyMs);
            return new TranscriptionResult(text.trim(), minutes, language, model, latencyMs);
        } catch (Exception exception) {
            log.warn("Transcription of {} failed, returning empty transcript", filePath.getFileName(), exception);
            return TranscriptionResult.empty(model, Duration.between(start, Instant.now()).toMillis());
        }
    }

    private boolean isEnglish(String language) {
        if (language == null) {
            return false;
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("en") || normalized.startsWith("en-") || normalized.equals("english");
    }
}
