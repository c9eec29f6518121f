package com.meetinganalyzer.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.TestProperties;
import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.service.AnalysisProvider;
import com.meetinganalyzer.analysis.service.PromptTemplateLoader;
import com.meetinganalyzer.analysis.service.ResponseNormalizer;
import com.meetinganalyzer.analysis.service.TranscriptAnalyzer;
import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptAnalyzerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Test
    void fallsBackWhenPrimaryProviderThrows() {
        StubProvider gemini = new StubProvider("gemini", prompt -> {
            throw new IllegalStateException("Gemini request failed: 503");
        });
        StubProvider openai = new StubProvider("openai", prompt -> "{\"Team\": \"West\"}");

        CanonicalRecord record = analyzer(List.of(gemini, openai), List.of("gemini", "openai"))
                .analyze("we discussed tally import", "call.mp3");

        assertThat(record.get("Team")).isEqualTo("West");
        assertThat(gemini.prompts).hasSize(1);
        assertThat(openai.prompts).hasSize(1);
        assertThat(meterRegistry.counter("meetings.provider.fallback.total").count()).isEqualTo(1.0);
    }

    @Test
    void blankAnswerMovesToNextProvider() {
        StubProvider gemini = new StubProvider("gemini", prompt -> "   ");
        StubProvider openai = new StubProvider("openai", prompt -> "{\"Team\": \"East\"}");

        CanonicalRecord record = analyzer(List.of(gemini, openai), List.of("gemini", "openai"))
                .analyze("transcript", "call.mp3");

        assertThat(record.get("Team")).isEqualTo("East");
    }

    @Test
    void firstNonBlankAnswerIsFinalEvenWhenUnparsable() {
        StubProvider gemini = new StubProvider("gemini", prompt -> "Sorry, I cannot help with that.");
        StubProvider openai = new StubProvider("openai", prompt -> "{\"Team\": \"East\"}");

        CanonicalRecord record = analyzer(List.of(gemini, openai), List.of("gemini", "openai"))
                .analyze("transcript", "call.mp3");

        assertThat(record.isEmpty()).isTrue();
        assertThat(openai.prompts).isEmpty();
    }

    @Test
    void providerOrderFollowsConfiguration() {
        StubProvider gemini = new StubProvider("gemini", prompt -> "{\"Team\": \"Gemini\"}");
        StubProvider openai = new StubProvider("openai", prompt -> "{\"Team\": \"OpenAI\"}");

        CanonicalRecord record = analyzer(List.of(gemini, openai), List.of("openai", "gemini"))
                .analyze("transcript", "call.mp3");

        assertThat(record.get("Team")).isEqualTo("OpenAI");
        assertThat(gemini.prompts).isEmpty();
    }

    @Test
    void unconfiguredProvidersAreSkipped() {
        StubProvider gemini = new StubProvider("gemini", false, prompt -> "{\"Team\": \"Gemini\"}");
        StubProvider openai = new StubProvider("openai", prompt -> "{\"Team\": \"OpenAI\"}");

        CanonicalRecord record = analyzer(List.of(gemini, openai), List.of("gemini", "openai"))
                .analyze("transcript", "call.mp3");

        assertThat(record.get("Team")).isEqualTo("OpenAI");
        assertThat(gemini.prompts).isEmpty();
    }

    @Test
    void allProvidersFailingRaisesProviderUnavailable() {
        StubProvider gemini = new StubProvider("gemini", prompt -> {
            throw new IllegalStateException("connection refused");
        });
        StubProvider openai = new StubProvider("openai", prompt -> "");

        assertThatThrownBy(() -> analyzer(List.of(gemini, openai), List.of("gemini", "openai"))
                .analyze("transcript", "call.mp3"))
                .isInstanceOf(PipelineException.class)
                .extracting(error -> ((PipelineException) error).getKind())
                .isEqualTo(ErrorKind.PROVIDER_UNAVAILABLE);
    }

    @Test
    void quotaFailureIsReportedAsQuotaExceeded() {
        StubProvider gemini = new StubProvider("gemini", prompt -> {
            throw new IllegalStateException("Gemini request failed",
                    new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS));
        });
        StubProvider openai = new StubProvider("openai", prompt -> {
            throw new IllegalStateException("OpenAI analysis request failed: timeout");
        });

        assertThatThrownBy(() -> analyzer(List.of(gemini, openai), List.of("gemini", "openai"))
                .analyze("transcript", "call.mp3"))
                .isInstanceOf(PipelineException.class)
                .extracting(error -> ((PipelineException) error).getKind())
                .isEqualTo(ErrorKind.QUOTA_EXCEEDED);
    }

    @Test
    void blankTranscriptShortCircuitsToEmptyRecord() {
        StubProvider gemini = new StubProvider("gemini", prompt -> "{\"Team\": \"West\"}");

        CanonicalRecord record = analyzer(List.of(gemini), List.of("gemini")).analyze("  ", "call.mp3");

        assertThat(record.isEmpty()).isTrue();
        assertThat(gemini.prompts).isEmpty();
    }

    @Test
    void promptEndsWithTranscriptAfterDivider() {
        StubProvider gemini = new StubProvider("gemini", prompt -> "{\"Team\": \"West\"}");

        analyzer(List.of(gemini), List.of("gemini")).analyze("hello society", "call.mp3");

        assertThat(gemini.prompts.get(0))
                .contains("Owner (Who handled the meeting)")
                .endsWith("\n\n---\nMEETING TRANSCRIPT:\nhello society");
    }

    private TranscriptAnalyzer analyzer(List<AnalysisProvider> providers, List<String> order) {
        return new TranscriptAnalyzer(
                providers,
                new PromptTemplateLoader(TestProperties.builder().build()),
                new ResponseNormalizer(new ObjectMapper()),
                TestProperties.builder().providerOrder(order).build(),
                meterRegistry
        );
    }

    private static final class StubProvider implements AnalysisProvider {

        private final String name;
        private final boolean configured;
        private final Function<String, String> answer;
        private final List<String> prompts = new ArrayList<>();

        StubProvider(String name, Function<String, String> answer) {
            this(name, true, answer);
        }

        StubProvider(String name, boolean configured, Function<String, String> answer) {
            this.name = name;
            this.configured = configured;
            this.answer = answer;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public String generate(String prompt) {
            prompts.add(prompt);
            return answer.apply(prompt);
        }
    }
}
