package com.meetinganalyzer.transcription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.TestProperties;
import com.meetinganalyzer.transcription.adapter.WhisperTranscriptionAdapter;
import com.meetinganalyzer.transcription.service.TranscriptionOptions;
import com.meetinganalyzer.transcription.service.TranscriptionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WhisperTranscriptionAdapterTest {

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private WhisperTranscriptionAdapter adapter;
    private Path audio;

    @BeforeEach
    void setUp() throws Exception {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new WhisperTranscriptionAdapter(builder, new ObjectMapper(), TestProperties.defaults());
        audio = tempDir.resolve("call.mp3");
        Files.write(audio, new byte[]{1, 2, 3});
    }

    @Test
    void englishTargetUsesTranslationEndpointAndParsesVerboseJson() {
        server.expect(requestTo("http://asr.test/v1/audio/translations"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andRespond(withSuccess("""
                        {"text":" We spoke about the tally import. ","language":"hi","duration":1530.4}
                        """, MediaType.APPLICATION_JSON));

        TranscriptionResult result = adapter.transcribe(audio, new TranscriptionOptions("en", true, true, 5));

        assertThat(result.text()).isEqualTo("We spoke about the tally import.");
        assertThat(result.detectedLanguage()).isEqualTo("hi");
        assertThat(result.durationMinutes()).isEqualTo(26);
        assertThat(result.providerModel()).isEqualTo("large-v3");
        server.verify();
    }

    @Test
    void nonEnglishTargetFallsBackToTranscription() {
        server.expect(requestTo("http://asr.test/v1/audio/transcriptions"))
                .andRespond(withSuccess("namaste", MediaType.TEXT_PLAIN));

        TranscriptionResult result = adapter.transcribe(audio, new TranscriptionOptions("hi", true, false, 5));

        assertThat(result.text()).isEqualTo("namaste");
        assertThat(result.durationMinutes()).isZero();
        server.verify();
    }

    @Test
    void silenceComesBackAsEmptyResult() {
        server.expect(requestTo("http://asr.test/v1/audio/translations"))
                .andRespond(withSuccess("{\"text\":\"\",\"duration\":12.0}", MediaType.APPLICATION_JSON));

        assertThat(adapter.transcribe(audio, new TranscriptionOptions("en", true, true, 5)).isEmpty()).isTrue();
    }

    @Test
    void engineFailureComesBackAsEmptyResult() {
        server.expect(requestTo("http://asr.test/v1/audio/translations"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        TranscriptionResult result = adapter.transcribe(audio, new TranscriptionOptions("en", true, true, 5));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.detectedLanguage()).isEqualTo("unknown");
    }
}
