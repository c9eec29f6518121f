package com.meetinganalyzer.transcription.service;

public record TranscriptionResult(
        String text,
        int durationMinutes,
        String detectedLanguage,
        String providerModel,
        long latencyMs
) {

    public static TranscriptionResult empty(String providerModel, long latencyMs) {
        return new TranscriptionResult("", 0, "unknown", providerModel, latencyMs);
    }

    public boolean isEmpty() {
        return text == null || text.isBlank();
    }
}
