package com.meetinganalyzer.transcription.service;

import com.meetinganalyzer.config.AppProperties;

public record TranscriptionOptions(
        String targetLanguage,
        boolean translateToTarget,
        boolean trimSilence,
        int beamSize
) {

    public TranscriptionOptions {
        targetLanguage = targetLanguage == null || targetLanguage.isBlank() ? "en" : targetLanguage;
        beamSize = beamSize < 1 ? 5 : beamSize;
    }

    public static TranscriptionOptions from(AppProperties.Asr asr) {
        return new TranscriptionOptions(asr.targetLanguage(), asr.translateToTarget(), asr.trimSilence(), asr.beamSize());
    }
}
