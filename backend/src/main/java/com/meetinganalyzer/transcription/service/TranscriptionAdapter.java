package com.meetinganalyzer.transcription.service;

import java.nio.file.Path;

public interface TranscriptionAdapter {

    TranscriptionResult transcribe(Path filePath, TranscriptionOptions options);
}
