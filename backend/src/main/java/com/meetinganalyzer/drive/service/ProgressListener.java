package com.meetinganalyzer.drive.service;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(String displayName, int percent);
}
