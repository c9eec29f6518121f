package com.meetinganalyzer.auth;

public interface AccessTokenProvider {
    String accessToken();
}
