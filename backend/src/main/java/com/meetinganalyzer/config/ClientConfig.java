package com.meetinganalyzer.config;

import com.meetinganalyzer.common.util.BackoffPolicy;
import com.meetinganalyzer.common.util.Sleeper;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class ClientConfig {

    @Bean
    RestClientCustomizer timeoutCustomizer(AppProperties appProperties) {
        AppProperties.Http http = appProperties.http();
        return builder -> {
            HttpClient httpClient = HttpClient.newBuilder()
                    .connectTimeout(http.connectTimeout())
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(http.readTimeout());
            builder.requestFactory(requestFactory);
        };
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    BackoffPolicy transferBackoff(AppProperties appProperties, Sleeper sleeper) {
        AppProperties.Transfer transfer = appProperties.transfer();
        return new BackoffPolicy(transfer.baseDelay(), transfer.jitter(), transfer.maxDelay(), sleeper);
    }

    @Bean
    Clock systemClock() {
        return Clock.systemUTC();
    }
}
