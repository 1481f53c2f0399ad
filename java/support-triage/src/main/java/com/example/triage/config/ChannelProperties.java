package com.example.triage.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.channel")
public record ChannelProperties(
    String baseUrl,
    String apiToken,
    long accountId,
    Long escalationAssigneeId,
    Duration timeout
) {

    public ChannelProperties {
        if (timeout == null) timeout = Duration.ofSeconds(10);
    }
}
