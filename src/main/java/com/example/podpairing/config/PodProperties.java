package com.example.podpairing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "pods")
public record PodProperties(
        @DefaultValue("24h") Duration defaultTtl,
        @DefaultValue("6") int defaultCodeLength,
        @DefaultValue("300000") long sweepIntervalMs,
        @DefaultValue("500") long snapshotDebounceMs,
        @DefaultValue Persistence persistence) {

    public static record Persistence(@DefaultValue("true") boolean enabled) { }
}
