package dev.repodocs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "repodocs.dashboard")
public record DashboardProperties(String ownerSigningSecret) {}
