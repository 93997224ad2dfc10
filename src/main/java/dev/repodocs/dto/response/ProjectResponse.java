package dev.repodocs.dto.response;

import tools.jackson.databind.JsonNode;

import java.time.Instant;

public record ProjectResponse(String slug, String repoName, String repoUrl, String docType,
                              JsonNode docs, Instant updatedAt) {}
