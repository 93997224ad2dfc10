package dev.repodocs.infrastructure.upstream;

/**
 * What the generation service needs to start a run. authToken lets it clone private
 * repositories on the owner's behalf and may be null.
 */
public record GenerationRequest(String repoUrl, String docType, String authToken) {
    public GenerationRequest {
        if (repoUrl == null || repoUrl.isBlank()) throw new IllegalArgumentException("repoUrl required");
        if (docType != null && docType.isBlank()) docType = null;
    }
}
